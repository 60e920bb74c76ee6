package bdl;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

/**
 * The variable stores and position of one session.
 *
 * <p>The global store is seeded once from the entry document and lives for the whole session.
 * The local store holds the defaults of the current document and is reset whenever the current
 * file changes. Names resolve local first, then global.
 *
 * <p>Not thread-safe: a session state belongs to exactly one session.
 */
public final class SessionState {
  private static final Splitter FIELD_SPLITTER = Splitter.on('.');

  private final String entryFile;
  private final Map<String, Value> globals;
  private final Map<String, Value> locals = new HashMap<>();

  private String currentFile;
  private Optional<String> currentNode = Optional.empty();

  public SessionState(Document entry) {
    Preconditions.checkArgument(entry.declaresGlobal(), "%s is not an entry file", entry.name());

    this.entryFile = entry.name();
    this.globals = new HashMap<>(entry.globalDefaults());
    this.currentFile = entry.name();
    this.locals.putAll(entry.localDefaults());
  }

  public String entryFile() {
    return entryFile;
  }

  public String currentFile() {
    return currentFile;
  }

  public Optional<String> currentNode() {
    return currentNode;
  }

  public boolean inEntryFile() {
    return currentFile.equals(entryFile);
  }

  /**
   * Looks up {@code name}, locals first. A dotted name such as {@code progress.score} reads a
   * field of a struct value. Unknown names yield {@link Value#empty()}.
   */
  public Value get(String name) {
    Value value = lookup(name);
    if (value != null) return value;
    if (name.indexOf('.') < 0) return Value.empty();

    Iterator<String> path = FIELD_SPLITTER.split(name).iterator();
    value = lookup(path.next());
    while (value != null && path.hasNext()) {
      if (value.type() != Value.Type.STRUCT) return Value.empty();
      value = value.<Value.StructValue>cast().fields().get(path.next());
    }
    return value == null ? Value.empty() : value;
  }

  private Value lookup(String name) {
    Value value = locals.get(name);
    return value != null ? value : globals.get(name);
  }

  public void setLocal(String name, Value value) {
    locals.put(name, value);
  }

  /** Writes a global variable. Only the entry file may do this. */
  public void setGlobal(String name, Value value) throws ScopeException {
    if (!inEntryFile()) throw new ScopeException(name, currentFile);
    globals.put(name, value);
  }

  /** Substitutes every {@code ${name}} token in {@code text} with its display string. */
  public String interpolate(String text) {
    return Interpolation.interpolate(text, this::get);
  }

  /**
   * Makes {@code document} the current file. The local store is reset to the document's
   * defaults only if the file actually changes.
   */
  void enter(Document document) {
    if (document.name().equals(currentFile)) return;

    currentFile = document.name();
    currentNode = Optional.empty();
    locals.clear();
    locals.putAll(document.localDefaults());
  }

  void setCurrentNode(String node) {
    currentNode = Optional.of(node);
  }

  public ImmutableMap<String, Value> locals() {
    return ImmutableMap.copyOf(locals);
  }

  public ImmutableMap<String, Value> globals() {
    return ImmutableMap.copyOf(globals);
  }
}
