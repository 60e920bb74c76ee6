package bdl;

import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Runs one session over the documents of a {@link DocumentRegistry}.
 *
 * <p>Rendering a node emits its text, dispatches its calls, then walks its branches in source
 * order: the first truthy condition or jump transitions immediately; otherwise the session
 * waits for input, which selects the first option whose keywords contain it. Failed calls and
 * unresolvable destinations recover through the fallback message and destination instead of
 * surfacing to the host.
 *
 * <p>A navigator is confined to one thread. Any number of navigators may share a registry.
 */
public final class Navigator {
  private static final Logger logger = LoggerFactory.getLogger(Navigator.class);

  public enum State {
    RENDERING,
    AWAITING_INPUT,
    TRANSFERRING,
    EXITED;
  }

  private static final class Location {
    private final Document document;
    private final Node node;

    private Location(Document document, Node node) {
      this.document = document;
      this.node = node;
    }

    @Override
    public String toString() {
      return document.name() + ":" + node.name();
    }
  }

  private final DocumentRegistry registry;
  private final FunctionDispatcher dispatcher;
  private final EngineConfig config;
  private final FallbackPolicy fallback;

  private SessionState session = null;
  private State state = null;
  private Location location = null;
  private Optional<String> lastInput = Optional.empty();

  public Navigator(DocumentRegistry registry, FunctionDispatcher dispatcher) {
    this(registry, dispatcher, EngineConfig.defaults());
  }

  public Navigator(DocumentRegistry registry, FunctionDispatcher dispatcher, EngineConfig config) {
    this.registry = registry;
    this.dispatcher = dispatcher;
    this.config = config;
    this.fallback = new FallbackPolicy(config, registry.entryFile());
  }

  /**
   * Loads {@code entryFile} and renders its start node.
   *
   * @throws ParseException if the entry file or one of its dependencies is malformed
   * @throws ReferenceException if the entry file, a dependency or the start node is missing
   */
  public Output start(String entryFile) throws ParseException, ReferenceException {
    Preconditions.checkState(state == null, "session already started");
    Preconditions.checkArgument(
        entryFile.equals(registry.entryFile()),
        "registry is set up for entry file %s, not %s",
        registry.entryFile(),
        entryFile);

    Document entry = registry.load(entryFile);
    Optional<Node> start = entry.node(config.startNode());
    if (!start.isPresent()) {
      throw new ReferenceException(
          ReferenceException.Kind.UNKNOWN_NODE,
          Pos.startOf(entryFile),
          String.format("no start node '%s' in %s", config.startNode(), entryFile));
    }

    session = new SessionState(entry);
    Output.Collector out = new Output.Collector();
    run(Optional.of(new Location(entry, start.get())), out);
    return out.build(state == State.EXITED);
  }

  /**
   * Feeds one line of user input to a session waiting for it. Input matching no option
   * re-prompts and changes nothing.
   *
   * <p>At a node without options the line is offered to the node's calls instead: they run
   * again, without its text, and its branches are re-evaluated. If none fires the session
   * re-prompts.
   */
  public Output submitInput(String line) {
    Preconditions.checkState(state != null, "start() has not been called");
    if (state == State.EXITED) return Output.exitedOutput();
    Preconditions.checkState(state == State.AWAITING_INPUT, "not awaiting input: %s", state);

    lastInput = Optional.of(line);
    Output.Collector out = new Output.Collector();
    if (!location.node.hasOptions()) {
      Optional<Location> next = reevaluate(location, out);
      if (next.isPresent()) {
        run(next, out);
      } else if (state == State.AWAITING_INPUT) {
        out.emit(config.repromptMessage());
      }
      return out.build(state == State.EXITED);
    }

    String token = line.trim().toLowerCase(Locale.ROOT);
    for (Branch branch : location.node.branches()) {
      if (branch.type() == Branch.Type.OPTION && branch.<Branch.Option>cast().matches(token)) {
        run(transition(branch.destination(), out), out);
        return out.build(state == State.EXITED);
      }
    }

    out.emit(config.repromptMessage());
    return out.build(false);
  }

  public State state() {
    Preconditions.checkState(state != null, "start() has not been called");
    return state;
  }

  public String currentFile() {
    Preconditions.checkState(session != null, "start() has not been called");
    return session.currentFile();
  }

  public String currentNode() {
    Preconditions.checkState(location != null, "start() has not been called");
    return location.node.name();
  }

  /** Reads a variable the way scripts do: locals, then globals, else empty. */
  public Value variable(String name) {
    Preconditions.checkState(session != null, "start() has not been called");
    return session.get(name);
  }

  SessionState session() {
    return session;
  }

  // Renders 'first', then follows automatic transitions until input is needed. A transition
  // past the limit is not taken: the session waits at the last rendered node.
  private void run(Optional<Location> first, Output.Collector out) {
    if (!first.isPresent()) return;

    Optional<Location> next = render(first.get(), out);
    int transitions = 0;
    while (next.isPresent()) {
      if (transitions == config.maxAutoTransitions()) {
        state = State.AWAITING_INPUT;
        warn(
            out,
            String.format(
                "stopped at %s after %d automatic transitions", location, transitions));
        return;
      }

      transitions++;
      next = render(next.get(), out);
    }
  }

  private void enter(Location next) {
    session.enter(next.document);
    session.setCurrentNode(next.node.name());
    location = next;
  }

  // Returns the next node to render, or empty if the session now waits for input or exited.
  private Optional<Location> render(Location next, Output.Collector out) {
    state = State.RENDERING;
    enter(next);

    for (ContentElement element : next.node.content()) {
      switch (element.type()) {
        case TEXT:
          out.emit(session.interpolate(element.<ContentElement.Text>cast().raw()));
          break;
        case CALL:
          if (!call(element.cast(), out)) return fallback(out);
          break;
        default:
          throw new AssertionError(element.type());
      }
    }
    return takeBranch(next, out);
  }

  private Optional<Location> reevaluate(Location here, Output.Collector out) {
    state = State.RENDERING;
    for (ContentElement element : here.node.content()) {
      if (element.type() == ContentElement.Type.CALL && !call(element.cast(), out)) {
        return fallback(out);
      }
    }
    return takeBranch(here, out);
  }

  private Optional<Location> takeBranch(Location here, Output.Collector out) {
    for (Branch branch : here.node.branches()) {
      switch (branch.type()) {
        case OPTION:
          break;
        case CONDITION:
          if (session.get(branch.<Branch.Condition>cast().variable()).isTruthy()) {
            return transition(branch.destination(), out);
          }
          break;
        case JUMP:
          return transition(branch.destination(), out);
        default:
          throw new AssertionError(branch.type());
      }
    }

    state = State.AWAITING_INPUT;
    if (!here.node.acceptsInput()) {
      warn(out, String.format("%s has no options; no input can leave it", here));
    }
    return Optional.empty();
  }

  // Returns false if the call failed, after binding the fallback values.
  private boolean call(ContentElement.Call call, Output.Collector out) {
    FunctionContext context = new FunctionContext(session, lastInput, out::warn);
    try {
      FunctionResult result = dispatcher.dispatch(call, context);
      if (result.succeeded()) {
        FunctionDispatcher.bind(call.bindings(), result.values(), session);
        return true;
      }
      warn(out, String.format("%s !{%s} failed", call.pos(), call.function()));
    } catch (ReferenceException ex) {
      warn(out, ex.getMessage());
    }

    fallback.bind(call.bindings(), session);
    return false;
  }

  private Optional<Location> transition(Destination destination, Output.Collector out) {
    state = State.TRANSFERRING;
    try {
      return resolve(destination, session.currentFile());
    } catch (ReferenceException ex) {
      warn(out, ex.getMessage());
      return fallback(out);
    }
  }

  private Optional<Location> fallback(Output.Collector out) {
    out.emit(fallback.message());
    state = State.TRANSFERRING;
    try {
      return resolve(fallback.target(), registry.entryFile());
    } catch (ParseException | ReferenceException ex) {
      warn(
          out,
          String.format(
              "fallback destination %s failed, ending the session: %s",
              fallback.destination(),
              ex.getMessage()));
      state = State.EXITED;
      return Optional.empty();
    }
  }

  // Node references resolve against 'baseFile'. Exit sets the state and returns empty.
  private Optional<Location> resolve(Destination destination, String baseFile)
      throws ReferenceException {
    switch (destination.type()) {
      case EXIT:
        state = State.EXITED;
        return Optional.empty();
      case NODE:
        {
          Document document = registry.document(baseFile);
          String name = destination.<Destination.NodeRef>cast().name();
          return Optional.of(new Location(document, node(document, name, destination.pos())));
        }
      case FILE_TRANSFER:
        {
          Destination.FileTransfer transfer = destination.cast();
          String file = session.interpolate(transfer.file()).trim();
          String name = session.interpolate(transfer.node()).trim();
          if (file.isEmpty()) {
            throw new ReferenceException(
                ReferenceException.Kind.UNKNOWN_FILE,
                transfer.pos(),
                String.format("%s names no file", transfer.toSource()));
          }
          Document document = registry.document(file);
          return Optional.of(new Location(document, node(document, name, transfer.pos())));
        }
      case DYNAMIC:
        return resolve(dynamicTarget(destination.cast()), baseFile);
      default:
        throw new AssertionError(destination.type());
    }
  }

  private static Node node(Document document, String name, Pos pos) throws ReferenceException {
    Optional<Node> node = document.node(name);
    if (!node.isPresent()) {
      throw new ReferenceException(
          ReferenceException.Kind.UNKNOWN_NODE,
          pos,
          String.format("no node '%s' in %s", name, document.name()));
    }
    return node.get();
  }

  // The destination held in a variable: 'node', '@node', 'file:node', '[file:node]' or '{exit}'.
  private Destination dynamicTarget(Destination.Dynamic dynamic) throws ReferenceException {
    String reference = session.get(dynamic.variable()).toDisplayString().trim();
    if (reference.isEmpty()) {
      throw new ReferenceException(
          ReferenceException.Kind.UNKNOWN_NODE,
          dynamic.pos(),
          String.format("${%s} holds no destination", dynamic.variable()));
    }

    Destination target;
    try {
      target = ScriptParser.parseReference(reference, dynamic.pos());
    } catch (ParseException ex) {
      throw new ReferenceException(
          ReferenceException.Kind.UNKNOWN_NODE,
          dynamic.pos(),
          String.format("${%s} holds an invalid destination '%s'", dynamic.variable(), reference),
          ex);
    }
    if (target.type() == Destination.Type.DYNAMIC) {
      throw new ReferenceException(
          ReferenceException.Kind.UNKNOWN_NODE,
          dynamic.pos(),
          String.format(
              "${%s} holds another variable reference: %s", dynamic.variable(), reference));
    }
    return target;
  }

  private static void warn(Output.Collector out, String warning) {
    logger.warn(warning);
    out.warn(warning);
  }
}
