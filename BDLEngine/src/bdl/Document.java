package bdl;

import java.util.Map;
import java.util.Optional;

import com.google.auto.value.AutoValue;
import com.google.auto.value.extension.memoized.Memoized;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import bdl.processor.ScriptChild;
import bdl.processor.ScriptNode;

/** One parsed script file. Immutable once parsed. */
@ScriptNode
@AutoValue
public abstract class Document implements Document_ScriptNode {

  // The file identifier, e.g. "main.bdl".
  public abstract String name();

  public abstract Metadata metadata();

  // True only for the entry file.
  public abstract boolean declaresGlobal();

  public abstract ImmutableMap<String, Value> localDefaults();

  // Empty unless declaresGlobal().
  public abstract ImmutableMap<String, Value> globalDefaults();

  // In source order.
  public abstract ImmutableMap<String, Node> nodes();

  @Memoized
  @ScriptChild
  @Override
  public ImmutableList<Node> nodeList() {
    return nodes().values().asList();
  }

  public Optional<Node> node(String name) {
    return Optional.ofNullable(nodes().get(name));
  }

  public boolean requires(String fileName) {
    return metadata().required().contains(fileName);
  }

  public static Document create(
      String name,
      Metadata metadata,
      boolean declaresGlobal,
      Map<String, Value> localDefaults,
      Map<String, Value> globalDefaults,
      Map<String, Node> nodes) {
    return new AutoValue_Document(
        name,
        metadata,
        declaresGlobal,
        ImmutableMap.copyOf(localDefaults),
        ImmutableMap.copyOf(globalDefaults),
        ImmutableMap.copyOf(nodes));
  }
}
