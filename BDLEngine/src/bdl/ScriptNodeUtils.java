package bdl;

import java.util.Map;
import java.util.Optional;

public final class ScriptNodeUtils {
  public static <V> V accept(ScriptNodeInterface node, ScriptVisitor<V> visitor, V value) {
    return node.accept(visitor, value);
  }

  public static <V> V accept(
      Iterable<? extends ScriptNodeInterface> nodes, ScriptVisitor<V> visitor, V value) {
    for (ScriptNodeInterface node : nodes) {
      value = accept(node, visitor, value);
    }
    return value;
  }

  public static <V> V accept(
      Map<String, ? extends ScriptNodeInterface> nodes, ScriptVisitor<V> visitor, V value) {
    return accept(nodes.values(), visitor, value);
  }

  public static <V> V accept(
      Optional<? extends ScriptNodeInterface> node, ScriptVisitor<V> visitor, V value) {
    return node.map(n -> accept(n, visitor, value)).orElse(value);
  }

  private ScriptNodeUtils() {}
}
