package bdl;

/** A document-model element that can be walked by a {@link ScriptVisitor}. */
public interface ScriptNodeInterface {
  <V> V accept(ScriptVisitor<V> visitor, V value);

  <V> V visitChildren(ScriptVisitor<V> visitor, V value);
}
