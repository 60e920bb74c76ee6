package bdl;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

import bdl.processor.ScriptNode;

/** A piece of node content, rendered in order. */
public abstract class ContentElement implements ScriptNodeInterface {
  public enum Type {
    TEXT,
    CALL;
  }

  private final Type type;

  private ContentElement(Type type) {
    this.type = type;
  }

  public final Type type() {
    return type;
  }

  public abstract Pos pos();

  @SuppressWarnings("unchecked")
  public <T extends ContentElement> T cast() {
    return (T) this;
  }

  public static Text text(String raw, Pos pos) {
    return new AutoValue_ContentElement_Text(pos, raw);
  }

  public static Call call(String function, ImmutableList<String> bindings, Pos pos) {
    return new AutoValue_ContentElement_Call(pos, function, bindings);
  }

  // Consecutive text lines, joined with '\n'. May contain ${name} tokens.
  @ScriptNode
  @AutoValue
  public abstract static class Text extends ContentElement
      implements ContentElement_Text_ScriptNode {
    Text() {
      super(Type.TEXT);
    }

    public abstract String raw();
  }

  // !{function} : ~{a} ~{b}
  @ScriptNode
  @AutoValue
  public abstract static class Call extends ContentElement
      implements ContentElement_Call_ScriptNode {
    Call() {
      super(Type.CALL);
    }

    public abstract String function();

    public abstract ImmutableList<String> bindings();
  }
}
