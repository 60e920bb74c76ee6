package bdl;

import com.google.auto.value.AutoValue;

import bdl.processor.ScriptNode;

/** The target of a transition. */
public abstract class Destination implements ScriptNodeInterface {
  public enum Type {
    NODE,
    FILE_TRANSFER,
    EXIT,
    DYNAMIC;
  }

  private final Type type;

  private Destination(Type type) {
    this.type = type;
  }

  public final Type type() {
    return type;
  }

  public abstract Pos pos();

  @SuppressWarnings("unchecked")
  public <T extends Destination> T cast() {
    return (T) this;
  }

  /** Renders this destination the way it is written in a script. */
  public abstract String toSource();

  public static NodeRef node(String name, Pos pos) {
    return new AutoValue_Destination_NodeRef(pos, name);
  }

  public static FileTransfer fileTransfer(String file, String node, Pos pos) {
    return new AutoValue_Destination_FileTransfer(pos, file, node);
  }

  public static Exit exit(Pos pos) {
    return new AutoValue_Destination_Exit(pos);
  }

  public static Dynamic dynamic(String variable, Pos pos) {
    return new AutoValue_Destination_Dynamic(pos, variable);
  }

  @ScriptNode
  @AutoValue
  public abstract static class NodeRef extends Destination
      implements Destination_NodeRef_ScriptNode {
    NodeRef() {
      super(Type.NODE);
    }

    public abstract String name();

    @Override
    public String toSource() {
      return name();
    }
  }

  // Either side may carry ${var} tokens, interpolated when the transfer is taken.
  @ScriptNode
  @AutoValue
  public abstract static class FileTransfer extends Destination
      implements Destination_FileTransfer_ScriptNode {
    FileTransfer() {
      super(Type.FILE_TRANSFER);
    }

    public abstract String file();

    public abstract String node();

    public boolean isLiteral() {
      return !Interpolation.hasTokens(file()) && !Interpolation.hasTokens(node());
    }

    @Override
    public String toSource() {
      return "[" + file() + ":" + node() + "]";
    }
  }

  @ScriptNode
  @AutoValue
  public abstract static class Exit extends Destination implements Destination_Exit_ScriptNode {
    Exit() {
      super(Type.EXIT);
    }

    @Override
    public String toSource() {
      return "{exit}";
    }
  }

  @ScriptNode
  @AutoValue
  public abstract static class Dynamic extends Destination
      implements Destination_Dynamic_ScriptNode {
    Dynamic() {
      super(Type.DYNAMIC);
    }

    public abstract String variable();

    @Override
    public String toSource() {
      return "${" + variable() + "}";
    }
  }
}
