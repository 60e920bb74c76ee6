package bdl;

import java.util.Objects;

import com.google.common.collect.ImmutableSet;

import bdl.processor.ScriptChild;
import bdl.processor.ScriptNode;

/** An edge out of a node. Branches keep their source order. */
public abstract class Branch implements ScriptNodeInterface {
  public enum Type {
    // {kw1, kw2} -> dest
    OPTION,
    // ?{var} -> dest
    CONDITION,
    // -> dest
    JUMP;
  }

  private final Type type;
  private final Destination destination;
  private final Pos pos;

  private Branch(Type type, Destination destination, Pos pos) {
    this.type = type;
    this.destination = destination;
    this.pos = pos;
  }

  public final Type type() {
    return type;
  }

  public final Pos pos() {
    return pos;
  }

  public Destination destination() {
    return destination;
  }

  @SuppressWarnings("unchecked")
  public <T extends Branch> T cast() {
    return (T) this;
  }

  /** True if this branch is taken without waiting for input. */
  public boolean isAutomatic() {
    return type != Type.OPTION;
  }

  @Override
  public boolean equals(Object o) {
    if (o == null || o.getClass() != getClass()) return false;

    Branch that = (Branch) o;
    return destination.equals(that.destination) && pos.equals(that.pos);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, destination, pos);
  }

  @ScriptNode
  public static final class Option extends Branch implements Branch_Option_ScriptNode {
    private final ImmutableSet<String> keywords;

    public Option(ImmutableSet<String> keywords, Destination destination, Pos pos) {
      super(Type.OPTION, destination, pos);
      this.keywords = keywords;
    }

    @ScriptChild
    @Override
    public Destination destination() {
      return super.destination();
    }

    // Trimmed and case-folded.
    public ImmutableSet<String> keywords() {
      return keywords;
    }

    public boolean matches(String normalizedInput) {
      return keywords.contains(normalizedInput);
    }

    @Override
    public boolean equals(Object o) {
      return super.equals(o) && keywords.equals(((Option) o).keywords);
    }

    @Override
    public int hashCode() {
      return 31 * super.hashCode() + keywords.hashCode();
    }

    @Override
    public String toString() {
      return String.join(", ", keywords) + " -> " + destination().toSource();
    }
  }

  @ScriptNode
  public static final class Condition extends Branch implements Branch_Condition_ScriptNode {
    private final String variable;

    public Condition(String variable, Destination destination, Pos pos) {
      super(Type.CONDITION, destination, pos);
      this.variable = variable;
    }

    @ScriptChild
    @Override
    public Destination destination() {
      return super.destination();
    }

    public String variable() {
      return variable;
    }

    @Override
    public boolean equals(Object o) {
      return super.equals(o) && variable.equals(((Condition) o).variable);
    }

    @Override
    public int hashCode() {
      return 31 * super.hashCode() + variable.hashCode();
    }

    @Override
    public String toString() {
      return "?{" + variable + "} -> " + destination().toSource();
    }
  }

  @ScriptNode
  public static final class Jump extends Branch implements Branch_Jump_ScriptNode {
    public Jump(Destination destination, Pos pos) {
      super(Type.JUMP, destination, pos);
    }

    @ScriptChild
    @Override
    public Destination destination() {
      return super.destination();
    }

    @Override
    public String toString() {
      return "-> " + destination().toSource();
    }
  }
}
