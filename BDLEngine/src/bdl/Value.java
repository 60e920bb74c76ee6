package bdl;

import java.util.Map;
import java.util.stream.Collectors;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;

/** A scalar script value, or an ordered mapping of names to values. */
public abstract class Value {
  public enum Type {
    STRING,
    NUMBER,
    BOOLEAN,
    EMPTY,
    STRUCT;
  }

  private final Type type;

  private Value(Type type) {
    this.type = type;
  }

  public final Type type() {
    return type;
  }

  @SuppressWarnings("unchecked")
  public <T extends Value> T cast() {
    return (T) this;
  }

  public boolean isEmpty() {
    return type == Type.EMPTY;
  }

  // Empty, false, 0, "false" and "0" are falsy.
  public abstract boolean isTruthy();

  public abstract String toDisplayString();

  public static Value of(String value) {
    return new AutoValue_Value_StringValue(value);
  }

  public static Value of(double value) {
    return new AutoValue_Value_NumberValue(value);
  }

  public static Value of(boolean value) {
    return value ? BooleanValue.TRUE : BooleanValue.FALSE;
  }

  public static Value empty() {
    return EmptyValue.INSTANCE;
  }

  public static Value struct(Map<String, Value> fields) {
    return new AutoValue_Value_StructValue(ImmutableMap.copyOf(fields));
  }

  @AutoValue
  public abstract static class StringValue extends Value {
    StringValue() {
      super(Type.STRING);
    }

    public abstract String value();

    @Override
    public boolean isTruthy() {
      return !value().equals("false") && !value().equals("0");
    }

    @Override
    public String toDisplayString() {
      return value();
    }
  }

  @AutoValue
  public abstract static class NumberValue extends Value {
    NumberValue() {
      super(Type.NUMBER);
    }

    public abstract double value();

    @Override
    public boolean isTruthy() {
      return value() != 0 && !Double.isNaN(value());
    }

    @Override
    public String toDisplayString() {
      double value = value();
      if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
        return Long.toString((long) value);
      }
      return Double.toString(value);
    }
  }

  @AutoValue
  public abstract static class BooleanValue extends Value {
    private static final BooleanValue TRUE = new AutoValue_Value_BooleanValue(true);
    private static final BooleanValue FALSE = new AutoValue_Value_BooleanValue(false);

    BooleanValue() {
      super(Type.BOOLEAN);
    }

    public abstract boolean value();

    @Override
    public boolean isTruthy() {
      return value();
    }

    @Override
    public String toDisplayString() {
      return Boolean.toString(value());
    }
  }

  public static final class EmptyValue extends Value {
    private static final EmptyValue INSTANCE = new EmptyValue();

    private EmptyValue() {
      super(Type.EMPTY);
    }

    @Override
    public boolean isTruthy() {
      return false;
    }

    @Override
    public String toDisplayString() {
      return "";
    }

    @Override
    public String toString() {
      return "Empty";
    }
  }

  @AutoValue
  public abstract static class StructValue extends Value {
    StructValue() {
      super(Type.STRUCT);
    }

    public abstract ImmutableMap<String, Value> fields();

    @Override
    public boolean isTruthy() {
      return true;
    }

    @Override
    public String toDisplayString() {
      return fields()
          .entrySet()
          .stream()
          .map(e -> e.getKey() + ": " + e.getValue().toDisplayString())
          .collect(Collectors.joining(", ", "{", "}"));
    }
  }
}
