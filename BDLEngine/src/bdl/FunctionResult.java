package bdl;

import java.util.List;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/** The outcome of a {@link HostFunction} call. */
@AutoValue
public abstract class FunctionResult {
  private static final FunctionResult FAILURE =
      new AutoValue_FunctionResult(false, ImmutableList.of());

  public abstract boolean succeeded();

  // Bound in order to the call's bindings. Empty on failure.
  public abstract ImmutableList<Value> values();

  public static FunctionResult success(Value... values) {
    return success(ImmutableList.copyOf(values));
  }

  public static FunctionResult success(List<Value> values) {
    return new AutoValue_FunctionResult(true, ImmutableList.copyOf(values));
  }

  public static FunctionResult failure() {
    return FAILURE;
  }
}
