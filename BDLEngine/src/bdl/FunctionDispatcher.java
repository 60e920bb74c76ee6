package bdl;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/** The host functions available to scripts, by name. Immutable once built. */
public final class FunctionDispatcher {
  private static final Logger logger = LoggerFactory.getLogger(FunctionDispatcher.class);

  private final ImmutableMap<String, HostFunction> functions;

  private FunctionDispatcher(ImmutableMap<String, HostFunction> functions) {
    this.functions = functions;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static FunctionDispatcher empty() {
    return builder().build();
  }

  public boolean isRegistered(String name) {
    return functions.containsKey(name);
  }

  public ImmutableSet<String> names() {
    return functions.keySet();
  }

  /**
   * Invokes the function named by {@code call}. A function that throws an unchecked exception
   * yields {@link FunctionResult#failure()}.
   */
  FunctionResult dispatch(ContentElement.Call call, FunctionContext context)
      throws ReferenceException {
    HostFunction function = functions.get(call.function());
    if (function == null) {
      throw new ReferenceException(
          ReferenceException.Kind.UNKNOWN_FUNCTION,
          call.pos(),
          String.format("no host function named '%s'", call.function()));
    }

    FunctionResult result;
    try {
      result = function.call(context);
    } catch (RuntimeException ex) {
      logger.warn(String.format("%s !{%s} threw", call.pos(), call.function()), ex);
      return FunctionResult.failure();
    }
    return result == null ? FunctionResult.failure() : result;
  }

  /**
   * Binds {@code values} to {@code bindings} as locals, in order. Missing values bind to {@link
   * Value#empty()}; extra values are discarded.
   */
  static void bind(List<String> bindings, List<Value> values, SessionState state) {
    for (int i = 0; i < bindings.size(); i++) {
      state.setLocal(bindings.get(i), i < values.size() ? values.get(i) : Value.empty());
    }
  }

  public static final class Builder {
    private final ImmutableMap.Builder<String, HostFunction> functions = ImmutableMap.builder();
    private final Set<String> names = new HashSet<>();

    private Builder() {}

    public Builder register(String name, HostFunction function) {
      Preconditions.checkArgument(names.add(name), "function already registered: %s", name);
      functions.put(name, Preconditions.checkNotNull(function));
      return this;
    }

    public FunctionDispatcher build() {
      return new FunctionDispatcher(functions.build());
    }
  }
}
