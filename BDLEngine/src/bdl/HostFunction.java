package bdl;

/**
 * A capability supplied by the host, invoked when a script renders {@code !{name} : ~{...}}.
 *
 * <p>A function returns its values in binding order, or {@link FunctionResult#failure()}. The
 * engine does not interpret why a call failed. Unchecked exceptions are treated as failures.
 */
@FunctionalInterface
public interface HostFunction {
  FunctionResult call(FunctionContext context);
}
