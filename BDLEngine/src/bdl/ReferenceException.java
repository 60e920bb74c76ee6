package bdl;

/**
 * A name could not be resolved: a node, a file, a required dependency or a host function.
 *
 * <p>The navigator recovers from these through the fallback policy, except for {@link
 * Kind#MISSING_DEPENDENCY} raised while loading.
 */
public class ReferenceException extends BdlException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    UNKNOWN_NODE,
    UNKNOWN_FILE,
    MISSING_DEPENDENCY,
    UNKNOWN_FUNCTION;
  }

  private final Kind kind;

  public ReferenceException(Kind kind, Pos pos, String errorMsg) {
    super(pos, errorMsg);
    this.kind = kind;
  }

  public ReferenceException(Kind kind, Pos pos, String errorMsg, Throwable cause) {
    super(pos, errorMsg, cause);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
