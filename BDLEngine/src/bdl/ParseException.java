package bdl;

/** A script could not be parsed. Always fatal to loading that document. */
public class ParseException extends BdlException {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    MISSING_METADATA,
    GLOBAL_OUTSIDE_ENTRY,
    DUPLICATE_VARIABLE,
    DUPLICATE_DECLARATION_BLOCK,
    MALFORMED_DECLARATION,
    INVALID_NODE_NAME,
    DUPLICATE_NODE,
    MALFORMED_BRANCH,
    MALFORMED_CALL,
    INVALID_DEPENDENCY,
    STRAY_CONTENT;
  }

  private final Kind kind;

  public ParseException(Kind kind, Pos pos, String errorMsg) {
    super(pos, errorMsg);
    this.kind = kind;
  }

  public Kind kind() {
    return kind;
  }
}
