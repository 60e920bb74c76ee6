package bdl;

/** A global variable was written outside the entry file. The write is dropped. */
public class ScopeException extends BdlException {
  private static final long serialVersionUID = 1L;

  private final String variable;

  public ScopeException(String variable, String currentFile) {
    super(
        Pos.startOf(currentFile),
        String.format(
            "global variable '%s' can only be written from the entry file", variable));
    this.variable = variable;
  }

  public String variable() {
    return variable;
  }
}
