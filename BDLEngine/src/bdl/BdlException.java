package bdl;

/** Base of every error raised while loading or running scripts. */
public class BdlException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Pos pos;

  public BdlException(Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
  }

  public BdlException(Pos pos, String errorMsg, Throwable cause) {
    super(errorMsg, cause);
    this.pos = pos;
  }

  public Pos pos() {
    return pos;
  }

  public String errorMsg() {
    return super.getMessage();
  }

  @Override
  public String getMessage() {
    return String.format("%s %s", pos, errorMsg());
  }

  public void print() {
    System.out.println("ERROR: " + getMessage());
  }
}
