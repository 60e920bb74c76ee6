package bdl;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;

abstract class ErrorCollectingValidator extends VoidDefaultScriptVisitor {
  private final List<BdlException> errors = new ArrayList<>();

  protected ImmutableList<BdlException> errors() {
    return ImmutableList.copyOf(errors);
  }

  protected void logError(Pos pos, String msg) {
    logError(new BdlException(pos, msg));
  }

  protected void logError(BdlException ex) {
    errors.add(ex);
  }

  protected void takeErrors(ErrorCollectingValidator other) {
    errors.addAll(other.errors);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  public void printErrors() {
    errors.stream().sorted((a, b) -> a.pos().compareTo(b.pos())).forEach(BdlException::print);
  }
}
