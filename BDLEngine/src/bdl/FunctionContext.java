package bdl;

import java.util.Optional;
import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The read/write view of a session handed to a {@link HostFunction}. */
public final class FunctionContext {
  private static final Logger logger = LoggerFactory.getLogger(FunctionContext.class);

  private final SessionState state;
  private final Optional<String> lastInput;
  private final Consumer<String> warnings;

  FunctionContext(SessionState state, Optional<String> lastInput, Consumer<String> warnings) {
    this.state = state;
    this.lastInput = lastInput;
    this.warnings = warnings;
  }

  public Value get(String name) {
    return state.get(name);
  }

  public String interpolate(String text) {
    return state.interpolate(text);
  }

  public void setLocal(String name, Value value) {
    state.setLocal(name, value);
  }

  /**
   * Writes a global variable. Outside the entry file the write is dropped and a warning is
   * surfaced to the host.
   *
   * @return whether the write happened
   */
  public boolean setGlobal(String name, Value value) {
    try {
      state.setGlobal(name, value);
      return true;
    } catch (ScopeException ex) {
      logger.warn(ex.getMessage());
      warnings.accept(ex.getMessage());
      return false;
    }
  }

  public String currentFile() {
    return state.currentFile();
  }

  public Optional<String> currentNode() {
    return state.currentNode();
  }

  // The last line given to Navigator.submitInput, if any.
  public Optional<String> lastInput() {
    return lastInput;
  }
}
