package bdl;

import java.util.List;

/**
 * Recovery from a failed host function or an unresolvable destination: the first binding of a
 * failed call receives the fallback message, the second the fallback destination, and the
 * session moves to that destination.
 */
final class FallbackPolicy {
  private final String message;
  private final String destination;

  FallbackPolicy(EngineConfig config, String entryFile) {
    this.message = config.fallbackMessage();
    this.destination = config.fallbackReference(entryFile);
  }

  String message() {
    return message;
  }

  // A 'file:node' or bare node reference.
  String destination() {
    return destination;
  }

  void bind(List<String> bindings, SessionState state) {
    for (int i = 0; i < bindings.size(); i++) {
      Value value;
      if (i == 0) {
        value = Value.of(message);
      } else if (i == 1) {
        value = Value.of(destination);
      } else {
        value = Value.empty();
      }
      state.setLocal(bindings.get(i), value);
    }
  }

  Destination target() throws ParseException {
    return ScriptParser.parseReference(destination, Pos.internal());
  }
}
