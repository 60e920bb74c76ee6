package bdl;

import java.io.IOException;

/** Where script text comes from. Implementations must be safe to call from several threads. */
public interface ScriptSource {
  /** Returns the content of {@code fileName}, e.g. {@code "main.bdl"}. */
  String read(String fileName) throws IOException;
}
