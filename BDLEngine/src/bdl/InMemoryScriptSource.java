package bdl;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/** Scripts held in memory, keyed by file name. */
public final class InMemoryScriptSource implements ScriptSource {
  private final ImmutableMap<String, String> scripts;

  public InMemoryScriptSource(Map<String, String> scripts) {
    this.scripts = ImmutableMap.copyOf(scripts);
  }

  public static InMemoryScriptSource of(String fileName, String text) {
    return new InMemoryScriptSource(ImmutableMap.of(fileName, text));
  }

  @Override
  public String read(String fileName) throws IOException {
    String text = scripts.get(fileName);
    if (text == null) throw new FileNotFoundException(fileName);
    return text;
  }
}
