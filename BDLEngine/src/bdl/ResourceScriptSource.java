package bdl;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Resources;

/** Reads scripts from the classpath, below a resource prefix such as {@code "scripts/"}. */
public final class ResourceScriptSource implements ScriptSource {
  private final String prefix;
  private final ClassLoader classLoader;

  public ResourceScriptSource(String prefix) {
    this(prefix, ResourceScriptSource.class.getClassLoader());
  }

  public ResourceScriptSource(String prefix, ClassLoader classLoader) {
    this.prefix = prefix.isEmpty() || prefix.endsWith("/") ? prefix : prefix + "/";
    this.classLoader = classLoader;
  }

  @Override
  public String read(String fileName) throws IOException {
    URL url = classLoader.getResource(prefix + fileName);
    if (url == null) throw new FileNotFoundException("no resource " + prefix + fileName);
    return Resources.toString(url, StandardCharsets.UTF_8);
  }

  @Override
  public String toString() {
    return "classpath:" + prefix;
  }
}
