package bdl;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.google.common.io.Files;

/** Reads scripts from a directory on disk. */
public final class DirectoryScriptSource implements ScriptSource {
  private final File dir;

  public DirectoryScriptSource(File dir) {
    this.dir = dir;
  }

  public File dir() {
    return dir;
  }

  @Override
  public String read(String fileName) throws IOException {
    File file = new File(dir, fileName);
    if (!file.isFile()) throw new FileNotFoundException(file.toString());
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }

  @Override
  public String toString() {
    return dir.toString();
  }
}
