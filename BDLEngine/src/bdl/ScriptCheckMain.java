package bdl;

import java.io.File;

import com.google.common.collect.ImmutableList;

public class ScriptCheckMain {

  public static void main(String[] args) {
    if (args.length != 2) {
      System.err.println("Usage: $CHECKER script_dir entry_file");
      System.exit(1);
    }

    File dir = new File(args[0]);
    if (!dir.isDirectory()) {
      System.err.println("Not a directory: " + dir);
      System.exit(1);
    }

    DocumentRegistry registry = new DocumentRegistry(new DirectoryScriptSource(dir), args[1]);
    try {
      registry.load(args[1]);
    } catch (BdlException ex) {
      ex.print();
      for (Throwable cause = ex.getCause(); cause != null; cause = cause.getCause()) {
        if (cause instanceof BdlException) ((BdlException) cause).print();
      }
      System.out.println("Loading failed.  See errors above.");
      System.exit(1);
    }

    ImmutableList<BdlException> errors = registry.validate();
    if (!errors.isEmpty()) {
      errors.stream().forEach(BdlException::print);
      System.out.println("Validation failed.  See errors above.");
      System.exit(1);
    }

    System.out.println(
        String.format(
            "%d script(s) OK: %s", registry.documents().size(), registry.documents().keySet()));
  }
}
