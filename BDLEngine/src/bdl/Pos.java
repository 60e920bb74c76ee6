package bdl;

import java.util.Comparator;

import com.google.auto.value.AutoValue;

/** A position in a script file. Line and column are zero-based. */
@AutoValue
public abstract class Pos implements Comparable<Pos> {
  private static final Pos INTERNAL = create("<internal>", -1, -1);

  public static Pos internal() {
    return INTERNAL;
  }

  public static Pos create(String file, int lineNumber, int column) {
    return new AutoValue_Pos(file, lineNumber, column);
  }

  public static Pos startOf(String file) {
    return create(file, 0, 0);
  }

  public abstract String file();

  public abstract int lineNumber();

  public abstract int column();

  public Pos addColumns(int columns) {
    return create(file(), lineNumber(), column() + columns);
  }

  @Override
  public int compareTo(Pos pos) {
    return Comparator.comparing(Pos::file)
        .thenComparing(Pos::lineNumber)
        .thenComparing(Pos::column)
        .compare(this, pos);
  }

  @Override
  public String toString() {
    if (this == INTERNAL) return file();
    return String.format("%s@%d:%d", file(), lineNumber() + 1, column() + 1);
  }
}
