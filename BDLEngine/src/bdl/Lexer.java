package bdl;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.auto.value.AutoValue;
import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

/**
 * Splits a script into classified lines. Blank lines and {@code #} comments are dropped, except
 * for the leading metadata header. A variable declaration block becomes a single line holding
 * the whole brace-delimited block.
 */
public class Lexer {
  public enum Kind {
    // # Key: value
    METADATA,
    // $global_vars: { ... }
    GLOBAL_DECLARATION,
    // $local_vars: { ... }
    LOCAL_DECLARATION,
    // @name
    NODE,
    // !{function} : ~{a} ~{b}
    CALL,
    // {kw1, kw2} -> dest
    OPTION,
    // ?{var} -> dest
    CONDITION,
    // -> dest
    JUMP,
    TEXT;
  }

  @AutoValue
  public abstract static class Line {
    public abstract Kind kind();

    // Trimmed. For METADATA, the text after '#'; for declarations, the block from '{' to '}'.
    public abstract String text();

    public abstract Pos pos();

    public static Line create(Kind kind, String text, Pos pos) {
      return new AutoValue_Lexer_Line(kind, text, pos);
    }

    @Override
    public String toString() {
      return kind() + ": " + text();
    }
  }

  private static final Pattern METADATA = Pattern.compile("#\\s*([A-Za-z][A-Za-z0-9_ -]*?)\\s*:.*");
  private static final Pattern DECLARATION =
      Pattern.compile("\\$(global_vars|local_vars)\\s*:(.*)");
  private static final char QUOTE = '"';

  private final String file;
  private final ImmutableList<String> lines;
  private int line = 0;

  private final ImmutableList.Builder<Line> linesBuilder = ImmutableList.builder();

  public Lexer(String file, String content) {
    this.file = file;
    this.lines =
        Splitter.on('\n')
            .splitToStream(content)
            .map(s -> CharMatcher.is('\r').trimTrailingFrom(s))
            .collect(ImmutableList.toImmutableList());
  }

  public ImmutableList<Line> tokenize() throws ParseException {
    readHeader();

    for (; line < lines.size(); line++) {
      String text = lines.get(line).trim();
      if (text.isEmpty() || text.startsWith("#")) continue;

      Matcher declaration = DECLARATION.matcher(text);
      if (declaration.matches()) {
        Kind kind =
            declaration.group(1).equals("global_vars")
                ? Kind.GLOBAL_DECLARATION
                : Kind.LOCAL_DECLARATION;
        Pos pos = pos();
        linesBuilder.add(Line.create(kind, readBlock(pos, lines.get(line).indexOf(':') + 1), pos));
      } else {
        linesBuilder.add(Line.create(classify(text), text, pos()));
      }
    }

    return linesBuilder.build();
  }

  private static Kind classify(String text) {
    if (text.startsWith("@")) {
      return Kind.NODE;
    } else if (text.startsWith("!{")) {
      return Kind.CALL;
    } else if (text.startsWith("?{")) {
      return Kind.CONDITION;
    } else if (text.startsWith("{")) {
      return Kind.OPTION;
    } else if (text.startsWith("->")) {
      return Kind.JUMP;
    }
    return Kind.TEXT;
  }

  private void readHeader() {
    while (line < lines.size() && lines.get(line).trim().isEmpty()) line++;

    for (; line < lines.size(); line++) {
      String text = lines.get(line).trim();
      if (!text.startsWith("#")) return;

      // Header lines without a key are comments.
      if (METADATA.matcher(text).matches()) {
        linesBuilder.add(Line.create(Kind.METADATA, text.substring(1).trim(), pos()));
      }
    }
  }

  // Reads from 'column' of the current line up to the brace closing the block. Comment lines
  // inside the block are blanked so that line offsets stay valid.
  private String readBlock(Pos start, int column) throws ParseException {
    StringBuilder block = new StringBuilder();
    int depth = 0;
    boolean quoted = false;
    boolean first = true;

    for (; line < lines.size(); line++, column = 0) {
      String raw = lines.get(line);
      if (!first && raw.trim().startsWith("#") && !quoted) {
        block.append('\n');
        continue;
      }
      first = false;

      for (int i = column; i < raw.length(); i++) {
        char ch = raw.charAt(i);
        if (depth == 0) {
          if (Character.isWhitespace(ch)) continue;
          if (ch != '{') {
            throw new ParseException(
                ParseException.Kind.MALFORMED_DECLARATION,
                Pos.create(file, line, i),
                "expected '{' to open the declaration block");
          }
        }

        block.append(ch);
        if (quoted) {
          if (ch == '\\' && i + 1 < raw.length()) {
            block.append(raw.charAt(++i));
          } else if (ch == QUOTE) {
            quoted = false;
          }
        } else if (ch == QUOTE) {
          quoted = true;
        } else if (ch == '{') {
          depth++;
        } else if (ch == '}' && --depth == 0) {
          String rest = raw.substring(i + 1).trim();
          if (!rest.isEmpty() && !rest.startsWith("#")) {
            throw new ParseException(
                ParseException.Kind.MALFORMED_DECLARATION,
                Pos.create(file, line, i + 1),
                "unexpected text after declaration block");
          }
          return block.toString();
        }
      }
      block.append('\n');
    }

    throw new ParseException(
        ParseException.Kind.MALFORMED_DECLARATION, start, "unterminated declaration block");
  }

  private Pos pos() {
    int column = CharMatcher.whitespace().negate().indexIn(lines.get(line));
    return Pos.create(file, line, Math.max(column, 0));
  }
}
