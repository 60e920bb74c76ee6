package bdl;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.common.primitives.Doubles;

/**
 * Recursive-descent parser for a variable declaration block:
 *
 * <pre>
 * block := '{' (entry ((',' | newline) entry)* ','?)? '}'
 * entry := name ':' value
 * value := "string" | number | true | false | block | (nothing)
 * </pre>
 */
final class DeclarationParser {
  private static final char QUOTE = '"';

  private final String text;
  private final Pos base;
  private int index = 0;

  private DeclarationParser(String text, Pos base) {
    this.text = text;
    this.base = base;
  }

  /** Parses {@code block}, which starts at {@code base}. */
  static ImmutableMap<String, Value> parse(String block, Pos base) throws ParseException {
    DeclarationParser parser = new DeclarationParser(block, base);
    parser.skipWhitespace();
    ImmutableMap<String, Value> result = parser.parseBlock();
    parser.skipWhitespace();
    if (!parser.atEnd()) throw parser.error("unexpected text after declaration block");
    return result;
  }

  private ImmutableMap<String, Value> parseBlock() throws ParseException {
    if (atEnd() || peek() != '{') throw error("expected '{'");
    index++;

    Map<String, Value> entries = new LinkedHashMap<>();
    while (true) {
      skipWhitespace();
      if (atEnd()) throw error("unterminated declaration block");
      if (peek() == '}') {
        index++;
        return ImmutableMap.copyOf(entries);
      }

      Pos namePos = pos();
      String name = readName();
      if (name.isEmpty()) throw error(String.format("expected a variable name, got '%c'", peek()));

      skipInlineWhitespace();
      if (atEnd() || peek() != ':') throw error("expected ':' after '" + name + "'");
      index++;
      skipInlineWhitespace();

      Value value = parseValue();
      if (entries.containsKey(name)) {
        throw new ParseException(
            ParseException.Kind.DUPLICATE_VARIABLE,
            namePos,
            String.format("duplicate variable '%s'", name));
      }
      entries.put(name, value);

      skipInlineWhitespace();
      if (atEnd()) throw error("unterminated declaration block");
      char ch = peek();
      if (ch == ',' || ch == '\n') {
        index++;
      } else if (ch != '}') {
        throw error(String.format("expected ',' or '}' after '%s', got '%c'", name, ch));
      }
    }
  }

  private Value parseValue() throws ParseException {
    if (atEnd()) throw error("unterminated declaration block");

    char ch = peek();
    if (ch == QUOTE) {
      return Value.of(readString());
    } else if (ch == '{') {
      return Value.struct(parseBlock());
    } else if (ch == ',' || ch == '\n' || ch == '}') {
      return Value.empty();
    }

    Pos valuePos = pos();
    int start = index;
    while (!atEnd() && peek() != ',' && peek() != '\n' && peek() != '}') index++;
    String raw = text.substring(start, index).trim();

    if (raw.equals("true")) {
      return Value.of(true);
    } else if (raw.equals("false")) {
      return Value.of(false);
    }
    Double number = Doubles.tryParse(raw);
    if (number != null) return Value.of(number);
    throw new ParseException(
        ParseException.Kind.MALFORMED_DECLARATION,
        valuePos,
        String.format("invalid value format: %s", raw));
  }

  private String readString() throws ParseException {
    Pos start = pos();
    index++;

    StringBuilder value = new StringBuilder();
    while (!atEnd()) {
      char ch = text.charAt(index++);
      if (ch == QUOTE) return value.toString();
      if (ch == '\n') break;

      if (ch == '\\' && !atEnd()) {
        char escaped = text.charAt(index++);
        value.append(escaped == 'n' ? '\n' : escaped);
      } else {
        value.append(ch);
      }
    }
    throw new ParseException(
        ParseException.Kind.MALFORMED_DECLARATION, start, "unterminated string literal");
  }

  private String readName() {
    int start = index;
    while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) index++;
    return text.substring(start, index);
  }

  private void skipWhitespace() {
    while (!atEnd() && Character.isWhitespace(peek())) index++;
  }

  // Whitespace other than newlines, which separate entries.
  private void skipInlineWhitespace() {
    while (!atEnd() && peek() != '\n' && Character.isWhitespace(peek())) index++;
  }

  private boolean atEnd() {
    return index >= text.length();
  }

  private char peek() {
    return text.charAt(index);
  }

  private Pos pos() {
    int lineStart = text.lastIndexOf('\n', index - 1) + 1;
    int lineOffset = 0;
    for (int i = 0; i < lineStart; i++) {
      if (text.charAt(i) == '\n') lineOffset++;
    }
    int column = index - lineStart + (lineOffset == 0 ? base.column() : 0);
    return Pos.create(base.file(), base.lineNumber() + lineOffset, column);
  }

  private ParseException error(String msg) {
    return new ParseException(ParseException.Kind.MALFORMED_DECLARATION, pos(), msg);
  }
}
