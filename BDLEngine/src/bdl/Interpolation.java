package bdl;

import java.util.function.Function;

import com.google.common.base.CharMatcher;
import com.google.common.collect.ImmutableSet;

/** Substitution of {@code ${name}} tokens. */
public final class Interpolation {
  private static final String OPEN = "${";
  private static final char CLOSE = '}';
  private static final CharMatcher NAME_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(CharMatcher.inRange('0', '9'))
          .or(CharMatcher.anyOf("_."));

  public static boolean hasTokens(String text) {
    return !variableNames(text).isEmpty();
  }

  /**
   * Replaces every well-formed {@code ${name}} token with the display string of {@code
   * lookup.apply(name)}. Malformed tokens, including an unterminated {@code ${}, are copied
   * verbatim.
   */
  public static String interpolate(String text, Function<String, Value> lookup) {
    StringBuilder out = new StringBuilder(text.length());
    int index = 0;
    while (index < text.length()) {
      int open = text.indexOf(OPEN, index);
      if (open < 0) break;

      out.append(text, index, open);
      String name = tokenName(text, open);
      if (name == null) {
        out.append(OPEN);
        index = open + OPEN.length();
      } else {
        out.append(lookup.apply(name).toDisplayString());
        index = open + OPEN.length() + name.length() + 1;
      }
    }
    out.append(text, index, text.length());
    return out.toString();
  }

  /** The names referenced by well-formed tokens in {@code text}, in order of appearance. */
  public static ImmutableSet<String> variableNames(String text) {
    ImmutableSet.Builder<String> names = ImmutableSet.builder();
    int index = 0;
    while (true) {
      int open = text.indexOf(OPEN, index);
      if (open < 0) break;

      String name = tokenName(text, open);
      if (name != null) names.add(name);
      index = open + OPEN.length();
    }
    return names.build();
  }

  // The name of the token starting at 'open', or null if it is malformed.
  private static String tokenName(String text, int open) {
    int start = open + OPEN.length();
    int close = text.indexOf(CLOSE, start);
    if (close <= start) return null;

    String name = text.substring(start, close);
    return NAME_CHARS.matchesAllOf(name) ? name : null;
  }

  private Interpolation() {}
}
