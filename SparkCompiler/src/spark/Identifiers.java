package spark;

import com.google.common.base.CharMatcher;

/** Character classes shared by the tokenizer and the static reference rewriter. */
public final class Identifiers {
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private static final CharMatcher IDENTIFIER_CHARS =
      CharMatcher.inRange('a', 'z')
          .or(CharMatcher.inRange('A', 'Z'))
          .or(DIGITS)
          .or(CharMatcher.is('_'))
          .precomputed();

  // ASCII only; non-ASCII letters never form part of an identifier.
  public static boolean isIdentifierChar(char ch) {
    return IDENTIFIER_CHARS.matches(ch);
  }

  public static boolean isIdentifierStart(char ch) {
    return isIdentifierChar(ch) && !DIGITS.matches(ch);
  }

  public static boolean isIdentifier(String text) {
    return !text.isEmpty()
        && isIdentifierStart(text.charAt(0))
        && IDENTIFIER_CHARS.matchesAllOf(text);
  }

  private Identifiers() {}
}
