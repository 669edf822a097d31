package io.sqlkit.core.lexer;

/**
 * A single token of SQL text.
 *
 * <p>The {@code value} is the kind-specific payload: canonical uppercase text for keywords,
 * unescaped content for quoted tokens, and the raw source text for everything else. Use {@link
 * #text(String)} to get the exact source slice.
 *
 * @param kind the kind of this token
 * @param value the kind-specific value
 * @param start offset where the token starts (inclusive)
 * @param end offset where the token ends (exclusive)
 */
public record Token(TokenKind kind, String value, int start, int end) {

  public int length() {
    return end - start;
  }

  public TextRange range() {
    return new TextRange(start, end);
  }

  public boolean isTrivia() {
    return kind.isTrivia();
  }

  /** Checks for a keyword token with the given canonical spelling. */
  public boolean isKeyword(String keyword) {
    return kind == TokenKind.KEYWORD && value.equals(keyword);
  }

  /**
   * Checks if the given offset lies within this token.
   *
   * @param offset the offset to check
   * @return true if {@code start <= offset < end}
   */
  public boolean contains(int offset) {
    return offset >= start && offset < end;
  }

  /** Returns the source slice this token was scanned from. */
  public String text(String source) {
    return source.substring(start, end);
  }

  @Override
  public String toString() {
    return String.format("%s['%s']@%d-%d", kind, value, start, end);
  }
}
