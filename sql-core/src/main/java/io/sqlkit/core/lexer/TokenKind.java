package io.sqlkit.core.lexer;

/**
 * Token kinds produced by {@link SqlTokenizer}.
 *
 * <p>Whitespace and comments are trivia: they carry no structural meaning but still occupy a source
 * range, so that concatenating all tokens reproduces the input.
 */
public enum TokenKind {
  /** SQL keyword; value is the canonical uppercase spelling. */
  KEYWORD,

  /** Bare identifier; value keeps the original case. */
  IDENTIFIER,

  /** Double-quoted identifier; value is the content with {@code ""} unescaped. */
  QUOTED_IDENTIFIER,

  /** Single-quoted string; value is the content with {@code ''} unescaped. */
  STRING_LITERAL,

  /** Numeric literal: 42, 3.14, .5, 1.5e-3 */
  NUMBER,

  /** Comma: , */
  COMMA,

  /** Star: * */
  STAR,

  /** Opening parenthesis: ( */
  LEFT_PAREN,

  /** Closing parenthesis: ) */
  RIGHT_PAREN,

  /** Run of spaces, tabs, carriage returns and line feeds */
  WHITESPACE,

  /** -- comment up to (not including) the end of line */
  LINE_COMMENT,

  /** Block comment, possibly unterminated */
  BLOCK_COMMENT,

  /** Any other single character: operators, semicolons, dots */
  OTHER;

  /** Returns true for whitespace and comments. */
  public boolean isTrivia() {
    return this == WHITESPACE || this == LINE_COMMENT || this == BLOCK_COMMENT;
  }
}
