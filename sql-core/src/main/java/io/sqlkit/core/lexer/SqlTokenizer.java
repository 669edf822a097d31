package io.sqlkit.core.lexer;

import io.sqlkit.core.SqlVocabulary;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Lossless tokenizer for SQL text as typed in an editor.
 *
 * <p>This tokenizer performs a single left-to-right pass and never fails: unterminated strings,
 * quoted identifiers and block comments simply run to the end of input, and any character it does
 * not recognize becomes an {@link TokenKind#OTHER} token. Whitespace and comments are kept as
 * trivia tokens, so the token ranges always cover the input exactly, without gaps or overlaps.
 *
 * <p>At each position the rules are tried in this order:
 *
 * <ol>
 *   <li>whitespace run (space, tab, CR, LF)
 *   <li>{@code --} line comment
 *   <li>{@code /* *}{@code /} block comment, no nesting
 *   <li>{@code '...'} string literal with {@code ''} escapes
 *   <li>{@code "..."} quoted identifier with {@code ""} escapes
 *   <li>{@code ( ) , *}
 *   <li>number: a digit, or a dot followed by a digit
 *   <li>word: keyword or identifier, Unicode letters and digits allowed
 *   <li>any other single character
 * </ol>
 *
 * <p>Instances hold no state and may be shared between threads.
 */
public final class SqlTokenizer {

  /**
   * Tokenizes SQL text.
   *
   * @param sql the text to tokenize, {@code null} is treated as empty
   * @return tokens in source order covering the whole input
   */
  public List<Token> tokenize(String sql) {
    if (sql == null || sql.isEmpty()) {
      return Collections.emptyList();
    }

    List<Token> tokens = new ArrayList<>();
    int pos = 0;
    int len = sql.length();

    while (pos < len) {
      char c = sql.charAt(pos);
      Token token;

      if (isWhitespace(c)) {
        token = tokenizeWhitespace(sql, pos);
      } else if (c == '-' && peek(sql, pos + 1) == '-') {
        token = tokenizeLineComment(sql, pos);
      } else if (c == '/' && peek(sql, pos + 1) == '*') {
        token = tokenizeBlockComment(sql, pos);
      } else if (c == '\'') {
        token = tokenizeQuoted(sql, pos, '\'', TokenKind.STRING_LITERAL);
      } else if (c == '"') {
        token = tokenizeQuoted(sql, pos, '"', TokenKind.QUOTED_IDENTIFIER);
      } else if (matchPunctuation(c) != null) {
        token = new Token(matchPunctuation(c), String.valueOf(c), pos, pos + 1);
      } else if (Character.isDigit(c) || (c == '.' && Character.isDigit(peek(sql, pos + 1)))) {
        token = tokenizeNumber(sql, pos);
      } else if (isWordStart(sql.codePointAt(pos))) {
        token = tokenizeWord(sql, pos);
      } else {
        // One code point, so a surrogate pair is never split
        int end = pos + Character.charCount(sql.codePointAt(pos));
        token = new Token(TokenKind.OTHER, sql.substring(pos, end), pos, end);
      }

      tokens.add(token);
      pos = token.end();
    }

    return tokens;
  }

  /**
   * Finds the token containing the given offset.
   *
   * @param tokens tokens of a single source text
   * @param offset offset into that text
   * @return index of the token containing {@code offset}, or -1 if the offset is out of bounds
   */
  public int tokenAt(List<Token> tokens, int offset) {
    int lo = 0;
    int hi = tokens.size() - 1;
    while (lo <= hi) {
      int mid = (lo + hi) >>> 1;
      Token token = tokens.get(mid);
      if (offset < token.start()) {
        hi = mid - 1;
      } else if (offset >= token.end()) {
        lo = mid + 1;
      } else {
        return mid;
      }
    }
    return -1;
  }

  /**
   * Finds the next non-trivia token starting from the given index.
   *
   * @param tokens list of tokens
   * @param fromIndex index to start searching from (inclusive)
   * @return index of the next non-trivia token, or -1 if none found
   */
  public int nextNonTrivia(List<Token> tokens, int fromIndex) {
    for (int i = Math.max(fromIndex, 0); i < tokens.size(); i++) {
      if (!tokens.get(i).isTrivia()) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Finds the closest non-trivia token at or before the given index.
   *
   * @param tokens list of tokens
   * @param fromIndex index to start searching backward from (inclusive)
   * @return index of the previous non-trivia token, or -1 if none found
   */
  public int previousNonTrivia(List<Token> tokens, int fromIndex) {
    for (int i = Math.min(fromIndex, tokens.size() - 1); i >= 0; i--) {
      if (!tokens.get(i).isTrivia()) {
        return i;
      }
    }
    return -1;
  }

  // Private helper methods

  private static boolean isWhitespace(char c) {
    return c == ' ' || c == '\t' || c == '\r' || c == '\n';
  }

  private static boolean isWordStart(int codePoint) {
    return Character.isLetter(codePoint) || codePoint == '_';
  }

  private static boolean isWordPart(int codePoint) {
    return Character.isLetterOrDigit(codePoint) || codePoint == '_';
  }

  /** Returns the char at {@code pos}, or NUL past the end. */
  private static char peek(String sql, int pos) {
    return pos < sql.length() ? sql.charAt(pos) : '\0';
  }

  private static TokenKind matchPunctuation(char c) {
    return switch (c) {
      case '(' -> TokenKind.LEFT_PAREN;
      case ')' -> TokenKind.RIGHT_PAREN;
      case ',' -> TokenKind.COMMA;
      case '*' -> TokenKind.STAR;
      default -> null;
    };
  }

  private Token tokenizeWhitespace(String sql, int start) {
    int pos = start;
    while (pos < sql.length() && isWhitespace(sql.charAt(pos))) {
      pos++;
    }
    return new Token(TokenKind.WHITESPACE, sql.substring(start, pos), start, pos);
  }

  private Token tokenizeLineComment(String sql, int start) {
    int end = sql.indexOf('\n', start);
    if (end < 0) {
      end = sql.length();
    }
    return new Token(TokenKind.LINE_COMMENT, sql.substring(start, end), start, end);
  }

  private Token tokenizeBlockComment(String sql, int start) {
    int close = sql.indexOf("*/", start + 2);
    int end = close < 0 ? sql.length() : close + 2;
    return new Token(TokenKind.BLOCK_COMMENT, sql.substring(start, end), start, end);
  }

  private Token tokenizeQuoted(String sql, int start, char quote, TokenKind kind) {
    int pos = start + 1; // Skip opening quote
    StringBuilder value = new StringBuilder();

    while (pos < sql.length()) {
      char c = sql.charAt(pos);
      if (c == quote) {
        if (peek(sql, pos + 1) == quote) {
          // Doubled quote is an escaped literal quote
          value.append(quote);
          pos += 2;
          continue;
        }
        pos++; // Closing quote
        return new Token(kind, value.toString(), start, pos);
      }
      value.append(c);
      pos++;
    }

    // Unterminated: runs to end of input
    return new Token(kind, value.toString(), start, pos);
  }

  private Token tokenizeNumber(String sql, int start) {
    int pos = start;
    int len = sql.length();

    while (pos < len && (Character.isDigit(sql.charAt(pos)) || sql.charAt(pos) == '.')) {
      pos++;
    }

    // Exponent only when digits follow, otherwise the letter starts a new word
    if (pos < len && (sql.charAt(pos) == 'e' || sql.charAt(pos) == 'E')) {
      int exp = pos + 1;
      if (exp < len && (sql.charAt(exp) == '+' || sql.charAt(exp) == '-')) {
        exp++;
      }
      if (exp < len && Character.isDigit(sql.charAt(exp))) {
        pos = exp;
        while (pos < len && Character.isDigit(sql.charAt(pos))) {
          pos++;
        }
      }
    }

    return new Token(TokenKind.NUMBER, sql.substring(start, pos), start, pos);
  }

  private Token tokenizeWord(String sql, int start) {
    int pos = start;
    while (pos < sql.length()) {
      int cp = sql.codePointAt(pos);
      if (!isWordPart(cp)) {
        break;
      }
      pos += Character.charCount(cp);
    }

    String word = sql.substring(start, pos);
    String upper = word.toUpperCase(Locale.ROOT);
    if (SqlVocabulary.STRUCTURAL_KEYWORDS.contains(upper)) {
      return new Token(TokenKind.KEYWORD, upper, start, pos);
    }
    return new Token(TokenKind.IDENTIFIER, word, start, pos);
  }
}
