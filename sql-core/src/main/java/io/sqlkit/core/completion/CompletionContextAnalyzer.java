package io.sqlkit.core.completion;

import io.sqlkit.core.lexer.SqlTokenizer;
import io.sqlkit.core.lexer.TextRange;
import io.sqlkit.core.lexer.Token;
import io.sqlkit.core.lexer.TokenKind;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Analyzes the editor text and cursor position to determine the completion context. This is the
 * single source of truth for context detection - all logic is isolated here.
 *
 * <p>Only the last meaningful token before the word being typed is inspected. A trailing comma
 * walks back to the nearest clause keyword to decide between a column list and a table list.
 */
public class CompletionContextAnalyzer {

  private static final Set<String> TABLE_REF_KEYWORDS =
      Set.of("FROM", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "CROSS", "NATURAL", "INTO");

  private static final Set<String> COLUMN_REF_KEYWORDS =
      Set.of(
          "SELECT", "WHERE", "AND", "OR", "ON", "HAVING", "SET", "BY", "WHEN", "THEN", "ELSE",
          "CASE", "DISTINCT", "NOT", "BETWEEN", "LIKE", "IN", "IS");

  // Clause keywords a trailing comma resolves against
  private static final Set<String> COLUMN_LIST_CLAUSES =
      Set.of("SELECT", "BY", "WHERE", "HAVING", "ON");
  private static final Set<String> TABLE_LIST_CLAUSES = Set.of("FROM", "JOIN");

  private final SqlTokenizer tokenizer;

  public CompletionContextAnalyzer() {
    this(new SqlTokenizer());
  }

  public CompletionContextAnalyzer(SqlTokenizer tokenizer) {
    this.tokenizer = tokenizer;
  }

  /**
   * Analyze the text to determine the completion context at {@code cursor}.
   *
   * @param text the full editor text
   * @param cursor cursor offset, {@code 0 <= cursor <= text.length()}
   * @return the context, with the word being typed as prefix
   */
  public CompletionContext analyze(String text, int cursor) {
    int wordStart = wordStart(text, cursor);
    return CompletionContext.builder()
        .type(determineContext(text.substring(0, wordStart)))
        .prefix(text.substring(wordStart, cursor))
        .prefixRange(new TextRange(wordStart, cursor))
        .fullText(text)
        .cursor(cursor)
        .build();
  }

  /**
   * Classifies the text preceding the cursor.
   *
   * @param textBeforeCursor the editor text up to the cursor; an unfinished segment at its end,
   *     such as a word or a qualifier like {@code t.}, is ignored
   * @return the expected kind of word
   */
  public CompletionContextType determineContext(String textBeforeCursor) {
    List<Token> all = tokenizer.tokenize(textBeforeCursor);
    List<Token> tokens =
        all.subList(0, unfinishedSegmentStart(all)).stream()
            .filter(t -> !t.isTrivia())
            .collect(Collectors.toList());

    if (tokens.isEmpty()) {
      return CompletionContextType.GENERAL;
    }

    Token last = tokens.get(tokens.size() - 1);
    if (last.kind() == TokenKind.COMMA) {
      return contextBeforeComma(tokens);
    }

    String word = word(last);
    if (word == null) {
      return CompletionContextType.GENERAL;
    }
    if (TABLE_REF_KEYWORDS.contains(word)) {
      return CompletionContextType.TABLE_REF;
    }
    if (COLUMN_REF_KEYWORDS.contains(word)) {
      return CompletionContextType.COLUMN_REF;
    }
    return switch (word) {
      case "ORDER" -> CompletionContextType.AFTER_ORDER;
      case "GROUP" -> CompletionContextType.AFTER_GROUP;
      default -> CompletionContextType.GENERAL;
    };
  }

  /**
   * Finds the start of the word ending at {@code cursor}.
   *
   * @return the offset of the first word character, or {@code cursor} if none precedes it
   */
  public static int wordStart(String text, int cursor) {
    int start = cursor;
    while (start > 0 && isWordCharacter(text.charAt(start - 1))) {
      start--;
    }
    return start;
  }

  /** Word characters for completion prefixes: A-Z, a-z, 0-9 and underscore. */
  public static boolean isWordCharacter(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
  }

  private CompletionContextType contextBeforeComma(List<Token> tokens) {
    for (int i = tokens.size() - 1; i >= 0; i--) {
      String word = word(tokens.get(i));
      if (word == null) {
        continue;
      }
      if (COLUMN_LIST_CLAUSES.contains(word)) {
        return CompletionContextType.COLUMN_REF;
      }
      if (TABLE_LIST_CLAUSES.contains(word)) {
        return CompletionContextType.TABLE_REF;
      }
    }
    return CompletionContextType.COLUMN_REF;
  }

  /**
   * Finds where the unfinished segment at the end of the text starts. The segment is the run of
   * tokens after the last trivia, comma or parenthesis, such as {@code t.} or {@code x=}.
   *
   * @return index of the first token of the segment, or {@code tokens.size()} if there is none
   */
  private static int unfinishedSegmentStart(List<Token> tokens) {
    int start = tokens.size();
    while (start > 0 && !endsSegment(tokens.get(start - 1))) {
      start--;
    }
    return start;
  }

  private static boolean endsSegment(Token token) {
    return token.isTrivia()
        || token.kind() == TokenKind.COMMA
        || token.kind() == TokenKind.LEFT_PAREN
        || token.kind() == TokenKind.RIGHT_PAREN;
  }

  /** Uppercase word for keywords and bare identifiers, null for any other token. */
  private static String word(Token token) {
    return switch (token.kind()) {
      case KEYWORD -> token.value();
      case IDENTIFIER -> token.value().toUpperCase(Locale.ROOT);
      default -> null;
    };
  }
}
