package io.sqlkit.core.structure;

import io.sqlkit.core.lexer.SqlTokenizer;
import io.sqlkit.core.lexer.TextRange;
import io.sqlkit.core.lexer.Token;
import io.sqlkit.core.lexer.TokenKind;
import java.util.List;
import java.util.Optional;

/**
 * Locates the column list of a {@code SELECT} statement, i.e. the text between {@code SELECT
 * [DISTINCT]} and the top-level {@code FROM}.
 *
 * <p>Boundaries are found on tokens, not on raw text, so a {@code FROM} inside a string literal,
 * quoted identifier, comment or parenthesized subquery never ends the list. Trivia right before the
 * {@code FROM} is not part of the returned range; comments between columns are.
 */
public final class ColumnListLocator {

  private final SqlTokenizer tokenizer;

  public ColumnListLocator() {
    this(new SqlTokenizer());
  }

  public ColumnListLocator(SqlTokenizer tokenizer) {
    this.tokenizer = tokenizer;
  }

  /**
   * Returns the range of the column list.
   *
   * @param sql the statement text
   * @return the column list range, or empty if the text is not a {@code SELECT ... FROM} statement
   */
  public Optional<TextRange> locate(String sql) {
    List<Token> tokens = tokenizer.tokenize(sql);

    int idx = tokenizer.nextNonTrivia(tokens, 0);
    if (idx < 0 || !tokens.get(idx).isKeyword("SELECT")) {
      return Optional.empty();
    }

    idx = tokenizer.nextNonTrivia(tokens, idx + 1);
    if (idx >= 0 && tokens.get(idx).isKeyword("DISTINCT")) {
      idx = tokenizer.nextNonTrivia(tokens, idx + 1);
    }
    if (idx < 0) {
      return Optional.empty();
    }
    int listStart = idx;

    int fromIdx = findTopLevelFrom(tokens, listStart);
    if (fromIdx <= listStart) {
      return Optional.empty();
    }

    int listEnd = tokenizer.previousNonTrivia(tokens, fromIdx - 1);
    return Optional.of(new TextRange(tokens.get(listStart).start(), tokens.get(listEnd).end()));
  }

  /**
   * Replaces the column list, keeping everything else (whitespace, comments, clauses) verbatim.
   *
   * @param sql the statement text
   * @param columns the new column list, e.g. {@code *} or {@code "a", "b"}
   * @return the rewritten statement, or empty if no column list could be located
   */
  public Optional<String> replace(String sql, String columns) {
    return locate(sql).map(range -> range.replaceIn(sql, columns));
  }

  /** Returns the index of the first depth-0 FROM at or after {@code from}, or -1. */
  private static int findTopLevelFrom(List<Token> tokens, int from) {
    int depth = 0;
    for (int i = from; i < tokens.size(); i++) {
      Token token = tokens.get(i);
      if (token.kind() == TokenKind.LEFT_PAREN) {
        depth++;
      } else if (token.kind() == TokenKind.RIGHT_PAREN) {
        depth = Math.max(0, depth - 1);
      } else if (depth == 0 && token.isKeyword("FROM")) {
        return i;
      }
    }
    return -1;
  }
}
