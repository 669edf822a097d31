package io.sqlkit.core.error;

import io.sqlkit.core.lexer.SqlTokenizer;
import io.sqlkit.core.lexer.TextRange;
import io.sqlkit.core.lexer.Token;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps positions from remote engine error messages onto the token they point at in the editor
 * text.
 *
 * <p>Offsets are UTF-16 offsets, the same unit as {@link String#charAt(int)}, and columns are
 * counted in the same unit.
 */
public final class ErrorPositionMapper {

  private static final Logger log = LoggerFactory.getLogger(ErrorPositionMapper.class);

  private final SqlTokenizer tokenizer;

  public ErrorPositionMapper() {
    this(new SqlTokenizer());
  }

  public ErrorPositionMapper(SqlTokenizer tokenizer) {
    this.tokenizer = tokenizer;
  }

  /**
   * Parses a position out of {@code message} and resolves it to a token range in {@code sql}.
   *
   * @param message the error message returned by the remote engine
   * @param sql the query text the error refers to
   * @return the range to highlight, or empty if the message has no usable position
   */
  public Optional<TextRange> highlightRange(String message, String sql) {
    return SqlErrorPosition.parse(message)
        .flatMap(pos -> errorHighlightRange(pos.line(), pos.column(), sql));
  }

  /** Resolves a 1-based line/column position to the range of the token at that position. */
  public Optional<TextRange> errorHighlightRange(int line, int column, String sql) {
    OptionalInt offset = characterOffset(line, column, sql);
    if (offset.isEmpty()) {
      log.debug("Position {}:{} is outside the query text", line, column);
      return Optional.empty();
    }
    return tokenRangeAt(offset.getAsInt(), sql);
  }

  /**
   * Converts a 1-based line/column into an offset within {@code sql}.
   *
   * @return the offset, or empty if the position lies beyond the text
   */
  public OptionalInt characterOffset(int line, int column, String sql) {
    if (sql == null || line < 1 || column < 1) {
      return OptionalInt.empty();
    }
    int length = sql.length();

    // Walk to the start of the target line
    int currentLine = 1;
    int i = 0;
    while (currentLine < line) {
      if (i >= length) {
        return OptionalInt.empty();
      }
      if (sql.charAt(i) == '\n') {
        currentLine++;
      }
      i++;
    }

    long offset = (long) i + column - 1;
    if (offset > length) {
      return OptionalInt.empty();
    }
    return OptionalInt.of((int) offset);
  }

  /**
   * Returns the range of the token at {@code offset}.
   *
   * <p>An offset inside whitespace or a comment snaps forward to the next real token. An offset in
   * trailing trivia has no token to point at. An offset at or past the end maps to the last real
   * token.
   *
   * @return the token range, or empty if no real token applies
   */
  public Optional<TextRange> tokenRangeAt(int offset, String sql) {
    List<Token> tokens = tokenizer.tokenize(sql);
    if (offset < 0) {
      return Optional.empty();
    }

    int idx = tokenizer.tokenAt(tokens, offset);
    if (idx < 0) {
      // At or past the end of the text
      int last = tokenizer.previousNonTrivia(tokens, tokens.size() - 1);
      return last < 0 ? Optional.empty() : Optional.of(tokens.get(last).range());
    }
    if (!tokens.get(idx).isTrivia()) {
      return Optional.of(tokens.get(idx).range());
    }

    int next = tokenizer.nextNonTrivia(tokens, idx + 1);
    return next < 0 ? Optional.empty() : Optional.of(tokens.get(next).range());
  }
}
