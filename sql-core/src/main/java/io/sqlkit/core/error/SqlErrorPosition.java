package io.sqlkit.core.error;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 1-based line/column position reported by the remote query engine.
 *
 * @param line 1-based line number
 * @param column 1-based column number
 */
public record SqlErrorPosition(int line, int column) {

  private static final Logger log = LoggerFactory.getLogger(SqlErrorPosition.class);

  // The engine sometimes writes "Column:" and sometimes "Column"
  private static final Pattern POSITION_PATTERN =
      Pattern.compile("Line:\\s*(\\d+),\\s*Column:?\\s*(\\d+)");

  /**
   * Extracts the first position from a free-text error message such as {@code "Expected: an
   * expression, found: FROM at Line: 1, Column 15"}.
   *
   * @param message the error message, may be null
   * @return the position, or empty if the message carries none
   */
  public static Optional<SqlErrorPosition> parse(String message) {
    if (message == null || message.isEmpty()) {
      return Optional.empty();
    }
    Matcher m = POSITION_PATTERN.matcher(message);
    if (!m.find()) {
      return Optional.empty();
    }
    try {
      return Optional.of(
          new SqlErrorPosition(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
    } catch (NumberFormatException e) {
      log.debug("Ignoring out-of-range position '{}' in error message", m.group(), e);
      return Optional.empty();
    }
  }

  @Override
  public String toString() {
    return "Line: " + line + ", Column: " + column;
  }
}
