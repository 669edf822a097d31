package io.sqlkit.shell.cli;

import io.sqlkit.core.SqlEditorSupport;
import io.sqlkit.core.highlight.HighlightStyle;
import io.sqlkit.core.highlight.StyledRange;
import io.sqlkit.core.lexer.TextRange;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jline.reader.Highlighter;
import org.jline.reader.LineReader;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;

/** JLine highlighter that colors the input buffer with the SQL syntax classes. */
public class SqlHighlighter implements Highlighter {

  static final AttributedStyle ERROR_STYLE =
      AttributedStyle.DEFAULT.foreground(AttributedStyle.RED).underline();

  private static final Map<HighlightStyle, AttributedStyle> STYLES =
      new EnumMap<>(HighlightStyle.class);

  static {
    STYLES.put(HighlightStyle.KEYWORD, AttributedStyle.BOLD.foreground(AttributedStyle.BLUE));
    STYLES.put(
        HighlightStyle.FUNCTION, AttributedStyle.DEFAULT.foreground(AttributedStyle.MAGENTA));
    STYLES.put(HighlightStyle.STRING, AttributedStyle.DEFAULT.foreground(AttributedStyle.GREEN));
    STYLES.put(
        HighlightStyle.QUOTED_IDENTIFIER, AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN));
    STYLES.put(HighlightStyle.NUMBER, AttributedStyle.DEFAULT.foreground(AttributedStyle.YELLOW));
    STYLES.put(
        HighlightStyle.COMMENT,
        AttributedStyle.DEFAULT.foreground(AttributedStyle.BRIGHT | AttributedStyle.BLACK));
  }

  private final SqlEditorSupport editor;
  private Pattern errorPattern;
  private int errorIndex = -1;

  public SqlHighlighter(SqlEditorSupport editor) {
    this.editor = editor;
  }

  static AttributedStyle styleFor(HighlightStyle style) {
    return STYLES.get(style);
  }

  @Override
  public AttributedString highlight(LineReader reader, String buffer) {
    TextRange error = null;
    if (errorIndex >= 0 && errorIndex < buffer.length()) {
      error = new TextRange(errorIndex, errorIndex + 1);
    }
    return highlight(buffer, error);
  }

  /**
   * Colors {@code text}. Styled ranges are applied in order so later ranges win; the error range
   * and error pattern matches are applied last.
   */
  public AttributedString highlight(String text, TextRange errorRange) {
    AttributedStyle[] styles = new AttributedStyle[text.length()];
    Arrays.fill(styles, AttributedStyle.DEFAULT);

    for (StyledRange styled : editor.classify(text)) {
      fill(styles, styled.range().start(), styled.range().end(), STYLES.get(styled.style()));
    }
    if (errorPattern != null) {
      Matcher m = errorPattern.matcher(text);
      while (m.find()) {
        fill(styles, m.start(), m.end(), ERROR_STYLE);
      }
    }
    if (errorRange != null) {
      fill(styles, errorRange.start(), errorRange.end(), ERROR_STYLE);
    }

    AttributedStringBuilder sb = new AttributedStringBuilder(text.length());
    for (int i = 0; i < text.length(); i++) {
      sb.style(styles[i]).append(text.charAt(i));
    }
    return sb.toAttributedString();
  }

  @Override
  public void setErrorPattern(Pattern errorPattern) {
    this.errorPattern = errorPattern;
  }

  @Override
  public void setErrorIndex(int errorIndex) {
    this.errorIndex = errorIndex;
  }

  private static void fill(AttributedStyle[] styles, int start, int end, AttributedStyle style) {
    int to = Math.min(end, styles.length);
    for (int i = Math.max(start, 0); i < to; i++) {
      styles[i] = style;
    }
  }
}
