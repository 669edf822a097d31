package io.sqlkit.core.highlight;

import io.sqlkit.core.SqlVocabulary;
import io.sqlkit.core.lexer.TextRange;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex-based SQL syntax highlighter.
 *
 * <p>Works independently of {@link io.sqlkit.core.lexer.SqlTokenizer} so that half-typed SQL in
 * the editor is always colored on a best-effort basis. Comments and quoted runs are found first in
 * a single left-to-right scan and become protected ranges; numbers, keywords and functions are only
 * styled when they are not fully inside a protected range.
 *
 * <p>The returned list is in application order: when ranges overlap, later entries win.
 */
public final class SqlSyntaxHighlighter {

  // Leftmost match wins, so quotes inside comments and comment markers inside strings are inert.
  // Unterminated runs extend to the end of the text. The quote loops are possessive so that long
  // runs of doubled quotes iterate instead of recursing.
  private static final Pattern PROTECTED_PATTERN =
      Pattern.compile(
          "(?<line>--[^\\n]*)"
              + "|(?<block>/\\*[\\s\\S]*?(?:\\*/|\\z))"
              + "|(?<single>'(?:[^']|'')*+(?:'|\\z))"
              + "|(?<double>\"(?:[^\"]|\"\")*+(?:\"|\\z))");

  private static final Pattern NUMBER_PATTERN = Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b");

  private static final Pattern KEYWORD_PATTERN = wordPattern(SqlVocabulary.SORTED_KEYWORDS);

  private static final Pattern FUNCTION_PATTERN = wordPattern(SqlVocabulary.SORTED_FUNCTIONS);

  /**
   * Classifies the text into styled ranges.
   *
   * @param text the SQL text, may be null
   * @return styled ranges in application order, empty for empty input
   */
  public List<StyledRange> classify(String text) {
    if (text == null || text.isEmpty()) {
      return Collections.emptyList();
    }

    List<StyledRange> styles = new ArrayList<>();
    List<TextRange> protectedRanges = new ArrayList<>();

    Matcher m = PROTECTED_PATTERN.matcher(text);
    while (m.find()) {
      TextRange range = new TextRange(m.start(), m.end());
      styles.add(new StyledRange(range, protectedStyle(m)));
      protectedRanges.add(range);
    }

    applyUnprotected(NUMBER_PATTERN, HighlightStyle.NUMBER, text, protectedRanges, styles);
    applyUnprotected(KEYWORD_PATTERN, HighlightStyle.KEYWORD, text, protectedRanges, styles);
    applyUnprotected(FUNCTION_PATTERN, HighlightStyle.FUNCTION, text, protectedRanges, styles);
    return styles;
  }

  private static HighlightStyle protectedStyle(Matcher m) {
    if (m.group("line") != null || m.group("block") != null) {
      return HighlightStyle.COMMENT;
    }
    return m.group("single") != null ? HighlightStyle.STRING : HighlightStyle.QUOTED_IDENTIFIER;
  }

  private static void applyUnprotected(
      Pattern pattern,
      HighlightStyle style,
      String text,
      List<TextRange> protectedRanges,
      List<StyledRange> styles) {
    Matcher m = pattern.matcher(text);
    while (m.find()) {
      TextRange range = new TextRange(m.start(), m.end());
      if (!isProtected(range, protectedRanges)) {
        styles.add(new StyledRange(range, style));
      }
    }
  }

  private static boolean isProtected(TextRange range, List<TextRange> protectedRanges) {
    for (TextRange p : protectedRanges) {
      if (p.encloses(range)) {
        return true;
      }
    }
    return false;
  }

  private static Pattern wordPattern(List<String> words) {
    return Pattern.compile(
        "\\b(?:" + String.join("|", words) + ")\\b", Pattern.CASE_INSENSITIVE);
  }
}
