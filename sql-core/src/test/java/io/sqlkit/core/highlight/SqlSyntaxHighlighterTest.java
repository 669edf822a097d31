package io.sqlkit.core.highlight;

import static org.junit.jupiter.api.Assertions.*;

import io.sqlkit.core.lexer.TextRange;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SqlSyntaxHighlighterTest {

  private SqlSyntaxHighlighter highlighter;

  @BeforeEach
  void setUp() {
    highlighter = new SqlSyntaxHighlighter();
  }

  /** Renders each styled range as {@code STYLE:text} in application order. */
  private List<String> styled(String sql) {
    return highlighter.classify(sql).stream()
        .map(s -> s.style() + ":" + s.range().slice(sql))
        .collect(Collectors.toList());
  }

  @Test
  void emptyInput() {
    assertTrue(highlighter.classify("").isEmpty());
    assertTrue(highlighter.classify(null).isEmpty());
  }

  @Test
  void simpleQuery() {
    assertEquals(
        List.of("NUMBER:10", "KEYWORD:SELECT", "KEYWORD:FROM", "KEYWORD:LIMIT", "FUNCTION:COUNT"),
        styled("SELECT COUNT(*) FROM logs LIMIT 10"));
  }

  @Test
  void keywordsAreCaseInsensitive() {
    assertEquals(List.of("KEYWORD:select", "KEYWORD:From"), styled("select a From t"));
  }

  @Test
  void wordBoundariesAreRespected() {
    assertTrue(styled("SELECTED fromage countx").isEmpty());
  }

  @Nested
  class Protected {
    @Test
    void keywordInsideStringIsNotStyled() {
      assertEquals(List.of("STRING:'select from'"), styled("'select from'"));
    }

    @Test
    void keywordInsideQuotedIdentifierIsNotStyled() {
      assertEquals(List.of("QUOTED_IDENTIFIER:\"order\""), styled("\"order\""));
    }

    @Test
    void lineComment() {
      assertEquals(
          List.of("COMMENT:-- select 1", "KEYWORD:FROM"), styled("-- select 1\nFROM"));
    }

    @Test
    void blockComment() {
      assertEquals(List.of("COMMENT:/* where 1 */"), styled("/* where 1 */"));
    }

    @Test
    void quoteInsideCommentDoesNotOpenString() {
      assertEquals(
          List.of("COMMENT:-- don't", "KEYWORD:SELECT"), styled("-- don't\nSELECT"));
    }

    @Test
    void commentMarkerInsideStringIsInert() {
      assertEquals(
          List.of("STRING:'--x'", "KEYWORD:FROM"), styled("'--x' FROM"));
    }

    @Test
    void escapedQuotesStayInsideString() {
      assertEquals(List.of("STRING:'it''s'", "KEYWORD:AND"), styled("'it''s' AND"));
    }

    @Test
    void unterminatedStringRunsToEnd() {
      assertEquals(
          List.of("KEYWORD:WHERE", "STRING:'abc FROM t"), sortedByStart("WHERE 'abc FROM t"));
    }

    @Test
    void unterminatedBlockCommentRunsToEnd() {
      assertEquals(List.of("COMMENT:/* SELECT"), styled("/* SELECT"));
    }

    private List<String> sortedByStart(String sql) {
      return highlighter.classify(sql).stream()
          .sorted((a, b) -> Integer.compare(a.range().start(), b.range().start()))
          .map(s -> s.style() + ":" + s.range().slice(sql))
          .collect(Collectors.toList());
    }
  }

  @Nested
  class Numbers {
    @Test
    void integersAndDecimals() {
      assertEquals(List.of("NUMBER:1", "NUMBER:2.5"), styled("1 + 2.5"));
    }

    @Test
    void digitsInsideIdentifierAreNotNumbers() {
      assertTrue(styled("table1").isEmpty());
    }
  }

  @Nested
  class LongInput {
    @Test
    void longRunOfEscapedSingleQuotes() {
      String literal = "'" + "''".repeat(20_000) + "'";
      assertEquals(
          List.of("STRING:" + literal, "KEYWORD:SELECT", "KEYWORD:FROM"),
          styled("SELECT " + literal + " FROM t"));
    }

    @Test
    void longRunOfEscapedDoubleQuotes() {
      String identifier = "\"" + "\"\"".repeat(20_000) + "\"";
      assertEquals(
          List.of("QUOTED_IDENTIFIER:" + identifier, "KEYWORD:SELECT", "KEYWORD:FROM"),
          styled("SELECT " + identifier + " FROM t"));
    }

    @Test
    void longEscapedRunLeftUnterminated() {
      String sql = "WHERE a = 'x" + "''".repeat(20_000);
      List<StyledRange> ranges = highlighter.classify(sql);

      assertTrue(
          ranges.contains(
              new StyledRange(new TextRange(10, sql.length()), HighlightStyle.STRING)));
    }

    @Test
    void longUnterminatedString() {
      String sql = "'" + "a".repeat(100_000);
      assertEquals(
          List.of(new StyledRange(new TextRange(0, sql.length()), HighlightStyle.STRING)),
          highlighter.classify(sql));
    }

    @Test
    void longUnterminatedBlockComment() {
      String sql = "/* " + "x ".repeat(50_000);
      assertEquals(
          List.of(new StyledRange(new TextRange(0, sql.length()), HighlightStyle.COMMENT)),
          highlighter.classify(sql));
    }

    @Test
    void longLineComment() {
      String sql = "-- " + "select ".repeat(20_000) + "\nFROM t";
      String comment = sql.substring(0, sql.indexOf('\n'));
      assertEquals(List.of("COMMENT:" + comment, "KEYWORD:FROM"), styled(sql));
    }
  }

  @Test
  void stylesAppearInApplicationOrder() {
    List<StyledRange> ranges = highlighter.classify("SELECT 'a' -- c\n, 1, MAX(x)");
    List<HighlightStyle> styles =
        ranges.stream().map(StyledRange::style).collect(Collectors.toList());

    assertEquals(
        List.of(
            HighlightStyle.STRING,
            HighlightStyle.COMMENT,
            HighlightStyle.NUMBER,
            HighlightStyle.KEYWORD,
            HighlightStyle.FUNCTION),
        styles);
  }
}
