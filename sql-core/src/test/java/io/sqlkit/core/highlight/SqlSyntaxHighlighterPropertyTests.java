package io.sqlkit.core.highlight;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import net.jqwik.api.*;

@PropertyDefaults(tries = 500)
class SqlSyntaxHighlighterPropertyTests {

  private final SqlSyntaxHighlighter highlighter = new SqlSyntaxHighlighter();

  @Property
  void rangesStayInsideText(@ForAll("sqlish") String sql) {
    for (StyledRange styled : highlighter.classify(sql)) {
      assertTrue(styled.range().end() <= sql.length());
      assertFalse(styled.range().isEmpty());
    }
  }

  @Property
  void neverThrowsOnArbitraryText(@ForAll String text) {
    assertNotNull(highlighter.classify(text));
  }

  @Property(tries = 40)
  void longEscapeRunsStayInsideText(@ForAll("longRuns") String sql) {
    List<StyledRange> ranges = highlighter.classify(sql);
    assertFalse(ranges.isEmpty());
    for (StyledRange styled : ranges) {
      assertTrue(styled.range().end() <= sql.length());
    }
  }

  @Property
  void protectedRangesDoNotOverlap(@ForAll("sqlish") String sql) {
    List<StyledRange> ranges = highlighter.classify(sql);
    int lastEnd = 0;
    for (StyledRange styled : ranges) {
      if (isProtected(styled.style())) {
        assertTrue(styled.range().start() >= lastEnd);
        lastEnd = styled.range().end();
      }
    }
  }

  private static boolean isProtected(HighlightStyle style) {
    return style == HighlightStyle.COMMENT
        || style == HighlightStyle.STRING
        || style == HighlightStyle.QUOTED_IDENTIFIER;
  }

  @Provide
  Arbitrary<String> sqlish() {
    Arbitrary<String> fragments =
        Arbitraries.of(
            "SELECT", "from", " ", "\n", "'", "''", "\"", "--", "/*", "*/", "42", "3.14", "count",
            "(", ")", "x", ",");
    return fragments.list().ofMaxSize(200).map(parts -> String.join("", parts));
  }

  /** A short query with one long repeated run of quotes, escapes or comment markers inside. */
  @Provide
  Arbitrary<String> longRuns() {
    Arbitrary<String> unit = Arbitraries.of("''", "\"\"", "'", "\"", "/*", "--", "x ", "'a'");
    Arbitrary<Integer> count = Arbitraries.integers().between(1_000, 20_000);
    Arbitrary<String> prefix = Arbitraries.of("SELECT ", "SELECT '", "SELECT \"", "WHERE a = '");
    Arbitrary<String> suffix = Arbitraries.of("", "'", "\"", " FROM t", "' FROM t");
    return Combinators.combine(prefix, unit, count, suffix)
        .as((p, u, n, s) -> p + u.repeat(n) + s);
  }
}
