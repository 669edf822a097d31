package io.sqlkit.core.completion;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import io.sqlkit.core.lexer.TextRange;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class SqlCompletionProviderTest {

  private static final List<String> TABLES = List.of("metrics", "error_logs", "access_logs");

  private static final List<SchemaField> FIELDS =
      List.of(
          new SchemaField("p_timestamp", "Timestamp"),
          new SchemaField("level", "Utf8"),
          new SchemaField("message", "Utf8"),
          new SchemaField("host", "Utf8"),
          new SchemaField("status_code", "Int64"));

  private SqlCompletionProvider provider;

  @BeforeEach
  void setUp() {
    provider = new SqlCompletionProvider();
  }

  private CompletionResult complete(String text) {
    return provider.completions(text, text.length(), TABLES, FIELDS);
  }

  private static List<String> displayed(CompletionResult result) {
    return result.items().stream().map(CompletionItem::displayText).collect(Collectors.toList());
  }

  @Nested
  class Tables {
    @Test
    void suggestsMatchingTablesQuoted() {
      CompletionResult result = complete("SELECT * FROM acc");

      assertEquals(List.of("\"access_logs\""), displayed(result));
      CompletionItem item = result.items().get(0);
      assertEquals("access_logs", item.insertText());
      assertEquals(CompletionKind.TABLE, item.kind());
      assertEquals("T", item.kindLabel());
    }

    @Test
    void tablesAreSortedAlphabetically() {
      List<String> tables = List.of("logs_c", "logs_a", "logs_b");
      CompletionResult result = provider.completions("SELECT * FROM logs", 18, tables, FIELDS);

      assertEquals(List.of("\"logs_a\"", "\"logs_b\"", "\"logs_c\""), displayed(result));
    }

    @Test
    void afterCommaInFromList() {
      assertEquals(List.of("\"error_logs\""), displayed(complete("SELECT * FROM a, e")));
    }

    @Test
    void matchingIsCaseInsensitive() {
      assertEquals(List.of("\"metrics\""), displayed(complete("select * from MET")));
    }

    @Test
    void noKeywordsInTableContext() {
      assertTrue(complete("SELECT * FROM sel").isEmpty());
    }
  }

  @Nested
  class Columns {
    @Test
    void suggestsFieldsThenFunctions() {
      CompletionResult result = complete("SELECT l");

      assertEquals(List.of("level", "LAG", "LAST_VALUE", "LEAD", "LENGTH", "LOWER"), displayed(result));
      assertEquals("Utf8", result.items().get(0).detail());
      assertEquals("C", result.items().get(0).kindLabel());
      assertEquals("F", result.items().get(1).kindLabel());
      assertNull(result.items().get(1).detail());
    }

    @Test
    void fieldDetailIsDataType() {
      CompletionResult result = complete("SELECT * FROM t WHERE status");

      assertEquals(List.of("status_code"), displayed(result));
      assertEquals("Int64", result.items().get(0).detail());
    }

    @Test
    void fieldsAreSortedAlphabetically() {
      CompletionResult result = complete("SELECT a, h");

      assertEquals(List.of("host"), displayed(result));
    }
  }

  @Nested
  class ByKeyword {
    @Test
    void suggestsByAfterOrder() {
      CompletionResult result = complete("SELECT * FROM t ORDER B");

      assertEquals(List.of("BY"), displayed(result));
      assertEquals(CompletionKind.KEYWORD, result.items().get(0).kind());
    }

    @Test
    void suggestsByAfterGroup() {
      assertEquals(List.of("BY"), displayed(complete("SELECT * FROM t GROUP b")));
    }

    @Test
    void completedByIsSuppressed() {
      assertTrue(complete("SELECT * FROM t ORDER BY").isEmpty());
    }

    @Test
    void otherWordsAfterOrderGetNothing() {
      assertTrue(complete("SELECT * FROM t ORDER x").isEmpty());
    }
  }

  @Nested
  class General {
    @Test
    void suggestsKeywordsFunctionsTablesAndColumns() {
      CompletionResult result = complete("m");

      assertEquals(List.of("MAX", "MIN", "\"metrics\"", "message"), displayed(result));
    }

    @Test
    void keywordsFirst() {
      CompletionResult result = complete("SEL");

      assertEquals(List.of("SELECT"), displayed(result));
      assertEquals("K", result.items().get(0).kindLabel());
    }

    @Test
    void exactMatchIsSuppressed() {
      CompletionResult result = complete("SELECT");

      assertTrue(result.isEmpty());
      assertEquals("SELECT", result.prefix());
    }

    @Test
    void exactMatchIgnoresCase() {
      assertTrue(complete("select").isEmpty());
    }

    @Test
    void exactMatchKeptWhenOtherItemsMatch() {
      // ROW, ROWS and ROW_NUMBER all start with ROW
      assertEquals(List.of("ROW", "ROWS", "ROW_NUMBER"), displayed(complete("ROW")));
    }
  }

  @Nested
  class PrefixHandling {
    @Test
    void prefixRangeCoversTheWord() {
      CompletionResult result = complete("SELECT * FROM acc");

      assertEquals("acc", result.prefix());
      assertEquals(new TextRange(14, 17), result.prefixRange());
    }

    @Test
    void emptyPrefixYieldsNothing() {
      CompletionResult result = complete("SELECT ");

      assertTrue(result.isEmpty());
      assertEquals("", result.prefix());
      assertEquals(TextRange.empty(7), result.prefixRange());
    }

    @Test
    void cursorAtStartYieldsNothing() {
      assertTrue(provider.completions("SELECT", 0, TABLES, FIELDS).isEmpty());
    }

    @Test
    void cursorBeyondTextYieldsNothing() {
      assertTrue(provider.completions("SELECT", 7, TABLES, FIELDS).isEmpty());
    }

    @Test
    void cursorInMiddleOfText() {
      String text = "SELECT lev FROM t";
      CompletionResult result = provider.completions(text, 10, TABLES, FIELDS);

      assertEquals(List.of("level"), displayed(result));
      assertEquals(new TextRange(7, 10), result.prefixRange());
    }

    @Test
    void nullVocabulariesAreEmpty() {
      CompletionResult result = provider.completions("SELECT * FROM a", 15, null, null);

      assertTrue(result.isEmpty());
      assertEquals("a", result.prefix());
    }
  }

  @Test
  void firstMatchingCompleterWins() {
    CompletionContextAnalyzer analyzer = mock(CompletionContextAnalyzer.class);
    when(analyzer.analyze(anyString(), anyInt()))
        .thenReturn(
            CompletionContext.builder()
                .type(CompletionContextType.TABLE_REF)
                .prefix("m")
                .prefixRange(new TextRange(0, 1))
                .fullText("m")
                .cursor(1)
                .build());

    CompletionResult result = new SqlCompletionProvider(analyzer).completions("m", 1, TABLES, FIELDS);

    assertEquals(List.of("\"metrics\""), displayed(result));
    verify(analyzer).analyze("m", 1);
  }
}
