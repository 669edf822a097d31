package io.sqlkit.core.completion;

import io.sqlkit.core.completion.completers.ByKeywordCompleter;
import io.sqlkit.core.completion.completers.ColumnRefCompleter;
import io.sqlkit.core.completion.completers.GeneralCompleter;
import io.sqlkit.core.completion.completers.TableRefCompleter;
import io.sqlkit.core.lexer.TextRange;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Produces completion items for a cursor position in SQL text. Uses the Strategy pattern: the
 * {@link CompletionContextAnalyzer} classifies the cursor position and the first {@link
 * ContextCompleter} that can handle the context supplies the items.
 */
public class SqlCompletionProvider {

  private final CompletionContextAnalyzer analyzer;
  private final List<ContextCompleter> completers;

  public SqlCompletionProvider() {
    this(new CompletionContextAnalyzer());
  }

  public SqlCompletionProvider(CompletionContextAnalyzer analyzer) {
    this.analyzer = analyzer;

    // Register completers in priority order
    this.completers =
        List.of(
            new TableRefCompleter(),
            new ColumnRefCompleter(),
            new ByKeywordCompleter(),
            new GeneralCompleter());
  }

  /**
   * Computes completions at {@code cursor}.
   *
   * @param text the full editor text
   * @param cursor cursor offset into {@code text}
   * @param tableNames table names known to the server, may be null
   * @param schemaFields fields of the current schema, may be null
   * @return matching items together with the prefix they complete
   */
  public CompletionResult completions(
      String text,
      int cursor,
      Collection<String> tableNames,
      Collection<SchemaField> schemaFields) {
    return completions(text, cursor, CompletionCatalog.of(tableNames, schemaFields));
  }

  /** Computes completions at {@code cursor} against a prebuilt catalog. */
  public CompletionResult completions(String text, int cursor, CompletionCatalog catalog) {
    if (text == null || cursor <= 0 || cursor > text.length()) {
      return CompletionResult.empty("", TextRange.empty(0));
    }

    CompletionContext ctx = analyzer.analyze(text, cursor);
    if (ctx.prefix().isEmpty()) {
      return CompletionResult.empty("", ctx.prefixRange());
    }

    List<CompletionItem> items = new ArrayList<>();
    for (ContextCompleter completer : completers) {
      if (completer.canHandle(ctx)) {
        completer.complete(ctx, catalog, items);
        break;
      }
    }

    // Don't offer a suggestion the user has already finished typing
    if (items.size() == 1 && isExactMatch(items.get(0), ctx.prefix())) {
      return CompletionResult.empty(ctx.prefix(), ctx.prefixRange());
    }
    return new CompletionResult(items, ctx.prefix(), ctx.prefixRange());
  }

  private static boolean isExactMatch(CompletionItem item, String prefix) {
    return item.displayText()
        .toUpperCase(Locale.ROOT)
        .equals(prefix.toUpperCase(Locale.ROOT));
  }
}
