package io.sqlkit.core.completion.completers;

import io.sqlkit.core.completion.CompletionCatalog;
import io.sqlkit.core.completion.CompletionContext;
import io.sqlkit.core.completion.CompletionContextType;
import io.sqlkit.core.completion.CompletionItem;
import io.sqlkit.core.completion.ContextCompleter;
import java.util.List;

/**
 * Fallback completer when no specific word is expected: keywords, functions, tables and columns,
 * in that order.
 */
public final class GeneralCompleter implements ContextCompleter {

  @Override
  public boolean canHandle(CompletionContext ctx) {
    return ctx.type() == CompletionContextType.GENERAL;
  }

  @Override
  public void complete(
      CompletionContext ctx, CompletionCatalog catalog, List<CompletionItem> items) {
    String prefix = ctx.prefix();
    addKeywords(prefix, catalog, items);
    addFunctions(prefix, catalog, items);
    addTables(prefix, catalog, items);
    addColumns(prefix, catalog, items);
  }
}
