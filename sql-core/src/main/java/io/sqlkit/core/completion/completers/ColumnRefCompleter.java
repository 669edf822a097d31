package io.sqlkit.core.completion.completers;

import io.sqlkit.core.completion.CompletionCatalog;
import io.sqlkit.core.completion.CompletionContext;
import io.sqlkit.core.completion.CompletionContextType;
import io.sqlkit.core.completion.CompletionItem;
import io.sqlkit.core.completion.ContextCompleter;
import java.util.List;

/**
 * Completer for expressions in column positions (select list, WHERE, ON, HAVING, ...). Suggests
 * schema fields first, then functions.
 */
public final class ColumnRefCompleter implements ContextCompleter {

  @Override
  public boolean canHandle(CompletionContext ctx) {
    return ctx.type() == CompletionContextType.COLUMN_REF;
  }

  @Override
  public void complete(
      CompletionContext ctx, CompletionCatalog catalog, List<CompletionItem> items) {
    addColumns(ctx.prefix(), catalog, items);
    addFunctions(ctx.prefix(), catalog, items);
  }
}
