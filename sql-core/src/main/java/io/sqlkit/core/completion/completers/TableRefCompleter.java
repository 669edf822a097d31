package io.sqlkit.core.completion.completers;

import io.sqlkit.core.completion.CompletionCatalog;
import io.sqlkit.core.completion.CompletionContext;
import io.sqlkit.core.completion.CompletionContextType;
import io.sqlkit.core.completion.CompletionItem;
import io.sqlkit.core.completion.ContextCompleter;
import java.util.List;

/** Completer for table names after FROM, JOIN, INTO and join modifiers. */
public final class TableRefCompleter implements ContextCompleter {

  @Override
  public boolean canHandle(CompletionContext ctx) {
    return ctx.type() == CompletionContextType.TABLE_REF;
  }

  @Override
  public void complete(
      CompletionContext ctx, CompletionCatalog catalog, List<CompletionItem> items) {
    addTables(ctx.prefix(), catalog, items);
  }
}
