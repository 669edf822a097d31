package io.sqlkit.core.completion.completers;

import io.sqlkit.core.completion.CompletionCatalog;
import io.sqlkit.core.completion.CompletionContext;
import io.sqlkit.core.completion.CompletionContextType;
import io.sqlkit.core.completion.CompletionItem;
import io.sqlkit.core.completion.ContextCompleter;
import java.util.List;
import java.util.Locale;

/** Completer for the BY that has to follow ORDER or GROUP. */
public final class ByKeywordCompleter implements ContextCompleter {

  private static final String BY = "BY";

  @Override
  public boolean canHandle(CompletionContext ctx) {
    return ctx.type() == CompletionContextType.AFTER_ORDER
        || ctx.type() == CompletionContextType.AFTER_GROUP;
  }

  @Override
  public void complete(
      CompletionContext ctx, CompletionCatalog catalog, List<CompletionItem> items) {
    if (BY.startsWith(ctx.prefix().toUpperCase(Locale.ROOT))) {
      items.add(CompletionItem.keyword(BY));
    }
  }
}
