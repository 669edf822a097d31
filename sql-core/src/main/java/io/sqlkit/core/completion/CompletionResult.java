package io.sqlkit.core.completion;

import io.sqlkit.core.lexer.TextRange;
import java.util.List;

/**
 * Completion outcome for one cursor position.
 *
 * @param items suggestions in display order, empty when nothing should be shown
 * @param prefix the partial word before the cursor
 * @param prefixRange where {@code prefix} sits in the text; accepted items replace this range
 */
public record CompletionResult(List<CompletionItem> items, String prefix, TextRange prefixRange) {

  public CompletionResult {
    items = List.copyOf(items);
  }

  public static CompletionResult empty(String prefix, TextRange prefixRange) {
    return new CompletionResult(List.of(), prefix, prefixRange);
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }
}
