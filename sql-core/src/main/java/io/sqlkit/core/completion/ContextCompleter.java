package io.sqlkit.core.completion;

import java.util.List;

/**
 * Strategy interface for context-specific completion providers. Each implementation handles one
 * type of completion context.
 */
public interface ContextCompleter {

  /**
   * Checks if this completer can handle the given context.
   *
   * @param ctx the completion context
   * @return true if this completer should handle the context
   */
  boolean canHandle(CompletionContext ctx);

  /**
   * Generates completion items for the given context.
   *
   * @param ctx the completion context with all necessary data
   * @param catalog the vocabularies to draw candidates from
   * @param items list to add items to
   */
  void complete(CompletionContext ctx, CompletionCatalog catalog, List<CompletionItem> items);

  /** Adds every table matching the prefix, quoted for display and bare for insertion. */
  default void addTables(String prefix, CompletionCatalog catalog, List<CompletionItem> items) {
    for (String table : catalog.tablesMatching(prefix)) {
      items.add(CompletionItem.table(table));
    }
  }

  /** Adds every schema field matching the prefix, with its data type as detail. */
  default void addColumns(String prefix, CompletionCatalog catalog, List<CompletionItem> items) {
    for (SchemaField field : catalog.fieldsMatching(prefix)) {
      items.add(CompletionItem.column(field));
    }
  }

  default void addFunctions(String prefix, CompletionCatalog catalog, List<CompletionItem> items) {
    for (String function : catalog.functionsMatching(prefix)) {
      items.add(CompletionItem.function(function));
    }
  }

  default void addKeywords(String prefix, CompletionCatalog catalog, List<CompletionItem> items) {
    for (String keyword : catalog.keywordsMatching(prefix)) {
      items.add(CompletionItem.keyword(keyword));
    }
  }
}
