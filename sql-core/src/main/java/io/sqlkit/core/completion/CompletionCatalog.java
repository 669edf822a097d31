package io.sqlkit.core.completion;

import io.sqlkit.core.SqlVocabulary;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Vocabularies available to completers: the fixed keyword and function lists plus the table names
 * and schema fields supplied by the caller. Every list is kept in alphabetical order so candidates
 * come out in a deterministic order.
 */
public final class CompletionCatalog {

  private static final CompletionCatalog EMPTY = new CompletionCatalog(List.of(), List.of());

  private final List<String> tableNames;
  private final List<SchemaField> schemaFields;

  private CompletionCatalog(List<String> tableNames, List<SchemaField> schemaFields) {
    this.tableNames = tableNames;
    this.schemaFields = schemaFields;
  }

  /**
   * Creates a catalog from caller-provided names.
   *
   * @param tableNames table (stream) names, may be null
   * @param schemaFields fields of the current schema, may be null
   */
  public static CompletionCatalog of(
      Collection<String> tableNames, Collection<SchemaField> schemaFields) {
    List<String> tables =
        tableNames == null ? List.of() : tableNames.stream().sorted().collect(Collectors.toList());
    List<SchemaField> fields =
        schemaFields == null
            ? List.of()
            : schemaFields.stream()
                .sorted(Comparator.comparing(SchemaField::name))
                .collect(Collectors.toList());
    return new CompletionCatalog(List.copyOf(tables), List.copyOf(fields));
  }

  public static CompletionCatalog empty() {
    return EMPTY;
  }

  public List<String> tableNames() {
    return tableNames;
  }

  public List<SchemaField> schemaFields() {
    return schemaFields;
  }

  public List<String> keywordsMatching(String prefix) {
    return matching(SqlVocabulary.SORTED_KEYWORDS, prefix, Function.identity());
  }

  public List<String> functionsMatching(String prefix) {
    return matching(SqlVocabulary.SORTED_FUNCTIONS, prefix, Function.identity());
  }

  public List<String> tablesMatching(String prefix) {
    return matching(tableNames, prefix, Function.identity());
  }

  public List<SchemaField> fieldsMatching(String prefix) {
    return matching(schemaFields, prefix, SchemaField::name);
  }

  /** Case-insensitive prefix filter that keeps the input order. */
  private static <T> List<T> matching(List<T> values, String prefix, Function<T, String> name) {
    String upperPrefix = prefix.toUpperCase(Locale.ROOT);
    return values.stream()
        .filter(v -> name.apply(v).toUpperCase(Locale.ROOT).startsWith(upperPrefix))
        .collect(Collectors.toList());
  }
}
