package io.sqlkit.shell;

import io.sqlkit.core.completion.SchemaField;
import java.util.List;

/** Mutable state of one shell session: the known vocabularies and the current query. */
public final class ShellState {

  private final List<String> tableNames;
  private final List<SchemaField> schemaFields;
  private String query = "";

  public ShellState(List<String> tableNames, List<SchemaField> schemaFields) {
    this.tableNames = tableNames == null ? List.of() : List.copyOf(tableNames);
    this.schemaFields = schemaFields == null ? List.of() : List.copyOf(schemaFields);
  }

  public List<String> tableNames() {
    return tableNames;
  }

  public List<SchemaField> schemaFields() {
    return schemaFields;
  }

  public String query() {
    return query;
  }

  public void setQuery(String query) {
    this.query = query == null ? "" : query;
  }

  public boolean hasQuery() {
    return !query.isBlank();
  }
}
