package io.sqlkit.core.completion;

import java.util.Objects;

/**
 * A column of the stream being queried.
 *
 * @param name the column name
 * @param dataType the data type as reported by the server, shown as completion detail
 */
public record SchemaField(String name, String dataType) {

  public SchemaField {
    Objects.requireNonNull(name, "name");
  }
}
