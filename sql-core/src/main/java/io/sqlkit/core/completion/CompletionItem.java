package io.sqlkit.core.completion;

import java.util.Objects;

/**
 * A single completion suggestion.
 *
 * @param displayText the text shown in the completion list
 * @param kind the vocabulary the item came from
 * @param detail optional extra information such as a column data type, may be null
 * @param insertText the text inserted on acceptance; tables are shown quoted but inserted bare
 */
public record CompletionItem(
    String displayText, CompletionKind kind, String detail, String insertText) {

  public CompletionItem {
    Objects.requireNonNull(displayText, "displayText");
    Objects.requireNonNull(kind, "kind");
    if (insertText == null) {
      insertText = displayText;
    }
  }

  public static CompletionItem keyword(String keyword) {
    return new CompletionItem(keyword, CompletionKind.KEYWORD, null, keyword);
  }

  public static CompletionItem function(String function) {
    return new CompletionItem(function, CompletionKind.FUNCTION, null, function);
  }

  public static CompletionItem table(String table) {
    return new CompletionItem("\"" + table + "\"", CompletionKind.TABLE, null, table);
  }

  public static CompletionItem column(SchemaField field) {
    return new CompletionItem(field.name(), CompletionKind.COLUMN, field.dataType(), field.name());
  }

  /** One-letter kind badge. */
  public String kindLabel() {
    return kind.label();
  }
}
