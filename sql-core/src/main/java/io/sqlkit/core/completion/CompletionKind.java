package io.sqlkit.core.completion;

/** Source vocabulary of a completion item. */
public enum CompletionKind {
  KEYWORD("K"),
  FUNCTION("F"),
  TABLE("T"),
  COLUMN("C");

  private final String label;

  CompletionKind(String label) {
    this.label = label;
  }

  /** One-letter badge shown next to the item in a completion list. */
  public String label() {
    return label;
  }
}
