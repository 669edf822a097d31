package io.sqlkit.core.completion;

import io.sqlkit.core.lexer.TextRange;

/**
 * Immutable context data extracted from the editor text for completion. Contains all information
 * needed by context-specific completers.
 */
public record CompletionContext(
    /** The kind of word expected at the cursor */
    CompletionContextType type,

    /** What the user has typed so far for the current word (for filtering candidates) */
    String prefix,

    /** Where the prefix sits in the full text */
    TextRange prefixRange,

    /** The full editor text */
    String fullText,

    /** Cursor position in the text */
    int cursor) {
  /** Canonical constructor with validation */
  public CompletionContext {
    if (type == null) {
      type = CompletionContextType.GENERAL;
    }
    if (prefix == null) {
      prefix = "";
    }
    if (fullText == null) {
      fullText = "";
    }
    if (prefixRange == null) {
      prefixRange = TextRange.empty(cursor);
    }
  }

  /** Builder for convenient construction */
  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private CompletionContextType type = CompletionContextType.GENERAL;
    private String prefix = "";
    private TextRange prefixRange;
    private String fullText = "";
    private int cursor = 0;

    public Builder type(CompletionContextType type) {
      this.type = type;
      return this;
    }

    public Builder prefix(String prefix) {
      this.prefix = prefix;
      return this;
    }

    public Builder prefixRange(TextRange prefixRange) {
      this.prefixRange = prefixRange;
      return this;
    }

    public Builder fullText(String fullText) {
      this.fullText = fullText;
      return this;
    }

    public Builder cursor(int cursor) {
      this.cursor = cursor;
      return this;
    }

    public CompletionContext build() {
      return new CompletionContext(type, prefix, prefixRange, fullText, cursor);
    }
  }
}
