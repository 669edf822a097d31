package io.sqlkit.core.highlight;

/** Display styles assigned by {@link SqlSyntaxHighlighter}. */
public enum HighlightStyle {
  COMMENT,
  STRING,
  QUOTED_IDENTIFIER,
  NUMBER,
  KEYWORD,
  FUNCTION
}
