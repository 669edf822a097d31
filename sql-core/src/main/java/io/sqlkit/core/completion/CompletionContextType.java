package io.sqlkit.core.completion;

/**
 * Identifies what kind of word is expected at the cursor. Each type corresponds to a distinct
 * completion behavior.
 */
public enum CompletionContextType {
  /** Nothing specific expected - keywords, functions, tables and columns all apply */
  GENERAL,

  /** After FROM, JOIN, INTO and join modifiers - suggests table names */
  TABLE_REF,

  /** After SELECT, WHERE, AND, ON, ... - suggests columns and functions */
  COLUMN_REF,

  /** After ORDER - suggests BY */
  AFTER_ORDER,

  /** After GROUP - suggests BY */
  AFTER_GROUP
}
