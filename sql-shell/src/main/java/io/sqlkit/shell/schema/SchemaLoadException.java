package io.sqlkit.shell.schema;

/**
 * Exception thrown when a schema file cannot be loaded. Carries a category so the shell can tell
 * an unreadable file apart from a malformed one.
 */
public class SchemaLoadException extends Exception {

  /** The type of error that occurred. */
  public enum ErrorType {
    /** The file could not be read. */
    IO_ERROR,
    /** The content is not valid JSON. */
    MALFORMED_JSON,
    /** The JSON is well formed but does not describe a list of fields. */
    INVALID_SCHEMA
  }

  private final ErrorType type;

  public SchemaLoadException(ErrorType type, String message) {
    super(message);
    this.type = type;
  }

  public SchemaLoadException(ErrorType type, String message, Throwable cause) {
    super(message, cause);
    this.type = type;
  }

  public ErrorType getType() {
    return type;
  }
}
