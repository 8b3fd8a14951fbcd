package io.intellixity.tessera.persistence.schema;

/** Raised when a record type declaration cannot be compiled or used (missing table, bad names, ambiguous key). */
public final class SchemaException extends RuntimeException {
  public SchemaException(String message) {
    super(message);
  }

  public SchemaException(String message, Throwable cause) {
    super(message, cause);
  }
}
