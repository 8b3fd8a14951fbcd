package io.intellixity.tessera.persistence.exec;

/** Statement rejected or failed by the storage engine (malformed SQL, unknown column, I/O). */
public final class QueryException extends RuntimeException {
  public QueryException(String message) {
    super(message);
  }

  public QueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
