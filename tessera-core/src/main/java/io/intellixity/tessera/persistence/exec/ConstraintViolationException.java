package io.intellixity.tessera.persistence.exec;

/**
 * Unique, foreign-key or not-null violation reported by the storage engine.
 * <p>
 * Pass-through: the engine's own error is kept as the cause.
 */
public final class ConstraintViolationException extends RuntimeException {
  public ConstraintViolationException(String message, Throwable cause) {
    super(message, cause);
  }
}
