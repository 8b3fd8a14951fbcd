package io.intellixity.tessera.persistence.record;

/** Save or delete attempted without the required table binding or primary key. */
public final class PersistenceException extends RuntimeException {
  public PersistenceException(String message) {
    super(message);
  }
}
