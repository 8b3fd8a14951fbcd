package io.intellixity.tessera.persistence.record;

/** Read or write of an attribute the record type does not declare. */
public final class UnknownAttributeException extends RuntimeException {
  private final String type;
  private final String attribute;

  public UnknownAttributeException(String type, String attribute) {
    super("Record type '" + type + "' has no attribute '" + attribute + "'");
    this.type = type;
    this.attribute = attribute;
  }

  public String type() { return type; }
  public String attribute() { return attribute; }
}
