package io.intellixity.tessera.persistence.schema;

/** Column-level metadata of one declared attribute: a plain {@link FieldDef} or a {@link RelationDef}. */
public interface AttributeDef {
  BaseType type();

  boolean nullable();
}
