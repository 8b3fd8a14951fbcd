package io.intellixity.tessera.persistence.schema;

import java.util.Objects;

/**
 * Plain column descriptor.\n
 *
 * Immutable; the {@code asPrimaryKey()/notNull()/asUnique()} methods return modified copies so declarations
 * read as {@code FieldDef.of(BaseType.TEXT).notNull().asUnique()}.\n
 */
public record FieldDef(BaseType type, boolean primaryKey, boolean nullable, boolean unique) implements AttributeDef {
  public FieldDef {
    Objects.requireNonNull(type, "type");
  }

  /** Nullable, non-unique, non-key column of the given type. */
  public static FieldDef of(BaseType type) {
    return new FieldDef(type, false, true, false);
  }

  public static FieldDef integer() { return of(BaseType.INTEGER); }
  public static FieldDef real() { return of(BaseType.REAL); }
  public static FieldDef text() { return of(BaseType.TEXT); }
  public static FieldDef blob() { return of(BaseType.BLOB); }

  public FieldDef asPrimaryKey() { return new FieldDef(type, true, nullable, unique); }
  public FieldDef notNull() { return new FieldDef(type, primaryKey, false, unique); }
  public FieldDef nullable(boolean nullable) { return new FieldDef(type, primaryKey, nullable, unique); }
  public FieldDef asUnique() { return new FieldDef(type, primaryKey, nullable, true); }
}
