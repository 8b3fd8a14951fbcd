package io.intellixity.tessera.persistence.schema;

import java.util.Objects;

/** Foreign-key column referencing the primary key of another record type. Always stored as INTEGER. */
public record RelationDef(RecordType referencedType, boolean nullable) implements AttributeDef {
  public RelationDef {
    Objects.requireNonNull(referencedType, "referencedType");
  }

  public static RelationDef to(RecordType referencedType) {
    return new RelationDef(referencedType, false);
  }

  public static RelationDef nullableTo(RecordType referencedType) {
    return new RelationDef(referencedType, true);
  }

  @Override
  public BaseType type() { return BaseType.INTEGER; }

  public OnDelete onDelete() {
    return nullable ? OnDelete.SET_NULL : OnDelete.CASCADE;
  }

  public enum OnDelete {
    SET_NULL("SET NULL"),
    CASCADE("CASCADE");

    private final String sql;

    OnDelete(String sql) { this.sql = sql; }

    public String sql() { return sql; }
  }
}
