package io.intellixity.tessera.persistence.testing;

import io.intellixity.tessera.persistence.schema.FieldDef;
import io.intellixity.tessera.persistence.schema.RecordType;
import io.intellixity.tessera.persistence.schema.RelationDef;

/** Record types shared by tests. */
public final class Schemas {
  private Schemas() {}

  public static final RecordType DEPARTMENT = RecordType.builder("Department")
      .table("departments")
      .field("id", FieldDef.integer().asPrimaryKey())
      .field("name", FieldDef.text().notNull().asUnique())
      .field("budget", FieldDef.real())
      .build();

  public static final RecordType EMPLOYEE = RecordType.builder("Employee")
      .table("employees")
      .field("id", FieldDef.integer().asPrimaryKey())
      .field("name", FieldDef.text().notNull())
      .field("email", FieldDef.text().asUnique())
      .field("salary", FieldDef.real())
      .relation("department_id", RelationDef.to(DEPARTMENT))
      .build();
}
