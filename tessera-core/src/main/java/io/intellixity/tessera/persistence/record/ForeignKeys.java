package io.intellixity.tessera.persistence.record;

import io.intellixity.tessera.persistence.schema.RecordType;
import io.intellixity.tessera.persistence.schema.SchemaException;

import java.util.Locale;

/** Naming convention for foreign-key columns: {@code <singular table name>_id}. */
public final class ForeignKeys {
  private ForeignKeys() {}

  /** Conventional name of a column referencing {@code referenced}, e.g. {@code departments -> department_id}. */
  public static String conventionFor(RecordType referenced) {
    String table = referenced.table();
    if (table == null || table.isBlank()) {
      throw new SchemaException("Table name not defined for record type " + referenced.name());
    }
    return singular(table) + "_id";
  }

  static String singular(String table) {
    String t = table.toLowerCase(Locale.ROOT);
    if (t.endsWith("ies") && t.length() > 3) return t.substring(0, t.length() - 3) + "y";
    if (t.endsWith("s") && !t.endsWith("ss") && t.length() > 1) return t.substring(0, t.length() - 1);
    return t;
  }
}
