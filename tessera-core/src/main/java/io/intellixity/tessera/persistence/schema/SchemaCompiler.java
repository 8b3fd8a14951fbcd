package io.intellixity.tessera.persistence.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives the {@code CREATE TABLE IF NOT EXISTS} statement of a record type.\n
 *
 * Clause order: columns, primary key, foreign keys, unique constraints. Nullability is always rendered
 * explicitly so the output is deterministic.\n
 */
public final class SchemaCompiler {

  public String compile(RecordType type) {
    if (type.table() == null || type.table().isBlank()) {
      throw new SchemaException("Table name not defined for record type " + type.name());
    }
    if (type.attributes().isEmpty()) {
      throw new SchemaException("Record type " + type.name() + " declares no columns");
    }

    List<String> columns = new ArrayList<>();
    List<String> primaryKeys = new ArrayList<>();
    List<String> foreignKeys = new ArrayList<>();
    List<String> uniques = new ArrayList<>();

    for (var e : type.attributes().entrySet()) {
      String col = e.getKey();
      AttributeDef ad = e.getValue();
      if (ad instanceof FieldDef fd) {
        columns.add(col + " " + fd.type().name() + nullability(fd.nullable()) + (fd.unique() ? " UNIQUE" : ""));
        if (fd.primaryKey()) primaryKeys.add(col);
        if (fd.unique() && !fd.primaryKey()) uniques.add("UNIQUE(" + col + ")");
      } else if (ad instanceof RelationDef rd) {
        columns.add(col + " " + rd.type().name() + nullability(rd.nullable()));
        // policy comes from this relation only
        foreignKeys.add(foreignKey(type, col, rd));
      } else {
        throw new SchemaException("Unsupported attribute definition on " + type.name() + "." + col + ": " + ad);
      }
    }

    List<String> clauses = new ArrayList<>(columns);
    if (!primaryKeys.isEmpty()) clauses.add("PRIMARY KEY (" + String.join(", ", primaryKeys) + ")");
    clauses.addAll(foreignKeys);
    clauses.addAll(uniques);

    return "CREATE TABLE IF NOT EXISTS " + type.table() + " (" + String.join(", ", clauses) + ")";
  }

  private static String foreignKey(RecordType owner, String col, RelationDef rd) {
    RecordType ref = rd.referencedType();
    if (ref.table() == null || ref.table().isBlank()) {
      throw new SchemaException("Relation " + owner.name() + "." + col + " references " + ref.name()
          + " which has no table name");
    }
    return "FOREIGN KEY(" + col + ") REFERENCES " + ref.table() + "(" + ref.primaryKey() + ")"
        + " ON DELETE " + rd.onDelete().sql();
  }

  private static String nullability(boolean nullable) {
    return nullable ? " NULL" : " NOT NULL";
  }
}
