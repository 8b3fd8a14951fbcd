package io.intellixity.tessera.persistence.dmlast;

import io.intellixity.tessera.persistence.schema.RecordType;
import io.intellixity.tessera.persistence.schema.SchemaException;

import java.util.*;

/** Maps a record type plus in-memory values into backend-agnostic DML ASTs. */
public final class DmlPlanner {

  /** INSERT over every populated attribute, in declaration order, reading back the primary key. */
  public InsertAst planInsert(RecordType type, Map<String, Object> values) {
    String table = requireTable(type);
    String pk = type.primaryKey();
    List<ColumnBind> cols = new ArrayList<>();
    for (String attr : type.attributes().keySet()) {
      if (values.containsKey(attr)) cols.add(new ColumnBind(attr, values.get(attr)));
    }
    // undeclared key column (default "id") set explicitly by the caller
    if (!type.declares(pk) && values.containsKey(pk)) cols.add(new ColumnBind(pk, values.get(pk)));
    return new InsertAst(table, cols, pk);
  }

  /** UPDATE of the dirty attributes only, keyed by the primary key. Key columns never appear in SET. */
  public UpdateAst planUpdate(RecordType type, Map<String, Object> values, Collection<String> dirty) {
    String table = requireTable(type);
    String pk = type.primaryKey();
    Object keyValue = values.get(pk);
    if (keyValue == null) throw new IllegalArgumentException("Update requires a primary key value: " + type.name());

    List<ColumnBind> sets = new ArrayList<>();
    for (String attr : dirty) {
      if (attr.equals(pk)) continue;
      sets.add(new ColumnBind(attr, values.get(attr)));
    }
    return new UpdateAst(table, sets, pk, keyValue);
  }

  public DeleteAst planDelete(RecordType type, Object keyValue) {
    if (keyValue == null) throw new IllegalArgumentException("Delete requires a primary key value: " + type.name());
    return new DeleteAst(requireTable(type), type.primaryKey(), keyValue);
  }

  private static String requireTable(RecordType type) {
    String t = type.table();
    if (t == null || t.isBlank()) throw new SchemaException("Table name not defined for record type " + type.name());
    return t;
  }
}
