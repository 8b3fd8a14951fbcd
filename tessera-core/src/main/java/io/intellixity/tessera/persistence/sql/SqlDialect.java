package io.intellixity.tessera.persistence.sql;

import io.intellixity.tessera.persistence.dmlast.DmlAst;
import io.intellixity.tessera.persistence.query.QueryDescriptor;
import io.intellixity.tessera.persistence.schema.RecordType;

/** Renders schema, query and DML descriptors into SQL for one engine family. */
public interface SqlDialect {
  String id();

  String renderCreateTable(RecordType type);

  SqlStatement renderSelect(QueryDescriptor query);

  /** {@code SELECT COUNT(*)} over the query's target table and predicates only. */
  SqlStatement renderCount(QueryDescriptor query);

  SqlStatement renderDml(DmlAst dml);

  /**
   * SQL that reads back the key assigned by the last INSERT on the same connection, or {@code null} to use
   * the driver's generated-keys support.
   */
  default String lastInsertIdSql() {
    return null;
  }
}
