package io.intellixity.tessera.persistence.dmlast;

/** Backend-agnostic DML statement, rendered by a {@link io.intellixity.tessera.persistence.sql.SqlDialect}. */
public interface DmlAst {
  String table();
}
