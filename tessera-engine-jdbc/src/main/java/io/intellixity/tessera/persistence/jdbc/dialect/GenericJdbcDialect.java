package io.intellixity.tessera.persistence.jdbc.dialect;

import io.intellixity.tessera.persistence.sql.AnsiSqlDialect;

/** ANSI rendering with driver generated keys and SQLState-based constraint detection. */
public class GenericJdbcDialect extends AnsiSqlDialect implements JdbcDialect {
  @Override
  public String id() {
    return "jdbc";
  }
}
