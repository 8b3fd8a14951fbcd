package io.intellixity.tessera.persistence.jdbc.dialect;

import io.intellixity.tessera.persistence.sql.SqlDialect;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

/** Dialect for JDBC engines: statement rendering plus classification of driver errors. */
public interface JdbcDialect extends SqlDialect {

  /** True if {@code e} reports a unique, foreign-key, not-null or check constraint violation. */
  default boolean isConstraintViolation(SQLException e) {
    if (e instanceof SQLIntegrityConstraintViolationException) return true;
    String state = e.getSQLState();
    return state != null && state.startsWith("23");
  }
}
