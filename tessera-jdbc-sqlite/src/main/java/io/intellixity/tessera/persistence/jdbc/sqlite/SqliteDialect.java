package io.intellixity.tessera.persistence.jdbc.sqlite;

import io.intellixity.tessera.persistence.jdbc.dialect.JdbcDialect;
import io.intellixity.tessera.persistence.sql.AnsiSqlDialect;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.sql.SQLException;

/** SQLite flavour: offset-only paging, rowid read-back and SQLite result codes. */
public final class SqliteDialect extends AnsiSqlDialect implements JdbcDialect {

  @Override
  public String id() {
    return "sqlite";
  }

  /** SQLite has no bare OFFSET; an offset without limit is rendered as {@code LIMIT -1 OFFSET n}. */
  @Override
  protected void appendPage(StringBuilder sql, Integer limit, Integer offset) {
    if (limit == null && offset != null) {
      sql.append(" LIMIT -1 OFFSET ").append(offset);
      return;
    }
    super.appendPage(sql, limit, offset);
  }

  @Override
  public String lastInsertIdSql() {
    return "SELECT last_insert_rowid()";
  }

  @Override
  public boolean isConstraintViolation(SQLException e) {
    if (e instanceof SQLiteException se) {
      return (se.getResultCode().code & 0xff) == SQLiteErrorCode.SQLITE_CONSTRAINT.code;
    }
    if ((e.getErrorCode() & 0xff) == SQLiteErrorCode.SQLITE_CONSTRAINT.code) return true;
    return JdbcDialect.super.isConstraintViolation(e);
  }
}
