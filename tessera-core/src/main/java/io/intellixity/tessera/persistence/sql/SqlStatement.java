package io.intellixity.tessera.persistence.sql;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Rendered SQL text with its positional ({@code ?}) parameters. Parameter values may be {@code null}. */
public record SqlStatement(String sql, List<Object> params, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via executeQuery() (SELECT/COUNT). */
    QUERY,
    /** Execute via executeUpdate() (UPDATE/DELETE/DDL). */
    UPDATE,
    /** Execute via executeUpdate() and read back the storage-assigned key. */
    UPDATE_GENERATED_KEYS
  }

  public SqlStatement {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("sql is blank");
    params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Object> params) {
    this(sql, params, ExecKind.QUERY);
  }
}
