package io.intellixity.tessera.persistence.dmlast;

import java.util.List;

/** INSERT over the given columns; {@code keyColumn} names the column whose generated value is read back. */
public record InsertAst(String table, List<ColumnBind> columns, String keyColumn) implements DmlAst {
  public InsertAst {
    columns = columns == null ? List.of() : List.copyOf(columns);
  }
}
