package io.intellixity.tessera.persistence.dmlast;

import java.util.List;

public record UpdateAst(String table, List<ColumnBind> sets, String keyColumn, Object keyValue) implements DmlAst {
  public UpdateAst {
    sets = sets == null ? List.of() : List.copyOf(sets);
  }
}
