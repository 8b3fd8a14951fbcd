package io.intellixity.tessera.persistence.dmlast;

import java.util.Objects;

public record ColumnBind(String column, Object value) {
  public ColumnBind {
    Objects.requireNonNull(column, "column");
  }
}
