package io.intellixity.tessera.persistence.query;

public enum JoinType {
  INNER,
  LEFT,
  RIGHT
}
