package io.intellixity.tessera.persistence.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Trusted raw SQL text plus the positional parameters it owns.\n
 *
 * The text is caller input and is neither parsed nor sanitized; only {@code params} are bound safely.\n
 */
public record SqlFragment(String sql, List<Object> params) {
  public SqlFragment {
    if (sql == null || sql.isBlank()) throw new IllegalArgumentException("SQL fragment is blank");
    params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  public static SqlFragment of(String sql, Object... params) {
    return new SqlFragment(sql, params == null ? List.of() : Arrays.asList(params));
  }
}
