package io.intellixity.tessera.persistence.jdbc;

import io.intellixity.tessera.persistence.exec.QueryException;
import io.intellixity.tessera.persistence.exec.RowAdapter;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.*;

/** {@link RowAdapter} over the current row of a {@link ResultSet}. */
public final class JdbcRowAdapter implements RowAdapter {
  private final ResultSet rs;
  private List<String> labels;
  private Map<String, Integer> colIndex;

  public JdbcRowAdapter(ResultSet rs) {
    this.rs = Objects.requireNonNull(rs, "rs");
  }

  @Override
  public List<String> labels() {
    ensureIndex();
    return labels;
  }

  @Override
  public Object raw(String label) {
    ensureIndex();
    Integer i = colIndex.get(label);
    if (i == null) throw new IllegalArgumentException("Unknown column label: " + label);
    try {
      return rs.getObject(i);
    } catch (SQLException e) {
      throw new QueryException("Failed to read column '" + label + "'", e);
    }
  }

  private void ensureIndex() {
    if (colIndex != null) return;
    try {
      ResultSetMetaData md = rs.getMetaData();
      List<String> ls = new ArrayList<>(md.getColumnCount());
      Map<String, Integer> idx = new HashMap<>();
      for (int i = 1; i <= md.getColumnCount(); i++) {
        String l = md.getColumnLabel(i);
        ls.add(l);
        idx.putIfAbsent(l, i);
      }
      labels = Collections.unmodifiableList(ls);
      colIndex = idx;
    } catch (SQLException e) {
      throw new QueryException("Failed to read result metadata", e);
    }
  }
}
