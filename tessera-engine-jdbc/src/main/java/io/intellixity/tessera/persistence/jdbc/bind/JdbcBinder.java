package io.intellixity.tessera.persistence.jdbc.bind;

import java.math.BigDecimal;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.UUID;

/** Binds positional parameter values onto a {@link PreparedStatement} by their Java type. */
public final class JdbcBinder {
  private JdbcBinder() {}

  public static void bind(PreparedStatement ps, int index, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(index, Types.NULL);
    } else if (value instanceof byte[] bytes) {
      ps.setBytes(index, bytes);
    } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
      ps.setLong(index, ((Number) value).longValue());
    } else if (value instanceof Double || value instanceof Float) {
      ps.setDouble(index, ((Number) value).doubleValue());
    } else if (value instanceof BigDecimal bd) {
      ps.setBigDecimal(index, bd);
    } else if (value instanceof String s) {
      ps.setString(index, s);
    } else if (value instanceof Boolean b) {
      ps.setBoolean(index, b);
    } else if (value instanceof Enum<?> en) {
      ps.setString(index, en.name());
    } else if (value instanceof UUID || value instanceof CharSequence || value instanceof Character) {
      ps.setString(index, value.toString());
    } else {
      ps.setObject(index, value);
    }
  }
}
