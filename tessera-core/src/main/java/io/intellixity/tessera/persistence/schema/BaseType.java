package io.intellixity.tessera.persistence.schema;

import java.math.BigDecimal;
import java.math.BigInteger;

/** Storage class of a column, rendered verbatim into DDL. */
public enum BaseType {
  INTEGER,
  REAL,
  TEXT,
  BLOB;

  /**
   * Normalizes a value to this type's canonical Java representation.\n
   *
   * INTEGER values become {@link Long}, REAL values become {@link Double}. Values that do not convert
   * losslessly are returned unchanged and left for the engine to accept or reject.\n
   */
  public Object normalize(Object value) {
    if (value == null) return null;
    return switch (this) {
      case INTEGER -> toLong(value);
      case REAL -> (value instanceof Number n && !(value instanceof BigDecimal) && !(value instanceof BigInteger))
          ? Double.valueOf(n.doubleValue())
          : value;
      case TEXT -> (value instanceof Character || value instanceof CharSequence) ? value.toString() : value;
      case BLOB -> value;
    };
  }

  private static Object toLong(Object value) {
    if (value instanceof Long) return value;
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger bi && bi.bitLength() < 64) return bi.longValue();
    if (value instanceof Double d && d == Math.rint(d) && !Double.isInfinite(d)
        && d >= Long.MIN_VALUE && d <= Long.MAX_VALUE) {
      return d.longValue();
    }
    if (value instanceof Boolean b) return b ? 1L : 0L;
    return value;
  }
}
