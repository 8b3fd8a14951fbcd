package io.intellixity.tessera.persistence.exec;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Read-only view of the current row of a result, addressed by column label. */
public interface RowAdapter {
  /** Column labels in result order; duplicates (from joins) are kept. */
  List<String> labels();

  Object raw(String label);

  default boolean isNull(String label) {
    return raw(label) == null;
  }

  /** Label to value map in result order; for duplicate labels the first column wins. */
  default Map<String, Object> toMap() {
    Map<String, Object> out = new LinkedHashMap<>();
    for (String l : labels()) {
      if (!out.containsKey(l)) out.put(l, raw(l));
    }
    return out;
  }
}
