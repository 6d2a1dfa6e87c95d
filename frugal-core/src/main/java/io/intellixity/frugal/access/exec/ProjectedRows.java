package io.intellixity.frugal.access.exec;

import java.util.*;

/**
 * Rows carrying only the requested columns.
 *
 * @param type    entity type the rows were read from
 * @param columns projected columns (fields, or group keys followed by aggregate aliases)
 * @param rows    one map per row, keyed by column
 */
public record ProjectedRows(String type, List<String> columns, List<Map<String, Object>> rows) {
  public ProjectedRows {
    Objects.requireNonNull(type, "type");
    columns = List.copyOf(columns == null ? List.of() : columns);
    List<Map<String, Object>> copy = new ArrayList<>(rows == null ? 0 : rows.size());
    if (rows != null) {
      for (Map<String, Object> r : rows) copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(r)));
    }
    rows = Collections.unmodifiableList(copy);
  }

  public int size() { return rows.size(); }
}
