package io.intellixity.frugal.access.exec;

import java.util.*;

/**
 * One root row of an {@link EntityGraph} with the related rows stitched under each requested relation.
 */
public record EntityNode(Map<String, Object> fields, Map<String, List<Map<String, Object>>> related) {
  public EntityNode {
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
    Map<String, List<Map<String, Object>>> rel = new LinkedHashMap<>();
    if (related != null) related.forEach((k, v) -> rel.put(k, List.copyOf(v)));
    related = Collections.unmodifiableMap(rel);
  }

  public Object get(String field) { return fields.get(field); }

  /** Related rows for a MANY relation; empty when the relation was not requested or has no matches. */
  public List<Map<String, Object>> many(String relation) {
    return related.getOrDefault(relation, List.of());
  }

  /** Related row for a ONE relation, or null. */
  public Map<String, Object> one(String relation) {
    List<Map<String, Object>> rows = many(relation);
    return rows.isEmpty() ? null : rows.get(0);
  }
}
