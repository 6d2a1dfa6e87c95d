package io.intellixity.frugal.access.query;

import java.util.List;
import java.util.Objects;

/**
 * Related sub-entity to fetch alongside the root rows.
 *
 * @param relation relation name declared on the root entity schema
 * @param fields   explicit projection of the related entity (never implicit "all")
 */
public record Include(String relation, List<String> fields) {
  public Include {
    Objects.requireNonNull(relation, "relation");
    if (relation.isBlank()) throw new IllegalArgumentException("relation is blank");
    fields = List.copyOf(fields == null ? List.of() : fields);
  }

  public static Include of(String relation, String... fields) {
    return new Include(relation, List.of(fields));
  }
}
