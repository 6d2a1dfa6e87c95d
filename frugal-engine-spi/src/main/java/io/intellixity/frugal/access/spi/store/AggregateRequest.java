package io.intellixity.frugal.access.spi.store;

import io.intellixity.frugal.access.query.Page;
import io.intellixity.frugal.access.query.QueryElement;
import io.intellixity.frugal.access.query.SortField;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.schema.EntitySchema;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate over the filtered rows of one entity. Result rows carry the group-by fields
 * followed by one column per aggregate alias; without group-by there is exactly one row.
 */
public record AggregateRequest(EntitySchema schema,
                               QueryElement filter,
                               List<Aggregate> aggregates,
                               List<String> groupBy,
                               List<SortField> sort,
                               Page page) {
  public AggregateRequest {
    Objects.requireNonNull(schema, "schema");
    aggregates = List.copyOf(Objects.requireNonNull(aggregates, "aggregates"));
    if (aggregates.isEmpty()) throw new IllegalArgumentException("aggregates must not be empty");
    groupBy = List.copyOf(groupBy == null ? List.of() : groupBy);
    sort = List.copyOf(sort == null ? List.of() : sort);
  }

  public boolean grouped() { return !groupBy.isEmpty(); }
}
