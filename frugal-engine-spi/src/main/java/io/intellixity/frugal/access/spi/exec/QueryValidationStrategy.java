package io.intellixity.frugal.access.spi.exec;

import io.intellixity.frugal.access.query.EntityQuery;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.query.aggregation.GroupBy;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.SchemaRegistry;

import java.util.List;

/**
 * Hook to validate queries against the entity schema before any statement is rendered.
 * Applications may plug in stricter rules.
 */
public interface QueryValidationStrategy {
  /** Fetch and projection: explicit field list, known fields, known relations. */
  void validateFetch(EntitySchema root, EntityQuery query, SchemaRegistry schemas);

  void validateAggregate(EntitySchema root, EntityQuery query, List<Aggregate> aggregates, GroupBy groupBy);
}
