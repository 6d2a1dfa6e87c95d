package io.intellixity.frugal.access.spi.exec;

import io.intellixity.frugal.access.query.*;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.query.aggregation.AggregateOp;
import io.intellixity.frugal.access.query.aggregation.GroupBy;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.FieldDef;
import io.intellixity.frugal.access.schema.Relation;
import io.intellixity.frugal.access.schema.SchemaRegistry;

import java.util.List;
import java.util.Objects;

/**
 * Default, backend-agnostic query validation.
 * <p>
 * Validates:
 * - projection list present and a subset of the schema (no implicit select-all)
 * - include relations and their projection lists
 * - filter properties, sort fields and group-by fields
 * - aggregate fields (SUM/AVG need numeric fields, date parts need temporal fields)
 * <p>
 * Violations throw {@link QueryValidationException}.
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public void validateFetch(EntitySchema root, EntityQuery query, SchemaRegistry schemas) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(query, "query");

    requireProjection(root, query.fields(), "fields");
    for (Include inc : query.includes()) {
      Relation rel = root.relation(inc.relation());
      EntitySchema target = schemas.schema(rel.targetType());
      requireProjection(target, inc.fields(), "include '" + inc.relation() + "'");
    }
    validateElement(root, query.filter());
    validateSort(root, query.sort());
  }

  @Override
  public void validateAggregate(EntitySchema root, EntityQuery query, List<Aggregate> aggregates, GroupBy groupBy) {
    Objects.requireNonNull(root, "root");
    Objects.requireNonNull(query, "query");
    if (query.hasIncludes()) {
      throw new QueryValidationException("Aggregates over '" + root.type() + "' cannot include relations");
    }
    if (aggregates == null || aggregates.isEmpty()) {
      throw new QueryValidationException("At least one aggregate is required for entity '" + root.type() + "'");
    }
    for (Aggregate a : aggregates) {
      if (a.field() == null) continue;
      FieldDef f = requireField(root, a.field(), "aggregate");
      if ((a.op() == AggregateOp.SUM || a.op() == AggregateOp.AVG) && !f.type().numeric()) {
        throw new QueryValidationException(a.op() + " requires a numeric field, '" + a.field() + "' is " + f.type());
      }
    }
    if (groupBy != null) {
      for (String g : groupBy.fields()) requireField(root, g, "groupBy");
    }
    validateElement(root, query.filter());
    validateSort(root, query.sort());
  }

  private static void requireProjection(EntitySchema schema, List<String> fields, String usage) {
    if (fields == null || fields.isEmpty()) {
      throw new QueryValidationException(
          "Explicit field list required in " + usage + " for entity '" + schema.type() + "' (no implicit select-all)");
    }
    for (String f : fields) requireField(schema, f, usage);
  }

  private static void validateSort(EntitySchema schema, List<SortField> sort) {
    for (SortField sf : sort) requireField(schema, sf.field(), "sort");
  }

  private static void validateElement(EntitySchema schema, QueryElement el) {
    if (el == null) return;
    if (el instanceof NotElement n) {
      validateElement(schema, n.element());
      return;
    }
    if (el instanceof LogicalGroup g) {
      for (QueryElement c : g.elements()) validateElement(schema, c);
      return;
    }
    if (el instanceof Condition c) {
      FieldDef f = requireField(schema, c.property(), "filter");
      if (c.operator() == Operator.DATE_PART_EQ) {
        c.datePart();
        if (!f.type().temporal()) {
          throw new QueryValidationException("DATE_PART_EQ requires a date field, '" + c.property() + "' is " + f.type());
        }
      }
      return;
    }
    throw new QueryValidationException("Unsupported QueryElement: " + el.getClass().getName());
  }

  private static FieldDef requireField(EntitySchema schema, String field, String usage) {
    if (field == null || field.isBlank()) {
      throw new QueryValidationException("Blank field in " + usage + " for entity '" + schema.type() + "'");
    }
    FieldDef f = schema.fields().get(field);
    if (f == null) {
      throw new QueryValidationException("Unknown field '" + field + "' in " + usage + " for entity '" + schema.type() + "'");
    }
    return f;
  }
}
