package io.intellixity.frugal.access.spi.exec;

import io.intellixity.frugal.access.exec.AggregateResult;
import io.intellixity.frugal.access.exec.CallOptions;
import io.intellixity.frugal.access.exec.ProjectedRows;
import io.intellixity.frugal.access.query.EntityQuery;
import io.intellixity.frugal.access.query.QueryElement;
import io.intellixity.frugal.access.query.QueryValidationException;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.query.aggregation.AggregateOp;
import io.intellixity.frugal.access.query.aggregation.GroupBy;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.SchemaRegistry;
import io.intellixity.frugal.access.spi.store.AggregateRequest;
import io.intellixity.frugal.access.spi.store.DataStore;
import io.intellixity.frugal.access.spi.store.SelectRequest;

import java.util.*;

/**
 * Pushes projections and aggregates down to the store.
 * <p>
 * Only the requested columns leave the store; aggregates are computed by the store.
 * Anything the store cannot evaluate raises
 * {@link io.intellixity.frugal.access.exec.UnsupportedPushdownException} without a round trip.
 */
public final class ProjectionExecutor {
  private final DataStore store;
  private final SchemaRegistry schemas;
  private final QueryValidationStrategy validation;

  public ProjectionExecutor(DataStore store, SchemaRegistry schemas) {
    this(store, schemas, new DefaultQueryValidationStrategy());
  }

  public ProjectionExecutor(DataStore store, SchemaRegistry schemas, QueryValidationStrategy validation) {
    this.store = Objects.requireNonNull(store, "store");
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.validation = (validation == null) ? new DefaultQueryValidationStrategy() : validation;
  }

  public ProjectedRows project(EntityQuery query) {
    return project(query, CallOptions.NONE);
  }

  public ProjectedRows project(EntityQuery query, CallOptions options) {
    Objects.requireNonNull(query, "query");
    EntitySchema schema = schemas.schema(query.type());
    if (query.hasIncludes()) {
      throw new QueryValidationException("Projection of '" + query.type() + "' cannot include relations; use fetch");
    }
    validation.validateFetch(schema, query, schemas);

    List<String> fields = new ArrayList<>(new LinkedHashSet<>(query.fields()));
    SelectRequest req = new SelectRequest(schema, fields, ParamResolver.resolve(query), query.sort(), query.page());
    List<Map<String, Object>> rows = store.select(req, options.start());
    return new ProjectedRows(schema.type(), fields, rows);
  }

  /**
   * Scalar aggregate. The field is the query's single projected field; {@code COUNT} may have none.
   */
  public AggregateResult aggregate(EntityQuery query, AggregateOp op) {
    Objects.requireNonNull(op, "op");
    List<String> fields = query.fields();
    if (fields.size() > 1) {
      throw new QueryValidationException(op + " takes at most one field, got " + fields);
    }
    String field = fields.isEmpty() ? null : fields.get(0);
    if (field == null && op.requiresField()) {
      throw new QueryValidationException(op + " requires a field for entity '" + query.type() + "'");
    }
    return aggregate(query, new Aggregate(op, field, null), CallOptions.NONE);
  }

  public AggregateResult aggregate(EntityQuery query, Aggregate aggregate) {
    return aggregate(query, aggregate, CallOptions.NONE);
  }

  public AggregateResult aggregate(EntityQuery query, Aggregate aggregate, CallOptions options) {
    Objects.requireNonNull(aggregate, "aggregate");
    List<Map<String, Object>> rows = run(query, List.of(aggregate), GroupBy.of(), options);
    Object v = rows.isEmpty() ? null : rows.get(0).get(aggregate.alias());
    if (v == null && aggregate.op() == AggregateOp.COUNT) v = 0L;
    return new AggregateResult(aggregate, v);
  }

  /** Grouped aggregation: one row per group, columns are the group fields followed by the aggregate aliases. */
  public ProjectedRows aggregate(EntityQuery query, List<Aggregate> aggregates, GroupBy groupBy) {
    return aggregate(query, aggregates, groupBy, CallOptions.NONE);
  }

  public ProjectedRows aggregate(EntityQuery query, List<Aggregate> aggregates, GroupBy groupBy, CallOptions options) {
    GroupBy g = (groupBy == null) ? GroupBy.of() : groupBy;
    List<Map<String, Object>> rows = run(query, aggregates, g, options);
    List<String> columns = new ArrayList<>(g.fields());
    for (Aggregate a : aggregates) columns.add(a.alias());
    return new ProjectedRows(query.type(), columns, rows);
  }

  private List<Map<String, Object>> run(EntityQuery query, List<Aggregate> aggregates, GroupBy groupBy, CallOptions options) {
    Objects.requireNonNull(query, "query");
    EntitySchema schema = schemas.schema(query.type());
    validation.validateAggregate(schema, query, aggregates, groupBy);
    requireUniqueAliases(aggregates, groupBy);

    QueryElement filter = ParamResolver.resolve(query);
    AggregateRequest req = new AggregateRequest(schema, filter, aggregates, groupBy.fields(), query.sort(), query.page());
    return store.aggregate(req, options.start());
  }

  private static void requireUniqueAliases(List<Aggregate> aggregates, GroupBy groupBy) {
    Set<String> names = new HashSet<>(groupBy.fields());
    for (Aggregate a : aggregates) {
      if (!names.add(a.alias())) throw new QueryValidationException("Duplicate output column '" + a.alias() + "'");
    }
  }
}
