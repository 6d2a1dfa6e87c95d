package io.intellixity.frugal.access.query.aggregation;

import java.util.Objects;

/**
 * Aggregate function applied to a field (or to rows for {@code COUNT(*)}).
 *
 * @param op    function
 * @param field scalar field, null only for {@code COUNT}
 * @param alias output column name (defaults to {@code op_field})
 */
public record Aggregate(AggregateOp op, String field, String alias) {
  public Aggregate {
    Objects.requireNonNull(op, "op");
    if (field != null && field.isBlank()) field = null;
    if (op.requiresField() && field == null) throw new IllegalArgumentException(op + " requires a field");
    if (alias == null || alias.isBlank()) {
      alias = op.name().toLowerCase() + (field == null ? "" : "_" + field.replace('.', '_'));
    }
  }

  public static Aggregate count() { return new Aggregate(AggregateOp.COUNT, null, null); }
  public static Aggregate of(AggregateOp op, String field) { return new Aggregate(op, field, null); }
  public static Aggregate sum(String field) { return of(AggregateOp.SUM, field); }
  public static Aggregate avg(String field) { return of(AggregateOp.AVG, field); }
  public static Aggregate min(String field) { return of(AggregateOp.MIN, field); }
  public static Aggregate max(String field) { return of(AggregateOp.MAX, field); }
}
