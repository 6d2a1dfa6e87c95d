package io.intellixity.frugal.access.spi.store;

import io.intellixity.frugal.access.query.Operator;
import io.intellixity.frugal.access.query.aggregation.AggregateOp;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * What a store evaluates natively.
 *
 * @param composition true when root and related entities can be fetched in one round trip
 * @param operators   filter operators evaluated server-side
 * @param aggregates  aggregate functions evaluated server-side
 * @param groupBy     true when grouped aggregation is evaluated server-side
 */
public record StoreCapabilities(boolean composition, Set<Operator> operators, Set<AggregateOp> aggregates, boolean groupBy) {
  public StoreCapabilities {
    operators = Set.copyOf(Objects.requireNonNull(operators, "operators"));
    aggregates = Set.copyOf(Objects.requireNonNull(aggregates, "aggregates"));
  }

  public static StoreCapabilities all() {
    return new StoreCapabilities(true, EnumSet.allOf(Operator.class), EnumSet.allOf(AggregateOp.class), true);
  }

  public boolean supports(Operator op) { return operators.contains(op); }
  public boolean supports(AggregateOp op) { return aggregates.contains(op); }

  public StoreCapabilities withComposition(boolean composition) {
    return new StoreCapabilities(composition, operators, aggregates, groupBy);
  }

  public StoreCapabilities withGroupBy(boolean groupBy) {
    return new StoreCapabilities(composition, operators, aggregates, groupBy);
  }

  public StoreCapabilities without(Operator op) {
    EnumSet<Operator> ops = operators.isEmpty() ? EnumSet.noneOf(Operator.class) : EnumSet.copyOf(operators);
    ops.remove(op);
    return new StoreCapabilities(composition, ops, aggregates, groupBy);
  }

  public StoreCapabilities without(AggregateOp op) {
    EnumSet<AggregateOp> ags = aggregates.isEmpty() ? EnumSet.noneOf(AggregateOp.class) : EnumSet.copyOf(aggregates);
    ags.remove(op);
    return new StoreCapabilities(composition, operators, ags, groupBy);
  }
}
