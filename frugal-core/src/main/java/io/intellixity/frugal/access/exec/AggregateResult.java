package io.intellixity.frugal.access.exec;

import io.intellixity.frugal.access.query.aggregation.Aggregate;

import java.math.BigDecimal;
import java.util.Objects;

/** Scalar produced by a pushed-down aggregate. {@code value} is null for SUM/AVG/MIN/MAX over no rows. */
public record AggregateResult(Aggregate aggregate, Object value) {
  public AggregateResult {
    Objects.requireNonNull(aggregate, "aggregate");
  }

  public long asLong() {
    if (value == null) return 0L;
    if (value instanceof Number n) return n.longValue();
    return Long.parseLong(String.valueOf(value));
  }

  public double asDouble() {
    if (value == null) return 0d;
    if (value instanceof Number n) return n.doubleValue();
    return Double.parseDouble(String.valueOf(value));
  }

  public BigDecimal asBigDecimal() {
    if (value == null) return null;
    if (value instanceof BigDecimal bd) return bd;
    return new BigDecimal(String.valueOf(value));
  }
}
