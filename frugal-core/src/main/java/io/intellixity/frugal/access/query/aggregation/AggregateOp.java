package io.intellixity.frugal.access.query.aggregation;

public enum AggregateOp {
  COUNT,
  SUM,
  AVG,
  MIN,
  MAX;

  /** COUNT may run without a field ({@code COUNT(*)}); every other op needs one. */
  public boolean requiresField() {
    return this != COUNT;
  }
}
