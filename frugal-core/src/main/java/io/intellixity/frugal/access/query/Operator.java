package io.intellixity.frugal.access.query;

public enum Operator {
  EQ,
  NE,
  GT,
  GE,
  LT,
  LE,

  IN,
  NIN,

  RANGE,
  LIKE,

  /**
   * Date arithmetic: {@code EXTRACT(part FROM field) = value}.
   * Value is a map {@code {"part": "YEAR|MONTH|DAY|DOW", "value": n}}; not every store evaluates it natively.
   */
  DATE_PART_EQ
}
