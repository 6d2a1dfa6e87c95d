package io.intellixity.frugal.access.schema;

public enum FieldType {
  STRING,
  INT,
  LONG,
  DOUBLE,
  DECIMAL,
  BOOLEAN,
  DATE,
  TIMESTAMP,
  UUID;

  /** Fields usable with {@code SUM}/{@code AVG}. */
  public boolean numeric() {
    return this == INT || this == LONG || this == DOUBLE || this == DECIMAL;
  }

  /** Fields usable with date-part predicates. */
  public boolean temporal() {
    return this == DATE || this == TIMESTAMP;
  }
}
