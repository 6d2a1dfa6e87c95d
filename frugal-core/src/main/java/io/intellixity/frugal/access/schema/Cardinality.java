package io.intellixity.frugal.access.schema;

public enum Cardinality {
  /** At most one related row per parent (many-to-one / one-to-one). */
  ONE,
  /** Zero or more related rows per parent. */
  MANY
}
