package io.intellixity.frugal.access.query;

/** Node of a filter tree ({@link Condition}, {@link LogicalGroup} or {@link NotElement}). */
public interface QueryElement {
  <Q> Q accept(QueryVisitor<Q> visitor);
}
