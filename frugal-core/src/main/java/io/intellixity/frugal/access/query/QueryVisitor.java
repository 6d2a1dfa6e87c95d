package io.intellixity.frugal.access.query;

public interface QueryVisitor<Q> {
  Q visit(Condition condition);
  Q visit(LogicalGroup group);
  Q visit(NotElement not);
}
