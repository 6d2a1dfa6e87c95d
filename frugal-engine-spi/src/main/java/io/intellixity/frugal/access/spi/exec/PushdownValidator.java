package io.intellixity.frugal.access.spi.exec;

import io.intellixity.frugal.access.exec.UnsupportedPushdownException;
import io.intellixity.frugal.access.query.*;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.spi.store.AggregateRequest;
import io.intellixity.frugal.access.spi.store.StoreCapabilities;

/**
 * Checks a request against {@link StoreCapabilities} before any round trip.
 * There is no in-process fallback: anything the store cannot evaluate is rejected.
 */
public final class PushdownValidator {
  private PushdownValidator() {}

  public static void requireFilter(String storeId, StoreCapabilities caps, QueryElement filter) {
    if (filter == null) return;
    filter.accept(new QueryVisitor<Void>() {
      @Override
      public Void visit(Condition c) {
        if (!caps.supports(c.operator())) {
          throw new UnsupportedPushdownException(storeId, "operator " + c.operator() + " on '" + c.property() + "'");
        }
        return null;
      }

      @Override
      public Void visit(LogicalGroup g) {
        for (QueryElement e : g.elements()) e.accept(this);
        return null;
      }

      @Override
      public Void visit(NotElement n) {
        return n.element().accept(this);
      }
    });
  }

  public static void requireAggregate(String storeId, StoreCapabilities caps, AggregateRequest request) {
    requireFilter(storeId, caps, request.filter());
    for (Aggregate a : request.aggregates()) {
      if (!caps.supports(a.op())) {
        throw new UnsupportedPushdownException(storeId, "aggregate " + a.op() + (a.field() == null ? "" : " on '" + a.field() + "'"));
      }
    }
    if (request.grouped() && !caps.groupBy()) {
      throw new UnsupportedPushdownException(storeId, "group by " + request.groupBy());
    }
  }
}
