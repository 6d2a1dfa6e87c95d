package io.intellixity.frugal.access.spi.store;

import io.intellixity.frugal.access.exec.Deadline;
import io.intellixity.frugal.access.exec.EntityNode;

import java.util.List;
import java.util.Map;

/**
 * Query interface of one data source. Every method call is exactly one round trip.
 * <p>
 * Implementations evaluate filters, projections and aggregates natively and raise
 * {@link io.intellixity.frugal.access.exec.UnsupportedPushdownException} for anything they cannot.
 */
public interface DataStore {
  String id();

  StoreCapabilities capabilities();

  /** Rows carry exactly {@link SelectRequest#fields()}. */
  List<Map<String, Object>> select(SelectRequest request, Deadline deadline);

  /** Root rows with related rows attached under each relation name. */
  List<EntityNode> selectComposed(ComposedRequest request, Deadline deadline);

  List<Map<String, Object>> aggregate(AggregateRequest request, Deadline deadline);
}
