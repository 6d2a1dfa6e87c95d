package io.intellixity.frugal.access.queue;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Durable queue primitives. Durability and at-least-once delivery are properties of the implementation;
 * {@link BackgroundOffloadQueue} only composes these calls.
 */
public interface MessageBroker extends AutoCloseable {

  /** Stores the item unless one with the same id is already known. Returns once the enqueue is durable. */
  WorkItemId enqueue(WorkItem item);

  /** Claims the oldest ready item, waiting up to {@code wait} for one. */
  Optional<Lease> lease(Duration wait);

  /** @throws LeaseExpiredException if the lease is no longer current */
  void ack(Lease lease);

  /**
   * Gives the item back after a failed delivery; it becomes leasable again after {@code retryDelay},
   * or is dead-lettered once its retries are used up.
   *
   * @throws LeaseExpiredException if the lease is no longer current
   */
  void abandon(Lease lease, String reason, Duration retryDelay);

  Optional<WorkItemStatus> find(WorkItemId id);

  /** Items not yet in a terminal state. */
  long depth();

  List<WorkItemStatus> deadLetters();

  /** Forgets a dead-lettered item. Returns false if the id is unknown or not dead-lettered. */
  boolean purge(WorkItemId id);

  @Override default void close() {}
}
