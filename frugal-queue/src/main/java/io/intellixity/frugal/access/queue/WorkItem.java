package io.intellixity.frugal.access.queue;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of deferred work.
 *
 * @param id           dedup key; producers retrying after a crash should reuse it
 * @param type         selects the {@link WorkHandler} on the consumer side
 * @param payload      handler input; must be JSON-serializable when the broker journals
 * @param enqueuedAt   stamped by the broker, {@code null} before enqueue
 * @param retries      failed deliveries so far (abandons and lease expiries)
 * @param leaseTimeout per-item visibility timeout, {@code null} for the queue default
 */
public record WorkItem(WorkItemId id,
                       String type,
                       Map<String, Object> payload,
                       Instant enqueuedAt,
                       int retries,
                       Duration leaseTimeout) {
  public WorkItem {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    payload = (payload == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    if (retries < 0) throw new IllegalArgumentException("retries must be >= 0");
    if (leaseTimeout != null && (leaseTimeout.isZero() || leaseTimeout.isNegative())) {
      throw new IllegalArgumentException("leaseTimeout must be > 0");
    }
  }

  public static WorkItem of(String type, Map<String, Object> payload) {
    return new WorkItem(WorkItemId.random(), type, payload, null, 0, null);
  }

  public WorkItem withId(WorkItemId id) {
    return new WorkItem(id, type, payload, enqueuedAt, retries, leaseTimeout);
  }

  public WorkItem withLeaseTimeout(Duration leaseTimeout) {
    return new WorkItem(id, type, payload, enqueuedAt, retries, leaseTimeout);
  }

  WorkItem enqueued(Instant at) {
    return new WorkItem(id, type, payload, at, retries, leaseTimeout);
  }

  /** Same item with the payload dropped; what the broker keeps once the work is done. */
  WorkItem withoutPayload() {
    return new WorkItem(id, type, Map.of(), enqueuedAt, retries, leaseTimeout);
  }

  WorkItem withRetries(int retries) {
    return new WorkItem(id, type, payload, enqueuedAt, retries, leaseTimeout);
  }
}
