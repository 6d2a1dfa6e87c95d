package io.intellixity.frugal.access.queue;

import java.time.Instant;
import java.util.Objects;

/**
 * Exclusive, time-bounded claim on a work item. The token ties ack/abandon to this delivery only:
 * once the lease expires and the item is handed out again, the old token is stale.
 */
public record Lease(WorkItem item, String token, Instant expiresAt) {
  public Lease {
    Objects.requireNonNull(item, "item");
    Objects.requireNonNull(token, "token");
    Objects.requireNonNull(expiresAt, "expiresAt");
  }

  public WorkItemId id() { return item.id(); }
}
