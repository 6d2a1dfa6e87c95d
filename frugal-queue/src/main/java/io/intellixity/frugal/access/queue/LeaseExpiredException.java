package io.intellixity.frugal.access.queue;

/**
 * Ack or abandon arrived after the lease ran out. The item has already been requeued (or dead-lettered),
 * so consumers log and move on.
 */
public final class LeaseExpiredException extends RuntimeException {
  private final WorkItemId id;

  public LeaseExpiredException(WorkItemId id) {
    super("Lease on work item " + id + " has expired");
    this.id = id;
  }

  public WorkItemId id() { return id; }
}
