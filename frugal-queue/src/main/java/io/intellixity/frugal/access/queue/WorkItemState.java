package io.intellixity.frugal.access.queue;

/**
 * Lifecycle of a work item.
 * <pre>
 * PENDING -> LEASED -> COMPLETED
 *                   -> ABANDONED -> (after its retry delay) LEASED ...
 * LEASED  -> PENDING          on lease expiry
 * any failure past maxRetries -> DEAD_LETTERED
 * </pre>
 */
public enum WorkItemState {
  PENDING,
  LEASED,
  COMPLETED,
  ABANDONED,
  DEAD_LETTERED;

  public boolean terminal() {
    return this == COMPLETED || this == DEAD_LETTERED;
  }
}
