package io.intellixity.frugal.access.queue;

/** The work item ran out of retries. Terminal; see {@link DeadLetterInspector}. */
public final class DeadLetteredException extends RuntimeException {
  private final WorkItemId id;
  private final int retries;

  public DeadLetteredException(WorkItemId id, int retries, String lastError) {
    super("Work item " + id + " dead-lettered after " + retries + " failed deliveries"
        + (lastError == null ? "" : ": " + lastError));
    this.id = id;
    this.retries = retries;
  }

  public WorkItemId id() { return id; }
  public int retries() { return retries; }
}
