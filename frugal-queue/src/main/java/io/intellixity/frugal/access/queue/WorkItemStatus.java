package io.intellixity.frugal.access.queue;

/** Point-in-time view of a work item held by a broker. */
public record WorkItemStatus(WorkItem item, WorkItemState state, String lastError) {
  public WorkItemId id() { return item.id(); }
  public int retries() { return item.retries(); }
}
