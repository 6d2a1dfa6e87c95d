package io.intellixity.frugal.access.queue;

/**
 * Processes one work type. Delivery is at-least-once, so handlers must tolerate seeing the same
 * {@link WorkItemId} twice. Throwing abandons the delivery for a later retry.
 */
@FunctionalInterface
public interface WorkHandler {
  void handle(WorkItem item) throws Exception;
}
