package io.intellixity.frugal.access.telemetry;

/**
 * Structured events emitted by the registry, planner, executor and queue.
 * Dashboards and exporters live outside this library.
 */
public interface AccessTelemetry {
  /** One facade-level request (fetch / project / aggregate / offload). */
  void requestCompleted(String operation, String entityType, long durationNanos, int roundTrips, boolean success);

  void queueDepth(String queue, long depth);

  void handleCreated(String kind, long constructionNanos);

  void poolCheckout(String kind, long waitNanos, boolean timedOut);

  void deadLettered(String queue, String workItemId, int retryCount);
}
