package io.intellixity.frugal.access.telemetry;

public final class NoopAccessTelemetry implements AccessTelemetry {
  public static final NoopAccessTelemetry INSTANCE = new NoopAccessTelemetry();

  private NoopAccessTelemetry() {}

  @Override public void requestCompleted(String operation, String entityType, long durationNanos, int roundTrips, boolean success) {}
  @Override public void queueDepth(String queue, long depth) {}
  @Override public void handleCreated(String kind, long constructionNanos) {}
  @Override public void poolCheckout(String kind, long waitNanos, boolean timedOut) {}
  @Override public void deadLettered(String queue, String workItemId, int retryCount) {}
}
