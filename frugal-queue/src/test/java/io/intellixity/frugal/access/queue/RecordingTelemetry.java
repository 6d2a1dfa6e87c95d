package io.intellixity.frugal.access.queue;

import io.intellixity.frugal.access.telemetry.AccessTelemetry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

final class RecordingTelemetry implements AccessTelemetry {
  final List<Long> depths = new CopyOnWriteArrayList<>();
  final List<String> deadLettered = new CopyOnWriteArrayList<>();

  @Override public void requestCompleted(String operation, String entityType, long durationNanos, int roundTrips, boolean success) {}
  @Override public void queueDepth(String queue, long depth) { depths.add(depth); }
  @Override public void handleCreated(String kind, long constructionNanos) {}
  @Override public void poolCheckout(String kind, long waitNanos, boolean timedOut) {}
  @Override public void deadLettered(String queue, String workItemId, int retryCount) { deadLettered.add(workItemId + ":" + retryCount); }
}
