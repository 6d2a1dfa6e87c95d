package io.intellixity.frugal.access.telemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Emits telemetry as {@code key=value} log lines on the {@code frugal.telemetry} logger. */
public final class Slf4jAccessTelemetry implements AccessTelemetry {
  private static final Logger log = LoggerFactory.getLogger("frugal.telemetry");

  @Override
  public void requestCompleted(String operation, String entityType, long durationNanos, int roundTrips, boolean success) {
    log.info("frugal.request op={} type={} roundTrips={} success={} durationMs={}",
        operation, entityType, roundTrips, success, durationNanos / 1_000_000);
  }

  @Override
  public void queueDepth(String queue, long depth) {
    log.debug("frugal.queue queue={} depth={}", queue, depth);
  }

  @Override
  public void handleCreated(String kind, long constructionNanos) {
    log.info("frugal.registry created kind={} durationMs={}", kind, constructionNanos / 1_000_000);
  }

  @Override
  public void poolCheckout(String kind, long waitNanos, boolean timedOut) {
    if (timedOut) {
      log.warn("frugal.pool checkout timed out kind={} waitedMs={}", kind, waitNanos / 1_000_000);
    } else if (log.isDebugEnabled()) {
      log.debug("frugal.pool checkout kind={} waitedMs={}", kind, waitNanos / 1_000_000);
    }
  }

  @Override
  public void deadLettered(String queue, String workItemId, int retryCount) {
    log.warn("frugal.queue dead-lettered queue={} id={} retries={}", queue, workItemId, retryCount);
  }
}
