package io.intellixity.frugal.access.exec;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/** Running deadline of a call started from {@link CallOptions#start()}. */
public final class Deadline {
  private final CallOptions options;
  private final long startedNanos;

  Deadline(CallOptions options, long startedNanos) {
    this.options = options;
    this.startedNanos = startedNanos;
  }

  public CancellationToken cancellation() { return options.cancellation(); }

  public boolean bounded() { return options.timeout() != null; }

  /** Remaining time; {@link Duration#ZERO} once expired, null when unbounded. */
  public Duration remaining() {
    if (!bounded()) return null;
    long left = options.timeout().toNanos() - (System.nanoTime() - startedNanos);
    return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
  }

  /** Whole seconds for JDBC {@code setQueryTimeout}: 0 when unbounded, at least 1 otherwise. */
  public int remainingSecondsForJdbc() {
    Duration r = remaining();
    if (r == null) return 0;
    long s = (r.toMillis() + 999) / 1000;
    return (int) Math.max(1, Math.min(Integer.MAX_VALUE, s));
  }

  /**
   * Checkpoint before each round trip.
   *
   * @throws CancellationException when the caller cancelled
   * @throws CallTimeoutException  when the deadline passed
   */
  public void check() {
    if (options.cancellation().isCancelled()) throw new CancellationException("call cancelled");
    Duration r = remaining();
    if (r != null && r.isZero()) throw new CallTimeoutException("call exceeded timeout " + options.timeout());
  }
}
