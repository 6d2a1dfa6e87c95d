package io.intellixity.frugal.access.queue;

import java.time.Duration;
import java.util.Objects;

/**
 * @param threads         consumer threads
 * @param pollInterval    how long an idle worker waits for a lease before polling again
 * @param baseBackoff     retry delay after the first failure; doubles per retry
 * @param maxBackoff      cap for the retry delay
 * @param shutdownTimeout how long {@link WorkerPool#close()} lets in-flight handlers finish
 */
public record WorkerPoolConfig(int threads,
                               Duration pollInterval,
                               Duration baseBackoff,
                               Duration maxBackoff,
                               Duration shutdownTimeout) {
  public static final WorkerPoolConfig DEFAULTS = new WorkerPoolConfig(
      4, Duration.ofMillis(500), Duration.ofMillis(200), Duration.ofSeconds(30), Duration.ofSeconds(10));

  public WorkerPoolConfig {
    if (threads <= 0) throw new IllegalArgumentException("threads must be > 0");
    Objects.requireNonNull(pollInterval, "pollInterval");
    Objects.requireNonNull(baseBackoff, "baseBackoff");
    Objects.requireNonNull(maxBackoff, "maxBackoff");
    Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
    if (maxBackoff.compareTo(baseBackoff) < 0) throw new IllegalArgumentException("maxBackoff must be >= baseBackoff");
  }

  public WorkerPoolConfig withThreads(int threads) {
    return new WorkerPoolConfig(threads, pollInterval, baseBackoff, maxBackoff, shutdownTimeout);
  }

  /** {@code baseBackoff * 2^(retries-1)}, capped at {@code maxBackoff}. */
  public Duration backoffFor(int retries) {
    if (retries <= 1) return baseBackoff;
    int shift = Math.min(retries - 1, 30);
    long millis = baseBackoff.toMillis() << shift;
    if (millis < 0 || millis > maxBackoff.toMillis()) return maxBackoff;
    return Duration.ofMillis(millis);
  }
}
