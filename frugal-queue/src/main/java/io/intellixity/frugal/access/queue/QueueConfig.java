package io.intellixity.frugal.access.queue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * @param name               queue name, used in logs and telemetry
 * @param maxRetries         failed deliveries tolerated; the next failure dead-letters the item
 * @param leaseTimeout       default visibility timeout for items without their own
 * @param journal            JSON-lines journal file, or {@code null} for a purely in-memory queue
 * @param fsync              force the journal to disk on every append
 * @param completedRetention completed ids kept (without payload) for de-duplication and status lookups;
 *                           older ones are forgotten
 * @param compactThreshold   terminal journal records (completed, dead-lettered, purged) tolerated before
 *                           the journal is rewritten to the current state
 */
public record QueueConfig(String name,
                          int maxRetries,
                          Duration leaseTimeout,
                          Path journal,
                          boolean fsync,
                          int completedRetention,
                          int compactThreshold) {
  public static final int DEFAULT_COMPLETED_RETENTION = 10_000;
  public static final int DEFAULT_COMPACT_THRESHOLD = 1_000;

  public QueueConfig {
    Objects.requireNonNull(name, "name");
    if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
    Objects.requireNonNull(leaseTimeout, "leaseTimeout");
    if (leaseTimeout.isZero() || leaseTimeout.isNegative()) throw new IllegalArgumentException("leaseTimeout must be > 0");
    if (completedRetention < 0) throw new IllegalArgumentException("completedRetention must be >= 0");
    if (compactThreshold <= 0) throw new IllegalArgumentException("compactThreshold must be > 0");
  }

  public static QueueConfig of(String name) {
    return new QueueConfig(name, 3, Duration.ofSeconds(30), null, false,
        DEFAULT_COMPLETED_RETENTION, DEFAULT_COMPACT_THRESHOLD);
  }

  public QueueConfig withMaxRetries(int maxRetries) {
    return new QueueConfig(name, maxRetries, leaseTimeout, journal, fsync, completedRetention, compactThreshold);
  }

  public QueueConfig withLeaseTimeout(Duration leaseTimeout) {
    return new QueueConfig(name, maxRetries, leaseTimeout, journal, fsync, completedRetention, compactThreshold);
  }

  public QueueConfig withJournal(Path journal, boolean fsync) {
    return new QueueConfig(name, maxRetries, leaseTimeout, journal, fsync, completedRetention, compactThreshold);
  }

  public QueueConfig withCompletedRetention(int completedRetention) {
    return new QueueConfig(name, maxRetries, leaseTimeout, journal, fsync, completedRetention, compactThreshold);
  }

  public QueueConfig withCompactThreshold(int compactThreshold) {
    return new QueueConfig(name, maxRetries, leaseTimeout, journal, fsync, completedRetention, compactThreshold);
  }
}
