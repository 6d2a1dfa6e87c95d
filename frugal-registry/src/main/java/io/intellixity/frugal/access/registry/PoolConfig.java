package io.intellixity.frugal.access.registry;

import io.intellixity.frugal.access.handle.ResourceConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounds for a pooled (non thread-safe) resource kind.
 *
 * @param maxSize         most clients alive at once
 * @param checkoutTimeout longest a caller waits for a free client before {@link ResourceExhaustedException}
 */
public record PoolConfig(int maxSize, Duration checkoutTimeout) {
  public static final String MAX_SIZE = "pool.maxSize";
  public static final String CHECKOUT_TIMEOUT = "pool.checkoutTimeout";

  public static final PoolConfig DEFAULTS = new PoolConfig(8, Duration.ofSeconds(5));

  public PoolConfig {
    if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be > 0");
    Objects.requireNonNull(checkoutTimeout, "checkoutTimeout");
    if (checkoutTimeout.isNegative()) throw new IllegalArgumentException("checkoutTimeout must be >= 0");
  }

  /** Per-kind overrides read from {@code pool.*} properties. */
  public PoolConfig overriddenBy(ResourceConfig config) {
    return new PoolConfig(
        config.intValue(MAX_SIZE, maxSize),
        config.duration(CHECKOUT_TIMEOUT, checkoutTimeout));
  }
}
