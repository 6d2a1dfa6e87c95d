package io.intellixity.frugal.access.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Per-call timeout and cancellation. A null timeout means no deadline.
 */
public record CallOptions(Duration timeout, CancellationToken cancellation) {
  public static final CallOptions NONE = new CallOptions(null, CancellationToken.NONE);

  public CallOptions {
    if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
      throw new IllegalArgumentException("timeout must be > 0");
    }
    cancellation = (cancellation == null) ? CancellationToken.NONE : cancellation;
  }

  public static CallOptions timeout(Duration timeout) {
    return new CallOptions(Objects.requireNonNull(timeout, "timeout"), CancellationToken.NONE);
  }

  public CallOptions withCancellation(CancellationToken token) {
    return new CallOptions(timeout, token);
  }

  /** Starts the clock for one logical call (which may span several round trips). */
  public Deadline start() {
    return new Deadline(this, System.nanoTime());
  }
}
