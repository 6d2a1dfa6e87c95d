package io.intellixity.frugal.access.registry;

import java.time.Duration;

/** Pool checkout did not get a client within its timeout. Surfaced to the caller, never retried here. */
public final class ResourceExhaustedException extends RuntimeException {
  private final String kind;
  private final Duration waited;

  public ResourceExhaustedException(String kind, Duration waited) {
    super("No '" + kind + "' client available within " + waited.toMillis() + "ms");
    this.kind = kind;
    this.waited = waited;
  }

  public String kind() { return kind; }
  public Duration waited() { return waited; }
}
