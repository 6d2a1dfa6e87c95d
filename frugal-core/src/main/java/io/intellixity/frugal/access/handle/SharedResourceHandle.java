package io.intellixity.frugal.access.handle;

import java.time.Instant;
import java.util.Objects;

public record SharedResourceHandle<TClient>(String id,
                                            TClient client,
                                            ResourceConfig config,
                                            Instant createdAt,
                                            boolean threadSafe) implements ResourceHandle<TClient> {
  public SharedResourceHandle {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(client, "client");
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  @Override public String kind() { return config.kind(); }
  @Override public String endpoint() { return config.endpoint(); }
}
