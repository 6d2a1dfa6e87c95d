package io.intellixity.frugal.access.handle;

import java.time.Instant;

/**
 * Long-lived handle to an external system, owned by the shared client registry.
 * <p>
 * Examples:
 * - JDBC: client() is a pooled {@code javax.sql.DataSource}
 * - Mongo: client() is a {@code MongoClient}
 */
public interface ResourceHandle<TClient> {
  /** Unique identifier for this handle (useful for logging). */
  String id();

  String kind();

  /** Native client used by a store. */
  TClient client();

  String endpoint();

  ResourceConfig config();

  Instant createdAt();

  /** True if {@link #client()} may be shared across threads without external locking. */
  boolean threadSafe();
}
