package io.intellixity.frugal.access.registry;

import io.intellixity.frugal.access.handle.ResourceConfig;

/**
 * Builds native clients for one family of external systems (a JDBC pool, a Mongo client, an SMTP session...).
 * <p>
 * Register programmatically with {@link SharedClientRegistry#registerFactory(ResourceFactory)} or list the
 * implementation under this interface's name in {@code META-INF/frugal.factories}.
 */
public interface ResourceFactory<TClient> {
  /** Name referenced by {@link ResourceConfig} property {@code factory}. */
  String name();

  TClient create(ResourceConfig config);

  /**
   * True when one client may serve concurrent callers; such kinds are cached as a single handle.
   * Otherwise clients are pooled and handed out through checkout.
   */
  boolean threadSafe();

  /** Releases a client built by {@link #create}. Defaults to {@link AutoCloseable#close()} when applicable. */
  default void close(TClient client) throws Exception {
    if (client instanceof AutoCloseable c) c.close();
  }
}
