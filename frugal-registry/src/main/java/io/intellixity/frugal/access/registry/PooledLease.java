package io.intellixity.frugal.access.registry;

import io.intellixity.frugal.access.handle.ResourceHandle;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive use of one pooled client. {@link #close()} checks it back in; {@link #invalidate()} discards it.
 */
public final class PooledLease<TClient> implements AutoCloseable {
  private final ResourcePool<TClient> pool;
  private final ResourceHandle<TClient> handle;
  private final AtomicBoolean released = new AtomicBoolean();

  PooledLease(ResourcePool<TClient> pool, ResourceHandle<TClient> handle) {
    this.pool = pool;
    this.handle = handle;
  }

  public ResourceHandle<TClient> handle() { return handle; }

  public TClient client() {
    if (released.get()) throw new IllegalStateException("Lease on " + handle.id() + " already released");
    return handle.client();
  }

  /** Drops the client (e.g. after a broken connection) instead of returning it to the pool. */
  public void invalidate() {
    if (released.compareAndSet(false, true)) pool.release(handle, false);
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) pool.release(handle, true);
  }
}
