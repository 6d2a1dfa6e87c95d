package io.intellixity.frugal.access.registry;

import io.intellixity.frugal.access.handle.ResourceConfig;
import io.intellixity.frugal.access.handle.ResourceHandle;
import io.intellixity.frugal.access.handle.SharedResourceHandle;
import io.intellixity.frugal.access.telemetry.AccessTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of non thread-safe clients for one kind.
 * <p>
 * A permit is held for every checked-out client; checkout waits at most the given timeout for one.
 * Clients are built lazily, so an unused pool holds nothing.
 */
final class ResourcePool<TClient> {
  private static final Logger log = LoggerFactory.getLogger(ResourcePool.class);

  private final ResourceConfig config;
  private final ResourceFactory<TClient> factory;
  private final PoolConfig poolConfig;
  private final AccessTelemetry telemetry;

  private final Semaphore permits;
  private final ConcurrentLinkedDeque<ResourceHandle<TClient>> idle = new ConcurrentLinkedDeque<>();
  private final AtomicInteger alive = new AtomicInteger();
  private final AtomicLong created = new AtomicLong();
  private final AtomicLong timeouts = new AtomicLong();
  private volatile boolean closed;

  ResourcePool(ResourceConfig config, ResourceFactory<TClient> factory, PoolConfig poolConfig, AccessTelemetry telemetry) {
    this.config = config;
    this.factory = factory;
    this.poolConfig = poolConfig;
    this.telemetry = telemetry;
    this.permits = new Semaphore(poolConfig.maxSize(), true);
  }

  PoolConfig poolConfig() { return poolConfig; }

  PooledLease<TClient> checkout(Duration timeout) {
    if (closed) throw new IllegalStateException("Pool for '" + config.kind() + "' is closed");
    long start = System.nanoTime();
    boolean acquired;
    try {
      acquired = permits.tryAcquire(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ResourceExhaustedException(config.kind(), Duration.ofNanos(System.nanoTime() - start));
    }
    long waited = System.nanoTime() - start;
    if (!acquired) {
      timeouts.incrementAndGet();
      telemetry.poolCheckout(config.kind(), waited, true);
      throw new ResourceExhaustedException(config.kind(), timeout);
    }
    telemetry.poolCheckout(config.kind(), waited, false);

    ResourceHandle<TClient> h = idle.pollFirst();
    if (h != null) return new PooledLease<>(this, h);
    try {
      return new PooledLease<>(this, create());
    } catch (RuntimeException e) {
      permits.release();
      throw e;
    }
  }

  void release(ResourceHandle<TClient> handle, boolean reusable) {
    try {
      if (!reusable || !checkIn(handle)) discard(handle);
    } finally {
      permits.release();
    }
  }

  /** Check-in and the close-time drain share this monitor, so no client is parked after the drain. */
  private synchronized boolean checkIn(ResourceHandle<TClient> handle) {
    if (closed) return false;
    idle.addFirst(handle);
    return true;
  }

  PoolStats stats() {
    int size = alive.get();
    int idleCount = idle.size();
    return new PoolStats(config.kind(), poolConfig.maxSize(), size, idleCount, Math.max(0, size - idleCount),
        permits.getQueueLength(), created.get(), timeouts.get());
  }

  /** Closes idle clients now; in-use clients are closed as they are checked in. */
  void close() {
    List<ResourceHandle<TClient>> drained = new ArrayList<>();
    synchronized (this) {
      closed = true;
      ResourceHandle<TClient> h;
      while ((h = idle.pollFirst()) != null) drained.add(h);
    }
    drained.forEach(this::discard);
  }

  private ResourceHandle<TClient> create() {
    long t0 = System.nanoTime();
    TClient client = factory.create(config);
    if (client == null) throw new IllegalStateException("ResourceFactory '" + factory.name() + "' returned null for " + config.kind());
    long n = created.incrementAndGet();
    alive.incrementAndGet();
    telemetry.handleCreated(config.kind(), System.nanoTime() - t0);
    return new SharedResourceHandle<>(config.kind() + "#" + n, client, config, Instant.now(), false);
  }

  private void discard(ResourceHandle<TClient> h) {
    alive.decrementAndGet();
    try {
      factory.close(h.client());
    } catch (Exception e) {
      log.warn("frugal.pool close failed kind={} id={}", config.kind(), h.id(), e);
    }
  }
}
