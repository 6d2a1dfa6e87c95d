package io.intellixity.frugal.access.registry;

import io.intellixity.frugal.access.handle.ResourceConfig;
import io.intellixity.frugal.access.handle.ResourceHandle;
import io.intellixity.frugal.access.handle.SharedResourceHandle;
import io.intellixity.frugal.access.telemetry.AccessTelemetry;
import io.intellixity.frugal.access.telemetry.NoopAccessTelemetry;
import io.intellixity.frugal.access.util.FrugalFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide owner of long-lived clients, keyed by resource kind.
 * <p>
 * Thread-safe kinds: {@link #acquire(String)} returns the one cached handle, built on first use under a single
 * initialization guard. Other kinds: {@link #checkout(String, Duration)} hands out a pooled client.
 * Handles are never recreated per request and live until {@link #close()}.
 */
public final class SharedClientRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SharedClientRegistry.class);

  private final PoolConfig defaultPool;
  private final AccessTelemetry telemetry;

  private final Map<String, ResourceFactory<?>> factories = new ConcurrentHashMap<>();
  private final Map<String, Definition<?>> definitions = new ConcurrentHashMap<>();
  private final Map<String, ResourceHandle<?>> handles = new ConcurrentHashMap<>();
  private final Map<String, ResourcePool<?>> pools = new ConcurrentHashMap<>();

  /** Held only while a kind's handle or pool is first built. */
  private final Object initGuard = new Object();
  private volatile boolean closed;

  public SharedClientRegistry() {
    this(PoolConfig.DEFAULTS, NoopAccessTelemetry.INSTANCE);
  }

  public SharedClientRegistry(PoolConfig defaultPool, AccessTelemetry telemetry) {
    this.defaultPool = Objects.requireNonNull(defaultPool, "defaultPool");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
  }

  public SharedClientRegistry registerFactory(ResourceFactory<?> factory) {
    Objects.requireNonNull(factory, "factory");
    ResourceFactory<?> prev = factories.putIfAbsent(factory.name(), factory);
    if (prev != null && prev != factory) throw new IllegalStateException("Duplicate ResourceFactory name: " + factory.name());
    return this;
  }

  /** Registers every factory listed in {@code META-INF/frugal.factories}. */
  @SuppressWarnings("rawtypes")
  public SharedClientRegistry discoverFactories() {
    for (ResourceFactory f : FrugalFactoriesLoader.load(ResourceFactory.class)) {
      registerFactory(f);
    }
    return this;
  }

  /** Declares a kind built by the factory named in the config's {@code factory} property. */
  public SharedClientRegistry define(ResourceConfig config) {
    Objects.requireNonNull(config, "config");
    String name = config.string("factory", null);
    if (name == null) throw new IllegalArgumentException("ResourceConfig for '" + config.kind() + "' has no 'factory' property");
    ResourceFactory<?> f = factories.get(name);
    if (f == null) throw new IllegalArgumentException("Unknown ResourceFactory '" + name + "' for kind '" + config.kind() + "'");
    return define(config, f);
  }

  public <T> SharedClientRegistry define(ResourceConfig config, ResourceFactory<T> factory) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(factory, "factory");
    ensureOpen();
    Definition<?> prev = definitions.putIfAbsent(config.kind(), new Definition<>(config, factory));
    if (prev != null) throw new IllegalStateException("Resource kind already defined: " + config.kind());
    return this;
  }

  public boolean isDefined(String kind) { return definitions.containsKey(kind); }

  public boolean isPooled(String kind) { return !definition(kind).factory().threadSafe(); }

  /**
   * Shared handle for a thread-safe kind.
   *
   * @throws IllegalStateException when the kind is pooled; use {@link #checkout(String, Duration)}
   */
  @SuppressWarnings("unchecked")
  public <T> ResourceHandle<T> acquire(String kind) {
    ResourceHandle<?> h = handles.get(kind);
    if (h != null) return (ResourceHandle<T>) h;

    Definition<?> d = definition(kind);
    if (!d.factory().threadSafe()) {
      throw new IllegalStateException("Resource kind '" + kind + "' is not thread-safe; use checkout()");
    }
    synchronized (initGuard) {
      ensureOpen();
      h = handles.get(kind);
      if (h == null) {
        h = construct(d);
        handles.put(kind, h);
      }
    }
    return (ResourceHandle<T>) h;
  }

  public <T> PooledLease<T> checkout(String kind) {
    ResourcePool<T> p = pool(kind);
    return p.checkout(p.poolConfig().checkoutTimeout());
  }

  /**
   * Exclusive client of a pooled kind, waiting at most {@code timeout}.
   *
   * @throws ResourceExhaustedException when no client frees up in time
   * @throws IllegalStateException      when the kind is thread-safe; use {@link #acquire(String)}
   */
  public <T> PooledLease<T> checkout(String kind, Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    ResourcePool<T> p = pool(kind);
    return p.checkout(timeout);
  }

  public PoolStats poolStats(String kind) {
    ResourcePool<?> p = pools.get(kind);
    if (p != null) return p.stats();
    Definition<?> d = definition(kind);
    if (d.factory().threadSafe()) throw new IllegalStateException("Resource kind '" + kind + "' is not pooled");
    return new PoolStats(kind, defaultPool.overriddenBy(d.config()).maxSize(), 0, 0, 0, 0, 0, 0);
  }

  public List<PoolStats> allPoolStats() {
    List<PoolStats> out = new ArrayList<>();
    for (ResourcePool<?> p : pools.values()) out.add(p.stats());
    out.sort(Comparator.comparing(PoolStats::kind));
    return out;
  }

  /** Closes every cached handle and pool exactly once. Further acquire/checkout calls fail. */
  @Override
  public void close() {
    synchronized (initGuard) {
      if (closed) return;
      closed = true;
    }
    for (Map.Entry<String, ResourceHandle<?>> e : handles.entrySet()) {
      closeHandle(definitions.get(e.getKey()), e.getValue());
    }
    handles.clear();
    for (ResourcePool<?> p : pools.values()) p.close();
    log.info("frugal.registry closed kinds={}", definitions.keySet());
  }

  @SuppressWarnings("unchecked")
  private <T> ResourcePool<T> pool(String kind) {
    ResourcePool<?> p = pools.get(kind);
    if (p != null) return (ResourcePool<T>) p;

    Definition<T> d = (Definition<T>) definition(kind);
    if (d.factory().threadSafe()) {
      throw new IllegalStateException("Resource kind '" + kind + "' is thread-safe; use acquire()");
    }
    synchronized (initGuard) {
      ensureOpen();
      p = pools.get(kind);
      if (p == null) {
        p = new ResourcePool<>(d.config(), d.factory(), defaultPool.overriddenBy(d.config()), telemetry);
        pools.put(kind, p);
      }
    }
    return (ResourcePool<T>) p;
  }

  private <T> ResourceHandle<T> construct(Definition<T> d) {
    long t0 = System.nanoTime();
    T client = d.factory().create(d.config());
    if (client == null) {
      throw new IllegalStateException("ResourceFactory '" + d.factory().name() + "' returned null for " + d.config().kind());
    }
    long took = System.nanoTime() - t0;
    telemetry.handleCreated(d.config().kind(), took);
    return new SharedResourceHandle<>(d.config().kind() + "#shared", client, d.config(), Instant.now(), true);
  }

  @SuppressWarnings("unchecked")
  private <T> void closeHandle(Definition<T> d, ResourceHandle<?> h) {
    try {
      d.factory().close((T) h.client());
    } catch (Exception e) {
      log.warn("frugal.registry close failed kind={} id={}", h.kind(), h.id(), e);
    }
  }

  private Definition<?> definition(String kind) {
    Objects.requireNonNull(kind, "kind");
    Definition<?> d = definitions.get(kind);
    if (d == null) throw new IllegalArgumentException("Unknown resource kind: " + kind);
    return d;
  }

  private void ensureOpen() {
    if (closed) throw new IllegalStateException("SharedClientRegistry is closed");
  }

  private record Definition<T>(ResourceConfig config, ResourceFactory<T> factory) {}
}
