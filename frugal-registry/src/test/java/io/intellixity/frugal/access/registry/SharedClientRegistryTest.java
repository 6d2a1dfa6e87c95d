package io.intellixity.frugal.access.registry;

import io.intellixity.frugal.access.handle.ResourceConfig;
import io.intellixity.frugal.access.handle.ResourceHandle;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class SharedClientRegistryTest {

  private static final class CountingFactory implements ResourceFactory<Object> {
    final AtomicInteger created = new AtomicInteger();
    final AtomicInteger closed = new AtomicInteger();
    private final boolean threadSafe;
    private final long buildMillis;

    CountingFactory(boolean threadSafe, long buildMillis) {
      this.threadSafe = threadSafe;
      this.buildMillis = buildMillis;
    }

    @Override public String name() { return "counting"; }
    @Override public boolean threadSafe() { return threadSafe; }

    @Override
    public Object create(ResourceConfig config) {
      created.incrementAndGet();
      if (buildMillis > 0) {
        try {
          Thread.sleep(buildMillis);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
      }
      return new Object();
    }

    @Override
    public void close(Object client) { closed.incrementAndGet(); }
  }

  @Test
  void fiftyConcurrentFirstAcquiresConstructOnce() throws Exception {
    CountingFactory f = new CountingFactory(true, 50);
    SharedClientRegistry r = new SharedClientRegistry().define(ResourceConfig.of("catalog-db", "jdbc:x"), f);

    int n = 50;
    ExecutorService pool = Executors.newFixedThreadPool(n);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<ResourceHandle<Object>>> futures = new ArrayList<>();
      for (int i = 0; i < n; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return r.<Object>acquire("catalog-db");
        }));
      }
      start.countDown();

      Set<ResourceHandle<Object>> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
      for (Future<ResourceHandle<Object>> fu : futures) distinct.add(fu.get(10, TimeUnit.SECONDS));

      assertEquals(1, f.created.get());
      assertEquals(1, distinct.size());
      ResourceHandle<Object> h = distinct.iterator().next();
      assertTrue(h.threadSafe());
      assertEquals("catalog-db", h.kind());
      assertEquals("jdbc:x", h.endpoint());
      assertNotNull(h.createdAt());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void acquireRejectsPooledKindAndCheckoutRejectsSharedKind() {
    SharedClientRegistry r = new SharedClientRegistry()
        .define(ResourceConfig.of("shared", null), new CountingFactory(true, 0))
        .define(ResourceConfig.of("pooled", null), new CountingFactory(false, 0));

    assertThrows(IllegalStateException.class, () -> r.acquire("pooled"));
    assertThrows(IllegalStateException.class, () -> r.checkout("shared", Duration.ofMillis(10)));
    assertThrows(IllegalArgumentException.class, () -> r.acquire("missing"));
  }

  @Test
  void checkoutTimesOutWhenPoolIsDrained() {
    CountingFactory f = new CountingFactory(false, 0);
    SharedClientRegistry r = new SharedClientRegistry(new PoolConfig(1, Duration.ofSeconds(1)),
        io.intellixity.frugal.access.telemetry.NoopAccessTelemetry.INSTANCE)
        .define(ResourceConfig.of("smtp", "smtp://mail"), f);

    PooledLease<Object> held = r.checkout("smtp");
    ResourceExhaustedException ex = assertThrows(ResourceExhaustedException.class,
        () -> r.checkout("smtp", Duration.ofMillis(30)));
    assertEquals("smtp", ex.kind());

    PoolStats stats = r.poolStats("smtp");
    assertEquals(1, stats.size());
    assertEquals(1, stats.inUse());
    assertEquals(0, stats.idle());
    assertEquals(1, stats.timeouts());

    Object client = held.client();
    held.close();
    held.close();
    try (PooledLease<Object> again = r.checkout("smtp", Duration.ofMillis(30))) {
      assertSame(client, again.client());
    }
    assertEquals(1, f.created.get());
    assertThrows(IllegalStateException.class, held::client);
  }

  @Test
  void invalidatedClientIsReplaced() {
    CountingFactory f = new CountingFactory(false, 0);
    SharedClientRegistry r = new SharedClientRegistry().define(ResourceConfig.of("ftp", null), f);

    PooledLease<Object> lease = r.checkout("ftp", Duration.ofMillis(50));
    Object first = lease.client();
    lease.invalidate();
    try (PooledLease<Object> next = r.checkout("ftp", Duration.ofMillis(50))) {
      assertNotSame(first, next.client());
    }
    assertEquals(2, f.created.get());
    assertEquals(1, f.closed.get());
  }

  @Test
  void poolSizeMayBeOverriddenPerKind() {
    CountingFactory f = new CountingFactory(false, 0);
    SharedClientRegistry r = new SharedClientRegistry()
        .define(ResourceConfig.of("ftp", null).with(PoolConfig.MAX_SIZE, 2), f);

    PooledLease<Object> a = r.checkout("ftp", Duration.ofMillis(10));
    PooledLease<Object> b = r.checkout("ftp", Duration.ofMillis(10));
    assertThrows(ResourceExhaustedException.class, () -> r.checkout("ftp", Duration.ofMillis(10)));
    assertEquals(2, r.poolStats("ftp").maxSize());
    a.close();
    b.close();
    assertEquals(2, r.poolStats("ftp").idle());
  }

  @Test
  void closeReleasesEveryClientExactlyOnce() {
    CountingFactory shared = new CountingFactory(true, 0);
    CountingFactory pooled = new CountingFactory(false, 0);
    SharedClientRegistry r = new SharedClientRegistry()
        .define(ResourceConfig.of("shared", null), shared)
        .define(ResourceConfig.of("pooled", null), pooled);

    r.acquire("shared");
    PooledLease<Object> out = r.checkout("pooled", Duration.ofMillis(10));
    r.checkout("pooled", Duration.ofMillis(10)).close();

    r.close();
    r.close();
    assertEquals(1, shared.closed.get());
    assertEquals(1, pooled.closed.get());

    out.close();
    assertEquals(2, pooled.closed.get());
    assertThrows(IllegalStateException.class, () -> r.acquire("shared"));
  }

  @Test
  void checkInRacingCloseStillClosesEveryClient() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      for (int round = 0; round < 100; round++) {
        CountingFactory f = new CountingFactory(false, 0);
        SharedClientRegistry r = new SharedClientRegistry()
            .define(ResourceConfig.of("ftp", null).with(PoolConfig.MAX_SIZE, 8), f);
        List<PooledLease<Object>> out = new ArrayList<>();
        for (int i = 0; i < 8; i++) out.add(r.checkout("ftp", Duration.ofMillis(50)));

        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> returns = new ArrayList<>();
        for (PooledLease<Object> lease : out) {
          returns.add(pool.submit(() -> {
            go.await();
            lease.close();
            return null;
          }));
        }
        go.countDown();
        r.close();
        for (Future<?> ret : returns) ret.get(5, TimeUnit.SECONDS);

        assertEquals(f.created.get(), f.closed.get(), "round " + round);
      }
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void discoveredFactoryIsSelectedByName() {
    SharedClientRegistry r = new SharedClientRegistry()
        .discoverFactories()
        .define(ResourceConfig.of("greeting", "host-a").with("factory", "echo"));

    ResourceHandle<String> h = r.acquire("greeting");
    assertEquals("echo:host-a", h.client());
    assertThrows(IllegalArgumentException.class,
        () -> r.define(ResourceConfig.of("other", null).with("factory", "nope")));
  }
}
