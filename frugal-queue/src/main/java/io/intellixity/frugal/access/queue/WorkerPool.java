package io.intellixity.frugal.access.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed set of consumer threads draining a {@link BackgroundOffloadQueue}, separate from request threads.
 * <p>
 * A handler failure abandons the lease with an exponential retry delay; the broker dead-letters the item
 * once its retries are spent. This is the only layer that retries.
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

  private final BackgroundOffloadQueue queue;
  private final WorkerPoolConfig config;
  private final Map<String, WorkHandler> handlers = new ConcurrentHashMap<>();
  private final AtomicBoolean running = new AtomicBoolean();
  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();
  private ExecutorService workers;

  public WorkerPool(BackgroundOffloadQueue queue, WorkerPoolConfig config) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.config = Objects.requireNonNull(config, "config");
  }

  public WorkerPool register(String type, WorkHandler handler) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(handler, "handler");
    if (handlers.putIfAbsent(type, handler) != null) throw new IllegalStateException("Handler already registered for type: " + type);
    return this;
  }

  public synchronized WorkerPool start() {
    if (!running.compareAndSet(false, true)) throw new IllegalStateException("WorkerPool already started");
    AtomicInteger seq = new AtomicInteger();
    workers = Executors.newFixedThreadPool(config.threads(), r -> {
      Thread t = new Thread(r, "frugal-worker-" + queue.name() + "-" + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    });
    for (int i = 0; i < config.threads(); i++) workers.submit(this::workLoop);
    log.info("frugal.worker started queue={} threads={} types={}", queue.name(), config.threads(), handlers.keySet());
    return this;
  }

  public boolean running() { return running.get(); }
  public long completedCount() { return completed.get(); }
  public long failedCount() { return failed.get(); }

  /** Stops leasing, lets in-flight handlers finish within the shutdown timeout, then interrupts. */
  @Override
  public synchronized void close() {
    if (!running.compareAndSet(true, false)) return;
    workers.shutdown();
    try {
      if (!workers.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn("frugal.worker shutdown timed out queue={}; interrupting handlers", queue.name());
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.info("frugal.worker stopped queue={} completed={} failed={}", queue.name(), completed.get(), failed.get());
  }

  private void workLoop() {
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      Optional<Lease> lease;
      try {
        lease = queue.lease(config.pollInterval());
      } catch (IllegalStateException closed) {
        log.debug("frugal.worker queue closed queue={}", queue.name());
        return;
      } catch (RuntimeException e) {
        // broker failure (journal I/O); the item stays pending, so keep polling
        log.warn("frugal.worker lease failed queue={}; retrying in {}ms", queue.name(), config.pollInterval().toMillis(), e);
        if (!pause()) return;
        continue;
      }
      lease.ifPresent(this::process);
    }
  }

  private boolean pause() {
    try {
      Thread.sleep(config.pollInterval().toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private void process(Lease lease) {
    WorkItem item = lease.item();
    WorkHandler handler = handlers.get(item.type());
    long start = System.nanoTime();
    try {
      if (handler == null) throw new IllegalStateException("No handler registered for work type '" + item.type() + "'");
      handler.handle(item);
    } catch (Exception e) {
      failed.incrementAndGet();
      Duration delay = config.backoffFor(item.retries() + 1);
      log.warn("frugal.worker handler failed queue={} id={} type={} retries={} retryInMs={}: {}",
          queue.name(), item.id(), item.type(), item.retries(), delay.toMillis(), e.toString());
      settle(() -> queue.abandon(lease, e.toString(), delay), lease);
      return;
    }
    if (!settle(() -> queue.ack(lease), lease)) return;
    completed.incrementAndGet();
    if (log.isDebugEnabled()) {
      log.debug("frugal.worker done queue={} id={} type={} durationMs={}",
          queue.name(), item.id(), item.type(), (System.nanoTime() - start) / 1_000_000);
    }
  }

  private boolean settle(Runnable action, Lease lease) {
    try {
      action.run();
      return true;
    } catch (LeaseExpiredException e) {
      // already requeued by the broker; the redelivery will run the handler again
      log.info("frugal.worker lease expired before settle queue={} id={}", queue.name(), lease.id());
      return false;
    } catch (RuntimeException e) {
      // the lease is still held and will expire, which redelivers the item
      log.warn("frugal.worker settle failed queue={} id={} leaseExpiresAt={}", queue.name(), lease.id(), lease.expiresAt(), e);
      return false;
    }
  }
}
