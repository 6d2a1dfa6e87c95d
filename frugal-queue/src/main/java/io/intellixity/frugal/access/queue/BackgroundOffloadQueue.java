package io.intellixity.frugal.access.queue;

import io.intellixity.frugal.access.telemetry.AccessTelemetry;
import io.intellixity.frugal.access.telemetry.NoopAccessTelemetry;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Producer and consumer entry point over a {@link MessageBroker}.
 * <p>
 * Producers call {@link #enqueue(WorkItem)} and return; the call costs one journal append and never runs
 * the work. Consumers iterate {@link #consume()} and settle each lease with {@link #ack} or {@link #abandon}.
 */
public final class BackgroundOffloadQueue implements AutoCloseable {
  private final String name;
  private final MessageBroker broker;
  private final AccessTelemetry telemetry;

  public BackgroundOffloadQueue(String name, MessageBroker broker) {
    this(name, broker, NoopAccessTelemetry.INSTANCE);
  }

  public BackgroundOffloadQueue(String name, MessageBroker broker, AccessTelemetry telemetry) {
    this.name = Objects.requireNonNull(name, "name");
    this.broker = Objects.requireNonNull(broker, "broker");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
  }

  public static BackgroundOffloadQueue inMemory(QueueConfig config, AccessTelemetry telemetry) {
    MessageBroker broker = new InMemoryMessageBroker(config, InMemoryMessageBroker.journalFor(config),
        Clock.systemUTC(), telemetry);
    return new BackgroundOffloadQueue(config.name(), broker, telemetry);
  }

  public String name() { return name; }

  public WorkItemId enqueue(WorkItem item) {
    WorkItemId id = broker.enqueue(item);
    reportDepth();
    return id;
  }

  public WorkItemId enqueue(String type, Map<String, Object> payload) {
    return enqueue(WorkItem.of(type, payload));
  }

  /** Leases one item, waiting up to {@code wait}. */
  public Optional<Lease> lease(Duration wait) {
    return broker.lease(wait);
  }

  /** Items ready now, leased lazily one per {@code next()}; no wait. */
  public Iterable<Lease> consume() {
    return consume(Duration.ZERO);
  }

  /**
   * Lazy sequence of leases. Each pass ends when no item becomes ready within {@code pollWait};
   * iterating again resumes with whatever is pending by then.
   */
  public Iterable<Lease> consume(Duration pollWait) {
    Objects.requireNonNull(pollWait, "pollWait");
    return () -> new LeaseIterator(pollWait);
  }

  public Stream<Lease> stream(Duration pollWait) {
    Iterator<Lease> it = consume(pollWait).iterator();
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(it, Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  public void ack(Lease lease) {
    broker.ack(lease);
    reportDepth();
  }

  public void abandon(Lease lease, String reason, Duration retryDelay) {
    broker.abandon(lease, reason, retryDelay);
    reportDepth();
  }

  public Optional<WorkItemStatus> status(WorkItemId id) {
    return broker.find(id);
  }

  /**
   * Blocks until the item completes or {@code timeout} passes, returning its state at that point.
   *
   * @throws DeadLetteredException if the item ran out of retries
   */
  public WorkItemState await(WorkItemId id, Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (true) {
      WorkItemStatus s = broker.find(id).orElseThrow(() -> new IllegalArgumentException("Unknown work item " + id));
      if (s.state() == WorkItemState.DEAD_LETTERED) throw new DeadLetteredException(id, s.retries(), s.lastError());
      if (s.state() == WorkItemState.COMPLETED || System.nanoTime() >= deadline) return s.state();
      Thread.sleep(10);
    }
  }

  public long depth() {
    return broker.depth();
  }

  public DeadLetterInspector deadLetters() {
    return new DeadLetterInspector(name, broker);
  }

  @Override
  public void close() {
    broker.close();
  }

  private void reportDepth() {
    telemetry.queueDepth(name, broker.depth());
  }

  private final class LeaseIterator implements Iterator<Lease> {
    private final Duration pollWait;
    private Lease next;
    private boolean done;

    LeaseIterator(Duration pollWait) {
      this.pollWait = pollWait;
    }

    @Override
    public boolean hasNext() {
      if (next != null) return true;
      if (done) return false;
      Optional<Lease> l = broker.lease(pollWait);
      if (l.isEmpty()) {
        done = true;
        return false;
      }
      next = l.get();
      return true;
    }

    @Override
    public Lease next() {
      if (!hasNext()) throw new NoSuchElementException();
      Lease l = next;
      next = null;
      return l;
    }
  }
}
