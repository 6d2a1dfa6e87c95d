package io.intellixity.frugal.access.queue;

import io.intellixity.frugal.access.queue.journal.FileWorkJournal;
import io.intellixity.frugal.access.queue.journal.JournalEntry;
import io.intellixity.frugal.access.queue.journal.JournalEntry.Op;
import io.intellixity.frugal.access.queue.journal.WorkJournal;
import io.intellixity.frugal.access.telemetry.AccessTelemetry;
import io.intellixity.frugal.access.telemetry.NoopAccessTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-process broker. Every state change is written to the {@link WorkJournal} before the call returns,
 * and the journal is replayed on construction, so acknowledged enqueues survive a restart.
 * Items that were leased when the process died count as expired leases on replay.
 * <p>
 * Lease expiry is evaluated lazily against the injected {@link Clock} on every broker call.
 * <p>
 * A transition is journaled before the in-memory entry changes; if the append fails the entry is left
 * as it was and the caller sees the exception. Completed items keep only their id and counters, up to
 * {@link QueueConfig#completedRetention()} of them, and the journal is rewritten to the live state once
 * {@link QueueConfig#compactThreshold()} terminal records have piled up.
 */
public final class InMemoryMessageBroker implements MessageBroker {
  private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBroker.class);
  private static final long MAX_WAIT_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(50);

  private final QueueConfig config;
  private final WorkJournal journal;
  private final Clock clock;
  private final AccessTelemetry telemetry;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition changed = lock.newCondition();
  private final Map<WorkItemId, Entry> entries = new HashMap<>();
  /** Non-terminal ids in enqueue order. */
  private final LinkedHashSet<WorkItemId> live = new LinkedHashSet<>();
  /** Completed ids, oldest first. */
  private final ArrayDeque<WorkItemId> completed = new ArrayDeque<>();
  private int terminalRecords;
  private boolean closed;

  public InMemoryMessageBroker(QueueConfig config) {
    this(config, journalFor(config), Clock.systemUTC(), NoopAccessTelemetry.INSTANCE);
  }

  public InMemoryMessageBroker(QueueConfig config, WorkJournal journal, Clock clock, AccessTelemetry telemetry) {
    this.config = Objects.requireNonNull(config, "config");
    this.journal = Objects.requireNonNull(journal, "journal");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    recover();
  }

  public static WorkJournal journalFor(QueueConfig config) {
    return config.journal() == null ? WorkJournal.none() : new FileWorkJournal(config.journal(), config.fsync());
  }

  public QueueConfig config() { return config; }

  @Override
  public WorkItemId enqueue(WorkItem item) {
    Objects.requireNonNull(item, "item");
    lock.lock();
    try {
      ensureOpen();
      if (entries.containsKey(item.id())) {
        log.debug("frugal.queue duplicate enqueue ignored queue={} id={}", config.name(), item.id());
        return item.id();
      }
      Instant now = clock.instant();
      WorkItem stamped = item.enqueued(now).withRetries(0);
      Long leaseMs = (stamped.leaseTimeout() == null) ? null : stamped.leaseTimeout().toMillis();
      journal.append(JournalEntry.enqueued(stamped.id().value(), now, stamped.type(), stamped.payload(), leaseMs));
      entries.put(stamped.id(), new Entry(stamped));
      live.add(stamped.id());
      changed.signalAll();
      log.debug("frugal.queue enqueued queue={} id={} type={}", config.name(), stamped.id(), stamped.type());
      return stamped.id();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<Lease> lease(Duration wait) {
    long remaining = Math.max(0L, wait.toNanos());
    lock.lock();
    try {
      while (true) {
        ensureOpen();
        Instant now = clock.instant();
        expireLeases(now);
        Entry ready = firstReady(now);
        if (ready != null) return Optional.of(grant(ready, now));
        if (remaining <= 0) return Optional.empty();
        long slice = Math.min(remaining, MAX_WAIT_SLICE_NANOS);
        long left = changed.awaitNanos(slice);
        remaining -= (slice - Math.max(0L, left));
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void ack(Lease lease) {
    lock.lock();
    try {
      Entry e = current(lease);
      Instant now = clock.instant();
      journal.append(JournalEntry.transition(Op.COMPLETED, e.item.id().value(), now, null, null, null));
      e.state = WorkItemState.COMPLETED;
      e.clearLease();
      live.remove(e.item.id());
      retireCompleted(e);
      log.debug("frugal.queue completed queue={} id={}", config.name(), e.item.id());
      terminalRecorded();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void abandon(Lease lease, String reason, Duration retryDelay) {
    lock.lock();
    try {
      Entry e = current(lease);
      Instant now = clock.instant();
      int retries = e.item.retries() + 1;
      if (retries > config.maxRetries()) {
        deadLetter(e, retries, reason, now);
        return;
      }
      Instant notBefore = (retryDelay == null || retryDelay.isNegative()) ? now : now.plus(retryDelay);
      journal.append(JournalEntry.transition(Op.ABANDONED, e.item.id().value(), now, retries, notBefore, reason));
      e.clearLease();
      e.item = e.item.withRetries(retries);
      e.lastError = reason;
      e.notBefore = notBefore;
      e.state = WorkItemState.ABANDONED;
      changed.signalAll();
      log.debug("frugal.queue abandoned queue={} id={} retries={} notBefore={}",
          config.name(), e.item.id(), e.item.retries(), e.notBefore);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<WorkItemStatus> find(WorkItemId id) {
    lock.lock();
    try {
      expireLeases(clock.instant());
      Entry e = entries.get(id);
      return (e == null) ? Optional.empty() : Optional.of(e.status());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long depth() {
    lock.lock();
    try {
      return live.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<WorkItemStatus> deadLetters() {
    lock.lock();
    try {
      expireLeases(clock.instant());
      List<WorkItemStatus> out = new ArrayList<>();
      for (Entry e : entries.values()) {
        if (e.state == WorkItemState.DEAD_LETTERED) out.add(e.status());
      }
      out.sort(Comparator.comparing((WorkItemStatus s) -> s.item().enqueuedAt()));
      return out;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean purge(WorkItemId id) {
    lock.lock();
    try {
      Entry e = entries.get(id);
      if (e == null || e.state != WorkItemState.DEAD_LETTERED) return false;
      journal.append(JournalEntry.transition(Op.PURGED, id.value(), clock.instant(), null, null, null));
      entries.remove(id);
      log.info("frugal.queue purged dead letter queue={} id={}", config.name(), id);
      terminalRecorded();
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() {
    lock.lock();
    try {
      if (closed) return;
      closed = true;
      changed.signalAll();
    } finally {
      lock.unlock();
    }
    try {
      journal.close();
    } catch (Exception e) {
      throw new IllegalStateException("Failed to close journal for queue " + config.name(), e);
    }
  }

  // ---- internals (lock held) ----

  private Lease grant(Entry e, Instant now) {
    Duration timeout = (e.item.leaseTimeout() != null) ? e.item.leaseTimeout() : config.leaseTimeout();
    journal.append(JournalEntry.transition(Op.LEASED, e.item.id().value(), now, e.item.retries(), null, null));
    e.state = WorkItemState.LEASED;
    e.notBefore = null;
    e.leaseToken = UUID.randomUUID().toString();
    e.leaseExpiresAt = now.plus(timeout);
    log.debug("frugal.queue leased queue={} id={} retries={} expiresAt={}",
        config.name(), e.item.id(), e.item.retries(), e.leaseExpiresAt);
    return new Lease(e.item, e.leaseToken, e.leaseExpiresAt);
  }

  private Entry firstReady(Instant now) {
    for (WorkItemId id : live) {
      Entry e = entries.get(id);
      if (e.state == WorkItemState.PENDING) return e;
      if (e.state == WorkItemState.ABANDONED && (e.notBefore == null || !now.isBefore(e.notBefore))) return e;
    }
    return null;
  }

  private void expireLeases(Instant now) {
    List<Entry> expired = null;
    for (WorkItemId id : live) {
      Entry e = entries.get(id);
      if (e.state == WorkItemState.LEASED && !now.isBefore(e.leaseExpiresAt)) {
        if (expired == null) expired = new ArrayList<>();
        expired.add(e);
      }
    }
    if (expired == null) return;
    for (Entry e : expired) expire(e, now);
  }

  private void expire(Entry e, Instant now) {
    int retries = e.item.retries() + 1;
    String reason = "lease expired";
    if (retries > config.maxRetries()) {
      deadLetter(e, retries, reason, now);
      return;
    }
    journal.append(JournalEntry.transition(Op.EXPIRED, e.item.id().value(), now, retries, null, reason));
    e.clearLease();
    e.item = e.item.withRetries(retries);
    e.lastError = reason;
    e.state = WorkItemState.PENDING;
    changed.signalAll();
    log.info("frugal.queue lease expired queue={} id={} retries={}", config.name(), e.item.id(), retries);
  }

  private void deadLetter(Entry e, int retries, String reason, Instant now) {
    journal.append(JournalEntry.transition(Op.DEAD_LETTERED, e.item.id().value(), now, retries, null, reason));
    e.clearLease();
    e.item = e.item.withRetries(retries);
    e.lastError = reason;
    e.state = WorkItemState.DEAD_LETTERED;
    e.notBefore = null;
    live.remove(e.item.id());
    telemetry.deadLettered(config.name(), e.item.id().value(), retries);
    terminalRecorded();
  }

  /** Drops the payload and forgets the oldest completed ids past the retention limit. */
  private void retireCompleted(Entry e) {
    e.item = e.item.withoutPayload();
    completed.addLast(e.item.id());
    while (completed.size() > config.completedRetention()) {
      entries.remove(completed.pollFirst());
    }
  }

  private void terminalRecorded() {
    if (++terminalRecords >= config.compactThreshold()) compact();
  }

  /** Rewrites the journal to one enqueue record plus one state record per known item. */
  private void compact() {
    Instant now = clock.instant();
    List<JournalEntry> snapshot = new ArrayList<>();
    for (WorkItemId id : completed) snapshot(entries.get(id), now, snapshot);
    List<Entry> dead = new ArrayList<>();
    for (Entry e : entries.values()) {
      if (e.state == WorkItemState.DEAD_LETTERED) dead.add(e);
    }
    dead.sort(Comparator.comparing((Entry e) -> e.item.enqueuedAt()));
    for (Entry e : dead) snapshot(e, now, snapshot);
    for (WorkItemId id : live) snapshot(entries.get(id), now, snapshot);
    try {
      journal.rewrite(snapshot);
      terminalRecords = 0;
    } catch (UncheckedIOException ex) {
      // the append-only history is still intact; try again after the next terminal record
      log.warn("frugal.queue journal compaction failed queue={} terminalRecords={}", config.name(), terminalRecords, ex);
    }
  }

  private static void snapshot(Entry e, Instant now, List<JournalEntry> out) {
    WorkItem item = e.item;
    String id = item.id().value();
    Long leaseMs = (item.leaseTimeout() == null) ? null : item.leaseTimeout().toMillis();
    out.add(JournalEntry.enqueued(id, item.enqueuedAt(), item.type(), item.payload(), leaseMs));
    int retries = item.retries();
    switch (e.state) {
      case PENDING -> {
        if (retries > 0 || e.lastError != null) out.add(JournalEntry.transition(Op.EXPIRED, id, now, retries, null, e.lastError));
      }
      case LEASED -> {
        if (e.lastError != null) out.add(JournalEntry.transition(Op.EXPIRED, id, now, retries, null, e.lastError));
        out.add(JournalEntry.transition(Op.LEASED, id, now, retries, null, null));
      }
      case ABANDONED -> out.add(JournalEntry.transition(Op.ABANDONED, id, now, retries, e.notBefore, e.lastError));
      case COMPLETED -> out.add(JournalEntry.transition(Op.COMPLETED, id, now, retries, null, null));
      case DEAD_LETTERED -> out.add(JournalEntry.transition(Op.DEAD_LETTERED, id, now, retries, null, e.lastError));
      default -> throw new IllegalStateException("Unexpected state " + e.state);
    }
  }

  /** Resolves the entry a lease still owns, or fails with {@link LeaseExpiredException}. */
  private Entry current(Lease lease) {
    Objects.requireNonNull(lease, "lease");
    ensureOpen();
    expireLeases(clock.instant());
    Entry e = entries.get(lease.id());
    if (e == null || e.state != WorkItemState.LEASED || !lease.token().equals(e.leaseToken)) {
      throw new LeaseExpiredException(lease.id());
    }
    return e;
  }

  private void ensureOpen() {
    if (closed) throw new IllegalStateException("Queue '" + config.name() + "' is closed");
  }

  private void recover() {
    int[] records = {0};
    journal.replay(r -> {
      records[0]++;
      if (r.op() == Op.COMPLETED || r.op() == Op.DEAD_LETTERED || r.op() == Op.PURGED) terminalRecords++;
      apply(r);
    });
    if (records[0] == 0) return;

    Instant now = clock.instant();
    int inFlight = 0;
    for (WorkItemId id : new ArrayList<>(live)) {
      Entry e = entries.get(id);
      if (e.state == WorkItemState.LEASED) {
        inFlight++;
        expire(e, now);
      }
    }
    log.info("frugal.queue recovered queue={} records={} live={} interruptedLeases={}",
        config.name(), records[0], live.size(), inFlight);
    if (terminalRecords >= config.compactThreshold()) compact();
  }

  private void apply(JournalEntry r) {
    WorkItemId id = WorkItemId.of(r.id());
    if (r.op() == Op.ENQUEUED) {
      if (entries.containsKey(id)) return;
      Duration lt = (r.leaseTimeoutMs() == null) ? null : Duration.ofMillis(r.leaseTimeoutMs());
      entries.put(id, new Entry(new WorkItem(id, r.type(), r.payload(), r.at(), 0, lt)));
      live.add(id);
      return;
    }
    Entry e = entries.get(id);
    if (e == null) {
      log.warn("frugal.queue journal record for unknown item queue={} op={} id={}", config.name(), r.op(), id);
      return;
    }
    if (r.retries() != null) e.item = e.item.withRetries(r.retries());
    switch (r.op()) {
      case LEASED -> e.state = WorkItemState.LEASED;
      case COMPLETED -> {
        e.state = WorkItemState.COMPLETED;
        live.remove(id);
        retireCompleted(e);
      }
      case ABANDONED -> {
        e.state = WorkItemState.ABANDONED;
        e.notBefore = r.notBefore();
        e.lastError = r.reason();
      }
      case EXPIRED -> {
        e.state = WorkItemState.PENDING;
        e.lastError = r.reason();
      }
      case DEAD_LETTERED -> {
        e.state = WorkItemState.DEAD_LETTERED;
        e.lastError = r.reason();
        live.remove(id);
      }
      case PURGED -> {
        entries.remove(id);
        live.remove(id);
      }
      default -> throw new IllegalStateException("Unexpected journal op " + r.op());
    }
  }

  private static final class Entry {
    WorkItem item;
    WorkItemState state = WorkItemState.PENDING;
    Instant notBefore;
    String leaseToken;
    Instant leaseExpiresAt;
    String lastError;

    Entry(WorkItem item) {
      this.item = item;
    }

    void clearLease() {
      leaseToken = null;
      leaseExpiresAt = null;
    }

    WorkItemStatus status() {
      return new WorkItemStatus(item, state, lastError);
    }
  }
}
