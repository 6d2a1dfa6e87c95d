package io.intellixity.frugal.access.exec;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation flag. Stores register listeners to abort an in-flight round trip.
 */
public final class CancellationToken {
  /** Never cancelled. */
  public static final CancellationToken NONE = new CancellationToken();

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

  public boolean isCancelled() { return cancelled.get(); }

  public void cancel() {
    if (this == NONE) throw new IllegalStateException("NONE cannot be cancelled");
    if (!cancelled.compareAndSet(false, true)) return;
    for (Runnable r : listeners) r.run();
  }

  /** Runs {@code listener} on cancel (immediately if already cancelled). Close the registration when done. */
  public Registration onCancel(Runnable listener) {
    if (this == NONE) return () -> {};
    listeners.add(listener);
    if (cancelled.get()) listener.run();
    return () -> listeners.remove(listener);
  }

  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
