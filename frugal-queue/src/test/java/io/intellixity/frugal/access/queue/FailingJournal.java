package io.intellixity.frugal.access.queue;

import io.intellixity.frugal.access.queue.journal.JournalEntry;
import io.intellixity.frugal.access.queue.journal.WorkJournal;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/** Keeps entries in memory and fails the first {@code times} appends of one op, like a full disk would. */
final class FailingJournal implements WorkJournal {
  private final JournalEntry.Op failOn;
  private final AtomicInteger failuresLeft;
  final List<JournalEntry> written = new CopyOnWriteArrayList<>();

  FailingJournal(JournalEntry.Op failOn, int times) {
    this.failOn = failOn;
    this.failuresLeft = new AtomicInteger(times);
  }

  int failuresLeft() { return Math.max(0, failuresLeft.get()); }

  @Override
  public void append(JournalEntry entry) {
    if (entry.op() == failOn && failuresLeft.getAndDecrement() > 0) {
      throw new UncheckedIOException(new IOException("No space left on device"));
    }
    written.add(entry);
  }

  @Override
  public void replay(Consumer<JournalEntry> sink) {
    written.forEach(sink);
  }
}
