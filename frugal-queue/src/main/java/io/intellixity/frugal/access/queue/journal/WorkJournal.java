package io.intellixity.frugal.access.queue.journal;

import java.util.List;
import java.util.function.Consumer;

/** Append-only record of broker state changes, replayed on start-up. */
public interface WorkJournal extends AutoCloseable {

  /** Returns once the entry is written. */
  void append(JournalEntry entry);

  /** Feeds every stored entry, oldest first. */
  void replay(Consumer<JournalEntry> sink);

  /**
   * Replaces the stored history with {@code snapshot}, which must replay to the same broker state.
   * Journals that keep nothing ignore it.
   */
  default void rewrite(List<JournalEntry> snapshot) {}

  @Override default void close() {}

  static WorkJournal none() {
    return None.INSTANCE;
  }

  final class None implements WorkJournal {
    private static final None INSTANCE = new None();

    private None() {}

    @Override public void append(JournalEntry entry) {}
    @Override public void replay(Consumer<JournalEntry> sink) {}
  }
}
