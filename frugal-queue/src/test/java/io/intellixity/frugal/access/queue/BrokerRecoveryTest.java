package io.intellixity.frugal.access.queue;

import io.intellixity.frugal.access.queue.journal.FileWorkJournal;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BrokerRecoveryTest {
  @TempDir Path dir;

  private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
  private final RecordingTelemetry telemetry = new RecordingTelemetry();

  private InMemoryMessageBroker open(Path journal) {
    QueueConfig cfg = QueueConfig.of("reports").withMaxRetries(2).withJournal(journal, false);
    return new InMemoryMessageBroker(cfg, new FileWorkJournal(journal, false), clock, telemetry);
  }

  @Test
  void acknowledgedEnqueuesSurviveRestart() {
    Path journal = dir.resolve("reports.jsonl");
    InMemoryMessageBroker before = open(journal);
    WorkItemId a = before.enqueue(WorkItem.of("render", Map.of("reportId", 1)));
    WorkItemId b = before.enqueue(WorkItem.of("render", Map.of("reportId", 2)));
    WorkItemId c = before.enqueue(WorkItem.of("render", Map.of("reportId", 3)));
    before.ack(before.lease(Duration.ZERO).orElseThrow());
    before.lease(Duration.ZERO).orElseThrow(); // b is in flight when the process dies
    before.close();

    InMemoryMessageBroker after = open(journal);

    assertEquals(WorkItemState.COMPLETED, after.find(a).orElseThrow().state());
    WorkItemStatus bs = after.find(b).orElseThrow();
    assertEquals(WorkItemState.PENDING, bs.state());
    assertEquals(1, bs.retries());
    assertEquals(2, after.depth());

    Lease next = after.lease(Duration.ZERO).orElseThrow();
    assertEquals(b, next.id());
    assertEquals(2, next.item().payload().get("reportId"));
    assertEquals(c, after.lease(Duration.ZERO).orElseThrow().id());

    after.enqueue(WorkItem.of("render", Map.of()).withId(a));
    assertEquals(WorkItemState.COMPLETED, after.find(a).orElseThrow().state(), "completed id stays deduplicated");
    after.close();
  }

  @Test
  void deadLettersAndRetryDelaysSurviveRestart() {
    Path journal = dir.resolve("reports.jsonl");
    InMemoryMessageBroker before = open(journal);
    WorkItemId dead = before.enqueue(WorkItem.of("render", Map.of()));
    WorkItemId delayed = before.enqueue(WorkItem.of("render", Map.of()));
    for (int i = 0; i < 3; i++) before.abandon(before.lease(Duration.ZERO).orElseThrow(), "boom", Duration.ZERO);
    before.abandon(before.lease(Duration.ZERO).orElseThrow(), "slow down", Duration.ofMinutes(1));
    before.close();

    InMemoryMessageBroker after = open(journal);

    assertEquals(WorkItemState.DEAD_LETTERED, after.find(dead).orElseThrow().state());
    assertEquals(1, after.deadLetters().size());
    WorkItemStatus d = after.find(delayed).orElseThrow();
    assertEquals(WorkItemState.ABANDONED, d.state());
    assertEquals("slow down", d.lastError());
    assertTrue(after.lease(Duration.ZERO).isEmpty());
    clock.advance(Duration.ofMinutes(1));
    assertEquals(delayed, after.lease(Duration.ZERO).orElseThrow().id());
    after.close();
  }

  @Test
  void tornLastLineIsDroppedAndJournalStaysUsable() throws IOException {
    Path journal = dir.resolve("reports.jsonl");
    InMemoryMessageBroker first = open(journal);
    WorkItemId a = first.enqueue(WorkItem.of("render", Map.of()));
    first.close();
    Files.writeString(journal, "{\"op\":\"ENQUEUED\",\"id\":\"tor", StandardCharsets.UTF_8, StandardOpenOption.APPEND);

    InMemoryMessageBroker second = open(journal);
    assertEquals(1, second.depth());
    WorkItemId b = second.enqueue(WorkItem.of("render", Map.of()));
    second.close();

    InMemoryMessageBroker third = open(journal);
    assertTrue(third.find(a).isPresent());
    assertTrue(third.find(b).isPresent());
    assertEquals(2, third.depth());
    third.close();
  }

  @Test
  void journalIsCompactedOnceTerminalRecordsPileUp() throws IOException {
    Path journal = dir.resolve("reports.jsonl");
    QueueConfig cfg = QueueConfig.of("reports").withMaxRetries(3).withJournal(journal, false).withCompactThreshold(5);
    InMemoryMessageBroker before = new InMemoryMessageBroker(cfg, new FileWorkJournal(journal, false), clock, telemetry);

    WorkItemId retried = before.enqueue(WorkItem.of("render", Map.of("reportId", "r")));
    before.abandon(before.lease(Duration.ZERO).orElseThrow(), "flaky", Duration.ofMinutes(1));
    List<WorkItemId> done = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      done.add(before.enqueue(WorkItem.of("render", Map.of("reportId", i))));
      before.ack(before.lease(Duration.ZERO).orElseThrow());
    }
    before.close();

    // one enqueue record and one state record per item
    assertEquals(12, Files.readAllLines(journal, StandardCharsets.UTF_8).size());
    assertFalse(Files.exists(dir.resolve("reports.jsonl.compact")));

    InMemoryMessageBroker after = new InMemoryMessageBroker(cfg, new FileWorkJournal(journal, false), clock, telemetry);
    for (WorkItemId id : done) assertEquals(WorkItemState.COMPLETED, after.find(id).orElseThrow().state());
    WorkItemStatus r = after.find(retried).orElseThrow();
    assertEquals(WorkItemState.ABANDONED, r.state());
    assertEquals(1, r.retries());
    assertEquals("flaky", r.lastError());
    assertEquals(1, after.depth());

    assertTrue(after.lease(Duration.ZERO).isEmpty(), "retry delay survives compaction");
    clock.advance(Duration.ofMinutes(1));
    Lease next = after.lease(Duration.ZERO).orElseThrow();
    assertEquals(retried, next.id());
    assertEquals("r", next.item().payload().get("reportId"));

    after.enqueue(WorkItem.of("render", Map.of()).withId(done.get(0)));
    assertEquals(1, after.depth(), "completed ids stay deduplicated after compaction");
    after.close();
  }
}
