package io.intellixity.frugal.access.queue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Operator-facing view of items that exhausted their retries. Nothing here re-drives work. */
public final class DeadLetterInspector {
  private static final Logger log = LoggerFactory.getLogger(DeadLetterInspector.class);

  private final String queue;
  private final MessageBroker broker;

  public DeadLetterInspector(String queue, MessageBroker broker) {
    this.queue = Objects.requireNonNull(queue, "queue");
    this.broker = Objects.requireNonNull(broker, "broker");
  }

  public List<WorkItemStatus> list() {
    return broker.deadLetters();
  }

  public Optional<WorkItemStatus> find(WorkItemId id) {
    return broker.find(id).filter(s -> s.state() == WorkItemState.DEAD_LETTERED);
  }

  public int count() {
    return broker.deadLetters().size();
  }

  public boolean purge(WorkItemId id) {
    return broker.purge(id);
  }

  public int purgeAll() {
    int n = 0;
    for (WorkItemStatus s : broker.deadLetters()) {
      if (broker.purge(s.id())) n++;
    }
    if (n > 0) log.info("frugal.queue purged dead letters queue={} count={}", queue, n);
    return n;
  }
}
