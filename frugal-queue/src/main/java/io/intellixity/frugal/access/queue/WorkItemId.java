package io.intellixity.frugal.access.queue;

import java.util.Objects;
import java.util.UUID;

/** Caller-visible identity of a work item; a replayed enqueue with the same id is not duplicated. */
public record WorkItemId(String value) {
  public WorkItemId {
    Objects.requireNonNull(value, "value");
    if (value.isBlank()) throw new IllegalArgumentException("WorkItemId must not be blank");
  }

  public static WorkItemId of(String value) {
    return new WorkItemId(value);
  }

  public static WorkItemId random() {
    return new WorkItemId(UUID.randomUUID().toString());
  }

  @Override public String toString() { return value; }
}
