package io.intellixity.frugal.access.queue.journal;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * One line of the work journal. Only the fields relevant to {@code op} are set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JournalEntry(Op op,
                           String id,
                           Instant at,
                           String type,
                           Map<String, Object> payload,
                           Long leaseTimeoutMs,
                           Integer retries,
                           Instant notBefore,
                           String reason) {

  public enum Op { ENQUEUED, LEASED, COMPLETED, ABANDONED, EXPIRED, DEAD_LETTERED, PURGED }

  public static JournalEntry enqueued(String id, Instant at, String type, Map<String, Object> payload, Long leaseTimeoutMs) {
    return new JournalEntry(Op.ENQUEUED, id, at, type, payload, leaseTimeoutMs, null, null, null);
  }

  public static JournalEntry transition(Op op, String id, Instant at, Integer retries, Instant notBefore, String reason) {
    return new JournalEntry(op, id, at, null, null, null, retries, notBefore, reason);
  }
}
