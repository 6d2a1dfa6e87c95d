package io.intellixity.frugal.examples.jobs;

import io.intellixity.frugal.access.queue.WorkItemId;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Finished report rows keyed by job id. Re-running a job overwrites its own entry only. */
@Component
public class ReportStore {
  private final Map<WorkItemId, List<Map<String, Object>>> reports = new ConcurrentHashMap<>();

  public void put(WorkItemId id, List<Map<String, Object>> rows) {
    reports.put(id, List.copyOf(rows));
  }

  public Optional<List<Map<String, Object>>> get(WorkItemId id) {
    return Optional.ofNullable(reports.get(id));
  }
}
