package io.intellixity.frugal.examples.service;

import io.intellixity.frugal.access.facade.ResourceAccessFacade;
import io.intellixity.frugal.access.queue.WorkItem;
import io.intellixity.frugal.access.queue.WorkItemId;
import io.intellixity.frugal.access.queue.WorkItemStatus;
import io.intellixity.frugal.examples.jobs.ReportStore;
import io.intellixity.frugal.examples.jobs.SalesReportHandler;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class ReportJobService {
  private final ResourceAccessFacade facade;
  private final ReportStore reports;

  public ReportJobService(ResourceAccessFacade facade, ReportStore reports) {
    this.facade = facade;
    this.reports = reports;
  }

  /**
   * Queues a sales report and returns at once. A client retrying with the same {@code requestId}
   * gets the same job back.
   */
  public WorkItemId submit(LocalDate from, LocalDate to, String requestId) {
    WorkItem item = WorkItem.of(SalesReportHandler.TYPE, Map.of("from", from.toString(), "to", to.toString()));
    if (requestId != null && !requestId.isBlank()) item = item.withId(WorkItemId.of(requestId));
    return facade.offload(item);
  }

  public Optional<WorkItemStatus> status(WorkItemId id) {
    return facade.workStatus(id);
  }

  public Optional<List<Map<String, Object>>> result(WorkItemId id) {
    return reports.get(id);
  }

  public List<WorkItemStatus> deadLetters() {
    return facade.deadLetters().list();
  }

  public boolean purge(WorkItemId id) {
    return facade.deadLetters().purge(id);
  }
}
