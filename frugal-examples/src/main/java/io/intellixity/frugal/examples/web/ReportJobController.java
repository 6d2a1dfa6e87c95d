package io.intellixity.frugal.examples.web;

import io.intellixity.frugal.access.queue.WorkItemId;
import io.intellixity.frugal.access.queue.WorkItemStatus;
import io.intellixity.frugal.examples.service.ReportJobService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/reports")
public final class ReportJobController {
  private final ReportJobService jobs;

  public ReportJobController(ReportJobService jobs) {
    this.jobs = jobs;
  }

  public record SubmitReportRequest(LocalDate from, LocalDate to, String requestId) {}

  public record JobView(String id, String type, String state, int retries, String lastError) {
    static JobView of(WorkItemStatus s) {
      return new JobView(s.id().value(), s.item().type(), s.state().name(), s.retries(), s.lastError());
    }
  }

  @PostMapping
  public ResponseEntity<Map<String, String>> submit(@RequestBody SubmitReportRequest req) {
    if (req.from() == null || req.to() == null) throw new IllegalArgumentException("'from' and 'to' are required");
    WorkItemId id = jobs.submit(req.from(), req.to(), req.requestId());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("id", id.value()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<JobView> status(@PathVariable("id") String id) {
    return jobs.status(WorkItemId.of(id))
        .map(s -> ResponseEntity.ok(JobView.of(s)))
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping("/{id}/result")
  public ResponseEntity<List<Map<String, Object>>> result(@PathVariable("id") String id) {
    return jobs.result(WorkItemId.of(id))
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @GetMapping("/dead-letters")
  public List<JobView> deadLetters() {
    return jobs.deadLetters().stream().map(JobView::of).toList();
  }

  @DeleteMapping("/dead-letters/{id}")
  public ResponseEntity<Void> purge(@PathVariable("id") String id) {
    return jobs.purge(WorkItemId.of(id)) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }
}
