package io.intellixity.frugal.examples.jobs;

import io.intellixity.frugal.access.exec.CallOptions;
import io.intellixity.frugal.access.exec.ProjectedRows;
import io.intellixity.frugal.access.facade.ResourceAccessFacade;
import io.intellixity.frugal.access.query.EntityQuery;
import io.intellixity.frugal.access.query.QueryFilters;
import io.intellixity.frugal.access.query.SortField;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.query.aggregation.GroupBy;
import io.intellixity.frugal.access.queue.WorkHandler;
import io.intellixity.frugal.access.queue.WorkItem;
import io.intellixity.frugal.examples.domain.CatalogSchemas;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Sales per region between two dates. Results are keyed by work item id, so a redelivered job
 * rewrites the same entry.
 */
@Component
public class SalesReportHandler implements WorkHandler {
  public static final String TYPE = "sales-report";
  private static final Logger log = LoggerFactory.getLogger(SalesReportHandler.class);

  private final ResourceAccessFacade facade;
  private final ReportStore reports;

  public SalesReportHandler(ResourceAccessFacade facade, ReportStore reports) {
    this.facade = facade;
    this.reports = reports;
  }

  @Override
  public void handle(WorkItem item) {
    LocalDate from = LocalDate.parse(String.valueOf(item.payload().get("from")));
    LocalDate to = LocalDate.parse(String.valueOf(item.payload().get("to")));
    if (to.isBefore(from)) throw new IllegalArgumentException("Report range ends before it starts: " + from + ".." + to);

    EntityQuery q = EntityQuery.of(CatalogSchemas.SALE)
        .withFilter(QueryFilters.range("soldOn", from, to))
        .withSort(List.of(SortField.asc("region")));
    ProjectedRows rows = facade.aggregate(q,
        List.of(Aggregate.sum("amount"), Aggregate.sum("units"), Aggregate.count()),
        GroupBy.of("region"),
        CallOptions.timeout(Duration.ofMinutes(2)));

    reports.put(item.id(), rows.rows());
    log.info("frugal.report done id={} from={} to={} regions={}", item.id(), from, to, rows.size());
  }
}
