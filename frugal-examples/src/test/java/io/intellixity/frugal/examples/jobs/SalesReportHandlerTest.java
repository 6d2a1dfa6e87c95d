package io.intellixity.frugal.examples.jobs;

import io.intellixity.frugal.access.facade.ResourceAccessFacade;
import io.intellixity.frugal.access.queue.BackgroundOffloadQueue;
import io.intellixity.frugal.access.queue.InMemoryMessageBroker;
import io.intellixity.frugal.access.queue.QueueConfig;
import io.intellixity.frugal.access.queue.WorkItem;
import io.intellixity.frugal.access.queue.WorkItemId;
import io.intellixity.frugal.access.queue.WorkItemState;
import io.intellixity.frugal.access.queue.WorkerPool;
import io.intellixity.frugal.access.queue.WorkerPoolConfig;
import io.intellixity.frugal.access.registry.SharedClientRegistry;
import io.intellixity.frugal.access.spi.memory.InMemoryDataStore;
import io.intellixity.frugal.examples.domain.CatalogSchemas;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class SalesReportHandlerTest {
  private final SharedClientRegistry registry = new SharedClientRegistry();
  private final BackgroundOffloadQueue queue =
      new BackgroundOffloadQueue("reports", new InMemoryMessageBroker(QueueConfig.of("reports").withMaxRetries(1)));
  private final InMemoryDataStore sales = new InMemoryDataStore("sales").insert("sales", List.of(
      sale(1, "EU", "10.00", LocalDate.of(2024, 1, 10)),
      sale(2, "EU", "15.00", LocalDate.of(2024, 2, 10)),
      sale(3, "US", "7.50", LocalDate.of(2024, 2, 11)),
      sale(4, "US", "99.00", LocalDate.of(2023, 12, 31))));
  private final ResourceAccessFacade facade = ResourceAccessFacade.builder(registry, CatalogSchemas.registry())
      .store("sales-db", sales)
      .defaultStore("sales-db")
      .queue(queue)
      .build();
  private final ReportStore reports = new ReportStore();

  @AfterEach
  void tearDown() {
    queue.close();
    registry.close();
  }

  private static Map<String, Object> sale(long id, String region, String amount, LocalDate soldOn) {
    return Map.of("id", id, "productId", 1L, "region", region, "amount", new BigDecimal(amount), "units", 1, "soldOn", soldOn);
  }

  @Test
  void offloadedReportIsComputedByWorkersAndStoredUnderItsJobId() throws Exception {
    WorkerPoolConfig cfg = new WorkerPoolConfig(1, Duration.ofMillis(20), Duration.ofMillis(1), Duration.ofMillis(5), Duration.ofSeconds(5));
    try (WorkerPool pool = new WorkerPool(queue, cfg).register(SalesReportHandler.TYPE, new SalesReportHandler(facade, reports)).start()) {
      WorkItemId id = facade.offload(SalesReportHandler.TYPE, Map.of("from", "2024-01-01", "to", "2024-12-31"));
      assertEquals(WorkItemState.COMPLETED, queue.await(id, Duration.ofSeconds(5)));

      List<Map<String, Object>> rows = reports.get(id).orElseThrow();
      assertEquals(2, rows.size());
      assertEquals("EU", rows.get(0).get("region"));
      assertEquals(0, new BigDecimal("25.00").compareTo(new BigDecimal(String.valueOf(rows.get(0).get("sum_amount")))));
      assertEquals(2L, ((Number) rows.get(0).get("count")).longValue());
      assertEquals(1L, ((Number) rows.get(1).get("count")).longValue());
    }
  }

  @Test
  void invalidRangeFailsTheJob() {
    SalesReportHandler handler = new SalesReportHandler(facade, reports);
    WorkItem item = WorkItem.of(SalesReportHandler.TYPE, Map.of("from", "2024-02-01", "to", "2024-01-01"));
    assertThrows(IllegalArgumentException.class, () -> handler.handle(item));
    assertTrue(reports.get(item.id()).isEmpty());
  }
}
