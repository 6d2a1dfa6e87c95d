package io.intellixity.frugal.access.facade;

import io.intellixity.frugal.access.exec.*;
import io.intellixity.frugal.access.handle.ResourceConfig;
import io.intellixity.frugal.access.query.EntityQuery;
import io.intellixity.frugal.access.query.QueryValidationException;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.query.aggregation.GroupBy;
import io.intellixity.frugal.access.queue.BackgroundOffloadQueue;
import io.intellixity.frugal.access.queue.InMemoryMessageBroker;
import io.intellixity.frugal.access.queue.QueueConfig;
import io.intellixity.frugal.access.queue.WorkItemId;
import io.intellixity.frugal.access.queue.WorkItemState;
import io.intellixity.frugal.access.registry.ResourceFactory;
import io.intellixity.frugal.access.registry.SharedClientRegistry;
import io.intellixity.frugal.access.schema.*;
import io.intellixity.frugal.access.spi.memory.InMemoryDataStore;
import io.intellixity.frugal.access.spi.store.StoreCapabilities;
import io.intellixity.frugal.access.telemetry.AccessTelemetry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static io.intellixity.frugal.access.query.QueryFilters.eq;
import static org.junit.jupiter.api.Assertions.*;

final class ResourceAccessFacadeTest {
  private static final SchemaRegistry SCHEMAS = InMemorySchemaRegistry.of(
      EntitySchema.builder("Product", "products")
          .key("id", FieldType.LONG)
          .field("name", FieldType.STRING)
          .field("description", FieldType.STRING)
          .relation(Relation.many("reviews", "Review", "id", "productId"))
          .build(),
      EntitySchema.builder("Review", "reviews")
          .key("id", FieldType.LONG)
          .field("productId", FieldType.LONG)
          .field("rating", FieldType.INT)
          .build(),
      EntitySchema.builder("Sale", "sales")
          .key("id", FieldType.LONG)
          .field("region", FieldType.STRING)
          .field("amount", FieldType.DECIMAL)
          .build());

  private final SharedClientRegistry registry = new SharedClientRegistry();
  private final List<String> events = new CopyOnWriteArrayList<>();
  private final AtomicInteger catalogsBuilt = new AtomicInteger();

  @AfterEach
  void closeRegistry() {
    registry.close();
  }

  /** Stands in for a database client: building it is the expensive part the registry must do once. */
  private final class CatalogFactory implements ResourceFactory<InMemoryDataStore> {
    @Override public String name() { return "catalog"; }
    @Override public boolean threadSafe() { return true; }

    @Override
    public InMemoryDataStore create(ResourceConfig config) {
      catalogsBuilt.incrementAndGet();
      InMemoryDataStore store = new InMemoryDataStore(config.kind(), StoreCapabilities.all().withComposition(false));
      store.insert("products", List.of(
          Map.of("id", 1L, "name", "kettle", "description", "long text"),
          Map.of("id", 2L, "name", "toaster", "description", "long text")));
      store.insert("reviews", List.of(
          Map.of("id", 10L, "productId", 1L, "rating", 5),
          Map.of("id", 11L, "productId", 1L, "rating", 3),
          Map.of("id", 20L, "productId", 2L, "rating", 4)));
      return store;
    }
  }

  private final AccessTelemetry telemetry = new AccessTelemetry() {
    @Override public void requestCompleted(String operation, String entityType, long durationNanos, int roundTrips, boolean success) {
      events.add(operation + ":" + entityType + ":" + roundTrips + ":" + success);
    }
    @Override public void queueDepth(String queue, long depth) {}
    @Override public void handleCreated(String kind, long constructionNanos) {}
    @Override public void poolCheckout(String kind, long waitNanos, boolean timedOut) {}
    @Override public void deadLettered(String queue, String workItemId, int retryCount) {}
  };

  private ResourceAccessFacade facade(BackgroundOffloadQueue queue, InMemoryDataStore sales) {
    registry.define(ResourceConfig.of("catalog-db", "memory://catalog"), new CatalogFactory());
    ResourceAccessFacade.Builder b = ResourceAccessFacade.builder(registry, SCHEMAS)
        .store("catalog-db", (DataStoreFactory<InMemoryDataStore>) h -> h.client())
        .store("sales-db", sales)
        .route("Sale", "sales-db")
        .defaultStore("catalog-db")
        .telemetry(telemetry);
    if (queue != null) b.queue(queue);
    return b.build();
  }

  private static InMemoryDataStore sales() {
    return new InMemoryDataStore("sales-db").insert("sales", List.of(
        Map.of("id", 1L, "region", "EU", "amount", new BigDecimal("10.00")),
        Map.of("id", 2L, "region", "EU", "amount", new BigDecimal("5.50")),
        Map.of("id", 3L, "region", "US", "amount", new BigDecimal("7.00"))));
  }

  @Test
  void fetchBuildsStoreFromSharedHandleOnceAndBatchesRelations() {
    ResourceAccessFacade f = facade(null, sales());
    assertEquals(0, catalogsBuilt.get(), "nothing is built before first use");

    for (int i = 0; i < 3; i++) {
      EntityGraph g = f.fetch(EntityQuery.of("Product", "id", "name").withInclude("reviews", "rating"));
      assertEquals(2, g.size());
      assertEquals(2, g.roundTrips());
      assertEquals(2, g.nodes().get(0).many("reviews").size());
    }

    assertEquals(1, catalogsBuilt.get());
    assertEquals(List.of("fetch:Product:2:true", "fetch:Product:2:true", "fetch:Product:2:true"), events);
  }

  @Test
  void projectReturnsOnlyRequestedFields() {
    ResourceAccessFacade f = facade(null, sales());
    ProjectedRows rows = f.project(EntityQuery.of("Product", "name").withFilter(eq("id", 2L)));
    assertEquals(List.of(Map.of("name", "toaster")), rows.rows());
    assertEquals(List.of("project:Product:1:true"), events);
  }

  @Test
  void aggregatesRunOnTheRoutedStore() {
    InMemoryDataStore sales = sales();
    ResourceAccessFacade f = facade(null, sales);

    AggregateResult count = f.aggregate(EntityQuery.of("Sale").withFilter(eq("region", "EU")), Aggregate.count());
    assertEquals(2L, count.asLong());

    ProjectedRows byRegion = f.aggregate(EntityQuery.of("Sale"), List.of(Aggregate.sum("amount")), GroupBy.of("region"));
    assertEquals(2, byRegion.size());
    assertEquals(2, sales.roundTrips());
    assertEquals(0, catalogsBuilt.get(), "catalog store untouched");
  }

  @Test
  void failuresAreReportedAndPropagatedUnchanged() {
    ResourceAccessFacade f = facade(null, sales());
    assertThrows(QueryValidationException.class, () -> f.project(EntityQuery.of("Product", "price")));
    assertEquals(List.of("project:Product:0:false"), events);
  }

  @Test
  void offloadEnqueuesAndReturnsImmediately() {
    BackgroundOffloadQueue queue = new BackgroundOffloadQueue("reports", new InMemoryMessageBroker(QueueConfig.of("reports")));
    ResourceAccessFacade f = facade(queue, sales());

    WorkItemId id = f.offload("sales-report", Map.of("region", "EU"));

    assertEquals(WorkItemState.PENDING, f.workStatus(id).orElseThrow().state());
    assertEquals(0, f.deadLetters().count());
    assertEquals(List.of("offload:sales-report:0:true"), events);
  }

  @Test
  void offloadWithoutQueueIsAConfigurationError() {
    ResourceAccessFacade f = facade(null, sales());
    assertThrows(IllegalStateException.class, () -> f.offload("x", Map.of()));
  }

  @Test
  void routesMustPointAtRegisteredStores() {
    ResourceAccessFacade.Builder b = ResourceAccessFacade.builder(registry, SCHEMAS)
        .store("sales-db", sales())
        .route("Product", "catalog-db");
    assertThrows(IllegalStateException.class, b::build);

    ResourceAccessFacade noDefault = ResourceAccessFacade.builder(registry, SCHEMAS).store("sales-db", sales()).build();
    assertThrows(IllegalArgumentException.class, () -> noDefault.project(EntityQuery.of("Product", "name")));
  }
}
