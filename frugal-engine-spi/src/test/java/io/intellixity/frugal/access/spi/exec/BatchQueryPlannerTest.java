package io.intellixity.frugal.access.spi.exec;

import io.intellixity.frugal.access.exec.*;
import io.intellixity.frugal.access.query.*;
import io.intellixity.frugal.access.spi.memory.InMemoryDataStore;
import io.intellixity.frugal.access.spi.store.ComposedRequest;
import io.intellixity.frugal.access.spi.store.SelectRequest;
import io.intellixity.frugal.access.spi.store.StoreCapabilities;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CancellationException;

import static org.junit.jupiter.api.Assertions.*;

final class BatchQueryPlannerTest {
  private static final StoreCapabilities NO_COMPOSITION = StoreCapabilities.all().withComposition(false);

  private static EntityQuery productsWithReviewsAndSupplier() {
    return EntityQuery.of("Product", "id", "name")
        .withInclude("reviews", "rating")
        .withInclude("supplier", "name");
  }

  @Test
  void roundTripsDoNotGrowWithRowCount() {
    for (int rows : new int[] {1, 10, 1000}) {
      InMemoryDataStore batched = Catalog.seed(new InMemoryDataStore("batched", NO_COMPOSITION), rows);
      EntityGraph g = new BatchQueryPlanner(batched, Catalog.schemas()).fetch(productsWithReviewsAndSupplier());
      assertEquals(rows, g.size());
      assertEquals(3, g.roundTrips(), "root + one fetch per relation for " + rows + " rows");
      assertEquals(3, batched.roundTrips());

      InMemoryDataStore composing = Catalog.seed(new InMemoryDataStore("composing"), rows);
      EntityGraph c = new BatchQueryPlanner(composing, Catalog.schemas()).fetch(productsWithReviewsAndSupplier());
      assertEquals(rows, c.size());
      assertEquals(1, c.roundTrips());
      assertEquals(1, composing.roundTrips());
    }
  }

  @Test
  void stitchesRelationsAndDropsJoinKeysNobodyAskedFor() {
    for (StoreCapabilities caps : List.of(NO_COMPOSITION, StoreCapabilities.all())) {
      InMemoryDataStore store = Catalog.seed(new InMemoryDataStore("s", caps), 4);
      EntityGraph g = new BatchQueryPlanner(store, Catalog.schemas())
          .fetch(new EntityQuery("Product").withFields("name")
              .withInclude("reviews", "rating")
              .withInclude("supplier", "name")
              .withSort(List.of(SortField.asc("id"))));

      EntityNode first = g.nodes().get(0);
      assertEquals(Map.of("name", "product-1"), first.fields());
      assertEquals(List.of(Map.of("rating", 4), Map.of("rating", 5)), first.many("reviews"));
      assertEquals(Map.of("name", "Globex"), first.one("supplier"));
      assertEquals(Map.of("name", "Acme"), g.nodes().get(2).one("supplier"));
    }
  }

  @Test
  void relationFetchIsKeyedByDistinctParentKeys() {
    InMemoryDataStore store = Catalog.seed(new InMemoryDataStore("s", NO_COMPOSITION), 9);
    new BatchQueryPlanner(store, Catalog.schemas())
        .fetch(EntityQuery.of("Product", "id").withInclude("supplier", "name"));

    List<Object> reqs = store.requests();
    assertEquals(2, reqs.size());
    SelectRequest root = (SelectRequest) reqs.get(0);
    assertEquals(List.of("id", "supplierId"), root.fields());

    SelectRequest suppliers = (SelectRequest) reqs.get(1);
    assertEquals(List.of("name", "id"), suppliers.fields());
    Condition in = assertInstanceOf(Condition.class, suppliers.filter());
    assertEquals(Operator.IN, in.operator());
    assertEquals("id", in.property());
    assertEquals(3, ((Collection<?>) in.value()).size());
  }

  @Test
  void composingStoreReceivesOneRequest() {
    InMemoryDataStore store = Catalog.seed(new InMemoryDataStore("s"), 5);
    new BatchQueryPlanner(store, Catalog.schemas()).fetch(productsWithReviewsAndSupplier());
    ComposedRequest req = assertInstanceOf(ComposedRequest.class, store.requests().get(0));
    assertEquals(2, req.relations().size());
    assertEquals(List.of("id", "name", "supplierId"), req.root().fields());
  }

  @Test
  void emptyRootSkipsRelationFetches() {
    InMemoryDataStore store = Catalog.seed(new InMemoryDataStore("s", NO_COMPOSITION), 5);
    EntityGraph g = new BatchQueryPlanner(store, Catalog.schemas())
        .fetch(productsWithReviewsAndSupplier().withFilter(QueryFilters.eq("name", "nope")));
    assertTrue(g.isEmpty());
    assertEquals(1, g.roundTrips());
  }

  @Test
  void filterParamsAreResolvedBeforeTheStore() {
    InMemoryDataStore store = Catalog.seed(new InMemoryDataStore("s"), 5);
    EntityGraph g = new BatchQueryPlanner(store, Catalog.schemas())
        .fetch(EntityQuery.of("Product", "id")
            .withFilter(QueryFilters.eq("name", QueryValues.param("n")))
            .withParam("n", "product-3"));
    assertEquals(1, g.size());
    assertEquals(3L, g.nodes().get(0).get("id"));

    SelectRequest sent = (SelectRequest) store.requests().get(0);
    assertEquals("product-3", ((Condition) sent.filter()).value());
  }

  @Test
  void missingProjectionFailsBeforeAnyRoundTrip() {
    InMemoryDataStore store = Catalog.seed(new InMemoryDataStore("s"), 5);
    BatchQueryPlanner planner = new BatchQueryPlanner(store, Catalog.schemas());

    assertThrows(QueryValidationException.class, () -> planner.fetch(new EntityQuery("Product")));
    assertThrows(QueryValidationException.class,
        () -> planner.fetch(EntityQuery.of("Product", "id").withInclude(Include.of("reviews"))));
    assertThrows(QueryValidationException.class,
        () -> planner.fetch(EntityQuery.of("Product", "id").withInclude("tags", "name")));
    assertEquals(0, store.roundTrips());
  }

  @Test
  void unsupportedPredicateFailsBeforeAnyRoundTrip() {
    InMemoryDataStore store = Catalog.seed(
        new InMemoryDataStore("s", NO_COMPOSITION.without(Operator.LIKE)), 5);
    BatchQueryPlanner planner = new BatchQueryPlanner(store, Catalog.schemas());

    UnsupportedPushdownException ex = assertThrows(UnsupportedPushdownException.class,
        () -> planner.fetch(productsWithReviewsAndSupplier().withFilter(QueryFilters.like("name", "product-%"))));
    assertEquals("s", ex.storeId());
    assertEquals(0, store.roundTrips());
  }

  @Test
  void storeWithoutInCannotBatchRelations() {
    InMemoryDataStore store = Catalog.seed(
        new InMemoryDataStore("s", NO_COMPOSITION.without(Operator.IN)), 5);
    assertThrows(UnsupportedPushdownException.class,
        () -> new BatchQueryPlanner(store, Catalog.schemas()).fetch(productsWithReviewsAndSupplier()));
    assertEquals(0, store.roundTrips());
  }

  @Test
  void cancelledCallMakesNoRoundTrip() {
    InMemoryDataStore store = Catalog.seed(new InMemoryDataStore("s", NO_COMPOSITION), 5);
    CancellationToken token = new CancellationToken();
    token.cancel();
    CallOptions opts = CallOptions.timeout(Duration.ofSeconds(5)).withCancellation(token);

    assertThrows(CancellationException.class,
        () -> new BatchQueryPlanner(store, Catalog.schemas()).fetch(productsWithReviewsAndSupplier(), opts));
    assertEquals(0, store.roundTrips());
  }

  @Test
  void slowStoreHitsCallerTimeout() {
    InMemoryDataStore store = Catalog.seed(new InMemoryDataStore("s", NO_COMPOSITION), 5)
        .latency(Duration.ofMillis(200));
    CallOptions opts = CallOptions.timeout(Duration.ofMillis(50));

    assertThrows(CallTimeoutException.class,
        () -> new BatchQueryPlanner(store, Catalog.schemas()).fetch(productsWithReviewsAndSupplier(), opts));
    assertEquals(1, store.roundTrips());
  }
}
