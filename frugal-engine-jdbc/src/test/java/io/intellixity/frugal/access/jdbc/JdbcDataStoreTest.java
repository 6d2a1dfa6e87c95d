package io.intellixity.frugal.access.jdbc;

import io.intellixity.frugal.access.exec.*;
import io.intellixity.frugal.access.handle.ResourceConfig;
import io.intellixity.frugal.access.handle.SharedResourceHandle;
import io.intellixity.frugal.access.jdbc.dialect.GenericJdbcDialect;
import io.intellixity.frugal.access.query.*;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.FieldType;
import io.intellixity.frugal.access.schema.Relation;
import io.intellixity.frugal.access.spi.store.AggregateRequest;
import io.intellixity.frugal.access.spi.store.ComposedRequest;
import io.intellixity.frugal.access.spi.store.RelationFetch;
import io.intellixity.frugal.access.spi.store.SelectRequest;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.*;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcDataStoreTest {
  private static final EntitySchema SALE = EntitySchema.builder("Sale", "sales")
      .key("id", FieldType.LONG)
      .field("region", FieldType.STRING)
      .field("amount", FieldType.DECIMAL)
      .field("units", FieldType.INT)
      .field("soldOn", FieldType.DATE)
      .build();

  private static JdbcDataStore store(FakeJdbc fake) {
    DataSource ds = fake.dataSource();
    var handle = new SharedResourceHandle<>("sales-db#shared", ds, ResourceConfig.of("sales-db", "jdbc:fake:sales"),
        Instant.now(), true);
    return new JdbcDataStore(handle, new GenericJdbcDialect());
  }

  @Test
  void selectRunsOneStatementAndTypesRows() {
    FakeJdbc fake = new FakeJdbc().returning(
        List.of("id", "region", "soldOn"),
        List.of(
            List.of(1, "EU", java.sql.Date.valueOf("2024-01-15")),
            List.of(2, "EU", java.sql.Date.valueOf("2024-06-01"))));
    JdbcDataStore store = store(fake);

    SelectRequest req = new SelectRequest(SALE, List.of("id", "region", "soldOn"),
        QueryFilters.and(QueryFilters.eq("region", "EU"), QueryFilters.range("amount", new BigDecimal("1"), new BigDecimal("50"))),
        List.of(SortField.asc("id")), OffsetPage.first(10));
    List<Map<String, Object>> rows = store.select(req, CallOptions.NONE.start());

    assertEquals("sales-db", store.id());
    assertEquals(List.of(
        "SELECT \"id\", \"region\", \"soldOn\" FROM \"sales\" WHERE (\"region\" = ? AND \"amount\" BETWEEN ? AND ?)"
            + " ORDER BY \"id\" ASC OFFSET 0 ROWS FETCH NEXT 10 ROWS ONLY"), fake.sql);
    assertEquals(Map.of(1, "EU", 2, new BigDecimal("1"), 3, new BigDecimal("50")), fake.binds.get(0));
    assertEquals(List.of(0), fake.timeouts);
    assertEquals(1, fake.connections);

    assertEquals(2, rows.size());
    assertEquals(1L, rows.get(0).get("id"));
    assertEquals(LocalDate.of(2024, 1, 15), rows.get(0).get("soldOn"));
  }

  @Test
  void remainingTimeBecomesQueryTimeout() {
    FakeJdbc fake = new FakeJdbc().returning(List.of("id"), List.of());
    store(fake).select(SelectRequest.of(SALE, List.of("id"), null), CallOptions.timeout(Duration.ofSeconds(3)).start());
    assertEquals(List.of(3), fake.timeouts);
  }

  @Test
  void aggregateValuesAreNormalized() {
    FakeJdbc fake = new FakeJdbc().returning(
        List.of("region", "sum_units", "avg_units", "count"),
        List.of(Arrays.asList("EU", new BigDecimal("3"), new BigDecimal("1.5"), 2L)));
    AggregateRequest req = new AggregateRequest(SALE, null,
        List.of(Aggregate.sum("units"), Aggregate.avg("units"), Aggregate.count()), List.of("region"), List.of(), null);

    List<Map<String, Object>> rows = store(fake).aggregate(req, CallOptions.NONE.start());

    assertEquals("SELECT \"region\", SUM(\"units\") AS \"sum_units\", AVG(\"units\") AS \"avg_units\", COUNT(*) AS \"count\""
        + " FROM \"sales\" GROUP BY \"region\"", fake.sql.get(0));
    assertEquals(Map.of("region", "EU", "sum_units", 3L, "avg_units", 1.5, "count", 2L), rows.get(0));
  }

  @Test
  void driverFailuresAreWrapped() {
    SQLException boom = new SQLException("relation \"sales\" does not exist", "42P01");
    FakeJdbc fake = new FakeJdbc().failingWith(boom);
    DataStoreException ex = assertThrows(DataStoreException.class,
        () -> store(fake).select(SelectRequest.of(SALE, List.of("id"), null), CallOptions.NONE.start()));
    assertSame(boom, ex.getCause());
    assertFalse(ex instanceof CallTimeoutException);
  }

  @Test
  void driverTimeoutIsCallTimeout() {
    FakeJdbc fake = new FakeJdbc().failingWith(new SQLTimeoutException("query timed out"));
    assertThrows(CallTimeoutException.class,
        () -> store(fake).select(SelectRequest.of(SALE, List.of("id"), null), CallOptions.timeout(Duration.ofSeconds(1)).start()));
  }

  @Test
  void cancellingTheTokenCancelsTheStatement() throws Exception {
    FakeJdbc fake = new FakeJdbc().blockingUntilCancel();
    JdbcDataStore store = store(fake);
    CancellationToken token = new CancellationToken();
    ExecutorService exec = Executors.newSingleThreadExecutor();
    try {
      Future<?> f = exec.submit(() ->
          store.select(SelectRequest.of(SALE, List.of("id"), null), CallOptions.NONE.withCancellation(token).start()));
      assertTrue(fake.executing.await(5, TimeUnit.SECONDS));
      token.cancel();
      ExecutionException ex = assertThrows(ExecutionException.class, () -> f.get(5, TimeUnit.SECONDS));
      assertInstanceOf(CancellationException.class, ex.getCause());
      assertEquals(1, fake.cancels);
    } finally {
      exec.shutdownNow();
    }
  }

  @Test
  void unsupportedWorkNeverReachesTheDriver() {
    FakeJdbc fake = new FakeJdbc();
    JdbcDataStore store = store(fake);
    EntitySchema region = EntitySchema.builder("Region", "regions")
        .key("code", FieldType.STRING)
        .relation(Relation.many("sales", "Sale", "code", "region"))
        .build();

    assertThrows(UnsupportedPushdownException.class, () -> store.select(
        SelectRequest.of(SALE, List.of("id"), QueryFilters.datePartEq("soldOn", DatePart.YEAR, 2024)),
        CallOptions.NONE.start()));
    assertThrows(UnsupportedPushdownException.class, () -> store.selectComposed(
        new ComposedRequest(SelectRequest.of(region, List.of("code"), null),
            List.of(new RelationFetch(region.relation("sales"), SALE, List.of("id", "region")))),
        CallOptions.NONE.start()));
    assertEquals(0, fake.connections);
  }

  @Test
  void composedRowsDecodeJsonRelationColumns() {
    EntitySchema region = EntitySchema.builder("Region", "regions")
        .key("code", FieldType.STRING)
        .relation(Relation.many("sales", "Sale", "code", "region"))
        .build();
    FakeJdbc fake = new FakeJdbc().returning(
        List.of("code", "sales"),
        List.of(
            List.of("EU", "[{\"id\": 1, \"region\": \"EU\", \"amount\": 10.50, \"soldOn\": \"2024-01-15\"}]"),
            List.of("US", "[]")));
    GenericJdbcDialect composing = new GenericJdbcDialect() {
      @Override
      public io.intellixity.frugal.access.spi.store.StoreCapabilities capabilities() {
        return super.capabilities().withComposition(true);
      }

      @Override
      protected String renderRelationSubquery(RelationFetch fetch, String parentAlias, String childAlias) {
        return "SELECT '[]'";
      }
    };
    DataSource ds = fake.dataSource();
    JdbcDataStore store = new JdbcDataStore("regions-db",
        new SharedResourceHandle<>("regions-db#shared", ds, ResourceConfig.of("regions-db", "jdbc:fake"), Instant.now(), true),
        composing);

    List<EntityNode> nodes = store.selectComposed(
        new ComposedRequest(SelectRequest.of(region, List.of("code"), null),
            List.of(new RelationFetch(region.relation("sales"), SALE, List.of("id", "region", "amount", "soldOn")))),
        CallOptions.NONE.start());

    assertEquals(1, fake.sql.size());
    assertEquals(2, nodes.size());
    Map<String, Object> sale = nodes.get(0).many("sales").get(0);
    assertEquals(1L, sale.get("id"));
    assertEquals(new BigDecimal("10.50"), sale.get("amount"));
    assertEquals(LocalDate.of(2024, 1, 15), sale.get("soldOn"));
    assertTrue(nodes.get(1).many("sales").isEmpty());
  }
}
