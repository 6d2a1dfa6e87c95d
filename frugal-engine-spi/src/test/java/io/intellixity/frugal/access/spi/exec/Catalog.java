package io.intellixity.frugal.access.spi.exec;

import io.intellixity.frugal.access.schema.*;
import io.intellixity.frugal.access.spi.memory.InMemoryDataStore;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.*;

/** Products with reviews (MANY) and a supplier (ONE); sales for aggregation. */
final class Catalog {
  static final EntitySchema PRODUCT;
  static final EntitySchema REVIEW = EntitySchema.builder("Review", "reviews")
      .key("id", FieldType.LONG)
      .field("productId", FieldType.LONG)
      .field("rating", FieldType.INT)
      .field("body", FieldType.STRING)
      .build();
  static final EntitySchema SUPPLIER = EntitySchema.builder("Supplier", "suppliers")
      .key("id", FieldType.LONG)
      .field("name", FieldType.STRING)
      .build();
  static final EntitySchema SALE = EntitySchema.builder("Sale", "sales")
      .key("id", FieldType.LONG)
      .field("region", FieldType.STRING)
      .field("amount", FieldType.DECIMAL)
      .field("units", FieldType.INT)
      .field("soldOn", FieldType.DATE)
      .build();

  static {
    EntitySchema.Builder b = EntitySchema.builder("Product", "products")
        .key("id", FieldType.LONG)
        .field("name", FieldType.STRING)
        .field("supplierId", FieldType.LONG);
    for (int i = 1; i <= 17; i++) b.field("attr" + i, FieldType.STRING);
    PRODUCT = b.relation(Relation.many("reviews", "Review", "id", "productId"))
        .relation(Relation.one("supplier", "Supplier", "supplierId", "id"))
        .build();
  }

  private Catalog() {}

  static SchemaRegistry schemas() {
    return InMemorySchemaRegistry.of(PRODUCT, REVIEW, SUPPLIER, SALE);
  }

  /** {@code products} rows, two reviews each, every product supplied by one of three suppliers. */
  static InMemoryDataStore seed(InMemoryDataStore store, int products) {
    List<Map<String, Object>> ps = new ArrayList<>();
    List<Map<String, Object>> rs = new ArrayList<>();
    for (long id = 1; id <= products; id++) {
      Map<String, Object> p = new LinkedHashMap<>();
      p.put("id", id);
      p.put("name", "product-" + id);
      p.put("supplierId", (id % 3) + 1);
      for (int i = 1; i <= 17; i++) p.put("attr" + i, "v" + i);
      ps.add(p);
      rs.add(Map.of("id", id * 10, "productId", id, "rating", 4, "body", "ok"));
      rs.add(Map.of("id", id * 10 + 1, "productId", id, "rating", 5, "body", "great"));
    }
    store.insert("products", ps);
    store.insert("reviews", rs);
    store.insert("suppliers", List.of(
        Map.of("id", 1L, "name", "Acme"),
        Map.of("id", 2L, "name", "Globex"),
        Map.of("id", 3L, "name", "Initech")));
    return store;
  }

  static InMemoryDataStore seedSales(InMemoryDataStore store) {
    store.insert("sales", List.of(
        sale(1, "EU", "10.50", 1, LocalDate.of(2024, 1, 15)),
        sale(2, "EU", "20.00", 2, LocalDate.of(2024, 6, 1)),
        sale(3, "US", "5.25", 3, LocalDate.of(2023, 12, 31)),
        sale(4, "US", "4.25", 1, LocalDate.of(2024, 3, 3)),
        sale(5, "APAC", "100.00", 10, LocalDate.of(2024, 3, 4))));
    return store;
  }

  private static Map<String, Object> sale(long id, String region, String amount, int units, LocalDate soldOn) {
    return Map.of("id", id, "region", region, "amount", new BigDecimal(amount), "units", units, "soldOn", soldOn);
  }
}
