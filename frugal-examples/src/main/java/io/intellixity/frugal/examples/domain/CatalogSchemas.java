package io.intellixity.frugal.examples.domain;

import io.intellixity.frugal.access.schema.*;

/** Entity schemas served by the demo. */
public final class CatalogSchemas {
  public static final String PRODUCT = "Product";
  public static final String REVIEW = "Review";
  public static final String SUPPLIER = "Supplier";
  public static final String SALE = "Sale";

  private CatalogSchemas() {}

  public static SchemaRegistry registry() {
    return InMemorySchemaRegistry.of(
        EntitySchema.builder(PRODUCT, "products")
            .key("id", FieldType.LONG)
            .field("name", FieldType.STRING)
            .field("description", FieldType.STRING)
            .field("price", FieldType.DECIMAL)
            .field("supplierId", FieldType.LONG)
            .field("createdAt", FieldType.TIMESTAMP)
            .relation(Relation.many("reviews", REVIEW, "id", "productId"))
            .relation(Relation.one("supplier", SUPPLIER, "supplierId", "id"))
            .build(),
        EntitySchema.builder(REVIEW, "reviews")
            .key("id", FieldType.LONG)
            .field("productId", FieldType.LONG)
            .field("rating", FieldType.INT)
            .field("body", FieldType.STRING)
            .build(),
        EntitySchema.builder(SUPPLIER, "suppliers")
            .key("id", FieldType.LONG)
            .field("name", FieldType.STRING)
            .field("country", FieldType.STRING)
            .build(),
        EntitySchema.builder(SALE, "sales")
            .key("id", FieldType.LONG)
            .field("productId", FieldType.LONG)
            .field("region", FieldType.STRING)
            .field("amount", FieldType.DECIMAL)
            .field("units", FieldType.INT)
            .field("soldOn", FieldType.DATE)
            .build());
  }
}
