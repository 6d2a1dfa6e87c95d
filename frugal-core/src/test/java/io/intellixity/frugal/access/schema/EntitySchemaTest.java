package io.intellixity.frugal.access.schema;

import io.intellixity.frugal.access.query.QueryValidationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class EntitySchemaTest {
  private static EntitySchema product() {
    return EntitySchema.builder("Product", "products")
        .key("id", FieldType.LONG)
        .field("name", FieldType.STRING)
        .relation(Relation.many("reviews", "Review", "id", "productId"))
        .build();
  }

  @Test
  void resolvesKeyFieldsAndRelations() {
    EntitySchema s = product();
    assertEquals("id", s.keyField());
    assertTrue(s.hasField("name"));
    assertEquals(Cardinality.MANY, s.relation("reviews").cardinality());
  }

  @Test
  void unknownRelationIsValidationError() {
    QueryValidationException ex = assertThrows(QueryValidationException.class, () -> product().relation("tags"));
    assertTrue(ex.getMessage().contains("Unknown relation 'tags'"));
  }

  @Test
  void relationNameMayNotShadowField() {
    EntitySchema.Builder b = EntitySchema.builder("Product", "products").field("reviews", FieldType.STRING);
    assertThrows(IllegalArgumentException.class, () -> b.relation(Relation.many("reviews", "Review", "id", "productId")));
  }

  @Test
  void registryRejectsUnknownType() {
    InMemorySchemaRegistry r = InMemorySchemaRegistry.of(product());
    assertSame(r.schema("Product"), r.schema("Product"));
    assertThrows(QueryValidationException.class, () -> r.schema("Order"));
  }
}
