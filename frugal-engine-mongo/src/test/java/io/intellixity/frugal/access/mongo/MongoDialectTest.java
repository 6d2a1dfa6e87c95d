package io.intellixity.frugal.access.mongo;

import io.intellixity.frugal.access.query.*;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.FieldType;
import io.intellixity.frugal.access.schema.Relation;
import io.intellixity.frugal.access.spi.store.AggregateRequest;
import io.intellixity.frugal.access.spi.store.ComposedRequest;
import io.intellixity.frugal.access.spi.store.RelationFetch;
import io.intellixity.frugal.access.spi.store.SelectRequest;
import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MongoDialectTest {
  private static final EntitySchema REVIEW = EntitySchema.builder("Review", "reviews")
      .key("id", FieldType.LONG)
      .field("productId", FieldType.LONG)
      .field("rating", FieldType.INT)
      .build();
  private static final EntitySchema PRODUCT = EntitySchema.builder("Product", "products")
      .key("id", FieldType.LONG)
      .field("name", FieldType.STRING)
      .field("price", FieldType.DECIMAL)
      .relation(Relation.many("reviews", "Review", "id", "productId"))
      .build();

  private final MongoDialect d = new MongoDialect();

  @Test
  void findProjectsOnlyRequestedFields() {
    MongoStatement st = d.renderSelect(new SelectRequest(PRODUCT, List.of("id", "name"),
        QueryFilters.eq("name", "lamp"), List.of(SortField.desc("name")), new OffsetPage(20, 10)));

    assertEquals(MongoStatement.Kind.FIND, st.kind());
    assertEquals("products", st.collection());
    assertEquals(new Document("id", 1).append("name", 1).append("_id", 0), st.projection());
    assertEquals(new Document("name", "lamp"), st.filter());
    assertEquals(-1, st.sort().get("name"));
    assertEquals(20, st.skip());
    assertEquals(10, st.limit());
  }

  @Test
  void composedReadIsOnePipelineWithLookup() {
    SelectRequest root = new SelectRequest(PRODUCT, List.of("id", "name"), QueryFilters.gt("price", 5),
        List.of(SortField.asc("id")), OffsetPage.first(50));
    MongoStatement st = d.renderComposed(new ComposedRequest(root,
        List.of(new RelationFetch(PRODUCT.relation("reviews"), REVIEW, List.of("productId", "rating")))));

    assertEquals(MongoStatement.Kind.AGGREGATE, st.kind());
    List<Document> p = st.pipeline();
    assertEquals(List.of("$match", "$sort", "$limit", "$lookup", "$project"),
        p.stream().map(s -> s.keySet().iterator().next()).toList());

    Document lookup = p.get(3).get("$lookup", Document.class);
    assertEquals("reviews", lookup.getString("from"));
    assertEquals("id", lookup.getString("localField"));
    assertEquals("productId", lookup.getString("foreignField"));
    assertEquals("reviews", lookup.getString("as"));
    assertEquals(List.of(new Document("$project", new Document("productId", 1).append("rating", 1).append("_id", 0))),
        lookup.get("pipeline"));
    assertEquals(new Document("id", 1).append("name", 1).append("_id", 0).append("reviews", 1), p.get(4).get("$project"));
  }

  @Test
  void groupedAggregateUsesGroupAndProject() {
    AggregateRequest req = new AggregateRequest(PRODUCT, null,
        List.of(Aggregate.count(), Aggregate.avg("price")), List.of("name"), List.of(SortField.asc("name")), null);
    List<Document> p = d.renderAggregate(req).pipeline();

    Document group = p.get(0).get("$group", Document.class);
    assertEquals(new Document("name", "$name"), group.get("_id"));
    assertEquals(new Document("$sum", 1), group.get("count"));
    assertEquals(new Document("$avg", "$price"), group.get("avg_price"));
    assertEquals(new Document("_id", 0).append("name", "$_id.name").append("count", 1).append("avg_price", 1),
        p.get(1).get("$project"));
    assertEquals(new Document("$sort", new Document("name", 1)), p.get(2));
  }

  @Test
  void ungroupedAggregateGroupsEverything() {
    AggregateRequest req = new AggregateRequest(PRODUCT, QueryFilters.eq("name", "lamp"),
        List.of(Aggregate.max("price")), List.of(), List.of(), null);
    List<Document> p = d.renderAggregate(req).pipeline();
    assertEquals(new Document("$match", new Document("name", "lamp")), p.get(0));
    assertNull(p.get(1).get("$group", Document.class).get("_id"));
    assertTrue(p.get(1).get("$group", Document.class).containsKey("_id"));
  }

  @Test
  void capabilitiesExcludeDateParts() {
    assertTrue(d.capabilities().composition());
    assertFalse(d.capabilities().supports(Operator.DATE_PART_EQ));
  }
}
