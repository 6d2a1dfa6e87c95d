package io.intellixity.frugal.access.mongo;

import io.intellixity.frugal.access.query.OffsetPage;
import io.intellixity.frugal.access.query.Operator;
import io.intellixity.frugal.access.query.Page;
import io.intellixity.frugal.access.query.SortField;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.spi.store.*;
import org.bson.Document;

import java.util.*;

/**
 * Mongo dialect: plain reads become {@code find} with a projection; composed reads and aggregates
 * become a single aggregation pipeline ({@code $lookup} per relation, {@code $group} for aggregates).
 * Date-part predicates are not pushed down.
 */
public final class MongoDialect implements StoreDialect<MongoStatement> {
  private static final StoreCapabilities CAPABILITIES = StoreCapabilities.all().without(Operator.DATE_PART_EQ);

  @Override public String id() { return "mongo"; }

  @Override public StoreCapabilities capabilities() { return CAPABILITIES; }

  @Override
  public MongoStatement renderSelect(SelectRequest req) {
    return MongoStatement.find(requireCollection(req.schema()),
        MongoQueryRenderer.toBson(id(), req.schema(), req.filter()),
        projection(req.fields()),
        sortDoc(req.sort()), skip(req.page()), limit(req.page()));
  }

  @Override
  public MongoStatement renderComposed(ComposedRequest req) {
    SelectRequest root = req.root();
    List<Document> pipeline = new ArrayList<>();
    Document match = MongoQueryRenderer.toBson(id(), root.schema(), root.filter());
    if (!match.isEmpty()) pipeline.add(new Document("$match", match));
    appendWindow(pipeline, root.sort(), root.page());

    Document finalProjection = projection(root.fields());
    for (RelationFetch rf : req.relations()) {
      Document lookup = new Document("from", requireCollection(rf.target()))
          .append("localField", rf.relation().localKey())
          .append("foreignField", rf.relation().foreignKey())
          .append("pipeline", List.of(new Document("$project", projection(rf.fields()))))
          .append("as", rf.relation().name());
      pipeline.add(new Document("$lookup", lookup));
      finalProjection.append(rf.relation().name(), 1);
    }
    pipeline.add(new Document("$project", finalProjection));
    return MongoStatement.aggregate(requireCollection(root.schema()), pipeline);
  }

  @Override
  public MongoStatement renderAggregate(AggregateRequest req) {
    List<Document> pipeline = new ArrayList<>();
    Document match = MongoQueryRenderer.toBson(id(), req.schema(), req.filter());
    if (!match.isEmpty()) pipeline.add(new Document("$match", match));

    Object groupId = null;
    if (req.grouped()) {
      Document keys = new Document();
      for (String g : req.groupBy()) keys.append(g, "$" + g);
      groupId = keys;
    }
    Document group = new Document("_id", groupId);
    for (Aggregate a : req.aggregates()) group.append(a.alias(), accumulator(a));
    pipeline.add(new Document("$group", group));

    Document project = new Document("_id", 0);
    for (String g : req.groupBy()) project.append(g, "$_id." + g);
    for (Aggregate a : req.aggregates()) project.append(a.alias(), 1);
    pipeline.add(new Document("$project", project));

    appendWindow(pipeline, req.sort(), req.page());
    return MongoStatement.aggregate(requireCollection(req.schema()), pipeline);
  }

  // ---- helpers ----

  private static Document accumulator(Aggregate a) {
    String ref = (a.field() == null) ? null : "$" + a.field();
    return switch (a.op()) {
      // COUNT(field) counts non-null values; null sorts below every other BSON value
      case COUNT -> (ref == null)
          ? new Document("$sum", 1)
          : new Document("$sum", new Document("$cond", List.of(new Document("$gt", Arrays.asList(ref, null)), 1, 0)));
      case SUM -> new Document("$sum", ref);
      case AVG -> new Document("$avg", ref);
      case MIN -> new Document("$min", ref);
      case MAX -> new Document("$max", ref);
    };
  }

  private static void appendWindow(List<Document> pipeline, List<SortField> sort, Page page) {
    Document s = sortDoc(sort);
    if (s != null) pipeline.add(new Document("$sort", s));
    Integer skip = skip(page);
    if (skip != null && skip > 0) pipeline.add(new Document("$skip", skip));
    Integer limit = limit(page);
    if (limit != null) pipeline.add(new Document("$limit", limit));
  }

  /** Inclusion projection; {@code _id} is dropped unless asked for. */
  private static Document projection(List<String> fields) {
    Document d = new Document();
    for (String f : fields) d.append(f, 1);
    if (!fields.contains("_id")) d.append("_id", 0);
    return d;
  }

  private static String requireCollection(EntitySchema schema) {
    String c = schema.source();
    if (c == null || c.isBlank()) throw new IllegalArgumentException("Entity schema has no collection source: " + schema.type());
    return c;
  }

  private static Integer skip(Page page) {
    if (page instanceof OffsetPage op) return op.offset();
    return null;
  }

  private static Integer limit(Page page) {
    if (page == null) return null;
    if (page instanceof OffsetPage op) return op.limit();
    throw new IllegalArgumentException("Unsupported page type for mongo: " + page.getClass().getName());
  }

  private static Document sortDoc(List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return null;
    Document d = new Document();
    for (SortField sf : sort) d.put(sf.field(), sf.direction() == SortField.Direction.DESC ? -1 : 1);
    return d;
  }
}
