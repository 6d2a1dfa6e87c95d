package io.intellixity.frugal.access.mongo;

import com.mongodb.MongoException;
import com.mongodb.MongoExecutionTimeoutException;
import com.mongodb.client.AggregateIterable;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoCursor;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.MongoIterable;
import io.intellixity.frugal.access.exec.CallTimeoutException;
import io.intellixity.frugal.access.exec.DataStoreException;
import io.intellixity.frugal.access.exec.Deadline;
import io.intellixity.frugal.access.exec.EntityNode;
import io.intellixity.frugal.access.handle.ResourceHandle;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.query.aggregation.AggregateOp;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.FieldDef;
import io.intellixity.frugal.access.schema.FieldType;
import io.intellixity.frugal.access.spi.store.*;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Mongo store using the official MongoDB Java sync driver. Each call is one {@code find} or one {@code aggregate}.
 * The caller's remaining time becomes the server-side {@code maxTimeMS}.
 */
public final class MongoDataStore extends AbstractDataStore<MongoStatement> {
  private static final Logger log = LoggerFactory.getLogger(MongoDataStore.class);

  /** {@link io.intellixity.frugal.access.handle.ResourceConfig} property naming the database. */
  public static final String DATABASE = "database";

  private final String id;
  private final ResourceHandle<MongoClient> handle;
  private final MongoDatabase db;

  public MongoDataStore(ResourceHandle<MongoClient> handle, MongoDialect dialect) {
    this(Objects.requireNonNull(handle, "handle").kind(), handle,
        handle.config().string(DATABASE, null), dialect);
  }

  public MongoDataStore(String id, ResourceHandle<MongoClient> handle, String database, MongoDialect dialect) {
    super(dialect);
    this.id = Objects.requireNonNull(id, "id");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.db = handle.client().getDatabase(Objects.requireNonNull(database, "database"));
  }

  @Override
  public String id() { return id; }

  @Override
  protected List<Map<String, Object>> executeSelect(MongoStatement st, SelectRequest request, Deadline deadline) {
    return run("find", st, deadline, d -> fields(request.schema(), request.fields(), d));
  }

  @Override
  protected List<EntityNode> executeComposed(MongoStatement st, ComposedRequest request, Deadline deadline) {
    SelectRequest root = request.root();
    return run("aggregate", st, deadline, d -> {
      Map<String, List<Map<String, Object>>> related = new LinkedHashMap<>();
      for (RelationFetch rf : request.relations()) {
        List<Map<String, Object>> rows = new ArrayList<>();
        Object joined = d.get(rf.relation().name());
        if (joined instanceof List<?> l) {
          for (Object o : l) {
            if (o instanceof Document child) rows.add(fields(rf.target(), rf.fields(), child));
          }
        }
        related.put(rf.relation().name(), rows);
      }
      return new EntityNode(fields(root.schema(), root.fields(), d), related);
    });
  }

  @Override
  protected List<Map<String, Object>> executeAggregate(MongoStatement st, AggregateRequest request, Deadline deadline) {
    List<Map<String, Object>> rows = run("aggregate", st, deadline, d -> aggregateRow(request, d));
    // $group emits nothing for an empty input; an ungrouped aggregate still answers one row
    if (rows.isEmpty() && !request.grouped()) {
      Map<String, Object> empty = new LinkedHashMap<>();
      for (Aggregate a : request.aggregates()) empty.put(a.alias(), a.op() == AggregateOp.COUNT ? 0L : null);
      return List.of(empty);
    }
    return rows;
  }

  private <T> List<T> run(String op, MongoStatement st, Deadline deadline, Function<Document, T> mapper) {
    MongoCollection<Document> col = db.getCollection(st.collection());
    long start = System.nanoTime();
    debugStatement(op, st);

    MongoIterable<Document> docs;
    Duration left = deadline.remaining();
    if (st.kind() == MongoStatement.Kind.AGGREGATE) {
      AggregateIterable<Document> agg = col.aggregate(st.pipeline());
      if (left != null) agg = agg.maxTime(Math.max(1, left.toMillis()), TimeUnit.MILLISECONDS);
      docs = agg;
    } else {
      FindIterable<Document> find = col.find(st.filter()).projection(st.projection());
      if (st.sort() != null && !st.sort().isEmpty()) find = find.sort(st.sort());
      if (st.skip() != null) find = find.skip(st.skip());
      if (st.limit() != null) find = find.limit(st.limit());
      if (left != null) find = find.maxTime(Math.max(1, left.toMillis()), TimeUnit.MILLISECONDS);
      docs = find;
    }

    List<T> out = new ArrayList<>();
    try (MongoCursor<Document> cur = docs.iterator()) {
      while (cur.hasNext()) {
        if (deadline.cancellation().isCancelled()) throw new CancellationException("call cancelled during " + op + " on store '" + id + "'");
        out.add(mapper.apply(cur.next()));
      }
    } catch (MongoExecutionTimeoutException e) {
      throw new CallTimeoutException("Store '" + id + "' " + op + " exceeded maxTimeMS", e);
    } catch (MongoException e) {
      throw new DataStoreException("Store '" + id + "' " + op + " on '" + st.collection() + "' failed: " + e.getMessage(), e);
    }
    if (log.isDebugEnabled()) {
      log.debug("frugal.mongo_done op={} collection={} docs={} durationMs={}",
          op, st.collection(), out.size(), (System.nanoTime() - start) / 1_000_000.0);
    }
    return out;
  }

  private static Map<String, Object> fields(EntitySchema schema, List<String> fields, Document d) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (String f : fields) {
      FieldDef def = schema.fields().get(f);
      row.put(f, MongoValues.read(def == null ? null : def.type(), d.get(f)));
    }
    return row;
  }

  private static Map<String, Object> aggregateRow(AggregateRequest req, Document d) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (String g : req.groupBy()) {
      FieldDef def = req.schema().fields().get(g);
      row.put(g, MongoValues.read(def == null ? null : def.type(), d.get(g)));
    }
    for (Aggregate a : req.aggregates()) row.put(a.alias(), aggregateValue(req.schema(), a, d.get(a.alias())));
    return row;
  }

  private static Object aggregateValue(EntitySchema schema, Aggregate a, Object v) {
    if (v == null) return null;
    FieldDef def = (a.field() == null) ? null : schema.fields().get(a.field());
    return switch (a.op()) {
      case COUNT -> (Object) ((Number) v).longValue();
      case AVG -> (Object) (v instanceof Number n ? n.doubleValue() : MongoValues.decimal(v).doubleValue());
      case SUM -> (def != null && (def.type() == FieldType.INT
          || def.type() == FieldType.LONG))
          ? (Object) ((Number) v).longValue()
          : MongoValues.read(def == null ? null : def.type(), v);
      case MIN, MAX -> MongoValues.read(def == null ? null : def.type(), v);
    };
  }

  private void debugStatement(String op, MongoStatement st) {
    if (!log.isDebugEnabled()) return;
    log.debug("frugal.mongo op={} kind={} handleId={} collection={} filter={} pipelineStages={}",
        op, st.kind(), handle.id(), st.collection(),
        st.filter() == null ? "null" : st.filter().keySet(),
        st.pipeline() == null ? 0 : st.pipeline().size());
  }
}
