package io.intellixity.frugal.access.spi.exec;

import io.intellixity.frugal.access.exec.CallOptions;
import io.intellixity.frugal.access.exec.Deadline;
import io.intellixity.frugal.access.exec.EntityGraph;
import io.intellixity.frugal.access.exec.EntityNode;
import io.intellixity.frugal.access.exec.UnsupportedPushdownException;
import io.intellixity.frugal.access.query.EntityQuery;
import io.intellixity.frugal.access.query.Include;
import io.intellixity.frugal.access.query.Operator;
import io.intellixity.frugal.access.query.QueryElement;
import io.intellixity.frugal.access.query.QueryFilters;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.Relation;
import io.intellixity.frugal.access.schema.SchemaRegistry;
import io.intellixity.frugal.access.spi.store.ComposedRequest;
import io.intellixity.frugal.access.spi.store.DataStore;
import io.intellixity.frugal.access.spi.store.RelationFetch;
import io.intellixity.frugal.access.spi.store.SelectRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Fetches a root entity and its included relations in the fewest round trips the store allows.
 * <p>
 * Composing stores answer everything in one round trip. Otherwise the root is read once and each
 * relation is read once, keyed by the distinct parent keys ({@code IN}), never once per row.
 * The round-trip count therefore depends on the number of relations requested, not on the row count.
 * <p>
 * Join keys are read when needed for stitching and removed again unless the caller asked for them.
 */
public final class BatchQueryPlanner {
  private static final Logger log = LoggerFactory.getLogger(BatchQueryPlanner.class);

  private final DataStore store;
  private final SchemaRegistry schemas;
  private final QueryValidationStrategy validation;

  public BatchQueryPlanner(DataStore store, SchemaRegistry schemas) {
    this(store, schemas, new DefaultQueryValidationStrategy());
  }

  public BatchQueryPlanner(DataStore store, SchemaRegistry schemas, QueryValidationStrategy validation) {
    this.store = Objects.requireNonNull(store, "store");
    this.schemas = Objects.requireNonNull(schemas, "schemas");
    this.validation = (validation == null) ? new DefaultQueryValidationStrategy() : validation;
  }

  public DataStore store() { return store; }

  public EntityGraph fetch(EntityQuery query) {
    return fetch(query, CallOptions.NONE);
  }

  public EntityGraph fetch(EntityQuery query, CallOptions options) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(options, "options");
    EntitySchema root = schemas.schema(query.type());
    validation.validateFetch(root, query, schemas);

    QueryElement filter = ParamResolver.resolve(query);
    PushdownValidator.requireFilter(store.id(), store.capabilities(), filter);

    List<String> requested = distinct(query.fields());
    List<PlannedInclude> includes = planIncludes(root, query.includes());
    if (!includes.isEmpty() && !store.capabilities().composition() && !store.capabilities().supports(Operator.IN)) {
      throw new UnsupportedPushdownException(store.id(), "keyed batch fetch (IN) of related entities");
    }

    List<String> rootFields = new ArrayList<>(requested);
    for (PlannedInclude p : includes) addIfAbsent(rootFields, p.relation().localKey());
    SelectRequest rootReq = new SelectRequest(root, rootFields, filter, query.sort(), query.page());

    Deadline deadline = options.start();
    long t0 = System.nanoTime();
    EntityGraph graph;
    if (includes.isEmpty()) {
      graph = rootsOnly(root, requested, store.select(rootReq, deadline));
    } else if (store.capabilities().composition()) {
      graph = composed(root, requested, includes, rootReq, deadline);
    } else {
      graph = perRelation(root, requested, includes, rootReq, deadline);
    }

    if (log.isDebugEnabled()) {
      log.debug("frugal.planner store={} type={} relations={} composed={} rows={} roundTrips={} durationMs={}",
          store.id(), root.type(), includes.size(), store.capabilities().composition(), graph.size(),
          graph.roundTrips(), (System.nanoTime() - t0) / 1_000_000);
    }
    return graph;
  }

  private EntityGraph rootsOnly(EntitySchema root, List<String> requested, List<Map<String, Object>> rows) {
    List<EntityNode> nodes = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) nodes.add(new EntityNode(keep(r, requested), Map.of()));
    return new EntityGraph(root.type(), nodes, 1);
  }

  private EntityGraph composed(EntitySchema root, List<String> requested, List<PlannedInclude> includes,
                               SelectRequest rootReq, Deadline deadline) {
    List<RelationFetch> fetches = new ArrayList<>(includes.size());
    for (PlannedInclude p : includes) fetches.add(p.fetch());
    List<EntityNode> raw = store.selectComposed(new ComposedRequest(rootReq, fetches), deadline);

    List<EntityNode> nodes = new ArrayList<>(raw.size());
    for (EntityNode n : raw) {
      Map<String, List<Map<String, Object>>> related = new LinkedHashMap<>();
      for (PlannedInclude p : includes) {
        related.put(p.relation().name(), keepAll(n.many(p.relation().name()), p.requested()));
      }
      nodes.add(new EntityNode(keep(n.fields(), requested), related));
    }
    return new EntityGraph(root.type(), nodes, 1);
  }

  private EntityGraph perRelation(EntitySchema root, List<String> requested, List<PlannedInclude> includes,
                                  SelectRequest rootReq, Deadline deadline) {
    List<Map<String, Object>> rows = store.select(rootReq, deadline);
    int roundTrips = 1;

    Map<String, Map<Object, List<Map<String, Object>>>> byRelation = new LinkedHashMap<>();
    for (PlannedInclude p : includes) {
      Relation rel = p.relation();
      Set<Object> keys = new LinkedHashSet<>();
      for (Map<String, Object> r : rows) {
        Object k = r.get(rel.localKey());
        if (k != null) keys.add(k);
      }
      Map<Object, List<Map<String, Object>>> grouped = new HashMap<>();
      byRelation.put(rel.name(), grouped);
      if (keys.isEmpty()) continue;

      SelectRequest req = SelectRequest.of(p.fetch().target(), p.fetch().fields(),
          QueryFilters.in(rel.foreignKey(), keys));
      List<Map<String, Object>> related = store.select(req, deadline);
      roundTrips++;
      for (Map<String, Object> r : related) {
        Object fk = JoinKeys.normalize(r.get(rel.foreignKey()));
        grouped.computeIfAbsent(fk, x -> new ArrayList<>()).add(keep(r, p.requested()));
      }
    }

    List<EntityNode> nodes = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) {
      Map<String, List<Map<String, Object>>> related = new LinkedHashMap<>();
      for (PlannedInclude p : includes) {
        Object k = JoinKeys.normalize(r.get(p.relation().localKey()));
        List<Map<String, Object>> matches = (k == null) ? List.of() : byRelation.get(p.relation().name()).getOrDefault(k, List.of());
        related.put(p.relation().name(), matches);
      }
      nodes.add(new EntityNode(keep(r, requested), related));
    }
    return new EntityGraph(root.type(), nodes, roundTrips);
  }

  private List<PlannedInclude> planIncludes(EntitySchema root, List<Include> includes) {
    List<PlannedInclude> out = new ArrayList<>(includes.size());
    Set<String> seen = new HashSet<>();
    for (Include inc : includes) {
      if (!seen.add(inc.relation())) continue;
      Relation rel = root.relation(inc.relation());
      EntitySchema target = schemas.schema(rel.targetType());
      List<String> requested = distinct(inc.fields());
      List<String> fetched = new ArrayList<>(requested);
      addIfAbsent(fetched, rel.foreignKey());
      out.add(new PlannedInclude(new RelationFetch(rel, target, fetched), requested));
    }
    return out;
  }

  private static List<String> distinct(List<String> fields) {
    return new ArrayList<>(new LinkedHashSet<>(fields));
  }

  private static void addIfAbsent(List<String> fields, String f) {
    if (!fields.contains(f)) fields.add(f);
  }

  private static Map<String, Object> keep(Map<String, Object> row, List<String> fields) {
    if (row.size() == fields.size() && row.keySet().containsAll(fields)) return row;
    Map<String, Object> out = new LinkedHashMap<>();
    for (String f : fields) out.put(f, row.get(f));
    return out;
  }

  private static List<Map<String, Object>> keepAll(List<Map<String, Object>> rows, List<String> fields) {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) out.add(keep(r, fields));
    return out;
  }

  private record PlannedInclude(RelationFetch fetch, List<String> requested) {
    Relation relation() { return fetch.relation(); }
  }
}
