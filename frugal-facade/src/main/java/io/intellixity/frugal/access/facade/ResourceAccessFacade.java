package io.intellixity.frugal.access.facade;

import io.intellixity.frugal.access.exec.AggregateResult;
import io.intellixity.frugal.access.exec.CallOptions;
import io.intellixity.frugal.access.exec.EntityGraph;
import io.intellixity.frugal.access.exec.ProjectedRows;
import io.intellixity.frugal.access.handle.ResourceHandle;
import io.intellixity.frugal.access.query.EntityQuery;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.query.aggregation.GroupBy;
import io.intellixity.frugal.access.queue.BackgroundOffloadQueue;
import io.intellixity.frugal.access.queue.DeadLetterInspector;
import io.intellixity.frugal.access.queue.WorkItem;
import io.intellixity.frugal.access.queue.WorkItemId;
import io.intellixity.frugal.access.queue.WorkItemStatus;
import io.intellixity.frugal.access.registry.SharedClientRegistry;
import io.intellixity.frugal.access.schema.SchemaRegistry;
import io.intellixity.frugal.access.spi.exec.BatchQueryPlanner;
import io.intellixity.frugal.access.spi.exec.DefaultQueryValidationStrategy;
import io.intellixity.frugal.access.spi.exec.ProjectionExecutor;
import io.intellixity.frugal.access.spi.exec.QueryValidationStrategy;
import io.intellixity.frugal.access.spi.store.DataStore;
import io.intellixity.frugal.access.telemetry.AccessTelemetry;
import io.intellixity.frugal.access.telemetry.NoopAccessTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.function.ToIntFunction;

/**
 * Single entry point for request handlers.
 * <ul>
 *   <li>{@link #fetch} builds an entity graph through the {@link BatchQueryPlanner}</li>
 *   <li>{@link #project} and {@link #aggregate} push work down through the {@link ProjectionExecutor}</li>
 *   <li>{@link #offload} hands heavy work to the {@link BackgroundOffloadQueue} and returns at once</li>
 * </ul>
 * Each entity type is routed to a resource kind. Stores for registry-backed kinds are built on first use from
 * the kind's shared handle and cached, so no request ever constructs a client.
 */
public final class ResourceAccessFacade {
  private static final Logger log = LoggerFactory.getLogger(ResourceAccessFacade.class);

  private final SharedClientRegistry registry;
  private final SchemaRegistry schemas;
  private final QueryValidationStrategy validation;
  private final AccessTelemetry telemetry;
  private final BackgroundOffloadQueue queue;
  private final Map<String, String> routes;
  private final String defaultKind;
  private final Map<String, DataStoreFactory<?>> storeFactories;
  private final Map<String, Engines> engines = new ConcurrentHashMap<>();

  private ResourceAccessFacade(Builder b) {
    this.registry = b.registry;
    this.schemas = b.schemas;
    this.validation = b.validation;
    this.telemetry = b.telemetry;
    this.queue = b.queue;
    this.routes = Map.copyOf(b.routes);
    this.defaultKind = b.defaultKind;
    this.storeFactories = Map.copyOf(b.storeFactories);
    for (Map.Entry<String, DataStore> e : b.stores.entrySet()) {
      engines.put(e.getKey(), new Engines(e.getValue(), schemas, validation));
    }
  }

  public static Builder builder(SharedClientRegistry registry, SchemaRegistry schemas) {
    return new Builder(registry, schemas);
  }

  public SharedClientRegistry registry() { return registry; }
  public SchemaRegistry schemas() { return schemas; }

  // ---- reads ----

  public EntityGraph fetch(EntityQuery query) {
    return fetch(query, CallOptions.NONE);
  }

  public EntityGraph fetch(EntityQuery query, CallOptions options) {
    return measured("fetch", query.type(), EntityGraph::roundTrips,
        () -> enginesFor(query.type()).planner.fetch(query, options));
  }

  public ProjectedRows project(EntityQuery query) {
    return project(query, CallOptions.NONE);
  }

  public ProjectedRows project(EntityQuery query, CallOptions options) {
    return measured("project", query.type(), r -> 1,
        () -> enginesFor(query.type()).executor.project(query, options));
  }

  public AggregateResult aggregate(EntityQuery query, Aggregate aggregate) {
    return aggregate(query, aggregate, CallOptions.NONE);
  }

  public AggregateResult aggregate(EntityQuery query, Aggregate aggregate, CallOptions options) {
    return measured("aggregate", query.type(), r -> 1,
        () -> enginesFor(query.type()).executor.aggregate(query, aggregate, options));
  }

  public ProjectedRows aggregate(EntityQuery query, List<Aggregate> aggregates, GroupBy groupBy) {
    return aggregate(query, aggregates, groupBy, CallOptions.NONE);
  }

  public ProjectedRows aggregate(EntityQuery query, List<Aggregate> aggregates, GroupBy groupBy, CallOptions options) {
    return measured("aggregate", query.type(), r -> 1,
        () -> enginesFor(query.type()).executor.aggregate(query, aggregates, groupBy, options));
  }

  // ---- offload ----

  /** Durably enqueues the work and returns its id; the caller's cancellation does not reach it. */
  public WorkItemId offload(WorkItem item) {
    return measured("offload", item.type(), id -> 0, () -> requireQueue().enqueue(item));
  }

  public WorkItemId offload(String workType, Map<String, Object> payload) {
    return offload(WorkItem.of(workType, payload));
  }

  public Optional<WorkItemStatus> workStatus(WorkItemId id) {
    return requireQueue().status(id);
  }

  public DeadLetterInspector deadLetters() {
    return requireQueue().deadLetters();
  }

  // ---- internals ----

  private <R> R measured(String operation, String type, ToIntFunction<R> roundTrips, Supplier<R> call) {
    long start = System.nanoTime();
    boolean ok = false;
    int trips = 0;
    try {
      R result = call.get();
      trips = roundTrips.applyAsInt(result);
      ok = true;
      return result;
    } finally {
      telemetry.requestCompleted(operation, type, System.nanoTime() - start, trips, ok);
    }
  }

  private Engines enginesFor(String entityType) {
    String kind = routes.getOrDefault(entityType, defaultKind);
    if (kind == null) throw new IllegalArgumentException("No data store routed for entity type '" + entityType + "'");
    Engines e = engines.get(kind);
    if (e != null) return e;
    return engines.computeIfAbsent(kind, this::buildEngines);
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private Engines buildEngines(String kind) {
    DataStoreFactory factory = storeFactories.get(kind);
    if (factory == null) throw new IllegalArgumentException("No data store registered for resource kind '" + kind + "'");
    ResourceHandle<?> handle = registry.acquire(kind);
    DataStore store = factory.create(handle);
    log.info("frugal.facade store ready kind={} store={} handleId={}", kind, store.id(), handle.id());
    return new Engines(store, schemas, validation);
  }

  private BackgroundOffloadQueue requireQueue() {
    if (queue == null) throw new IllegalStateException("No background queue configured");
    return queue;
  }

  private static final class Engines {
    final BatchQueryPlanner planner;
    final ProjectionExecutor executor;

    Engines(DataStore store, SchemaRegistry schemas, QueryValidationStrategy validation) {
      this.planner = new BatchQueryPlanner(store, schemas, validation);
      this.executor = new ProjectionExecutor(store, schemas, validation);
    }
  }

  public static final class Builder {
    private final SharedClientRegistry registry;
    private final SchemaRegistry schemas;
    private QueryValidationStrategy validation = new DefaultQueryValidationStrategy();
    private AccessTelemetry telemetry = NoopAccessTelemetry.INSTANCE;
    private BackgroundOffloadQueue queue;
    private final Map<String, String> routes = new HashMap<>();
    private String defaultKind;
    private final Map<String, DataStoreFactory<?>> storeFactories = new HashMap<>();
    private final Map<String, DataStore> stores = new HashMap<>();

    private Builder(SharedClientRegistry registry, SchemaRegistry schemas) {
      this.registry = Objects.requireNonNull(registry, "registry");
      this.schemas = Objects.requireNonNull(schemas, "schemas");
    }

    /** Store for a registry-defined kind, built lazily from the kind's shared handle. */
    public <T> Builder store(String kind, DataStoreFactory<T> factory) {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(factory, "factory");
      if (stores.containsKey(kind) || storeFactories.putIfAbsent(kind, factory) != null) {
        throw new IllegalStateException("Data store already registered for kind: " + kind);
      }
      return this;
    }

    /** Ready-made store under a kind name (in-memory or externally managed stores). */
    public Builder store(String kind, DataStore store) {
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(store, "store");
      if (storeFactories.containsKey(kind) || stores.putIfAbsent(kind, store) != null) {
        throw new IllegalStateException("Data store already registered for kind: " + kind);
      }
      return this;
    }

    public Builder route(String entityType, String kind) {
      routes.put(Objects.requireNonNull(entityType, "entityType"), Objects.requireNonNull(kind, "kind"));
      return this;
    }

    /** Kind used for entity types without an explicit route. */
    public Builder defaultStore(String kind) {
      this.defaultKind = Objects.requireNonNull(kind, "kind");
      return this;
    }

    public Builder validation(QueryValidationStrategy validation) {
      this.validation = Objects.requireNonNull(validation, "validation");
      return this;
    }

    public Builder telemetry(AccessTelemetry telemetry) {
      this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
      return this;
    }

    public Builder queue(BackgroundOffloadQueue queue) {
      this.queue = Objects.requireNonNull(queue, "queue");
      return this;
    }

    public ResourceAccessFacade build() {
      Set<String> known = new HashSet<>(stores.keySet());
      known.addAll(storeFactories.keySet());
      for (Map.Entry<String, String> r : routes.entrySet()) {
        if (!known.contains(r.getValue())) {
          throw new IllegalStateException("Entity type '" + r.getKey() + "' routed to unknown kind '" + r.getValue() + "'");
        }
      }
      if (defaultKind != null && !known.contains(defaultKind)) {
        throw new IllegalStateException("Default store kind '" + defaultKind + "' is not registered");
      }
      return new ResourceAccessFacade(this);
    }
  }
}
