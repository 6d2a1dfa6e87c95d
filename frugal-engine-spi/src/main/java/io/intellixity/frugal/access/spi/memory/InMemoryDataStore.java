package io.intellixity.frugal.access.spi.memory;

import io.intellixity.frugal.access.exec.Deadline;
import io.intellixity.frugal.access.exec.EntityNode;
import io.intellixity.frugal.access.query.OffsetPage;
import io.intellixity.frugal.access.query.Page;
import io.intellixity.frugal.access.query.SortField;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.spi.exec.JoinKeys;
import io.intellixity.frugal.access.spi.store.*;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Reference store holding rows in memory, keyed by {@link io.intellixity.frugal.access.schema.EntitySchema#source()}.
 * <p>
 * Behaves like a remote store: every call counts as one round trip, only requested columns are returned,
 * and capabilities are configurable so tests can model stores with and without composition.
 */
public final class InMemoryDataStore extends AbstractDataStore<InMemoryStatement> {
  private final String id;
  private final Map<String, List<Map<String, Object>>> tables = new ConcurrentHashMap<>();
  private final AtomicInteger roundTrips = new AtomicInteger();
  private final List<Object> requests = new CopyOnWriteArrayList<>();
  private volatile Duration latency = Duration.ZERO;

  public InMemoryDataStore(String id) {
    this(id, StoreCapabilities.all());
  }

  public InMemoryDataStore(String id, StoreCapabilities capabilities) {
    super(new InMemoryDialect(capabilities));
    this.id = Objects.requireNonNull(id, "id");
  }

  @Override
  public String id() { return id; }

  public InMemoryDataStore insert(String source, List<Map<String, Object>> rows) {
    List<Map<String, Object>> t = tables.computeIfAbsent(source, s -> new CopyOnWriteArrayList<>());
    for (Map<String, Object> r : rows) t.add(new LinkedHashMap<>(r));
    return this;
  }

  /** Simulated per-round-trip latency; the caller's deadline and cancellation still apply. */
  public InMemoryDataStore latency(Duration latency) {
    this.latency = Objects.requireNonNull(latency, "latency");
    return this;
  }

  public int roundTrips() { return roundTrips.get(); }

  /** Requests in the order they reached the store. */
  public List<Object> requests() { return List.copyOf(requests); }

  public void reset() {
    roundTrips.set(0);
    requests.clear();
  }

  @Override
  protected List<Map<String, Object>> executeSelect(InMemoryStatement stmt, SelectRequest req, Deadline deadline) {
    roundTrip(req, deadline);
    return project(read(req), req.fields());
  }

  @Override
  protected List<EntityNode> executeComposed(InMemoryStatement stmt, ComposedRequest req, Deadline deadline) {
    roundTrip(req, deadline);
    List<Map<String, Object>> roots = read(req.root());
    List<EntityNode> out = new ArrayList<>(roots.size());
    for (Map<String, Object> root : roots) {
      Map<String, List<Map<String, Object>>> related = new LinkedHashMap<>();
      for (RelationFetch rf : req.relations()) {
        Object key = JoinKeys.normalize(root.get(rf.relation().localKey()));
        List<Map<String, Object>> matches = new ArrayList<>();
        if (key != null) {
          for (Map<String, Object> r : table(rf.target().source())) {
            if (key.equals(JoinKeys.normalize(r.get(rf.relation().foreignKey())))) matches.add(r);
          }
        }
        related.put(rf.relation().name(), project(matches, rf.fields()));
      }
      out.add(new EntityNode(project(List.of(root), req.root().fields()).get(0), related));
    }
    return out;
  }

  @Override
  protected List<Map<String, Object>> executeAggregate(InMemoryStatement stmt, AggregateRequest req, Deadline deadline) {
    roundTrip(req, deadline);
    Predicate<Map<String, Object>> p = RowPredicates.of(req.filter());
    Map<List<Object>, List<Map<String, Object>>> groups = new LinkedHashMap<>();
    for (Map<String, Object> r : table(req.schema().source())) {
      if (!p.test(r)) continue;
      List<Object> key = new ArrayList<>(req.groupBy().size());
      for (String g : req.groupBy()) key.add(JoinKeys.normalize(r.get(g)));
      groups.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
    }
    if (groups.isEmpty() && !req.grouped()) groups.put(List.of(), List.of());

    List<Map<String, Object>> out = new ArrayList<>(groups.size());
    for (Map.Entry<List<Object>, List<Map<String, Object>>> e : groups.entrySet()) {
      Map<String, Object> row = new LinkedHashMap<>();
      List<Map<String, Object>> members = e.getValue();
      for (String g : req.groupBy()) row.put(g, members.get(0).get(g));
      for (Aggregate a : req.aggregates()) row.put(a.alias(), compute(a, members));
      out.add(row);
    }
    return page(sort(out, req.sort()), req.page());
  }

  private void roundTrip(Object request, Deadline deadline) {
    roundTrips.incrementAndGet();
    requests.add(request);
    Duration l = latency;
    if (l.isZero()) return;
    Duration left = deadline.remaining();
    long sleepMs = (left == null) ? l.toMillis() : Math.min(l.toMillis(), left.toMillis() + 1);
    try {
      Thread.sleep(sleepMs);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    deadline.check();
  }

  private List<Map<String, Object>> read(SelectRequest req) {
    Predicate<Map<String, Object>> p = RowPredicates.of(req.filter());
    List<Map<String, Object>> rows = new ArrayList<>();
    for (Map<String, Object> r : table(req.schema().source())) {
      if (p.test(r)) rows.add(r);
    }
    return page(sort(rows, req.sort()), req.page());
  }

  private List<Map<String, Object>> table(String source) {
    return tables.getOrDefault(source, List.of());
  }

  private static List<Map<String, Object>> project(List<Map<String, Object>> rows, List<String> fields) {
    List<Map<String, Object>> out = new ArrayList<>(rows.size());
    for (Map<String, Object> r : rows) {
      Map<String, Object> m = new LinkedHashMap<>();
      for (String f : fields) m.put(f, r.get(f));
      out.add(m);
    }
    return out;
  }

  private static List<Map<String, Object>> sort(List<Map<String, Object>> rows, List<SortField> sort) {
    if (sort.isEmpty()) return rows;
    Comparator<Map<String, Object>> cmp = null;
    for (SortField sf : sort) {
      Comparator<Map<String, Object>> c = Comparator.comparing(r -> r.get(sf.field()), RowValues.NULLS_LAST);
      if (sf.direction() == SortField.Direction.DESC) c = c.reversed();
      cmp = (cmp == null) ? c : cmp.thenComparing(c);
    }
    List<Map<String, Object>> out = new ArrayList<>(rows);
    out.sort(cmp);
    return out;
  }

  private static List<Map<String, Object>> page(List<Map<String, Object>> rows, Page page) {
    if (!(page instanceof OffsetPage op)) return rows;
    if (op.offset() >= rows.size()) return List.of();
    return rows.subList(op.offset(), Math.min(rows.size(), op.offset() + op.limit()));
  }

  private static Object compute(Aggregate a, List<Map<String, Object>> rows) {
    List<Object> vals = new ArrayList<>();
    for (Map<String, Object> r : rows) {
      Object v = (a.field() == null) ? Boolean.TRUE : r.get(a.field());
      if (v != null) vals.add(v);
    }
    return switch (a.op()) {
      case COUNT -> (long) vals.size();
      case MIN -> vals.stream().min(RowValues::compare).orElse(null);
      case MAX -> vals.stream().max(RowValues::compare).orElse(null);
      case SUM -> vals.isEmpty() ? null : sum(vals);
      case AVG -> vals.isEmpty() ? null : avg(vals);
    };
  }

  private static Object sum(List<Object> vals) {
    boolean integral = vals.stream().allMatch(v -> v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte);
    if (integral) return vals.stream().mapToLong(v -> ((Number) v).longValue()).sum();
    boolean decimal = vals.stream().anyMatch(v -> v instanceof BigDecimal);
    if (decimal) {
      BigDecimal s = BigDecimal.ZERO;
      for (Object v : vals) s = s.add(RowValues.toBigDecimal((Number) v));
      return s;
    }
    return vals.stream().mapToDouble(v -> ((Number) v).doubleValue()).sum();
  }

  private static Object avg(List<Object> vals) {
    BigDecimal s = BigDecimal.ZERO;
    for (Object v : vals) s = s.add(RowValues.toBigDecimal((Number) v));
    return s.divide(BigDecimal.valueOf(vals.size()), MathContext.DECIMAL64).doubleValue();
  }
}
