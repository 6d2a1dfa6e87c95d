package io.intellixity.frugal.access.spi.store;

import io.intellixity.frugal.access.exec.Deadline;
import io.intellixity.frugal.access.exec.EntityNode;
import io.intellixity.frugal.access.exec.UnsupportedPushdownException;
import io.intellixity.frugal.access.spi.exec.PushdownValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Template-method base for stores.
 * <p>
 * Responsibilities:
 * - Reject requests the dialect cannot push down, before any round trip
 * - Render native statements through the {@link StoreDialect}
 * - Check the caller's deadline, then delegate execution to backend hooks
 */
public abstract class AbstractDataStore<S extends NativeStatement> implements DataStore {
  private static final Logger log = LoggerFactory.getLogger(AbstractDataStore.class);

  private final StoreDialect<S> dialect;

  protected AbstractDataStore(StoreDialect<S> dialect) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  protected final StoreDialect<S> dialect() { return dialect; }

  @Override
  public StoreCapabilities capabilities() { return dialect.capabilities(); }

  @Override
  public final List<Map<String, Object>> select(SelectRequest request, Deadline deadline) {
    PushdownValidator.requireFilter(id(), capabilities(), request.filter());
    S stmt = dialect.renderSelect(request);
    deadline.check();
    long t0 = System.nanoTime();
    List<Map<String, Object>> rows = executeSelect(stmt, request, deadline);
    trace("select", request.schema().type(), rows.size(), t0);
    return rows;
  }

  @Override
  public final List<EntityNode> selectComposed(ComposedRequest request, Deadline deadline) {
    if (!capabilities().composition()) throw new UnsupportedPushdownException(id(), "multi-entity composition");
    PushdownValidator.requireFilter(id(), capabilities(), request.root().filter());
    S stmt = dialect.renderComposed(request);
    deadline.check();
    long t0 = System.nanoTime();
    List<EntityNode> nodes = executeComposed(stmt, request, deadline);
    trace("selectComposed", request.root().schema().type(), nodes.size(), t0);
    return nodes;
  }

  @Override
  public final List<Map<String, Object>> aggregate(AggregateRequest request, Deadline deadline) {
    PushdownValidator.requireAggregate(id(), capabilities(), request);
    S stmt = dialect.renderAggregate(request);
    deadline.check();
    long t0 = System.nanoTime();
    List<Map<String, Object>> rows = executeAggregate(stmt, request, deadline);
    trace("aggregate", request.schema().type(), rows.size(), t0);
    return rows;
  }

  private void trace(String op, String type, int rows, long t0) {
    if (log.isDebugEnabled()) {
      log.debug("frugal.store id={} op={} type={} rows={} durationMs={}",
          id(), op, type, rows, (System.nanoTime() - t0) / 1_000_000);
    }
  }

  // --- Backend-specific hooks ---

  protected abstract List<Map<String, Object>> executeSelect(S stmt, SelectRequest request, Deadline deadline);

  protected abstract List<EntityNode> executeComposed(S stmt, ComposedRequest request, Deadline deadline);

  protected abstract List<Map<String, Object>> executeAggregate(S stmt, AggregateRequest request, Deadline deadline);
}
