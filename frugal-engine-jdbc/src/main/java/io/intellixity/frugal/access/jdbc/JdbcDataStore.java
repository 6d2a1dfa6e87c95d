package io.intellixity.frugal.access.jdbc;

import io.intellixity.frugal.access.exec.CallTimeoutException;
import io.intellixity.frugal.access.exec.CancellationToken;
import io.intellixity.frugal.access.exec.DataStoreException;
import io.intellixity.frugal.access.exec.Deadline;
import io.intellixity.frugal.access.exec.EntityNode;
import io.intellixity.frugal.access.handle.ResourceHandle;
import io.intellixity.frugal.access.jdbc.dialect.JdbcDialect;
import io.intellixity.frugal.access.spi.store.AbstractDataStore;
import io.intellixity.frugal.access.spi.store.AggregateRequest;
import io.intellixity.frugal.access.spi.store.ComposedRequest;
import io.intellixity.frugal.access.spi.store.RelationFetch;
import io.intellixity.frugal.access.spi.store.SelectRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.util.*;
import java.util.concurrent.CancellationException;

/**
 * Store over a pooled {@link DataSource}. Every call borrows one connection and runs exactly one statement.
 * The caller's remaining time becomes the JDBC query timeout; cancelling the caller's token cancels the statement.
 */
public final class JdbcDataStore extends AbstractDataStore<SqlStatement> {
  private static final Logger log = LoggerFactory.getLogger(JdbcDataStore.class);

  private final String id;
  private final ResourceHandle<DataSource> handle;
  private final DataSource ds;

  public JdbcDataStore(ResourceHandle<DataSource> handle, JdbcDialect dialect) {
    this(Objects.requireNonNull(handle, "handle").kind(), handle, dialect);
  }

  public JdbcDataStore(String id, ResourceHandle<DataSource> handle, JdbcDialect dialect) {
    super(dialect);
    this.id = Objects.requireNonNull(id, "id");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.ds = handle.client();
  }

  @Override
  public String id() { return id; }

  @Override
  protected List<Map<String, Object>> executeSelect(SqlStatement ss, SelectRequest request, Deadline deadline) {
    return query("SELECT", ss, deadline, rows -> rows.fields(request.schema(), request.fields()));
  }

  @Override
  protected List<EntityNode> executeComposed(SqlStatement ss, ComposedRequest request, Deadline deadline) {
    SelectRequest root = request.root();
    return query("SELECT_COMPOSED", ss, deadline, rows -> {
      Map<String, List<Map<String, Object>>> related = new LinkedHashMap<>();
      for (RelationFetch rf : request.relations()) related.put(rf.relation().name(), rows.related(rf));
      return new EntityNode(rows.fields(root.schema(), root.fields()), related);
    });
  }

  @Override
  protected List<Map<String, Object>> executeAggregate(SqlStatement ss, AggregateRequest request, Deadline deadline) {
    return query("AGGREGATE", ss, deadline, rows -> rows.aggregate(request));
  }

  @FunctionalInterface
  private interface RowMapper<T> {
    T map(JdbcRows rows) throws SQLException;
  }

  private <T> List<T> query(String op, SqlStatement ss, Deadline deadline, RowMapper<T> mapper) {
    String jdbcSql = SqlParamCompiler.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql(op, ss, jdbcSql);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      ps.setQueryTimeout(deadline.remainingSecondsForJdbc());
      bindAll(ps, ss);
      try (CancellationToken.Registration ignored = deadline.cancellation().onCancel(() -> cancel(ps));
           ResultSet rs = ps.executeQuery()) {
        JdbcRows rows = new JdbcRows(rs);
        List<T> out = new ArrayList<>();
        while (rs.next()) out.add(mapper.map(rows));
        debugDone(op, out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLTimeoutException e) {
      throw new CallTimeoutException("Store '" + id + "' " + op + " exceeded query timeout", e);
    } catch (SQLException e) {
      if (deadline.cancellation().isCancelled()) {
        CancellationException ce = new CancellationException("call cancelled during " + op + " on store '" + id + "'");
        ce.initCause(e);
        throw ce;
      }
      throw new DataStoreException("Store '" + id + "' " + op + " failed: " + e.getMessage(), e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement stmt) throws SQLException {
    for (int i = 0; i < stmt.binds().size(); i++) {
      ps.setObject(i + 1, JdbcValues.bind(stmt.binds().get(i)));
    }
  }

  private void cancel(PreparedStatement ps) {
    try {
      ps.cancel();
    } catch (SQLException e) {
      log.warn("frugal.jdbc cancel_failed store={} handleId={}", id, handle.id(), e);
    }
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("frugal.jdbc op={} bindCount={} handleId={} endpoint={} sql={}",
        op, ss.binds().size(), handle.id(), handle.endpoint(), jdbcSql);

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : ss.binds()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("frugal.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, int rows, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("frugal.jdbc_done op={} rows={} durationMs={}", op, rows, durationNanos / 1_000_000.0);
  }
}
