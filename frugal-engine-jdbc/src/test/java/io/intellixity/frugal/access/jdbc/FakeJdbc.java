package io.intellixity.frugal.access.jdbc;

import javax.sql.DataSource;
import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Proxy;
import java.sql.*;
import java.util.*;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Scripted JDBC driver built from dynamic proxies; records statements, binds and timeouts. */
final class FakeJdbc {
  final List<String> sql = Collections.synchronizedList(new ArrayList<>());
  final List<Map<Integer, Object>> binds = Collections.synchronizedList(new ArrayList<>());
  final List<Integer> timeouts = Collections.synchronizedList(new ArrayList<>());
  final CountDownLatch executing = new CountDownLatch(1);
  private final CountDownLatch cancelled = new CountDownLatch(1);
  volatile int connections;
  volatile int cancels;

  private List<String> labels = List.of();
  private List<List<Object>> rows = List.of();
  private SQLException failure;
  private boolean blockUntilCancel;

  FakeJdbc returning(List<String> labels, List<List<Object>> rows) {
    this.labels = labels;
    this.rows = rows;
    return this;
  }

  FakeJdbc failingWith(SQLException e) {
    this.failure = e;
    return this;
  }

  FakeJdbc blockingUntilCancel() {
    this.blockUntilCancel = true;
    return this;
  }

  DataSource dataSource() {
    return proxy(DataSource.class, (p, m, a) -> {
      if (m.getName().equals("getConnection")) {
        connections++;
        return connection();
      }
      return objectMethod(p, m.getName(), a);
    });
  }

  private Connection connection() {
    return proxy(Connection.class, (p, m, a) -> switch (m.getName()) {
      case "prepareStatement" -> {
        sql.add((String) a[0]);
        yield statement();
      }
      case "close" -> null;
      default -> objectMethod(p, m.getName(), a);
    });
  }

  private PreparedStatement statement() {
    Map<Integer, Object> bound = new TreeMap<>();
    binds.add(bound);
    return proxy(PreparedStatement.class, (p, m, a) -> switch (m.getName()) {
      case "setQueryTimeout" -> {
        timeouts.add((Integer) a[0]);
        yield null;
      }
      case "setObject" -> {
        bound.put((Integer) a[0], a[1]);
        yield null;
      }
      case "executeQuery" -> {
        executing.countDown();
        if (blockUntilCancel) {
          cancelled.await(5, TimeUnit.SECONDS);
          throw new SQLException("canceling statement due to user request", "57014");
        }
        if (failure != null) throw failure;
        yield resultSet();
      }
      case "cancel" -> {
        cancels++;
        cancelled.countDown();
        yield null;
      }
      case "close" -> null;
      default -> objectMethod(p, m.getName(), a);
    });
  }

  private ResultSet resultSet() {
    int[] cursor = {-1};
    ResultSetMetaData md = proxy(ResultSetMetaData.class, (p, m, a) -> switch (m.getName()) {
      case "getColumnCount" -> labels.size();
      case "getColumnLabel" -> labels.get((Integer) a[0] - 1);
      default -> objectMethod(p, m.getName(), a);
    });
    return proxy(ResultSet.class, (p, m, a) -> switch (m.getName()) {
      case "next" -> ++cursor[0] < rows.size();
      case "getMetaData" -> md;
      case "getObject" -> rows.get(cursor[0]).get((Integer) a[0] - 1);
      case "getString" -> {
        Object v = rows.get(cursor[0]).get((Integer) a[0] - 1);
        yield v == null ? null : String.valueOf(v);
      }
      case "close" -> null;
      default -> objectMethod(p, m.getName(), a);
    });
  }

  private static Object objectMethod(Object proxy, String name, Object[] args) {
    return switch (name) {
      case "toString" -> "FakeJdbc proxy";
      case "hashCode" -> System.identityHashCode(proxy);
      case "equals" -> proxy == args[0];
      default -> throw new UnsupportedOperationException(name);
    };
  }

  @SuppressWarnings("unchecked")
  private static <T> T proxy(Class<T> type, InvocationHandler h) {
    return (T) Proxy.newProxyInstance(FakeJdbc.class.getClassLoader(), new Class<?>[]{type}, h);
  }
}
