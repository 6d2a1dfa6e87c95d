package io.intellixity.frugal.access.spi.exec;

import io.intellixity.frugal.access.query.*;

import java.util.*;

/**
 * Substitutes {@link QueryValues.Param} placeholders with values from the query's params.
 * Returns the same tree instance when nothing changed.
 */
public final class ParamResolver {
  private ParamResolver() {}

  public static QueryElement resolve(EntityQuery query) {
    return resolve(query.filter(), query);
  }

  private static QueryElement resolve(QueryElement el, EntityQuery query) {
    if (el == null) return null;

    if (el instanceof NotElement n) {
      QueryElement child = resolve(n.element(), query);
      if (child == n.element()) return n;
      return (child == null) ? null : new NotElement(child);
    }

    if (el instanceof LogicalGroup g) {
      List<QueryElement> in = g.elements();
      List<QueryElement> out = null;
      for (int i = 0; i < in.size(); i++) {
        QueryElement c = in.get(i);
        QueryElement nc = resolve(c, query);
        if (nc == c) continue;
        if (out == null) out = new ArrayList<>(in);
        out.set(i, nc);
      }
      if (out == null) return g;
      out.removeIf(Objects::isNull);
      if (out.isEmpty()) return null;
      if (out.size() == 1) return out.get(0);
      return new LogicalGroup(g.clause(), out);
    }

    if (el instanceof Condition c) {
      Object v = eval(query, c.value());
      Object lo = eval(query, c.lower());
      Object hi = eval(query, c.upper());
      if (v == c.value() && lo == c.lower() && hi == c.upper()) return c;
      return c.withValues(v, lo, hi);
    }

    throw new IllegalArgumentException("Unsupported QueryElement: " + el.getClass().getName());
  }

  private static Object eval(EntityQuery query, Object v) {
    if (v == null) return null;
    if (v instanceof QueryValues.Param p) return query.param(p.name());
    if (v instanceof Collection<?> c) {
      List<Object> out = new ArrayList<>(c.size());
      boolean changed = false;
      for (Object x : c) {
        Object nx = eval(query, x);
        changed |= (nx != x);
        out.add(nx);
      }
      return changed ? out : v;
    }
    return v;
  }
}
