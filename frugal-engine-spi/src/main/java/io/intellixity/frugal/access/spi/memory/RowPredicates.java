package io.intellixity.frugal.access.spi.memory;

import io.intellixity.frugal.access.query.*;

import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/** Compiles a filter tree into a row predicate with SQL-like semantics (comparisons against NULL never match). */
final class RowPredicates implements QueryVisitor<Predicate<Map<String, Object>>> {
  static final RowPredicates INSTANCE = new RowPredicates();

  static Predicate<Map<String, Object>> of(QueryElement filter) {
    return (filter == null) ? r -> true : filter.accept(INSTANCE);
  }

  @Override
  public Predicate<Map<String, Object>> visit(LogicalGroup g) {
    List<Predicate<Map<String, Object>>> parts = new ArrayList<>();
    for (QueryElement e : g.elements()) parts.add(e.accept(this));
    if (g.clause() == Clause.OR) return r -> parts.stream().anyMatch(p -> p.test(r));
    return r -> parts.stream().allMatch(p -> p.test(r));
  }

  @Override
  public Predicate<Map<String, Object>> visit(NotElement n) {
    return n.element().accept(this).negate();
  }

  @Override
  public Predicate<Map<String, Object>> visit(Condition c) {
    String f = c.property();
    Object value = c.value();
    if (c.operator() == Operator.EQ && value == null) return r -> (r.get(f) == null) != c.not();
    if (c.operator() == Operator.NE && value == null) return r -> (r.get(f) != null) != c.not();

    Predicate<Object> test = switch (c.operator()) {
      case EQ -> v -> RowValues.same(v, value);
      case NE -> v -> !RowValues.same(v, value);
      case GT -> v -> RowValues.compare(v, value) > 0;
      case GE -> v -> RowValues.compare(v, value) >= 0;
      case LT -> v -> RowValues.compare(v, value) < 0;
      case LE -> v -> RowValues.compare(v, value) <= 0;
      case IN -> {
        List<Object> vals = toList(value);
        yield v -> vals.stream().anyMatch(x -> RowValues.same(v, x));
      }
      case NIN -> {
        List<Object> vals = toList(value);
        yield v -> vals.stream().noneMatch(x -> RowValues.same(v, x));
      }
      case RANGE -> {
        if (c.lower() == null || c.upper() == null) {
          throw new IllegalArgumentException("RANGE requires non-null lower+upper for property '" + f + "'");
        }
        yield v -> RowValues.compare(v, c.lower()) >= 0 && RowValues.compare(v, c.upper()) <= 0;
      }
      case LIKE -> {
        Pattern p = likePattern(String.valueOf(value));
        yield v -> p.matcher(String.valueOf(v)).matches();
      }
      case DATE_PART_EQ -> {
        Condition.DatePartValue dp = c.datePart();
        yield v -> RowValues.datePart(v, dp.part()) == dp.value();
      }
    };
    boolean not = c.not();
    return r -> {
      Object v = r.get(f);
      if (v == null) return false;
      return test.test(v) != not;
    };
  }

  /** SQL LIKE: {@code %} any run, {@code _} one character, everything else literal. */
  static Pattern likePattern(String like) {
    StringBuilder sb = new StringBuilder();
    StringBuilder lit = new StringBuilder();
    for (char ch : like.toCharArray()) {
      if (ch == '%' || ch == '_') {
        if (lit.length() > 0) {
          sb.append(Pattern.quote(lit.toString()));
          lit.setLength(0);
        }
        sb.append(ch == '%' ? ".*" : ".");
      } else {
        lit.append(ch);
      }
    }
    if (lit.length() > 0) sb.append(Pattern.quote(lit.toString()));
    return Pattern.compile(sb.toString(), Pattern.DOTALL);
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }
}
