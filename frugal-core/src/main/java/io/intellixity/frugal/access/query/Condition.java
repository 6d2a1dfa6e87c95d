package io.intellixity.frugal.access.query;

import java.util.*;

public final class Condition implements QueryElement {
  private final String property;
  private final Operator operator;
  private final Object value;
  private final Object lower;
  private final Object upper;
  private final boolean not;

  public Condition(String property, Operator operator, Object value, Object lower, Object upper, boolean not) {
    this.property = Objects.requireNonNull(property, "property");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = value;
    this.lower = lower;
    this.upper = upper;
    this.not = not;
  }

  public String property() { return property; }
  public Operator operator() { return operator; }
  public Object value() { return value; }
  public Object lower() { return lower; }
  public Object upper() { return upper; }
  public boolean not() { return not; }

  public Condition negate() {
    return new Condition(property, operator, value, lower, upper, !not);
  }

  /** Copy with resolved value/lower/upper (used when substituting params). */
  public Condition withValues(Object value, Object lower, Object upper) {
    return new Condition(property, operator, value, lower, upper, not);
  }

  @Override
  public <Q> Q accept(QueryVisitor<Q> visitor) { return visitor.visit(this); }

  public static Condition of(String property, Operator operator, Object value) {
    return new Condition(property, operator, value, null, null, false);
  }

  public static Condition range(String property, Object lower, Object upper) {
    return new Condition(property, Operator.RANGE, null, lower, upper, false);
  }

  /** Part/value pair of a {@link Operator#DATE_PART_EQ} condition. */
  public DatePartValue datePart() {
    if (operator != Operator.DATE_PART_EQ) throw new IllegalStateException("Not a DATE_PART_EQ condition: " + operator);
    if (value instanceof DatePartValue dp) return dp;
    if (value instanceof Map<?,?> m) {
      Object part = m.get("part");
      Object v = m.get("value");
      if (part == null || v == null) throw new IllegalArgumentException("DATE_PART_EQ requires {part, value}");
      int n = (v instanceof Number num) ? num.intValue() : Integer.parseInt(String.valueOf(v));
      return new DatePartValue(DatePart.valueOf(String.valueOf(part).toUpperCase(Locale.ROOT)), n);
    }
    throw new IllegalArgumentException("DATE_PART_EQ requires {part, value}, got: " + value);
  }

  public record DatePartValue(DatePart part, int value) {
    public DatePartValue {
      Objects.requireNonNull(part, "part");
    }
  }

  public static Condition fromMap(Map<String,Object> m) {
    String property = String.valueOf(m.get("property"));
    Operator op = Operator.valueOf(String.valueOf(m.get("operator")).toUpperCase(Locale.ROOT));
    boolean not = Boolean.parseBoolean(String.valueOf(m.getOrDefault("not", "false")));

    Object value = QueryValues.maybeParam(m.get("value"));
    Object lower = QueryValues.maybeParam(m.get("lower"));
    Object upper = QueryValues.maybeParam(m.get("upper"));

    if (op == Operator.RANGE) {
      if (lower == null) lower = QueryValues.maybeParam(m.get("from"));
      if (upper == null) upper = QueryValues.maybeParam(m.get("to"));
      return new Condition(property, op, null, lower, upper, not);
    }

    return new Condition(property, op, value, null, null, not);
  }
}
