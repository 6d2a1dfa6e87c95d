package io.intellixity.frugal.access.jdbc.dialect;

import io.intellixity.frugal.access.exec.UnsupportedPushdownException;
import io.intellixity.frugal.access.jdbc.SqlStatement;
import io.intellixity.frugal.access.query.*;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.FieldDef;
import io.intellixity.frugal.access.schema.FieldType;
import io.intellixity.frugal.access.spi.store.*;

import java.util.*;

/**
 * JDBC-generic SQL dialect base.\n
 *
 * Provides common rendering for:\n
 * - select: explicit column list + QueryElement filter + sort + paging\n
 * - composed select: root select with one correlated subquery column per relation\n
 * - aggregate: aggregate functions with optional GROUP BY\n
 *
 * DB-specific dialects override hooks for quoting, paging, date parts and relation subqueries.\n
 * Columns are named after schema fields; {@link EntitySchema#source()} is the table.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final String ROOT_ALIAS = "r";

  protected static final class RenderCtx {
    private int n = 1;
    private final List<Object> binds = new ArrayList<>();

    public String add(Object value) {
      binds.add(value);
      return ":b" + (n++);
    }

    List<Object> binds() { return binds; }
  }

  @Override
  public StoreCapabilities capabilities() {
    return StoreCapabilities.all().withComposition(false).without(Operator.DATE_PART_EQ);
  }

  @Override
  public final SqlStatement renderSelect(SelectRequest req) {
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    for (String f : req.fields()) cols.add(quoteIdent(f));
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", cols))
        .append(" FROM ").append(table(req.schema()));
    appendWhere(sql, req.schema(), null, req.filter(), ctx);
    appendSort(sql, null, req.sort());
    return new SqlStatement(appendPage(sql.toString(), req.page()), ctx.binds());
  }

  @Override
  public final SqlStatement renderComposed(ComposedRequest req) {
    if (!capabilities().composition()) throw new UnsupportedPushdownException(id(), "multi-entity composition");
    SelectRequest root = req.root();
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    for (String f : root.fields()) cols.add(column(ROOT_ALIAS, f) + " AS " + quoteIdent(f));
    int i = 0;
    for (RelationFetch rf : req.relations()) {
      String expr = renderRelationSubquery(rf, ROOT_ALIAS, "c" + (i++));
      cols.add("(" + expr + ") AS " + quoteIdent(rf.relation().name()));
    }
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", cols))
        .append(" FROM ").append(table(root.schema())).append(' ').append(ROOT_ALIAS);
    appendWhere(sql, root.schema(), ROOT_ALIAS, root.filter(), ctx);
    appendSort(sql, ROOT_ALIAS, root.sort());
    return new SqlStatement(appendPage(sql.toString(), root.page()), ctx.binds());
  }

  @Override
  public final SqlStatement renderAggregate(AggregateRequest req) {
    RenderCtx ctx = new RenderCtx();
    List<String> cols = new ArrayList<>();
    for (String g : req.groupBy()) cols.add(quoteIdent(g));
    for (Aggregate a : req.aggregates()) {
      String col = (a.field() == null) ? null : quoteIdent(a.field());
      cols.add(aggregateExpr(a, col) + " AS " + quoteIdent(a.alias()));
    }
    StringBuilder sql = new StringBuilder("SELECT ")
        .append(String.join(", ", cols))
        .append(" FROM ").append(table(req.schema()));
    appendWhere(sql, req.schema(), null, req.filter(), ctx);
    if (req.grouped()) {
      List<String> groups = new ArrayList<>();
      for (String g : req.groupBy()) groups.add(quoteIdent(g));
      sql.append(" GROUP BY ").append(String.join(", ", groups));
    }
    appendSort(sql, null, req.sort());
    return new SqlStatement(appendPage(sql.toString(), req.page()), ctx.binds());
  }

  /**
   * Scalar subquery yielding the related rows of one parent row (JSON array for MANY, JSON object for ONE).
   * Only reached when {@link #capabilities()} reports composition.
   */
  protected String renderRelationSubquery(RelationFetch fetch, String parentAlias, String childAlias) {
    throw new UnsupportedPushdownException(id(), "multi-entity composition");
  }

  /** Date-part comparison. Default throws; dialects with EXTRACT support override. */
  protected String renderDatePart(String expr, DatePart part, int value, boolean not, RenderCtx ctx) {
    throw new UnsupportedPushdownException(id(), "operator DATE_PART_EQ");
  }

  protected String aggregateExpr(Aggregate a, String column) {
    return switch (a.op()) {
      case COUNT -> column == null ? "COUNT(*)" : "COUNT(" + column + ")";
      case SUM -> "SUM(" + column + ")";
      case AVG -> "AVG(" + column + ")";
      case MIN -> "MIN(" + column + ")";
      case MAX -> "MAX(" + column + ")";
    };
  }

  /** ANSI {@code OFFSET/FETCH}; dialects override (Postgres LIMIT/OFFSET). */
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql + " OFFSET " + page.offset() + " ROWS FETCH NEXT " + page.limit() + " ROWS ONLY";
  }

  protected abstract String quoteIdent(String ident);

  protected final String column(String qualifier, String field) {
    return (qualifier == null) ? quoteIdent(field) : qualifier + "." + quoteIdent(field);
  }

  /** Quotes each dot-separated part of a (possibly schema-qualified) table name. */
  protected final String table(EntitySchema schema) {
    String source = schema.source();
    if (source == null || source.isBlank()) {
      throw new IllegalArgumentException("EntitySchema has no source for JDBC: " + schema.type());
    }
    List<String> parts = new ArrayList<>();
    for (String p : source.split("\\.")) parts.add(quoteIdent(p));
    return String.join(".", parts);
  }

  /** Renders a filter scoped to {@code qualifier} (or unqualified) into {@code WHERE}-ready SQL; empty for no filter. */
  protected final String renderPredicate(EntitySchema schema, String qualifier, QueryElement el, RenderCtx ctx) {
    if (el == null) return "";
    String sql = renderPredicateSql(schema, qualifier, el, ctx, false);
    return sql == null ? "" : sql;
  }

  private void appendWhere(StringBuilder sql, EntitySchema schema, String qualifier, QueryElement filter, RenderCtx ctx) {
    String where = renderPredicate(schema, qualifier, filter, ctx);
    if (!where.isBlank()) sql.append(" WHERE ").append(where);
  }

  private void appendSort(StringBuilder sql, String qualifier, List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return;
    List<String> parts = new ArrayList<>();
    for (SortField sf : sort) {
      parts.add(column(qualifier, sf.field()) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC"));
    }
    sql.append(" ORDER BY ").append(String.join(", ", parts));
  }

  private String appendPage(String sql, Page page) {
    if (page == null) return sql;
    if (page instanceof OffsetPage op) return applyOffsetPage(sql, op);
    throw new IllegalArgumentException("Unsupported page type for dialect " + id() + ": " + page.getClass().getName());
  }

  private String renderPredicateSql(EntitySchema schema, String qualifier, QueryElement el, RenderCtx ctx, boolean negate) {
    if (el == null) return "";

    if (el instanceof NotElement n) {
      return renderPredicateSql(schema, qualifier, n.element(), ctx, !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (clause == null) clause = Clause.AND;
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;
      List<String> childSql = new ArrayList<>();
      for (QueryElement c : g.elements()) {
        String s = renderPredicateSql(schema, qualifier, c, ctx, negate);
        if (s == null || s.isBlank()) continue;
        childSql.add(s);
      }
      if (childSql.isEmpty()) return "";
      if (childSql.size() == 1) return childSql.get(0);
      String sep = (clause == Clause.OR) ? " OR " : " AND ";
      return "(" + String.join(sep, childSql) + ")";
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String property = c.property();
    FieldDef field = schema.fields().get(property);
    if (field == null) {
      throw new QueryValidationException("Unknown field '" + property + "' in filter for entity '" + schema.type() + "'");
    }
    String expr = column(qualifier, property);
    FieldType type = field.type();
    boolean not = c.not() ^ negate;
    Object value = c.value();

    return switch (c.operator()) {
      case EQ -> (value == null)
          ? nullCheckSql(expr, true, not)
          : unarySql(expr, "=", value, type, not, ctx);
      case NE -> (value == null)
          ? nullCheckSql(expr, false, not)
          : unarySql(expr, "<>", value, type, not, ctx);
      case GT -> unaryNonNull(expr, ">", value, type, not, ctx);
      case GE -> unaryNonNull(expr, ">=", value, type, not, ctx);
      case LT -> unaryNonNull(expr, "<", value, type, not, ctx);
      case LE -> unaryNonNull(expr, "<=", value, type, not, ctx);
      case LIKE -> unaryNonNull(expr, "LIKE", value, type, not, ctx);
      case IN -> listSql(expr, "IN", toList(value), type, not, ctx);
      case NIN -> listSql(expr, "NOT IN", toList(value), type, not, ctx);
      case RANGE -> {
        Object lo = c.lower();
        Object hi = c.upper();
        if (lo == null || hi == null) throw new IllegalArgumentException("RANGE requires non-null lower+upper for property '" + property + "'");
        yield betweenSql(expr, lo, hi, type, not, ctx);
      }
      case DATE_PART_EQ -> {
        Condition.DatePartValue dp = c.datePart();
        yield renderDatePart(expr, dp.part(), dp.value(), not, ctx);
      }
    };
  }

  private static String nullCheckSql(String expr, boolean isNull, boolean not) {
    String sql = expr + (isNull ? " IS NULL" : " IS NOT NULL");
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String unarySql(String expr, String op, Object value, FieldType type, boolean not, RenderCtx ctx) {
    String p = ctx.add(coerceScalar(type, value));
    String sql = expr + " " + op + " " + p;
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String unaryNonNull(String expr, String op, Object value, FieldType type, boolean not, RenderCtx ctx) {
    if (value == null) throw new IllegalArgumentException(op + " requires non-null value");
    return unarySql(expr, op, value, type, not, ctx);
  }

  private static String betweenSql(String expr, Object lower, Object upper, FieldType type, boolean not, RenderCtx ctx) {
    String p1 = ctx.add(coerceScalar(type, lower));
    String p2 = ctx.add(coerceScalar(type, upper));
    String sql = expr + " BETWEEN " + p1 + " AND " + p2;
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static String listSql(String expr, String op, List<Object> vals, FieldType type, boolean not, RenderCtx ctx) {
    // "IN ()" matches nothing, "NOT IN ()" everything
    boolean matchesAll = op.startsWith("NOT");
    if (vals.isEmpty()) return (matchesAll ^ not) ? "TRUE" : "FALSE";
    List<String> ph = new ArrayList<>();
    for (Object x : vals) ph.add(ctx.add(coerceScalar(type, x)));
    String sql = expr + " " + op + " (" + String.join(", ", ph) + ")";
    return not ? "NOT (" + sql + ")" : sql;
  }

  private static Object coerceScalar(FieldType type, Object value) {
    if (value == null || type == null) return value;
    if (type == FieldType.UUID && !(value instanceof UUID)) {
      return UUID.fromString(String.valueOf(value).trim());
    }
    return value;
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }
}
