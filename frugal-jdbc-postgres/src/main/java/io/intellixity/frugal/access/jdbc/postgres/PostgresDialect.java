package io.intellixity.frugal.access.jdbc.postgres;

import io.intellixity.frugal.access.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.frugal.access.jdbc.dialect.JdbcDialect;
import io.intellixity.frugal.access.query.DatePart;
import io.intellixity.frugal.access.query.OffsetPage;
import io.intellixity.frugal.access.schema.Cardinality;
import io.intellixity.frugal.access.spi.store.RelationFetch;
import io.intellixity.frugal.access.spi.store.StoreCapabilities;

import java.util.ArrayList;
import java.util.List;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides.\n
 * Relations are composed server-side: each one becomes a correlated {@code json_agg}/{@code json_build_object}
 * subquery column, so a root read with every include is a single statement.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  @Override public String id() { return "postgres"; }

  @Override
  public StoreCapabilities capabilities() {
    return StoreCapabilities.all();
  }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String applyOffsetPage(String sql, OffsetPage page) {
    return sql + " LIMIT " + page.limit() + " OFFSET " + page.offset();
  }

  /** Postgres DOW is 0 for Sunday. */
  @Override
  protected String renderDatePart(String expr, DatePart part, int value, boolean not, RenderCtx ctx) {
    String p = ctx.add(value);
    String sql = "EXTRACT(" + part.name() + " FROM " + expr + ") = " + p;
    return not ? "NOT (" + sql + ")" : sql;
  }

  @Override
  protected String renderRelationSubquery(RelationFetch fetch, String parentAlias, String childAlias) {
    List<String> pairs = new ArrayList<>();
    for (String f : fetch.fields()) {
      pairs.add("'" + f.replace("'", "''") + "', " + column(childAlias, f));
    }
    String object = "json_build_object(" + String.join(", ", pairs) + ")";
    String from = " FROM " + table(fetch.target()) + " " + childAlias
        + " WHERE " + column(childAlias, fetch.relation().foreignKey()) + " = " + column(parentAlias, fetch.relation().localKey());
    if (fetch.relation().cardinality() == Cardinality.ONE) {
      return "SELECT " + object + from + " LIMIT 1";
    }
    return "SELECT COALESCE(json_agg(" + object + "), '[]'::json)" + from;
  }
}
