package io.intellixity.frugal.access.jdbc.dialect;

/**
 * ANSI SQL dialect for any JDBC driver: double-quoted identifiers, {@code OFFSET/FETCH} paging.
 * No server-side composition and no date-part pushdown; relations are fetched in batched IN queries.
 */
public class GenericJdbcDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "jdbc"; }

  @Override
  protected String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
