package io.intellixity.frugal.access.jdbc.dialect;

import io.intellixity.frugal.access.jdbc.SqlStatement;
import io.intellixity.frugal.access.spi.store.StoreDialect;

/** Dialect for JDBC stores (statement rendering only). */
public interface JdbcDialect extends StoreDialect<SqlStatement> {
}
