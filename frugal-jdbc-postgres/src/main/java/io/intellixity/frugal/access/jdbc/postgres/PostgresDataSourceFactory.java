package io.intellixity.frugal.access.jdbc.postgres;

import io.intellixity.frugal.access.handle.ResourceConfig;
import io.intellixity.frugal.access.jdbc.HikariDataSourceFactory;
import io.intellixity.frugal.access.registry.ResourceFactory;
import org.postgresql.Driver;

import javax.sql.DataSource;

/** HikariCP pool pinned to the Postgres JDBC driver. */
public final class PostgresDataSourceFactory implements ResourceFactory<DataSource> {
  public static final String NAME = "postgres";

  private final HikariDataSourceFactory hikari = new HikariDataSourceFactory();

  @Override public String name() { return NAME; }

  @Override public boolean threadSafe() { return true; }

  @Override
  public DataSource create(ResourceConfig config) {
    return hikari.create(withDriver(config));
  }

  @Override
  public void close(DataSource client) {
    hikari.close(client);
  }

  static ResourceConfig withDriver(ResourceConfig config) {
    if (config.endpoint() == null || !config.endpoint().startsWith("jdbc:postgresql:")) {
      throw new IllegalArgumentException("Not a Postgres JDBC url for kind '" + config.kind() + "': " + config.endpoint());
    }
    return config.with("driverClassName", Driver.class.getName());
  }
}
