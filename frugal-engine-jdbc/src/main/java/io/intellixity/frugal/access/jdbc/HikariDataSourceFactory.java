package io.intellixity.frugal.access.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.frugal.access.handle.ResourceConfig;
import io.intellixity.frugal.access.registry.ResourceFactory;

import javax.sql.DataSource;
import java.time.Duration;

/**
 * HikariCP pool as a shared JDBC resource. The pool is thread-safe, so the registry keeps one per kind.
 * <p>
 * Recognized properties: {@code username}, {@code password}, {@code driverClassName},
 * {@code maximumPoolSize}, {@code connectionTimeout}, {@code readOnly}.
 */
public final class HikariDataSourceFactory implements ResourceFactory<DataSource> {
  public static final String NAME = "hikari";

  @Override public String name() { return NAME; }

  @Override public boolean threadSafe() { return true; }

  @Override
  public DataSource create(ResourceConfig config) {
    return new HikariDataSource(hikariConfig(config));
  }

  @Override
  public void close(DataSource client) {
    if (client instanceof HikariDataSource h) h.close();
  }

  static HikariConfig hikariConfig(ResourceConfig config) {
    if (config.endpoint() == null || config.endpoint().isBlank()) {
      throw new IllegalArgumentException("JDBC url (endpoint) is required for kind '" + config.kind() + "'");
    }
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("frugal-" + config.kind());
    hc.setJdbcUrl(config.endpoint());
    String user = config.string("username", null);
    if (user != null) hc.setUsername(user);
    String password = config.string("password", null);
    if (password != null) hc.setPassword(password);
    String driver = config.string("driverClassName", null);
    if (driver != null) hc.setDriverClassName(driver);
    hc.setMaximumPoolSize(config.intValue("maximumPoolSize", 10));
    hc.setConnectionTimeout(config.duration("connectionTimeout", Duration.ofSeconds(30)).toMillis());
    hc.setReadOnly(Boolean.parseBoolean(config.string("readOnly", "false")));
    // connections are opened on first use
    hc.setInitializationFailTimeout(-1);
    return hc;
  }
}
