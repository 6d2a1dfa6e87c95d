package io.intellixity.frugal.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "frugal")
public class FrugalProperties {
  private final Catalog catalog = new Catalog();
  private final Sales sales = new Sales();
  private final Queue queue = new Queue();

  public Catalog getCatalog() { return catalog; }
  public Sales getSales() { return sales; }
  public Queue getQueue() { return queue; }

  /** Postgres database holding products, reviews and suppliers. */
  public static class Catalog {
    private String jdbcUrl;
    private String username;
    private String password;
    private int maximumPoolSize = 10;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  }

  /** Optional Mongo deployment for sales; when the uri is blank sales live in the catalog database. */
  public static class Sales {
    private String mongoUri;
    private String database = "frugal";

    public String getMongoUri() { return mongoUri; }
    public void setMongoUri(String mongoUri) { this.mongoUri = mongoUri; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }

    public boolean mongoEnabled() { return mongoUri != null && !mongoUri.isBlank(); }
  }

  public static class Queue {
    private String name = "reports";
    private String journal;
    private boolean fsync;
    private int maxRetries = 3;
    private Duration leaseTimeout = Duration.ofSeconds(30);
    private int workers = 2;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getJournal() { return journal; }
    public void setJournal(String journal) { this.journal = journal; }
    public boolean isFsync() { return fsync; }
    public void setFsync(boolean fsync) { this.fsync = fsync; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public Duration getLeaseTimeout() { return leaseTimeout; }
    public void setLeaseTimeout(Duration leaseTimeout) { this.leaseTimeout = leaseTimeout; }
    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }
  }
}
