package io.intellixity.frugal.examples.config;

import com.mongodb.client.MongoClient;
import io.intellixity.frugal.access.facade.DataStoreFactory;
import io.intellixity.frugal.access.facade.ResourceAccessFacade;
import io.intellixity.frugal.access.handle.ResourceConfig;
import io.intellixity.frugal.access.jdbc.JdbcDataStore;
import io.intellixity.frugal.access.jdbc.postgres.PostgresDataSourceFactory;
import io.intellixity.frugal.access.jdbc.postgres.PostgresDialect;
import io.intellixity.frugal.access.mongo.MongoClientFactory;
import io.intellixity.frugal.access.mongo.MongoDataStore;
import io.intellixity.frugal.access.mongo.MongoDialect;
import io.intellixity.frugal.access.queue.BackgroundOffloadQueue;
import io.intellixity.frugal.access.queue.QueueConfig;
import io.intellixity.frugal.access.queue.WorkerPool;
import io.intellixity.frugal.access.queue.WorkerPoolConfig;
import io.intellixity.frugal.access.registry.PoolConfig;
import io.intellixity.frugal.access.registry.SharedClientRegistry;
import io.intellixity.frugal.access.schema.SchemaRegistry;
import io.intellixity.frugal.access.telemetry.AccessTelemetry;
import io.intellixity.frugal.access.telemetry.Slf4jAccessTelemetry;
import io.intellixity.frugal.examples.domain.CatalogSchemas;
import io.intellixity.frugal.examples.jobs.SalesReportHandler;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(FrugalProperties.class)
public class FrugalExampleConfig {
  static final String CATALOG_DB = "catalog-db";
  static final String SALES_DB = "sales-db";

  @Bean
  public AccessTelemetry accessTelemetry() {
    return new Slf4jAccessTelemetry();
  }

  @Bean
  public SchemaRegistry schemaRegistry() {
    return CatalogSchemas.registry();
  }

  /** One registry per process; factories come from {@code META-INF/frugal.factories}. */
  @Bean(destroyMethod = "close")
  public SharedClientRegistry sharedClientRegistry(FrugalProperties props, AccessTelemetry telemetry) {
    SharedClientRegistry registry = new SharedClientRegistry(PoolConfig.DEFAULTS, telemetry).discoverFactories();

    FrugalProperties.Catalog c = props.getCatalog();
    if (c.getJdbcUrl() == null || c.getJdbcUrl().isBlank()) throw new IllegalStateException("frugal.catalog.jdbc-url is required");
    ResourceConfig catalog = ResourceConfig.of(CATALOG_DB, c.getJdbcUrl())
        .with("factory", PostgresDataSourceFactory.NAME)
        .with("maximumPoolSize", c.getMaximumPoolSize());
    if (c.getUsername() != null) catalog = catalog.with("username", c.getUsername());
    if (c.getPassword() != null) catalog = catalog.with("password", c.getPassword());
    registry.define(catalog);

    FrugalProperties.Sales s = props.getSales();
    if (s.mongoEnabled()) {
      registry.define(ResourceConfig.of(SALES_DB, s.getMongoUri())
          .with("factory", MongoClientFactory.NAME)
          .with(MongoDataStore.DATABASE, s.getDatabase()));
    }
    return registry;
  }

  @Bean(destroyMethod = "close")
  public BackgroundOffloadQueue reportQueue(FrugalProperties props, AccessTelemetry telemetry) {
    FrugalProperties.Queue q = props.getQueue();
    QueueConfig cfg = QueueConfig.of(q.getName())
        .withMaxRetries(q.getMaxRetries())
        .withLeaseTimeout(q.getLeaseTimeout());
    if (q.getJournal() != null && !q.getJournal().isBlank()) cfg = cfg.withJournal(Path.of(q.getJournal()), q.isFsync());
    return BackgroundOffloadQueue.inMemory(cfg, telemetry);
  }

  @Bean
  public ResourceAccessFacade resourceAccessFacade(SharedClientRegistry registry,
                                                   SchemaRegistry schemas,
                                                   BackgroundOffloadQueue reportQueue,
                                                   AccessTelemetry telemetry,
                                                   FrugalProperties props) {
    DataStoreFactory<DataSource> postgres = h -> new JdbcDataStore(h, new PostgresDialect());
    ResourceAccessFacade.Builder b = ResourceAccessFacade.builder(registry, schemas)
        .store(CATALOG_DB, postgres)
        .defaultStore(CATALOG_DB)
        .queue(reportQueue)
        .telemetry(telemetry);
    if (props.getSales().mongoEnabled()) {
      DataStoreFactory<MongoClient> mongo = h -> new MongoDataStore(h, new MongoDialect());
      b.store(SALES_DB, mongo).route(CatalogSchemas.SALE, SALES_DB);
    }
    return b.build();
  }

  @Bean(destroyMethod = "close")
  public WorkerPool reportWorkers(BackgroundOffloadQueue reportQueue, SalesReportHandler handler, FrugalProperties props) {
    return new WorkerPool(reportQueue, WorkerPoolConfig.DEFAULTS.withThreads(props.getQueue().getWorkers()))
        .register(SalesReportHandler.TYPE, handler)
        .start();
  }
}
