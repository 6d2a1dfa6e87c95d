package io.intellixity.frugal.access.mongo;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import io.intellixity.frugal.access.handle.ResourceConfig;
import io.intellixity.frugal.access.registry.ResourceFactory;
import org.bson.UuidRepresentation;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * {@link MongoClient} as a shared resource. The client pools its own connections and is thread-safe,
 * so the registry keeps exactly one per kind.
 * <p>
 * Recognized properties: {@code database} (read by {@link MongoDataStore}), {@code maxPoolSize},
 * {@code connectTimeout}.
 */
public final class MongoClientFactory implements ResourceFactory<MongoClient> {
  public static final String NAME = "mongo";

  @Override public String name() { return NAME; }

  @Override public boolean threadSafe() { return true; }

  @Override
  public MongoClient create(ResourceConfig config) {
    return MongoClients.create(settings(config));
  }

  static MongoClientSettings settings(ResourceConfig config) {
    if (config.endpoint() == null || config.endpoint().isBlank()) {
      throw new IllegalArgumentException("Mongo connection string (endpoint) is required for kind '" + config.kind() + "'");
    }
    int maxPool = config.intValue("maxPoolSize", 100);
    long connectMs = config.duration("connectTimeout", Duration.ofSeconds(10)).toMillis();
    return MongoClientSettings.builder()
        .applyConnectionString(new ConnectionString(config.endpoint()))
        .applicationName("frugal-" + config.kind())
        .uuidRepresentation(UuidRepresentation.STANDARD)
        .applyToConnectionPoolSettings(b -> b.maxSize(maxPool))
        .applyToSocketSettings(b -> b.connectTimeout((int) connectMs, TimeUnit.MILLISECONDS))
        .build();
  }
}
