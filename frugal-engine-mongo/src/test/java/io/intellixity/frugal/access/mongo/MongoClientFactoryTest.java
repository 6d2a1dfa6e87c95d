package io.intellixity.frugal.access.mongo;

import com.mongodb.MongoClientSettings;
import io.intellixity.frugal.access.handle.ResourceConfig;
import org.bson.UuidRepresentation;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class MongoClientFactoryTest {
  @Test
  void mapsResourceConfigOntoClientSettings() {
    MongoClientSettings s = MongoClientFactory.settings(new ResourceConfig("catalog", "mongodb://localhost:27017",
        Map.of("database", "catalog", "maxPoolSize", 7)));
    assertEquals("frugal-catalog", s.getApplicationName());
    assertEquals(7, s.getConnectionPoolSettings().getMaxSize());
    assertEquals(UuidRepresentation.STANDARD, s.getUuidRepresentation());
  }

  @Test
  void requiresConnectionString() {
    assertThrows(IllegalArgumentException.class, () -> MongoClientFactory.settings(ResourceConfig.of("catalog", null)));
    assertTrue(new MongoClientFactory().threadSafe());
  }
}
