package io.intellixity.frugal.access.handle;

import java.time.Duration;
import java.util.*;

/**
 * Construction settings for one resource kind.
 *
 * @param kind       registry key (e.g. {@code "orders-db"})
 * @param endpoint   URL / connection string of the external system
 * @param properties factory-specific settings
 */
public record ResourceConfig(String kind, String endpoint, Map<String, Object> properties) {
  public ResourceConfig {
    Objects.requireNonNull(kind, "kind");
    if (kind.isBlank()) throw new IllegalArgumentException("kind is blank");
    properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties == null ? Map.of() : properties));
  }

  public static ResourceConfig of(String kind, String endpoint) {
    return new ResourceConfig(kind, endpoint, Map.of());
  }

  public ResourceConfig with(String key, Object value) {
    Map<String, Object> m = new LinkedHashMap<>(properties);
    m.put(key, value);
    return new ResourceConfig(kind, endpoint, m);
  }

  public String string(String key, String def) {
    Object v = properties.get(key);
    return v == null ? def : String.valueOf(v);
  }

  public int intValue(String key, int def) {
    Object v = properties.get(key);
    if (v == null) return def;
    return (v instanceof Number n) ? n.intValue() : Integer.parseInt(String.valueOf(v).trim());
  }

  public long longValue(String key, long def) {
    Object v = properties.get(key);
    if (v == null) return def;
    return (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
  }

  /** Millis as number, or ISO-8601 ({@code PT5S}). */
  public Duration duration(String key, Duration def) {
    Object v = properties.get(key);
    if (v == null) return def;
    if (v instanceof Duration d) return d;
    if (v instanceof Number n) return Duration.ofMillis(n.longValue());
    return Duration.parse(String.valueOf(v).trim());
  }
}
