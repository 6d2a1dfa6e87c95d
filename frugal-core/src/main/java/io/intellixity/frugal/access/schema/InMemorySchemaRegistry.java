package io.intellixity.frugal.access.schema;

import io.intellixity.frugal.access.query.QueryValidationException;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemorySchemaRegistry implements SchemaRegistry {
  private final Map<String, EntitySchema> byType = new ConcurrentHashMap<>();

  public InMemorySchemaRegistry() {}

  public InMemorySchemaRegistry(Collection<EntitySchema> schemas) {
    for (EntitySchema s : schemas) register(s);
  }

  public static InMemorySchemaRegistry of(EntitySchema... schemas) {
    return new InMemorySchemaRegistry(List.of(schemas));
  }

  public InMemorySchemaRegistry register(EntitySchema schema) {
    Objects.requireNonNull(schema, "schema");
    byType.put(schema.type(), schema);
    return this;
  }

  @Override
  public EntitySchema schema(String type) {
    EntitySchema s = byType.get(type);
    if (s == null) throw new QueryValidationException("Unknown entity type: " + type);
    return s;
  }

  @Override
  public Collection<EntitySchema> all() {
    return List.copyOf(byType.values());
  }
}
