package io.intellixity.frugal.access.schema;

import java.util.Collection;

/** Lookup of {@link EntitySchema} by entity type. */
public interface SchemaRegistry {
  /** @throws io.intellixity.frugal.access.query.QueryValidationException when the type is unknown */
  EntitySchema schema(String type);

  Collection<EntitySchema> all();
}
