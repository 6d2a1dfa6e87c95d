package io.intellixity.frugal.access.schema;

import java.util.Objects;

/**
 * Scalar field of an entity.
 *
 * @param name   logical name, also the physical column/document key
 * @param type   scalar type
 * @param key    true for the entity's identity field
 */
public record FieldDef(String name, FieldType type, boolean key) {
  public FieldDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
  }

  public static FieldDef of(String name, FieldType type) { return new FieldDef(name, type, false); }
  public static FieldDef key(String name, FieldType type) { return new FieldDef(name, type, true); }
}
