package io.intellixity.frugal.access.schema;

import java.util.Objects;

/**
 * Named relation from one entity to another.
 * <p>
 * Related rows are those whose {@code foreignKey} equals the parent's {@code localKey}.
 */
public record Relation(String name, String targetType, String localKey, String foreignKey, Cardinality cardinality) {
  public Relation {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(targetType, "targetType");
    Objects.requireNonNull(localKey, "localKey");
    Objects.requireNonNull(foreignKey, "foreignKey");
    cardinality = (cardinality == null) ? Cardinality.MANY : cardinality;
  }

  public static Relation many(String name, String targetType, String localKey, String foreignKey) {
    return new Relation(name, targetType, localKey, foreignKey, Cardinality.MANY);
  }

  public static Relation one(String name, String targetType, String localKey, String foreignKey) {
    return new Relation(name, targetType, localKey, foreignKey, Cardinality.ONE);
  }
}
