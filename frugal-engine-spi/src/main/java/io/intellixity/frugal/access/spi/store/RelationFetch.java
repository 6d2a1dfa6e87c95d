package io.intellixity.frugal.access.spi.store;

import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.Relation;

import java.util.List;
import java.util.Objects;

/** Related entity to attach to every root row; {@code fields} always contains the relation's foreign key. */
public record RelationFetch(Relation relation, EntitySchema target, List<String> fields) {
  public RelationFetch {
    Objects.requireNonNull(relation, "relation");
    Objects.requireNonNull(target, "target");
    fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    if (!fields.contains(relation.foreignKey())) {
      throw new IllegalArgumentException("fields of relation '" + relation.name() + "' must contain " + relation.foreignKey());
    }
  }
}
