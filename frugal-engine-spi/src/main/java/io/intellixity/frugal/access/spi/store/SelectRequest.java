package io.intellixity.frugal.access.spi.store;

import io.intellixity.frugal.access.query.Page;
import io.intellixity.frugal.access.query.QueryElement;
import io.intellixity.frugal.access.query.SortField;
import io.intellixity.frugal.access.schema.EntitySchema;

import java.util.List;
import java.util.Objects;

/**
 * One single-entity read. {@code fields} is the complete column list sent to the store;
 * {@code filter} carries no unresolved params.
 */
public record SelectRequest(EntitySchema schema, List<String> fields, QueryElement filter, List<SortField> sort, Page page) {
  public SelectRequest {
    Objects.requireNonNull(schema, "schema");
    fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    if (fields.isEmpty()) throw new IllegalArgumentException("fields must not be empty");
    sort = List.copyOf(sort == null ? List.of() : sort);
  }

  public static SelectRequest of(EntitySchema schema, List<String> fields, QueryElement filter) {
    return new SelectRequest(schema, fields, filter, List.of(), null);
  }
}
