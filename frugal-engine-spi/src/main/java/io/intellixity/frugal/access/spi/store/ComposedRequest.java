package io.intellixity.frugal.access.spi.store;

import java.util.List;
import java.util.Objects;

/** Root read plus every relation, answered by the store in a single round trip. */
public record ComposedRequest(SelectRequest root, List<RelationFetch> relations) {
  public ComposedRequest {
    Objects.requireNonNull(root, "root");
    relations = List.copyOf(relations == null ? List.of() : relations);
  }
}
