package io.intellixity.frugal.access.exec;

import java.util.List;
import java.util.Objects;

/**
 * Result of a batched fetch: root rows with related sub-entities attached.
 *
 * @param type       root entity type
 * @param nodes      root rows in store order
 * @param roundTrips data-source round trips spent building this graph
 */
public record EntityGraph(String type, List<EntityNode> nodes, int roundTrips) {
  public EntityGraph {
    Objects.requireNonNull(type, "type");
    nodes = List.copyOf(nodes == null ? List.of() : nodes);
  }

  public int size() { return nodes.size(); }
  public boolean isEmpty() { return nodes.isEmpty(); }
}
