package io.intellixity.frugal.access.jdbc;

import io.intellixity.frugal.access.spi.store.NativeStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rendered SQL with named placeholders ({@code :b1}, {@code :b2}...) and the values bound to them, in order.
 */
public record SqlStatement(String sql, List<Object> binds) implements NativeStatement {
  public SqlStatement {
    // binds may legitimately contain nulls, so no List.copyOf
    binds = Collections.unmodifiableList(new ArrayList<>(binds == null ? List.of() : binds));
  }
}
