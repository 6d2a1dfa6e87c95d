package io.intellixity.frugal.access.spi.memory;

import io.intellixity.frugal.access.spi.store.NativeStatement;

/** The in-memory store evaluates requests directly; the statement just carries the request. */
public record InMemoryStatement(Object request) implements NativeStatement {
}
