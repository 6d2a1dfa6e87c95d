package io.intellixity.frugal.access.spi.memory;

import io.intellixity.frugal.access.spi.store.*;

import java.util.Objects;

final class InMemoryDialect implements StoreDialect<InMemoryStatement> {
  private final StoreCapabilities capabilities;

  InMemoryDialect(StoreCapabilities capabilities) {
    this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
  }

  @Override public String id() { return "memory"; }
  @Override public StoreCapabilities capabilities() { return capabilities; }
  @Override public InMemoryStatement renderSelect(SelectRequest request) { return new InMemoryStatement(request); }
  @Override public InMemoryStatement renderComposed(ComposedRequest request) { return new InMemoryStatement(request); }
  @Override public InMemoryStatement renderAggregate(AggregateRequest request) { return new InMemoryStatement(request); }
}
