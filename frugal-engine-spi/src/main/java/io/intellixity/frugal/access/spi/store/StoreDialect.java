package io.intellixity.frugal.access.spi.store;

/**
 * Backend-specific rendering of store requests into native statements.
 * Rendering never touches the network.
 */
public interface StoreDialect<S extends NativeStatement> {
  String id();

  StoreCapabilities capabilities();

  S renderSelect(SelectRequest request);

  /** Only called when {@link StoreCapabilities#composition()} is true. */
  S renderComposed(ComposedRequest request);

  S renderAggregate(AggregateRequest request);
}
