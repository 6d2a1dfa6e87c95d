package io.intellixity.frugal.access.spi.store;

/** Marker for backend-native statements (SQL + binds, Mongo pipeline...). */
public interface NativeStatement {
}
