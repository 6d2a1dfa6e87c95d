package io.intellixity.frugal.access.facade;

import io.intellixity.frugal.access.handle.ResourceHandle;
import io.intellixity.frugal.access.spi.store.DataStore;

/** Builds the store for a resource kind once its shared handle exists. */
@FunctionalInterface
public interface DataStoreFactory<TClient> {
  DataStore create(ResourceHandle<TClient> handle);
}
