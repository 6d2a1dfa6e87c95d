package io.intellixity.frugal.access.registry;

import io.intellixity.frugal.access.handle.ResourceConfig;

/** Discovered through META-INF/frugal.factories in tests. */
public final class EchoClientFactory implements ResourceFactory<String> {
  @Override public String name() { return "echo"; }
  @Override public String create(ResourceConfig config) { return "echo:" + config.endpoint(); }
  @Override public boolean threadSafe() { return true; }
}
