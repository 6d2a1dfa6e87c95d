package io.intellixity.frugal.access.util;

public interface Greeter {
  String greet(String name);
}
