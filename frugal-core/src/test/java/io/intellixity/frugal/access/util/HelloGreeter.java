package io.intellixity.frugal.access.util;

public final class HelloGreeter implements Greeter {
  @Override
  public String greet(String name) { return "hello " + name; }
}
