package io.intellixity.frugal.access.query;

public interface Page {
  int limit();
}
