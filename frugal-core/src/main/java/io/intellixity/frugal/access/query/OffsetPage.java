package io.intellixity.frugal.access.query;

public record OffsetPage(int offset, int limit) implements Page {
  public OffsetPage {
    if (limit <= 0) throw new IllegalArgumentException("limit must be > 0");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
  }

  public static OffsetPage first(int limit) { return new OffsetPage(0, limit); }
}
