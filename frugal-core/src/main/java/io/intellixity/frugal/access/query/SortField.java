package io.intellixity.frugal.access.query;

import java.util.Objects;

public record SortField(String field, Direction direction) {
  public SortField {
    Objects.requireNonNull(field, "field");
    direction = (direction == null) ? Direction.ASC : direction;
  }

  public static SortField asc(String field) { return new SortField(field, Direction.ASC); }
  public static SortField desc(String field) { return new SortField(field, Direction.DESC); }

  public enum Direction { ASC, DESC }
}
