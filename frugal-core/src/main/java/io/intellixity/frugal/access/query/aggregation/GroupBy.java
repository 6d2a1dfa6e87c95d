package io.intellixity.frugal.access.query.aggregation;

import java.util.*;

public record GroupBy(List<String> fields) {
  public GroupBy {
    fields = List.copyOf(fields == null ? List.of() : fields);
  }

  public static GroupBy of(String... fields) { return new GroupBy(List.of(fields)); }
}
