package io.intellixity.frugal.access.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Logical fetch: target entity type, explicit projection list, related sub-entities to include,
 * plus optional filter/sort/page.
 * <p>
 * The projection list is mandatory; there is no implicit "select all".
 */
@JsonSerialize(using = EntityQueryJsonSerializer.class)
@JsonDeserialize(using = EntityQueryJsonDeserializer.class)
public final class EntityQuery {
  private final String type;
  private List<String> fields = new ArrayList<>();
  private List<Include> includes = new ArrayList<>();
  private QueryElement filter;
  private List<SortField> sort = new ArrayList<>();
  private Page page;
  private Map<String, Object> params = new LinkedHashMap<>();

  public EntityQuery(String type) {
    if (type == null || type.isBlank()) throw new IllegalArgumentException("type is required");
    this.type = type;
  }

  public String type() { return type; }
  public List<String> fields() { return fields; }
  public List<Include> includes() { return includes; }
  public QueryElement filter() { return filter; }
  public List<SortField> sort() { return sort; }
  public Page page() { return page; }
  /** Named params referenced by {@link QueryValues.Param} values in the filter. */
  public Map<String, Object> params() { return params; }

  public EntityQuery withFields(List<String> fields) { this.fields = new ArrayList<>(fields == null ? List.of() : fields); return this; }
  public EntityQuery withFields(String... fields) { return withFields(List.of(fields)); }
  public EntityQuery withIncludes(List<Include> includes) { this.includes = new ArrayList<>(includes == null ? List.of() : includes); return this; }
  public EntityQuery withInclude(Include include) { this.includes.add(Objects.requireNonNull(include, "include")); return this; }
  public EntityQuery withInclude(String relation, String... fields) { return withInclude(Include.of(relation, fields)); }
  public EntityQuery withFilter(QueryElement filter) { this.filter = filter; return this; }
  public EntityQuery withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public EntityQuery withPage(Page page) { this.page = page; return this; }
  public EntityQuery withParams(Map<String, Object> params) { this.params = new LinkedHashMap<>(params == null ? Map.of() : params); return this; }
  public EntityQuery withParam(String name, Object value) { this.params.put(name, value); return this; }

  public Object param(String name) {
    if (!params.containsKey(name)) throw new IllegalArgumentException("Missing query param: " + name);
    return params.get(name);
  }

  public boolean hasIncludes() { return !includes.isEmpty(); }

  public static EntityQuery of(String type, String... fields) {
    return new EntityQuery(type).withFields(fields);
  }

  @Override
  public String toString() {
    return "EntityQuery{type=" + type + ", fields=" + fields + ", includes=" + includes.size()
        + ", filter=" + (filter != null) + ", sort=" + sort.size() + ", page=" + page + "}";
  }
}
