package io.intellixity.frugal.access.schema;

import io.intellixity.frugal.access.query.QueryValidationException;

import java.util.*;

/**
 * Known shape of an entity: its physical source (table / collection), scalar fields and relations.
 */
public record EntitySchema(String type, String source, Map<String, FieldDef> fields, Map<String, Relation> relations) {
  public EntitySchema {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(source, "source");
    fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
    relations = Collections.unmodifiableMap(new LinkedHashMap<>(relations == null ? Map.of() : relations));
  }

  public boolean hasField(String name) { return fields.containsKey(name); }

  public FieldDef field(String name) {
    FieldDef f = fields.get(name);
    if (f == null) throw new QueryValidationException("Unknown field '" + name + "' for entity '" + type + "'");
    return f;
  }

  public Relation relation(String name) {
    Relation r = relations.get(name);
    if (r == null) throw new QueryValidationException("Unknown relation '" + name + "' for entity '" + type + "'");
    return r;
  }

  /** First field flagged as key, or null when the entity declares none. */
  public String keyField() {
    for (FieldDef f : fields.values()) {
      if (f.key()) return f.name();
    }
    return null;
  }

  public static Builder builder(String type, String source) { return new Builder(type, source); }

  public static final class Builder {
    private final String type;
    private final String source;
    private final Map<String, FieldDef> fields = new LinkedHashMap<>();
    private final Map<String, Relation> relations = new LinkedHashMap<>();

    private Builder(String type, String source) {
      this.type = type;
      this.source = source;
    }

    public Builder key(String name, FieldType t) { return field(FieldDef.key(name, t)); }
    public Builder field(String name, FieldType t) { return field(FieldDef.of(name, t)); }

    public Builder field(FieldDef f) {
      if (fields.putIfAbsent(f.name(), f) != null) throw new IllegalArgumentException("Duplicate field: " + f.name());
      return this;
    }

    public Builder relation(Relation r) {
      if (fields.containsKey(r.name())) throw new IllegalArgumentException("Relation name clashes with field: " + r.name());
      if (relations.putIfAbsent(r.name(), r) != null) throw new IllegalArgumentException("Duplicate relation: " + r.name());
      return this;
    }

    public EntitySchema build() { return new EntitySchema(type, source, fields, relations); }
  }
}
