package io.intellixity.frugal.access.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/** Canonical JSON serializer for {@link EntityQuery}. */
public final class EntityQueryJsonSerializer extends JsonSerializer<EntityQuery> {
  @Override
  public void serialize(EntityQuery q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    g.writeStringField("type", q.type());
    g.writeObjectField("fields", q.fields());

    if (!q.includes().isEmpty()) {
      g.writeArrayFieldStart("include");
      for (Include inc : q.includes()) {
        g.writeStartObject();
        g.writeStringField("relation", inc.relation());
        g.writeObjectField("fields", inc.fields());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeElement(q.filter(), g, serializers);
    }

    if (!q.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : q.sort()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.page() instanceof OffsetPage op) {
      g.writeObjectFieldStart("page");
      g.writeNumberField("offset", op.offset());
      g.writeNumberField("limit", op.limit());
      g.writeEndObject();
    }

    if (!q.params().isEmpty()) {
      g.writeObjectField("params", q.params());
    }

    g.writeEndObject();
  }

  private static void writeElement(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el == null) {
      g.writeNull();
      return;
    }

    if (el instanceof LogicalGroup lg) {
      String key = lg.clause() == Clause.OR ? "or" : "and";
      g.writeStartObject();
      g.writeArrayFieldStart(key);
      for (QueryElement child : lg.elements()) {
        writeElement(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof NotElement n) {
      g.writeStartObject();
      g.writeFieldName("not");
      writeElement(n.element(), g, serializers);
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      g.writeStartObject();
      g.writeObjectFieldStart(c.operator().name().toLowerCase());
      g.writeStringField("field", c.property());
      if (c.not()) g.writeBooleanField("not", true);
      switch (c.operator()) {
        case RANGE -> {
          g.writeFieldName("lower");
          writeValue(c.lower(), g, serializers);
          g.writeFieldName("upper");
          writeValue(c.upper(), g, serializers);
        }
        case IN, NIN -> {
          g.writeFieldName("values");
          serializers.defaultSerializeValue(c.value(), g);
        }
        case DATE_PART_EQ -> {
          Condition.DatePartValue dp = c.datePart();
          g.writeStringField("part", dp.part().name());
          g.writeNumberField("value", dp.value());
        }
        default -> {
          g.writeFieldName("value");
          writeValue(c.value(), g, serializers);
        }
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    throw new IllegalArgumentException("Unsupported QueryElement: " + el.getClass().getName());
  }

  private static void writeValue(Object v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (v instanceof QueryValues.Param p) {
      g.writeStartObject();
      g.writeStringField("param", p.name());
      g.writeEndObject();
      return;
    }
    serializers.defaultSerializeValue(v, g);
  }
}
