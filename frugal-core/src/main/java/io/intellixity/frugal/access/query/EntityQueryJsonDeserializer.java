package io.intellixity.frugal.access.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.*;

import java.io.IOException;
import java.util.*;

/** Canonical JSON deserializer for {@link EntityQuery}. */
public final class EntityQueryJsonDeserializer extends JsonDeserializer<EntityQuery> {
  @Override
  public EntityQuery deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("EntityQuery JSON must be an object");

    String type = textOrNull(root.get("type"));
    if (type == null) throw new IllegalArgumentException("EntityQuery JSON requires 'type'");
    EntityQuery q = new EntityQuery(type);

    q.withFields(textList(root.get("fields")));

    JsonNode include = root.get("include");
    if (include != null && include.isArray()) {
      List<Include> out = new ArrayList<>();
      for (JsonNode x : include) {
        String rel = textOrNull(x.get("relation"));
        if (rel == null) throw new IllegalArgumentException("include entry requires 'relation'");
        out.add(new Include(rel, textList(x.get("fields"))));
      }
      q.withIncludes(out);
    }

    JsonNode params = root.get("params");
    if (params != null && params.isObject()) {
      @SuppressWarnings("unchecked")
      Map<String, Object> m = codec.treeToValue(params, Map.class);
      q.withParams(m);
    }

    JsonNode filter = root.get("filter");
    if (filter != null && !filter.isNull()) {
      q.withFilter(parseElement(filter, codec));
    }

    JsonNode sort = root.get("sort");
    if (sort != null && sort.isArray()) {
      List<SortField> fields = new ArrayList<>();
      for (JsonNode s : sort) {
        if (!s.isObject()) continue;
        String f = textOrNull(s.get("field"));
        String dir = textOrNull(s.get("dir"));
        if (f == null) continue;
        SortField.Direction d = (dir == null) ? SortField.Direction.ASC : SortField.Direction.valueOf(dir.toUpperCase(Locale.ROOT));
        fields.add(new SortField(f, d));
      }
      q.withSort(fields);
    }

    JsonNode page = root.get("page");
    if (page != null && page.isObject()) {
      q.withPage(new OffsetPage(intOrDefault(page.get("offset"), 0), intOrDefault(page.get("limit"), 50)));
    }

    return q;
  }

  private static QueryElement parseElement(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new IllegalArgumentException("Unsupported filter element: " + n);

    // Group forms: { "and": [ ... ] } / { "or": [ ... ] }
    if (n.has("and")) return new LogicalGroup(Clause.AND, parseChildren(n.get("and"), codec));
    if (n.has("or")) return new LogicalGroup(Clause.OR, parseChildren(n.get("or"), codec));

    if (n.has("not")) {
      QueryElement child = parseElement(n.get("not"), codec);
      return (child == null) ? null : new NotElement(child);
    }

    // Condition forms: { "eq": { field:..., value:..., not?:... } }
    Iterator<String> it = n.fieldNames();
    while (it.hasNext()) {
      String k = it.next();
      Operator op = tryOp(k);
      if (op == null) continue;
      JsonNode body = n.get(k);
      if (body == null || !body.isObject()) throw new IllegalArgumentException(k + " must be an object");
      return parseCondition(op, body, codec);
    }

    // Flat form: { operator: EQ, property: name, value: ... }
    @SuppressWarnings("unchecked")
    Map<String, Object> m = codec.treeToValue(n, Map.class);
    if (m.containsKey("operator") && m.containsKey("property")) return Condition.fromMap(m);

    throw new IllegalArgumentException("Unsupported filter element: " + n);
  }

  private static List<QueryElement> parseChildren(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || !arr.isArray()) return List.of();
    List<QueryElement> out = new ArrayList<>();
    for (JsonNode x : arr) {
      QueryElement e = parseElement(x, codec);
      if (e != null) out.add(e);
    }
    return out;
  }

  private static QueryElement parseCondition(Operator op, JsonNode body, ObjectCodec codec) throws IOException {
    String field = textOrNull(body.get("field"));
    if (field == null) throw new IllegalArgumentException(op + " requires field");
    boolean not = boolOrDefault(body.get("not"), false);

    return switch (op) {
      case RANGE -> new Condition(field, op, null,
          decodeValue(body.get("lower"), codec), decodeValue(body.get("upper"), codec), not);
      case IN, NIN -> new Condition(field, op, decodeValue(body.get("values"), codec), null, null, not);
      case DATE_PART_EQ -> {
        String part = textOrNull(body.get("part"));
        if (part == null) throw new IllegalArgumentException("date_part_eq requires part");
        DatePart dp = DatePart.valueOf(part.toUpperCase(Locale.ROOT));
        yield new Condition(field, op, new Condition.DatePartValue(dp, intOrDefault(body.get("value"), 0)), null, null, not);
      }
      default -> new Condition(field, op, decodeValue(body.get("value"), codec), null, null, not);
    };
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    // Param: {"param":"x"} or {"$param":"x"}
    if (v.isObject()) {
      JsonNode p = v.get("param");
      if (p == null) p = v.get("$param");
      if (p != null && p.isTextual()) return QueryValues.param(p.asText());
    }
    return codec.treeToValue(v, Object.class);
  }

  private static Operator tryOp(String key) {
    if (key == null) return null;
    for (Operator op : Operator.values()) {
      if (op.name().equalsIgnoreCase(key)) return op;
    }
    return null;
  }

  private static List<String> textList(JsonNode arr) {
    List<String> out = new ArrayList<>();
    if (arr == null || !arr.isArray()) return out;
    for (JsonNode x : arr) if (x.isTextual()) out.add(x.asText());
    return out;
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static int intOrDefault(JsonNode n, int def) {
    if (n == null || n.isNull()) return def;
    return n.isNumber() ? n.intValue() : Integer.parseInt(n.asText());
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    if (n == null || n.isNull()) return def;
    return n.isBoolean() ? n.booleanValue() : Boolean.parseBoolean(n.asText());
  }
}
