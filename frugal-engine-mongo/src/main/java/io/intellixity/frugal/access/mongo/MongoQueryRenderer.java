package io.intellixity.frugal.access.mongo;

import io.intellixity.frugal.access.exec.UnsupportedPushdownException;
import io.intellixity.frugal.access.query.*;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.FieldDef;
import io.intellixity.frugal.access.schema.FieldType;
import org.bson.Document;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Renders filters ({@link QueryElement}) to MongoDB BSON ({@link Document}),
 * applying De Morgan for NOT groups and rewriting EQ/NE null to IS NULL/IS NOT NULL semantics.
 * <p>
 * Negated comparisons also require the field to be present, so a missing or null field never
 * matches a comparison in either polarity.
 */
final class MongoQueryRenderer {
  private MongoQueryRenderer() {}

  static Document toBson(String storeId, EntitySchema schema, QueryElement filter) {
    if (filter == null) return new Document();
    return render(storeId, schema, filter, false);
  }

  private static Document render(String storeId, EntitySchema schema, QueryElement el, boolean negate) {
    if (el == null) return new Document();

    if (el instanceof NotElement n) {
      return render(storeId, schema, n.element(), !negate);
    }

    if (el instanceof LogicalGroup g) {
      Clause clause = g.clause();
      if (clause == null) clause = Clause.AND;
      if (negate) clause = (clause == Clause.OR) ? Clause.AND : Clause.OR;

      List<Document> parts = new ArrayList<>();
      for (QueryElement child : g.elements()) {
        Document d = render(storeId, schema, child, negate);
        if (d != null && !d.isEmpty()) parts.add(d);
      }
      if (parts.isEmpty()) return new Document();
      if (parts.size() == 1) return parts.get(0);
      return new Document((clause == Clause.OR) ? "$or" : "$and", parts);
    }

    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported QueryElement in filter: " + el.getClass().getName());
    }

    String path = c.property();
    FieldDef field = schema.fields().get(path);
    if (field == null) {
      throw new QueryValidationException("Unknown field '" + path + "' in filter for entity '" + schema.type() + "'");
    }
    FieldType type = field.type();

    boolean not = c.not() ^ negate;
    Operator op = c.operator();
    boolean nullCheck = (op == Operator.EQ || op == Operator.NE) && c.value() == null;

    Document positive = switch (op) {
      case EQ -> (c.value() == null)
          ? new Document(path, null)
          : new Document(path, value(type, c.value()));
      case NE -> (c.value() == null)
          ? new Document(path, new Document("$ne", null))
          : new Document(path, new Document("$ne", value(type, c.value())));
      case GT -> new Document(path, new Document("$gt", value(type, requireNonNull(op, c.value()))));
      case GE -> new Document(path, new Document("$gte", value(type, requireNonNull(op, c.value()))));
      case LT -> new Document(path, new Document("$lt", value(type, requireNonNull(op, c.value()))));
      case LE -> new Document(path, new Document("$lte", value(type, requireNonNull(op, c.value()))));
      case IN -> new Document(path, new Document("$in", values(type, toList(c.value()))));
      case NIN -> new Document(path, new Document("$nin", values(type, toList(c.value()))));
      case RANGE -> new Document(path,
          new Document("$gte", value(type, requireNonNull("RANGE.lower", c.lower())))
              .append("$lte", value(type, requireNonNull("RANGE.upper", c.upper()))));
      case LIKE -> likePositive(path, String.valueOf(requireNonNull(op, c.value())));
      case DATE_PART_EQ -> throw new UnsupportedPushdownException(storeId, "operator DATE_PART_EQ on '" + path + "'");
    };

    if (!not) {
      // SQL NE/NIN never match null
      if ((op == Operator.NE && !nullCheck) || op == Operator.NIN) {
        return new Document("$and", List.of(new Document(path, new Document("$ne", null)), positive));
      }
      return positive;
    }
    if (nullCheck) return new Document("$nor", List.of(positive));
    return new Document("$and", List.of(
        new Document(path, new Document("$ne", null)),
        new Document("$nor", List.of(positive))));
  }

  private static Object requireNonNull(Object op, Object v) {
    if (v == null) throw new IllegalArgumentException(op + " requires non-null value");
    return v;
  }

  private static Document likePositive(String path, String likePattern) {
    // Translate SQL LIKE to regex. '%' -> '.*', '_' -> '.'
    StringBuilder re = new StringBuilder();
    re.append("^");
    for (int i = 0; i < likePattern.length(); i++) {
      char ch = likePattern.charAt(i);
      if (ch == '%') re.append(".*");
      else if (ch == '_') re.append(".");
      else re.append(Pattern.quote(String.valueOf(ch)));
    }
    re.append("$");
    return new Document(path, new Document("$regex", re.toString()));
  }

  private static Object value(FieldType type, Object raw) {
    return MongoValues.write(type, raw);
  }

  private static List<Object> values(FieldType type, List<Object> raw) {
    List<Object> out = new ArrayList<>(raw.size());
    for (Object r : raw) out.add(value(type, r));
    return out;
  }

  private static List<Object> toList(Object v) {
    if (v == null) return List.of();
    if (v instanceof Collection<?> c) return new ArrayList<>(c);
    return List.of(v);
  }
}
