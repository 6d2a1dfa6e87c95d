package io.intellixity.frugal.access.jdbc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.frugal.access.exec.DataStoreException;
import io.intellixity.frugal.access.query.aggregation.Aggregate;
import io.intellixity.frugal.access.schema.EntitySchema;
import io.intellixity.frugal.access.schema.FieldDef;
import io.intellixity.frugal.access.schema.FieldType;
import io.intellixity.frugal.access.spi.store.AggregateRequest;
import io.intellixity.frugal.access.spi.store.RelationFetch;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.*;

/** Reads result-set rows by column label into field maps typed after the schema. */
final class JdbcRows {
  private static final ObjectMapper JSON = new ObjectMapper()
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

  private final ResultSet rs;
  private Map<String, Integer> colIndex;

  JdbcRows(ResultSet rs) {
    this.rs = rs;
  }

  Map<String, Object> fields(EntitySchema schema, List<String> fields) throws SQLException {
    Map<String, Object> row = new LinkedHashMap<>();
    for (String f : fields) row.put(f, JdbcValues.read(typeOf(schema, f), raw(f)));
    return row;
  }

  /** Related rows of a composed select, rendered by the dialect as a JSON array (MANY) or object (ONE). */
  List<Map<String, Object>> related(RelationFetch fetch) throws SQLException {
    String label = fetch.relation().name();
    String json = rs.getString(indexOf(label));
    if (json == null || json.isBlank()) return List.of();
    Object decoded;
    try {
      decoded = JSON.readValue(json, Object.class);
    } catch (JsonProcessingException e) {
      throw new DataStoreException("Failed to decode JSON column '" + label + "'", e);
    }
    List<Map<String, Object>> out = new ArrayList<>();
    if (decoded instanceof Map<?, ?> m) {
      out.add(typed(fetch, m));
    } else if (decoded instanceof List<?> l) {
      for (Object o : l) {
        if (o instanceof Map<?, ?> m) out.add(typed(fetch, m));
      }
    } else if (decoded != null) {
      throw new DataStoreException("Not a JSON object or array in column '" + label + "': " + decoded.getClass().getName());
    }
    return out;
  }

  Map<String, Object> aggregate(AggregateRequest req) throws SQLException {
    Map<String, Object> row = new LinkedHashMap<>();
    for (String g : req.groupBy()) row.put(g, JdbcValues.read(typeOf(req.schema(), g), raw(g)));
    for (Aggregate a : req.aggregates()) row.put(a.alias(), aggregateValue(req.schema(), a, raw(a.alias())));
    return row;
  }

  private static Object aggregateValue(EntitySchema schema, Aggregate a, Object v) {
    if (v == null) return null;
    FieldType type = (a.field() == null) ? null : typeOf(schema, a.field());
    return switch (a.op()) {
      case COUNT -> (Object) ((Number) v).longValue();
      case AVG -> (Object) ((Number) v).doubleValue();
      case SUM -> (type == FieldType.INT || type == FieldType.LONG)
          ? (Object) ((Number) v).longValue()
          : JdbcValues.read(type, v);
      case MIN, MAX -> JdbcValues.read(type, v);
    };
  }

  private Map<String, Object> typed(RelationFetch fetch, Map<?, ?> src) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (String f : fetch.fields()) row.put(f, JdbcValues.read(typeOf(fetch.target(), f), src.get(f)));
    return row;
  }

  private static FieldType typeOf(EntitySchema schema, String field) {
    FieldDef f = schema.fields().get(field);
    return f == null ? null : f.type();
  }

  private Object raw(String label) throws SQLException {
    return rs.getObject(indexOf(label));
  }

  private int indexOf(String label) throws SQLException {
    if (colIndex == null) {
      colIndex = new HashMap<>();
      ResultSetMetaData md = rs.getMetaData();
      for (int i = 1; i <= md.getColumnCount(); i++) {
        colIndex.put(md.getColumnLabel(i), i);
      }
    }
    Integer i = colIndex.get(label);
    if (i == null) throw new DataStoreException("Unknown column label: " + label);
    return i;
  }
}
