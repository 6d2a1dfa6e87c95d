package io.intellixity.frugal.access.mongo;

import io.intellixity.frugal.access.schema.FieldType;
import org.bson.types.Decimal128;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.UUID;

/** Java values to and from BSON-friendly values. Dates are stored as BSON dates at UTC midnight. */
final class MongoValues {
  private MongoValues() {}

  static Object write(FieldType type, Object v) {
    if (v == null) return null;
    if (v instanceof LocalDate d) return Date.from(d.atStartOfDay(ZoneOffset.UTC).toInstant());
    if (v instanceof Instant i) return Date.from(i);
    if (v instanceof BigDecimal bd) return new Decimal128(bd);
    if (type == FieldType.UUID && !(v instanceof UUID)) return UUID.fromString(String.valueOf(v).trim());
    if (type == FieldType.DECIMAL && v instanceof Number n) return new Decimal128(new BigDecimal(n.toString()));
    if (v instanceof Enum<?> e) return e.name();
    return v;
  }

  static Object read(FieldType type, Object v) {
    if (v == null || type == null) return v;
    return switch (type) {
      case STRING -> (v instanceof String) ? v : String.valueOf(v);
      case INT -> (v instanceof Number n) ? (Object) n.intValue() : Integer.valueOf(String.valueOf(v).trim());
      case LONG -> (v instanceof Number n) ? (Object) n.longValue() : Long.valueOf(String.valueOf(v).trim());
      case DOUBLE -> (v instanceof Number n) ? (Object) n.doubleValue() : Double.valueOf(String.valueOf(v).trim());
      case DECIMAL -> decimal(v);
      case BOOLEAN -> (v instanceof Boolean) ? v : Boolean.valueOf(String.valueOf(v).trim());
      case DATE -> (v instanceof Date d) ? (Object) d.toInstant().atOffset(ZoneOffset.UTC).toLocalDate() : LocalDate.parse(String.valueOf(v));
      case TIMESTAMP -> (v instanceof Date d) ? (Object) d.toInstant() : Instant.parse(String.valueOf(v));
      case UUID -> (v instanceof UUID) ? v : UUID.fromString(String.valueOf(v).trim());
    };
  }

  static BigDecimal decimal(Object v) {
    if (v instanceof Decimal128 d) return d.bigDecimalValue();
    if (v instanceof BigDecimal bd) return bd;
    if (v instanceof Long || v instanceof Integer) return BigDecimal.valueOf(((Number) v).longValue());
    if (v instanceof Number n) return BigDecimal.valueOf(n.doubleValue());
    return new BigDecimal(String.valueOf(v).trim());
  }
}
