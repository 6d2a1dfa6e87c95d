package io.intellixity.frugal.access.jdbc;

import io.intellixity.frugal.access.schema.FieldType;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Timestamp;
import java.time.*;
import java.util.UUID;

/**
 * Converts driver values (and values decoded from JSON columns) into the Java types the schema declares.
 * DATE reads as {@link LocalDate}, TIMESTAMP as {@link Instant}.
 */
final class JdbcValues {
  private JdbcValues() {}

  static Object read(FieldType type, Object v) {
    if (v == null || type == null) return v;
    return switch (type) {
      case STRING -> (v instanceof String) ? v : String.valueOf(v);
      case INT -> (v instanceof Number n) ? (Object) n.intValue() : Integer.valueOf(String.valueOf(v).trim());
      case LONG -> (v instanceof Number n) ? (Object) n.longValue() : Long.valueOf(String.valueOf(v).trim());
      case DOUBLE -> (v instanceof Number n) ? (Object) n.doubleValue() : Double.valueOf(String.valueOf(v).trim());
      case DECIMAL -> decimal(v);
      case BOOLEAN -> (v instanceof Boolean) ? v : Boolean.valueOf(String.valueOf(v).trim());
      case DATE -> date(v);
      case TIMESTAMP -> instant(v);
      case UUID -> (v instanceof UUID) ? v : UUID.fromString(String.valueOf(v).trim());
    };
  }

  /** Value to hand to {@code PreparedStatement.setObject}. */
  static Object bind(Object v) {
    if (v instanceof Instant i) return Timestamp.from(i);
    if (v instanceof Enum<?> e) return e.name();
    return v;
  }

  static BigDecimal decimal(Object v) {
    if (v instanceof BigDecimal bd) return bd;
    if (v instanceof BigInteger bi) return new BigDecimal(bi);
    if (v instanceof Long || v instanceof Integer || v instanceof Short) return BigDecimal.valueOf(((Number) v).longValue());
    if (v instanceof Number n) return BigDecimal.valueOf(n.doubleValue());
    return new BigDecimal(String.valueOf(v).trim());
  }

  private static LocalDate date(Object v) {
    if (v instanceof LocalDate d) return d;
    if (v instanceof java.sql.Date d) return d.toLocalDate();
    if (v instanceof Timestamp t) return t.toLocalDateTime().toLocalDate();
    if (v instanceof LocalDateTime dt) return dt.toLocalDate();
    String s = String.valueOf(v).trim();
    return LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
  }

  private static Instant instant(Object v) {
    if (v instanceof Instant i) return i;
    if (v instanceof Timestamp t) return t.toInstant();
    if (v instanceof OffsetDateTime odt) return odt.toInstant();
    if (v instanceof LocalDateTime dt) return dt.toInstant(ZoneOffset.UTC);
    String s = String.valueOf(v).trim();
    try {
      return OffsetDateTime.parse(s).toInstant();
    } catch (DateTimeException e) {
      // JSON rendering of timestamp without time zone
      return LocalDateTime.parse(s).toInstant(ZoneOffset.UTC);
    }
  }
}
