package io.intellixity.frugal.access.spi.memory;

import io.intellixity.frugal.access.query.DatePart;

import java.math.BigDecimal;
import java.time.*;
import java.time.temporal.TemporalAccessor;
import java.util.Comparator;

/** Value comparison and date-part extraction used by the in-memory store. */
final class RowValues {
  static final Comparator<Object> NULLS_LAST = Comparator.nullsLast(RowValues::compare);

  private RowValues() {}

  @SuppressWarnings({"unchecked", "rawtypes"})
  static int compare(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) return toBigDecimal(x).compareTo(toBigDecimal(y));
    if (a instanceof Comparable ca && a.getClass().isInstance(b)) return ca.compareTo(b);
    return String.valueOf(a).compareTo(String.valueOf(b));
  }

  static boolean same(Object a, Object b) {
    if (a == null || b == null) return a == b;
    return compare(a, b) == 0;
  }

  static BigDecimal toBigDecimal(Number n) {
    if (n instanceof BigDecimal bd) return bd;
    if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
    return new BigDecimal(n.toString());
  }

  /** DOW follows the SQL convention: Sunday = 0 ... Saturday = 6. */
  static int datePart(Object v, DatePart part) {
    LocalDate d = toLocalDate(v);
    return switch (part) {
      case YEAR -> d.getYear();
      case MONTH -> d.getMonthValue();
      case DAY -> d.getDayOfMonth();
      case DOW -> d.getDayOfWeek().getValue() % 7;
    };
  }

  private static LocalDate toLocalDate(Object v) {
    if (v instanceof LocalDate d) return d;
    if (v instanceof LocalDateTime dt) return dt.toLocalDate();
    if (v instanceof OffsetDateTime odt) return odt.toLocalDate();
    if (v instanceof ZonedDateTime zdt) return zdt.toLocalDate();
    if (v instanceof Instant i) return LocalDate.ofInstant(i, ZoneOffset.UTC);
    if (v instanceof java.util.Date ud) return LocalDate.ofInstant(ud.toInstant(), ZoneOffset.UTC);
    if (v instanceof TemporalAccessor ta) return LocalDate.from(ta);
    String s = String.valueOf(v);
    return s.length() > 10 ? LocalDateTime.parse(s).toLocalDate() : LocalDate.parse(s);
  }
}
