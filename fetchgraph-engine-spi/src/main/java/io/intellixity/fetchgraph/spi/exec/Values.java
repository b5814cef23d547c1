package io.intellixity.fetchgraph.spi.exec;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

/**
 * Cell-value helpers shared by the engines: join/match key normalization and ordering across the numeric and
 * temporal types that JSON, JDBC and in-memory tables produce.
 */
public final class Values {
  private Values() {}

  /** Key form for hashing: numbers compare by value, so {@code 1}, {@code 1L} and {@code 1.0} share a key. */
  public static Object key(Object v) {
    if (v instanceof Number n) return decimal(n);
    if (v instanceof CharSequence cs) return cs.toString();
    return v;
  }

  /**
   * Total order over non-null values of comparable kinds. Numbers compare numerically; a date cell compares
   * with an ISO string operand by parsing it; mixed kinds fall back to their string forms.
   */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static int compare(Object a, Object b) {
    if (a instanceof Number x && b instanceof Number y) return decimal(x).compareTo(decimal(y));
    if (isTemporal(a) && b instanceof String s) {
      Object parsed = parseDate(s, a);
      return (parsed == null) ? a.toString().compareTo(s) : compare(a, parsed);
    }
    if (a instanceof String && isTemporal(b)) return -compare(b, a);
    if (a instanceof Comparable ca && a.getClass().isInstance(b)) return ca.compareTo(b);
    return String.valueOf(a).compareTo(String.valueOf(b));
  }

  public static boolean equal(Object a, Object b) {
    if (a == null || b == null) return a == b;
    return compare(a, b) == 0;
  }

  public static BigDecimal decimal(Number n) {
    if (n instanceof BigDecimal d) return d.stripTrailingZeros();
    if (n instanceof BigInteger i) return new BigDecimal(i).stripTrailingZeros();
    if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
      return BigDecimal.valueOf(n.longValue()).stripTrailingZeros();
    }
    return BigDecimal.valueOf(n.doubleValue()).stripTrailingZeros();
  }

  private static boolean isTemporal(Object v) {
    return v instanceof LocalDate || v instanceof LocalDateTime;
  }

  /** Null when {@code s} is not an ISO date or date-time. */
  private static Object parseDate(String s, Object like) {
    try {
      if (like instanceof LocalDate) return LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
      return s.length() == 10 ? LocalDate.parse(s).atStartOfDay() : LocalDateTime.parse(s.replace(' ', 'T'));
    } catch (DateTimeParseException e) {
      return null;
    }
  }
}
