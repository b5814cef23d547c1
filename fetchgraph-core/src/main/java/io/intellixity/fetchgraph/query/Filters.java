package io.intellixity.fetchgraph.query;

import java.util.*;

public final class Filters {
  private Filters() {}

  public static ComparisonFilter eq(String field, Object value) { return new ComparisonFilter(null, field, ComparisonOp.EQ, value); }
  public static ComparisonFilter ne(String field, Object value) { return new ComparisonFilter(null, field, ComparisonOp.NE, value); }
  public static ComparisonFilter gt(String field, Object value) { return new ComparisonFilter(null, field, ComparisonOp.GT, value); }
  public static ComparisonFilter ge(String field, Object value) { return new ComparisonFilter(null, field, ComparisonOp.GE, value); }
  public static ComparisonFilter lt(String field, Object value) { return new ComparisonFilter(null, field, ComparisonOp.LT, value); }
  public static ComparisonFilter le(String field, Object value) { return new ComparisonFilter(null, field, ComparisonOp.LE, value); }

  public static ComparisonFilter in(String field, Collection<?> values) { return new ComparisonFilter(null, field, ComparisonOp.IN, List.copyOf(values)); }
  public static ComparisonFilter notIn(String field, Collection<?> values) { return new ComparisonFilter(null, field, ComparisonOp.NOT_IN, List.copyOf(values)); }

  public static ComparisonFilter like(String field, String value) { return new ComparisonFilter(null, field, ComparisonOp.LIKE, value); }
  public static ComparisonFilter ilike(String field, String value) { return new ComparisonFilter(null, field, ComparisonOp.ILIKE, value); }
  public static ComparisonFilter starts(String field, String value) { return new ComparisonFilter(null, field, ComparisonOp.STARTS, value); }
  public static ComparisonFilter ends(String field, String value) { return new ComparisonFilter(null, field, ComparisonOp.ENDS, value); }

  public static ComparisonFilter on(String entity, String field, ComparisonOp op, Object value) {
    return new ComparisonFilter(entity, field, op, value);
  }

  public static LogicalFilter and(FilterClause... clauses) {
    return new LogicalFilter(LogicalOp.AND, List.of(clauses));
  }

  public static LogicalFilter or(FilterClause... clauses) {
    return new LogicalFilter(LogicalOp.OR, List.of(clauses));
  }

  /** Collapses a list of parts: none -> null, one -> itself, more -> AND. */
  public static FilterClause allOf(List<FilterClause> parts) {
    if (parts == null || parts.isEmpty()) return null;
    if (parts.size() == 1) return parts.get(0);
    return new LogicalFilter(LogicalOp.AND, parts);
  }
}
