package io.intellixity.fetchgraph.tabular;

import io.intellixity.fetchgraph.query.*;
import io.intellixity.fetchgraph.spi.exec.ColumnRef;
import io.intellixity.fetchgraph.spi.exec.JoinPlan;
import io.intellixity.fetchgraph.spi.exec.Values;

import java.util.Collection;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Compiles a filter tree into a predicate over joined rows, with SQL null semantics: a comparison that
 * touches a null cell is false, except the explicit {@code = null} / {@code != null} tests and an empty
 * {@code not_in}, which holds for every row.
 */
final class RowPredicates implements FilterVisitor<Predicate<int[]>> {
  private final JoinPlan plan;
  private final JoinedFrame frame;
  private final boolean caseSensitive;

  RowPredicates(JoinPlan plan, JoinedFrame frame, boolean caseSensitive) {
    this.plan = plan;
    this.frame = frame;
    this.caseSensitive = caseSensitive;
  }

  static Predicate<int[]> compile(FilterClause filter, JoinPlan plan, JoinedFrame frame, boolean caseSensitive) {
    if (filter == null) return r -> true;
    return filter.accept(new RowPredicates(plan, frame, caseSensitive));
  }

  @Override
  public Predicate<int[]> visit(LogicalFilter logical) {
    Predicate<int[]> acc = null;
    for (FilterClause c : logical.clauses()) {
      Predicate<int[]> p = c.accept(this);
      acc = (acc == null) ? p : (logical.op() == LogicalOp.AND ? acc.and(p) : acc.or(p));
    }
    if (acc != null) return acc;
    return logical.op() == LogicalOp.AND ? r -> true : r -> false;
  }

  @Override
  public Predicate<int[]> visit(ComparisonFilter c) {
    ColumnRef ref = plan.resolve(c.entity(), c.field());
    ComparisonOp op = c.op();
    Object operand = c.value();
    return r -> test(op, frame.value(r, ref), operand);
  }

  private boolean test(ComparisonOp op, Object cell, Object operand) {
    if (op == ComparisonOp.EQ && operand == null) return cell == null;
    if (op == ComparisonOp.NE && operand == null) return cell != null;
    if (op == ComparisonOp.NOT_IN && ((Collection<?>) operand).isEmpty()) return true;
    if (cell == null) return false;
    return switch (op) {
      case EQ -> operand != null && Values.equal(cell, operand);
      case NE -> operand != null && !Values.equal(cell, operand);
      case LT -> operand != null && Values.compare(cell, operand) < 0;
      case LE -> operand != null && Values.compare(cell, operand) <= 0;
      case GT -> operand != null && Values.compare(cell, operand) > 0;
      case GE -> operand != null && Values.compare(cell, operand) >= 0;
      case IN -> contains((Collection<?>) operand, cell);
      case NOT_IN -> notIn((Collection<?>) operand, cell);
      case LIKE, ILIKE, NOT_LIKE, NOT_ILIKE, STARTS, ENDS, NOT_STARTS, NOT_ENDS -> textMatch(op, cell, operand);
    };
  }

  private static boolean contains(Collection<?> values, Object cell) {
    for (Object v : values) {
      if (v != null && Values.equal(cell, v)) return true;
    }
    return false;
  }

  /** {@code x NOT IN (.., NULL)} is never true in SQL. */
  private static boolean notIn(Collection<?> values, Object cell) {
    for (Object v : values) {
      if (v == null || Values.equal(cell, v)) return false;
    }
    return true;
  }

  private boolean textMatch(ComparisonOp op, Object cell, Object operand) {
    boolean insensitive = op.alwaysCaseInsensitive() || !caseSensitive;
    String text = insensitive ? cell.toString().toLowerCase(Locale.ROOT) : cell.toString();
    String needle = insensitive ? operand.toString().toLowerCase(Locale.ROOT) : operand.toString();
    boolean hit = switch (op) {
      case STARTS, NOT_STARTS -> text.startsWith(needle);
      case ENDS, NOT_ENDS -> text.endsWith(needle);
      default -> text.contains(needle);
    };
    return op.isNegatedTextMatch() != hit;
  }
}
