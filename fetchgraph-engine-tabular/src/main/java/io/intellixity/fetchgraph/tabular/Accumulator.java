package io.intellixity.fetchgraph.tabular;

import io.intellixity.fetchgraph.query.AggregationOp;
import io.intellixity.fetchgraph.spi.exec.Values;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.HashSet;
import java.util.Set;

/**
 * Running state of one aggregate over one group. Null inputs are skipped, as in SQL; {@code count(*)} is fed
 * a non-null marker per row.
 */
final class Accumulator {
  private final AggregationOp op;
  private long count;
  private Set<Object> distinct;
  private Object extreme;
  private long longSum;
  private BigDecimal decimalSum;
  private double doubleSum;
  private boolean sawDecimal;
  private boolean sawFloating;

  Accumulator(AggregationOp op) {
    this.op = op;
    if (op == AggregationOp.COUNT_DISTINCT) distinct = new HashSet<>();
  }

  void add(Object v) {
    if (v == null) return;
    count++;
    switch (op) {
      case COUNT -> { }
      case COUNT_DISTINCT -> distinct.add(Values.key(v));
      case MIN -> { if (extreme == null || Values.compare(v, extreme) < 0) extreme = v; }
      case MAX -> { if (extreme == null || Values.compare(v, extreme) > 0) extreme = v; }
      case SUM, AVG -> addNumber(v);
    }
  }

  Object result() {
    return switch (op) {
      case COUNT -> count;
      case COUNT_DISTINCT -> (long) distinct.size();
      case MIN, MAX -> extreme;
      case SUM -> count == 0 ? null : sum();
      case AVG -> count == 0 ? null : decimalTotal().doubleValue() / count;
    };
  }

  private void addNumber(Object v) {
    if (!(v instanceof Number n)) {
      throw new IllegalStateException("Cannot " + op.symbol() + " non-numeric value of type " + v.getClass().getSimpleName());
    }
    if (n instanceof Double || n instanceof Float) {
      sawFloating = true;
      doubleSum += n.doubleValue();
    } else if (n instanceof BigDecimal || n instanceof BigInteger) {
      sawDecimal = true;
      decimalSum = (decimalSum == null ? BigDecimal.ZERO : decimalSum).add(n instanceof BigDecimal d ? d : new BigDecimal((BigInteger) n));
    } else {
      longSum = Math.addExact(longSum, n.longValue());
    }
  }

  private BigDecimal decimalTotal() {
    BigDecimal total = BigDecimal.valueOf(longSum);
    if (decimalSum != null) total = total.add(decimalSum);
    if (sawFloating) total = total.add(BigDecimal.valueOf(doubleSum));
    return total;
  }

  /** Integral inputs sum to a long, decimals to a BigDecimal, anything floating to a double. */
  private Object sum() {
    if (sawFloating) return decimalTotal().doubleValue();
    if (sawDecimal) return decimalTotal();
    return longSum;
  }
}
