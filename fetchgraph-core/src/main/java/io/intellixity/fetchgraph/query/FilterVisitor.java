package io.intellixity.fetchgraph.query;

public interface FilterVisitor<R> {
  R visit(ComparisonFilter comparison);
  R visit(LogicalFilter logical);
}
