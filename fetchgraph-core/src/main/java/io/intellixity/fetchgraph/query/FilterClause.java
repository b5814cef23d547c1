package io.intellixity.fetchgraph.query;

/**
 * Node of the canonical filter tree.
 * <p>
 * The set of node kinds is closed; engines consume it through {@link FilterVisitor}, so adding a kind
 * is a compile error everywhere it is not handled.
 */
public sealed interface FilterClause permits ComparisonFilter, LogicalFilter {
  <R> R accept(FilterVisitor<R> visitor);
}
