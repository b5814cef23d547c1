package io.intellixity.fetchgraph.query;

import java.util.List;
import java.util.Objects;

/** AND/OR over child clauses. An empty AND is always true, an empty OR always false. */
public record LogicalFilter(LogicalOp op, List<FilterClause> clauses) implements FilterClause {
  public LogicalFilter {
    Objects.requireNonNull(op, "op");
    clauses = List.copyOf(clauses == null ? List.of() : clauses);
  }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }
}
