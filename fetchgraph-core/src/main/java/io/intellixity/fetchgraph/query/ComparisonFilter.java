package io.intellixity.fetchgraph.query;

import java.util.Objects;

/**
 * Leaf comparison {@code field op value}.
 *
 * @param entity optional qualifier (relation alias or entity name); when null the field may carry its own
 *               {@code qualifier.column} prefix
 */
public record ComparisonFilter(String entity, String field, ComparisonOp op, Object value) implements FilterClause {
  public ComparisonFilter {
    Objects.requireNonNull(field, "field");
    Objects.requireNonNull(op, "op");
    if (field.isBlank()) throw new IllegalArgumentException("field must not be blank");
  }

  public ComparisonFilter negate() {
    return new ComparisonFilter(entity, field, op.inverse(), value);
  }

  @Override
  public <R> R accept(FilterVisitor<R> visitor) { return visitor.visit(this); }
}
