package io.intellixity.fetchgraph.query;

/** A comparison operand has the wrong shape for its operator (e.g. {@code in} over a scalar). */
public final class OperandTypeException extends QueryValidationException {
  private final String field;
  private final ComparisonOp op;

  public OperandTypeException(String field, ComparisonOp op, String message) {
    super(message);
    this.field = field;
    this.op = op;
  }

  public String field() { return field; }
  public ComparisonOp op() { return op; }
}
