package io.intellixity.fetchgraph.query;

import java.util.Objects;

/** Projected column {@code expr} (a {@code qualifier.column} or bare column), optionally renamed. */
public record SelectExpr(String expr, String alias) {
  public SelectExpr {
    Objects.requireNonNull(expr, "expr");
    if (expr.isBlank()) throw new IllegalArgumentException("select expr must not be blank");
  }

  public static SelectExpr of(String expr) { return new SelectExpr(expr, null); }
}
