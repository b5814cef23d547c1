package io.intellixity.fetchgraph.sketch;

import java.util.Objects;

/** {@code [path, op, value]} with a canonical sketch operator. */
public record Clause(String path, String op, Object value) implements WhereNode {
  public Clause {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(op, "op");
  }

  public Clause withPath(String newPath) {
    return new Clause(newPath, op, value);
  }
}
