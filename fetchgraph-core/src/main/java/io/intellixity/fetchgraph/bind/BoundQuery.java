package io.intellixity.fetchgraph.bind;

import io.intellixity.fetchgraph.sketch.WhereNode;

import java.util.List;
import java.util.Objects;

/**
 * Sketch after binding: every path is {@code <relation-or-root>.<column>} and {@code with} includes the
 * relations the binder inferred.
 */
public record BoundQuery(String from, WhereNode where, List<String> get, List<String> with, int take, int skip,
                         Boolean caseSensitive, List<BindingTrace> bindings) {
  public BoundQuery {
    Objects.requireNonNull(from, "from");
    get = List.copyOf(get == null ? List.of("*") : get);
    with = List.copyOf(with == null ? List.of() : with);
    bindings = List.copyOf(bindings == null ? List.of() : bindings);
  }
}
