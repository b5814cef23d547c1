package io.intellixity.fetchgraph.sketch;

import java.util.List;

/** {@code {all: [...], any: [...], not: node}}; present parts are AND-combined. */
public record WhereGroup(List<WhereNode> all, List<WhereNode> any, WhereNode not) implements WhereNode {
  public WhereGroup {
    all = List.copyOf(all == null ? List.of() : all);
    any = List.copyOf(any == null ? List.of() : any);
  }

  public static WhereGroup allOf(List<WhereNode> nodes) {
    return new WhereGroup(nodes, List.of(), null);
  }

  public boolean isEmpty() {
    return all.isEmpty() && any.isEmpty() && not == null;
  }
}
