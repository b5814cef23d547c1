package io.intellixity.fetchgraph.sketch;

/** Node of a normalized {@code where} tree. */
public sealed interface WhereNode permits Clause, WhereGroup {
}
