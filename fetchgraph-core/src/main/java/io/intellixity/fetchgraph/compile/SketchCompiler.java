package io.intellixity.fetchgraph.compile;

import io.intellixity.fetchgraph.bind.BoundQuery;
import io.intellixity.fetchgraph.query.*;
import io.intellixity.fetchgraph.schema.SchemaNames;
import io.intellixity.fetchgraph.sketch.Clause;
import io.intellixity.fetchgraph.sketch.WhereGroup;
import io.intellixity.fetchgraph.sketch.WhereNode;

import java.util.*;

/**
 * Compiles a {@link BoundQuery} into a {@link RelationalQuery}.
 * <p>
 * Pure and schema-free: paths arrive already qualified, so the compiler only maps operators, rewrites NOT
 * and collects the relations that paths mention.
 */
public final class SketchCompiler {

  public RelationalQuery compile(BoundQuery bound) {
    Objects.requireNonNull(bound, "bound");

    List<SelectExpr> select = new ArrayList<>();
    if (!bound.get().isEmpty() && !bound.get().contains("*")) {
      for (String path : bound.get()) select.add(SelectExpr.of(path));
    }

    FilterClause filters = null;
    if (bound.where() != null && !(bound.where() instanceof WhereGroup g && g.isEmpty())) {
      filters = compileNode(bound.where());
    }

    return RelationalQuery.of(bound.from())
        .withSelect(select)
        .withFilters(filters)
        .withRelations(relations(bound))
        .withLimit(bound.take())
        .withOffset(bound.skip())
        .withCaseSensitivity(Boolean.TRUE.equals(bound.caseSensitive()));
  }

  private FilterClause compileNode(WhereNode node) {
    if (node instanceof Clause c) return compileClause(c);
    WhereGroup g = (WhereGroup) node;

    List<FilterClause> parts = new ArrayList<>();
    if (!g.all().isEmpty()) parts.add(combine(LogicalOp.AND, g.all()));
    if (!g.any().isEmpty()) parts.add(combine(LogicalOp.OR, g.any()));
    if (g.not() != null) parts.add(compileNot(g.not()));

    if (parts.isEmpty()) return new LogicalFilter(LogicalOp.AND, List.of());
    return parts.size() == 1 ? parts.get(0) : new LogicalFilter(LogicalOp.AND, parts);
  }

  private FilterClause combine(LogicalOp op, List<WhereNode> nodes) {
    List<FilterClause> children = new ArrayList<>();
    for (WhereNode n : nodes) children.add(compileNode(n));
    return children.size() == 1 ? children.get(0) : new LogicalFilter(op, children);
  }

  private FilterClause compileClause(Clause c) {
    checkPath(c.path());
    if (c.op().equals("between")) {
      List<?> bounds = betweenBounds(c);
      return new LogicalFilter(LogicalOp.AND, List.of(
          new ComparisonFilter(null, c.path(), ComparisonOp.GE, bounds.get(0)),
          new ComparisonFilter(null, c.path(), ComparisonOp.LE, bounds.get(1))));
    }
    return new ComparisonFilter(null, c.path(), mapOperator(c.op()), c.value());
  }

  private FilterClause compileNot(WhereNode node) {
    if (!(node instanceof Clause c)) {
      throw new QueryCompileException("NOT is only supported over a single comparison, not a group");
    }
    checkPath(c.path());
    if (c.op().equals("between")) {
      List<?> bounds = betweenBounds(c);
      return new LogicalFilter(LogicalOp.OR, List.of(
          new ComparisonFilter(null, c.path(), ComparisonOp.LT, bounds.get(0)),
          new ComparisonFilter(null, c.path(), ComparisonOp.GT, bounds.get(1))));
    }
    return new ComparisonFilter(null, c.path(), mapOperator(c.op()).inverse(), c.value());
  }

  /** Sketch operator to backend comparison. Unknown operators have no comparison and no inverse. */
  static ComparisonOp mapOperator(String op) {
    String o = op.trim().toLowerCase(Locale.ROOT);
    return switch (o) {
      case "is" -> ComparisonOp.EQ;
      case "before" -> ComparisonOp.LT;
      case "after" -> ComparisonOp.GT;
      case "contains", "similar", "related" -> ComparisonOp.ILIKE;
      default -> ComparisonOp.fromSymbol(o)
          .orElseThrow(() -> new QueryCompileException("Unsupported operator: " + op));
    };
  }

  private static List<?> betweenBounds(Clause c) {
    if (c.value() instanceof List<?> list && list.size() == 2) return list;
    throw new QueryCompileException("between on '" + c.path() + "' expects a list of exactly two values");
  }

  private static void checkPath(String path) {
    if (path.indexOf('.') != path.lastIndexOf('.')) {
      throw new QueryCompileException("Multi-hop dotted path is not supported: " + path);
    }
  }

  /**
   * {@code with} first, then qualifiers of where/get paths in first-seen order; the root qualifier adds nothing.
   * Names are compared after {@link SchemaNames#normalize}.
   */
  private static List<String> relations(BoundQuery bound) {
    String root = SchemaNames.normalize(bound.from());
    Set<String> seen = new HashSet<>();
    List<String> out = new ArrayList<>();
    for (String rel : bound.with()) {
      if (seen.add(SchemaNames.normalize(rel))) out.add(rel);
    }
    List<String> paths = new ArrayList<>();
    collectPaths(bound.where(), paths);
    for (String p : bound.get()) if (!"*".equals(p)) paths.add(p);
    for (String path : paths) {
      checkPath(path);
      int dot = path.indexOf('.');
      if (dot < 0) continue;
      String qualifier = path.substring(0, dot);
      String key = SchemaNames.normalize(qualifier);
      if (!key.equals(root) && seen.add(key)) out.add(qualifier);
    }
    return List.copyOf(out);
  }

  private static void collectPaths(WhereNode node, List<String> into) {
    if (node == null) return;
    if (node instanceof Clause c) {
      into.add(c.path());
      return;
    }
    WhereGroup g = (WhereGroup) node;
    for (WhereNode n : g.all()) collectPaths(n, into);
    for (WhereNode n : g.any()) collectPaths(n, into);
    collectPaths(g.not(), into);
  }
}
