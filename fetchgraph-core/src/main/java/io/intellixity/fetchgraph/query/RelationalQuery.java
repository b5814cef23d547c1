package io.intellixity.fetchgraph.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Canonical, backend-agnostic query.
 * <p>
 * Instances are immutable: every {@code withX} returns a copy. No schema reference is held, so a query can
 * be cached or handed to any engine.
 */
@JsonSerialize(using = RelationalQueryJsonSerializer.class)
@JsonDeserialize(using = RelationalQueryJsonDeserializer.class)
public final class RelationalQuery {
  private final String rootEntity;
  private final List<SelectExpr> select;
  private final FilterClause filters;
  private final List<String> relations;
  private final List<SemanticClause> semanticClauses;
  private final List<GroupBySpec> groupBy;
  private final List<AggregationSpec> aggregations;
  private final Integer limit;
  private final int offset;
  private final boolean caseSensitivity;

  private RelationalQuery(String rootEntity,
                          List<SelectExpr> select,
                          FilterClause filters,
                          List<String> relations,
                          List<SemanticClause> semanticClauses,
                          List<GroupBySpec> groupBy,
                          List<AggregationSpec> aggregations,
                          Integer limit,
                          int offset,
                          boolean caseSensitivity) {
    this.rootEntity = Objects.requireNonNull(rootEntity, "rootEntity");
    this.select = List.copyOf(select);
    this.filters = filters;
    this.relations = List.copyOf(relations);
    this.semanticClauses = List.copyOf(semanticClauses);
    this.groupBy = List.copyOf(groupBy);
    this.aggregations = List.copyOf(aggregations);
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    this.limit = limit;
    this.offset = offset;
    this.caseSensitivity = caseSensitivity;
  }

  public static RelationalQuery of(String rootEntity) {
    return new RelationalQuery(rootEntity, List.of(), null, List.of(), List.of(), List.of(), List.of(),
        null, 0, false);
  }

  public String rootEntity() { return rootEntity; }
  public List<SelectExpr> select() { return select; }
  public FilterClause filters() { return filters; }
  public List<String> relations() { return relations; }
  public List<SemanticClause> semanticClauses() { return semanticClauses; }
  public List<GroupBySpec> groupBy() { return groupBy; }
  public List<AggregationSpec> aggregations() { return aggregations; }
  public Integer limit() { return limit; }
  public int offset() { return offset; }
  public boolean caseSensitivity() { return caseSensitivity; }

  public boolean isAggregate() { return !groupBy.isEmpty() || !aggregations.isEmpty(); }

  /** Aggregations to compute; grouping without any implies {@code count(*)} aliased {@code count}. */
  public List<AggregationSpec> effectiveAggregations() {
    if (aggregations.isEmpty() && !groupBy.isEmpty()) return List.of(AggregationSpec.of(AggregationOp.COUNT, "*"));
    return aggregations;
  }

  public RelationalQuery withSelect(List<SelectExpr> v) {
    return new RelationalQuery(rootEntity, v, filters, relations, semanticClauses, groupBy, aggregations, limit, offset, caseSensitivity);
  }

  public RelationalQuery withFilters(FilterClause v) {
    return new RelationalQuery(rootEntity, select, v, relations, semanticClauses, groupBy, aggregations, limit, offset, caseSensitivity);
  }

  public RelationalQuery withRelations(List<String> v) {
    return new RelationalQuery(rootEntity, select, filters, v, semanticClauses, groupBy, aggregations, limit, offset, caseSensitivity);
  }

  public RelationalQuery withSemanticClauses(List<SemanticClause> v) {
    return new RelationalQuery(rootEntity, select, filters, relations, v, groupBy, aggregations, limit, offset, caseSensitivity);
  }

  public RelationalQuery withGroupBy(List<GroupBySpec> v) {
    return new RelationalQuery(rootEntity, select, filters, relations, semanticClauses, v, aggregations, limit, offset, caseSensitivity);
  }

  public RelationalQuery withAggregations(List<AggregationSpec> v) {
    return new RelationalQuery(rootEntity, select, filters, relations, semanticClauses, groupBy, v, limit, offset, caseSensitivity);
  }

  public RelationalQuery withLimit(Integer v) {
    return new RelationalQuery(rootEntity, select, filters, relations, semanticClauses, groupBy, aggregations, v, offset, caseSensitivity);
  }

  public RelationalQuery withOffset(int v) {
    return new RelationalQuery(rootEntity, select, filters, relations, semanticClauses, groupBy, aggregations, limit, v, caseSensitivity);
  }

  public RelationalQuery withCaseSensitivity(boolean v) {
    return new RelationalQuery(rootEntity, select, filters, relations, semanticClauses, groupBy, aggregations, limit, offset, v);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RelationalQuery q)) return false;
    return offset == q.offset
        && caseSensitivity == q.caseSensitivity
        && rootEntity.equals(q.rootEntity)
        && select.equals(q.select)
        && Objects.equals(filters, q.filters)
        && relations.equals(q.relations)
        && semanticClauses.equals(q.semanticClauses)
        && groupBy.equals(q.groupBy)
        && aggregations.equals(q.aggregations)
        && Objects.equals(limit, q.limit);
  }

  @Override
  public int hashCode() {
    return Objects.hash(rootEntity, select, filters, relations, semanticClauses, groupBy, aggregations, limit, offset, caseSensitivity);
  }

  @Override
  public String toString() {
    return "RelationalQuery{root=" + rootEntity + ", relations=" + relations + ", filters=" + filters
        + ", limit=" + limit + ", offset=" + offset + "}";
  }
}
