package io.intellixity.fetchgraph.tabular;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.fetchgraph.query.*;
import io.intellixity.fetchgraph.schema.*;
import io.intellixity.fetchgraph.spi.result.AggregationResult;
import io.intellixity.fetchgraph.spi.result.QueryResult;
import io.intellixity.fetchgraph.spi.result.RowResult;
import io.intellixity.fetchgraph.spi.semantic.SemanticBackend;
import io.intellixity.fetchgraph.spi.semantic.SemanticMatch;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class TabularRelationalProviderTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static SchemaRegistry schema(JoinType join) {
    return SchemaRegistry.of(
        List.of(
            EntityDescriptor.of("customer",
                ColumnDescriptor.primaryKey("id", "int"),
                ColumnDescriptor.of("name", "string"),
                ColumnDescriptor.semantic("notes")),
            EntityDescriptor.of("order",
                ColumnDescriptor.primaryKey("id", "int"),
                ColumnDescriptor.foreignKey("customer_id", "int"),
                ColumnDescriptor.of("total", "int"),
                ColumnDescriptor.of("status", "string"))),
        List.of(RelationDescriptor.of("order_customer", "order", "customer", "customer_id", "id", join)));
  }

  private static Map<String, ColumnTable> tables() {
    return Map.of(
        "customer", ColumnTable.builder("customer", "id", "name", "notes")
            .row(1, "Alice", "pharma buyer")
            .row(2, "Bob", "retail")
            .build(),
        "order", ColumnTable.builder("order", "id", "customer_id", "total", "status")
            .row(101, 1, 120, "shipped")
            .row(102, 2, 80, "pending")
            .row(103, 1, 200, "pending")
            .build());
  }

  private static SemanticBackend scores(Object... idScorePairs) {
    return (entity, fields, query, topK) -> {
      List<SemanticMatch> out = new ArrayList<>();
      for (int i = 0; i < idScorePairs.length; i += 2) {
        out.add(new SemanticMatch(entity, idScorePairs[i], ((Number) idScorePairs[i + 1]).doubleValue()));
      }
      return out;
    };
  }

  private static TabularRelationalProvider provider(SemanticBackend backend) {
    return new TabularRelationalProvider("orders", schema(JoinType.INNER), tables(), backend);
  }

  private static RelationalQuery ordersWithCustomer() {
    return RelationalQuery.of("order").withRelations(List.of("order_customer"));
  }

  private static List<Object> column(QueryResult r, String key) {
    List<Object> out = new ArrayList<>();
    for (RowResult row : r.rows()) out.add(row.data().get(key));
    return out;
  }

  @Test
  void defaultProjectionNestsJoinedColumnsUnderEntityLabel() {
    QueryResult r = provider(null).execute(ordersWithCustomer());

    assertEquals(3, r.rows().size());
    RowResult first = r.rows().get(0);
    assertEquals(List.of("id", "customer_id", "total", "status"), new ArrayList<>(first.data().keySet()));
    assertEquals("Alice", first.related().get("customer").get("name"));
    assertEquals(List.of("order_customer"), r.meta().get("relations_used"));
    assertEquals("tabular", r.meta().get("engine"));
  }

  @Test
  void nestedBooleanFilter() {
    RelationalQuery q = ordersWithCustomer().withFilters(Filters.or(
        Filters.gt("total", 150),
        Filters.and(Filters.eq("status", "pending"), Filters.like("customer.name", "Ali"))));

    assertEquals(List.of(103), column(provider(null).execute(q), "id"));
  }

  @Test
  void explicitSelectIsFlat() {
    RelationalQuery q = ordersWithCustomer()
        .withSelect(List.of(SelectExpr.of("id"), SelectExpr.of("customer.name"), new SelectExpr("total", "amount")))
        .withFilters(Filters.eq("id", 102));

    RowResult row = provider(null).execute(q).rows().get(0);
    assertEquals(Map.of("id", 102, "customer__name", "Bob", "amount", 80), row.data());
    assertTrue(row.related().isEmpty());
  }

  @Test
  void groupBySumsPerRelatedKey() {
    RelationalQuery q = ordersWithCustomer()
        .withGroupBy(List.of(GroupBySpec.of("customer.name")))
        .withAggregations(List.of(new AggregationSpec("total", AggregationOp.SUM, "total_spend")));

    QueryResult r = provider(null).execute(q);
    assertEquals(List.of("Alice", "Bob"), column(r, "customer__name"));
    assertEquals(List.of(320L, 80L), column(r, "total_spend"));
    assertEquals(List.of("customer.name"), r.meta().get("group_by"));
  }

  @Test
  void groupingWithoutAggregationsCounts() {
    RelationalQuery q = RelationalQuery.of("order").withGroupBy(List.of(GroupBySpec.of("status")));

    QueryResult r = provider(null).execute(q);
    assertEquals(List.of("pending", "shipped"), column(r, "status"));
    assertEquals(List.of(2L, 1L), column(r, "count"));
  }

  @Test
  void aggregationsWithoutGroupingReturnMapAndNoRows() {
    RelationalQuery q = RelationalQuery.of("order").withAggregations(List.of(
        AggregationSpec.of(AggregationOp.COUNT, "*"),
        AggregationSpec.of(AggregationOp.AVG, "total"),
        AggregationSpec.of(AggregationOp.COUNT_DISTINCT, "customer_id"),
        AggregationSpec.of(AggregationOp.MAX, "status")));

    QueryResult r = provider(null).execute(q);
    assertTrue(r.rows().isEmpty());
    Map<String, AggregationResult> a = r.aggregations();
    assertEquals(3L, a.get("count").value());
    assertEquals(400.0 / 3, (Double) a.get("avg_total").value(), 1e-9);
    assertEquals(2L, a.get("count_distinct_customer_id").value());
    assertEquals("shipped", a.get("max_status").value());
  }

  @Test
  void sumOverNoRowsIsNull() {
    RelationalQuery q = RelationalQuery.of("order")
        .withFilters(Filters.eq("status", "cancelled"))
        .withAggregations(List.of(AggregationSpec.of(AggregationOp.SUM, "total"), AggregationSpec.of(AggregationOp.COUNT, "*")));

    QueryResult r = provider(null).execute(q);
    assertNull(r.aggregations().get("sum_total").value());
    assertEquals(0L, r.aggregations().get("count").value());
  }

  @Test
  void semanticFilterKeepsMatchesAboveThreshold() {
    RelationalQuery q = ordersWithCustomer()
        .withSemanticClauses(List.of(SemanticClause.filter("customer", List.of("notes"), "pharma", 0.8)));

    QueryResult r = provider(scores(1, 0.9, 2, 0.3)).execute(q);
    assertEquals(List.of(1, 1), column(r, "customer_id"));
    assertEquals(List.of(101, 103), column(r, "id"));
  }

  @Test
  void semanticBoostOrdersByScoreThenPrimaryKey() {
    RelationalQuery q = ordersWithCustomer()
        .withSelect(List.of(SelectExpr.of("id")))
        .withSemanticClauses(List.of(SemanticClause.boost("customer", List.of("notes"), "retail", 0.5)));

    assertEquals(List.of(102, 101, 103), column(provider(scores(2, 0.9, 1, 0.4)).execute(q), "id"));
  }

  @Test
  void semanticFilterOrderingAppliesBeforeLimit() {
    RelationalQuery q = ordersWithCustomer()
        .withSemanticClauses(List.of(SemanticClause.filter("customer", List.of("notes"), "retail", null)))
        .withLimit(2);

    assertEquals(List.of(102, 101), column(provider(scores(2, 0.9, 1, 0.4)).execute(q), "id"));
  }

  @Test
  void semanticBoostCombinesWithFilters() {
    RelationalQuery q = ordersWithCustomer()
        .withFilters(Filters.eq("status", "pending"))
        .withSemanticClauses(List.of(SemanticClause.boost("customer", List.of("notes"), "retail", 0.5)));

    assertEquals(List.of(102, 103), column(provider(scores(2, 0.9, 1, 0.4)).execute(q), "id"));
  }

  @Test
  void groupedBoostOrdersGroupsByMaxScore() {
    RelationalQuery q = ordersWithCustomer()
        .withGroupBy(List.of(GroupBySpec.of("customer", "id")))
        .withAggregations(List.of(AggregationSpec.of(AggregationOp.SUM, "total")))
        .withSemanticClauses(List.of(SemanticClause.boost("customer", List.of("notes"), "retail", 0.5)));

    QueryResult r = provider(scores(2, 0.9, 1, 0.4)).execute(q);
    assertEquals(List.of(2, 1), column(r, "customer__id"));
    assertEquals(List.of(80L, 320L), column(r, "sum_total"));
  }

  @Test
  void boostScoresFromSeveralClausesAdd() {
    RelationalQuery q = RelationalQuery.of("order")
        .withSelect(List.of(SelectExpr.of("id")))
        .withSemanticClauses(List.of(
            SemanticClause.boost("order", List.of(), "a", null),
            SemanticClause.boost("order", List.of(), "b", null)));
    SemanticBackend backend = (entity, fields, query, topK) -> query.equals("a")
        ? List.of(new SemanticMatch(entity, 101, 0.5), new SemanticMatch(entity, 103, 0.4))
        : List.of(new SemanticMatch(entity, 103, 0.3));

    assertEquals(List.of(103, 101, 102), column(provider(backend).execute(q), "id"));
  }

  @Test
  void offsetAndLimitPage() {
    RelationalQuery q = RelationalQuery.of("order").withOffset(1).withLimit(1);
    assertEquals(List.of(102), column(provider(null).execute(q), "id"));

    assertTrue(provider(null).execute(RelationalQuery.of("order").withOffset(5)).rows().isEmpty());
  }

  @Test
  void leftJoinKeepsOrdersWithoutCustomer() {
    Map<String, ColumnTable> t = new HashMap<>(tables());
    t.put("order", ColumnTable.builder("order", "id", "customer_id", "total", "status")
        .row(101, 1, 120, "shipped")
        .row(104, 9, 10, "pending")
        .row(105, null, 15, "pending")
        .build());

    RelationalQuery q = ordersWithCustomer();
    assertEquals(List.of(101), column(new TabularRelationalProvider("o", schema(JoinType.INNER), t, null).execute(q), "id"));

    QueryResult left = new TabularRelationalProvider("o", schema(JoinType.LEFT), t, null).execute(q);
    assertEquals(List.of(101, 104, 105), column(left, "id"));
    assertNull(left.rows().get(1).related().get("customer").get("name"));
  }

  @Test
  void outerJoinAppendsUnmatchedRightRows() {
    RelationalQuery q = ordersWithCustomer()
        .withSelect(List.of(SelectExpr.of("id"), SelectExpr.of("customer.id")))
        .withFilters(Filters.eq("status", null));
    Map<String, ColumnTable> t = new HashMap<>(tables());
    t.put("order", ColumnTable.builder("order", "id", "customer_id", "total", "status").row(101, 1, 120, "shipped").build());

    QueryResult r = new TabularRelationalProvider("o", schema(JoinType.OUTER), t, null).execute(q);
    assertEquals(1, r.rows().size());
    assertNull(r.rows().get(0).data().get("id"));
    assertEquals(2, r.rows().get(0).data().get("customer__id"));
  }

  @Test
  void nullComparisonsFollowSqlRules() {
    Map<String, ColumnTable> t = new HashMap<>(tables());
    t.put("order", ColumnTable.builder("order", "id", "customer_id", "total", "status")
        .row(1, 1, 10, "a")
        .row(2, 1, 20, null)
        .row(3, 1, 30, "b")
        .build());
    TabularRelationalProvider p = new TabularRelationalProvider("o", schema(JoinType.INNER), t, null);

    assertEquals(List.of(2), column(p.execute(RelationalQuery.of("order").withFilters(Filters.eq("status", null))), "id"));
    assertEquals(List.of(1, 3), column(p.execute(RelationalQuery.of("order").withFilters(Filters.ne("status", null))), "id"));
    assertEquals(List.of(3), column(p.execute(RelationalQuery.of("order").withFilters(Filters.ne("status", "a"))), "id"));
    assertEquals(List.of(1), column(p.execute(RelationalQuery.of("order").withFilters(
        Filters.on(null, "status", ComparisonOp.IN, Arrays.asList("a", null)))), "id"));
    assertEquals(List.of(), column(p.execute(RelationalQuery.of("order").withFilters(
        Filters.on(null, "status", ComparisonOp.NOT_IN, Arrays.asList("a", null)))), "id"));
    assertEquals(List.of(), column(p.execute(RelationalQuery.of("order").withFilters(
        Filters.in("status", List.of()))), "id"));
    assertEquals(List.of(1, 2, 3), column(p.execute(RelationalQuery.of("order").withFilters(
        Filters.notIn("status", List.of()))), "id"));
  }

  @Test
  void textOperators() {
    Map<String, ColumnTable> t = new HashMap<>(tables());
    t.put("customer", ColumnTable.builder("customer", "id", "name", "notes")
        .row(1, "Alice", null)
        .row(2, "Alfred", null)
        .row(3, "Grace", null)
        .row(4, "bob", null)
        .build());
    TabularRelationalProvider p = new TabularRelationalProvider("c", schema(JoinType.INNER), t, null);

    assertEquals(List.of("Alice", "Alfred"), names(p, Filters.starts("name", "Al"), false));
    assertEquals(List.of("Alfred", "bob"), names(p, Filters.on(null, "name", ComparisonOp.NOT_ENDS, "e"), false));
    assertEquals(List.of("Alice"), names(p, Filters.ends("name", "ice"), false));
    assertEquals(List.of("Grace", "bob"), names(p, Filters.on(null, "name", ComparisonOp.NOT_ILIKE, "al"), false));
    assertEquals(List.of("Alice", "Alfred"), names(p, Filters.like("name", "al"), false));
    assertEquals(List.of(), names(p, Filters.like("name", "al"), true));
    assertEquals(List.of("Alice", "Alfred"), names(p, Filters.ilike("name", "AL"), true));
    assertEquals(List.of(), names(p, Filters.like("notes", "x"), false));
    assertEquals(List.of(), names(p, Filters.on(null, "notes", ComparisonOp.NOT_LIKE, "x"), false));
  }

  private static List<Object> names(TabularRelationalProvider p, FilterClause f, boolean caseSensitive) {
    RelationalQuery q = RelationalQuery.of("customer").withFilters(f).withCaseSensitivity(caseSensitive);
    return column(p.execute(q), "name");
  }

  @Test
  void comparesAcrossNumericTypes() {
    RelationalQuery q = RelationalQuery.of("order").withFilters(Filters.and(
        Filters.ge("total", 120.0), Filters.in("customer_id", List.of(1L))));

    assertEquals(List.of(101, 103), column(provider(null).execute(q), "id"));
  }

  @Test
  void fetchRunsCanonicalSelectors() throws Exception {
    QueryResult r = (QueryResult) provider(null).fetch(MAPPER.readTree(
        "{\"op\":\"query\",\"root_entity\":\"order\",\"relations\":[\"order_customer\"],"
            + "\"filters\":{\"type\":\"comparison\",\"field\":\"customer.name\",\"op\":\"=\",\"value\":\"Bob\"},"
            + "\"select\":[{\"expr\":\"id\"}]}"));

    assertEquals(List.of(102), column(r, "id"));
  }

  @Test
  void fetchCompilesSketchEnvelope() throws Exception {
    QueryResult r = (QueryResult) provider(null).fetch(MAPPER.readTree(
        "{\"$dsl\":\"fetchgraph.dsl.query_sketch@v0\","
            + "\"payload\":{\"from\":\"order\",\"where\":[[\"status\",\"=\",\"pending\"]],\"take\":5}}"));

    assertEquals(List.of(102, 103), column(r, "id"));
  }

  @Test
  void missingTableFails() {
    Map<String, ColumnTable> t = Map.of("order", tables().get("order"));
    TabularRelationalProvider p = new TabularRelationalProvider("o", schema(JoinType.INNER), t, null);

    assertThrows(IllegalStateException.class, () -> p.execute(ordersWithCustomer()));
  }

  @Test
  void invalidQueriesAreRejectedBeforeExecution() {
    TabularRelationalProvider p = provider(null);
    assertThrows(QueryValidationException.class,
        () -> p.execute(RelationalQuery.of("order").withFilters(Filters.eq("nope", 1))));
    assertThrows(QueryValidationException.class,
        () -> p.execute(RelationalQuery.of("order").withFilters(Filters.eq("customer.name", "Bob"))));
    assertThrows(IllegalStateException.class, () -> p.execute(ordersWithCustomer()
        .withSemanticClauses(List.of(SemanticClause.filter("customer", List.of(), "x", null)))));
  }
}
