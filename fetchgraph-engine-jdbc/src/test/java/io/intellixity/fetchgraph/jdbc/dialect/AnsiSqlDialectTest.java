package io.intellixity.fetchgraph.jdbc.dialect;

import io.intellixity.fetchgraph.jdbc.SqlStatement;
import io.intellixity.fetchgraph.query.*;
import io.intellixity.fetchgraph.schema.*;
import io.intellixity.fetchgraph.spi.exec.JoinPlan;
import io.intellixity.fetchgraph.spi.exec.JoinPlanner;
import io.intellixity.fetchgraph.spi.exec.ResolvedSemanticClause;
import io.intellixity.fetchgraph.spi.semantic.SemanticMatch;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class AnsiSqlDialectTest {
  private static final String JOIN =
      " FROM \"order\" \"order\" INNER JOIN \"customer\" \"order_customer\""
          + " ON \"order\".\"customer_id\" = \"order_customer\".\"id\"";

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
                ColumnDescriptor.of("status", "string"),
                ColumnDescriptor.of("placed_on", "date"))),
        List.of(RelationDescriptor.of("order_customer", "order", "customer", "customer_id", "id", join)));
  }

  private static SqlStatement render(RelationalQuery q) {
    return render(q, JoinType.INNER, null);
  }

  private static SqlStatement render(RelationalQuery q, JoinType join, String schema) {
    JoinPlan plan = new JoinPlanner().plan(schema(join), q);
    return new AnsiSqlDialect().renderQuery(q, plan, List.of(), schema);
  }

  private static SqlStatement renderSemantic(RelationalQuery q, List<SemanticMatch> matches) {
    JoinPlan plan = new JoinPlanner().plan(schema(JoinType.INNER), q);
    SemanticClause c = q.semanticClauses().get(0);
    ResolvedSemanticClause resolved = new ResolvedSemanticClause(c, plan.resolve(c.entity(), "id"), matches);
    return new AnsiSqlDialect().renderQuery(q, plan, List.of(resolved), null);
  }

  private static RelationalQuery joined() {
    return RelationalQuery.of("order").withRelations(List.of("order_customer"));
  }

  private static String from(SqlStatement stmt) {
    return stmt.sql().substring(stmt.sql().indexOf(" FROM "));
  }

  @Test
  void defaultProjectionQualifiesJoinedColumns() {
    SqlStatement stmt = render(joined());
    assertEquals("SELECT \"order\".\"id\" AS \"id\", \"order\".\"customer_id\" AS \"customer_id\","
        + " \"order\".\"total\" AS \"total\", \"order\".\"status\" AS \"status\","
        + " \"order\".\"placed_on\" AS \"placed_on\", \"order_customer\".\"id\" AS \"customer__id\","
        + " \"order_customer\".\"name\" AS \"customer__name\", \"order_customer\".\"notes\" AS \"customer__notes\""
        + JOIN, stmt.sql());
    assertEquals(List.of("id", "customer_id", "total", "status", "placed_on",
        "customer__id", "customer__name", "customer__notes"), stmt.columns());
    assertTrue(stmt.binds().isEmpty());
  }

  @Test
  void schemaQualifiesTables() {
    SqlStatement stmt = render(joined(), JoinType.INNER, "sales");
    assertTrue(stmt.sql().contains(" FROM \"sales\".\"order\" \"order\" INNER JOIN \"sales\".\"customer\" \"order_customer\""));
  }

  @Test
  void joinKeywords() {
    assertTrue(render(joined(), JoinType.LEFT, null).sql().contains(" LEFT JOIN \"customer\""));
    assertFalse(render(joined(), JoinType.OUTER, null).sql().contains("FULL OUTER JOIN"));
  }

  @Test
  void outerJoinRendersOverFlattenedRows() {
    RelationalQuery q = joined()
        .withSelect(List.of(SelectExpr.of("id"), new SelectExpr("customer.name", "who")))
        .withFilters(Filters.gt("total", 100));
    String orderCols = "\"order\".\"id\" AS \"order.id\", \"order\".\"customer_id\" AS \"order.customer_id\","
        + " \"order\".\"total\" AS \"order.total\", \"order\".\"status\" AS \"order.status\","
        + " \"order\".\"placed_on\" AS \"order.placed_on\"";
    String customerCols = "\"order_customer\".\"id\" AS \"order_customer.id\","
        + " \"order_customer\".\"name\" AS \"order_customer.name\","
        + " \"order_customer\".\"notes\" AS \"order_customer.notes\"";
    String orders = "(SELECT " + orderCols + " FROM \"order\" \"order\") \"fg_j1\"";
    String on = "\"fg_j1\".\"order.customer_id\" = \"order_customer\".\"id\"";

    SqlStatement stmt = render(q, JoinType.OUTER, null);
    assertEquals("SELECT \"fg_rows\".\"order.id\" AS \"id\", \"fg_rows\".\"order_customer.name\" AS \"who\""
        + " FROM (SELECT \"fg_j1\".\"order.id\", \"fg_j1\".\"order.customer_id\", \"fg_j1\".\"order.total\","
        + " \"fg_j1\".\"order.status\", \"fg_j1\".\"order.placed_on\", " + customerCols
        + " FROM " + orders + " LEFT JOIN \"customer\" \"order_customer\" ON " + on
        + " UNION ALL SELECT NULL AS \"order.id\", NULL AS \"order.customer_id\", NULL AS \"order.total\","
        + " NULL AS \"order.status\", NULL AS \"order.placed_on\", " + customerCols
        + " FROM \"customer\" \"order_customer\" WHERE NOT EXISTS (SELECT 1 FROM " + orders + " WHERE " + on + "))"
        + " \"fg_rows\" WHERE \"fg_rows\".\"order.total\" > :b1", stmt.sql());
    assertEquals(List.of(100), stmt.binds());
    assertEquals(List.of("id", "who"), stmt.columns());
  }

  @Test
  void selectFilterAndPaging() {
    RelationalQuery q = joined()
        .withSelect(List.of(SelectExpr.of("id"), new SelectExpr("customer.name", "who")))
        .withFilters(Filters.and(Filters.ge("total", 100), Filters.ilike("customer.name", "50%_off")))
        .withOffset(10)
        .withLimit(5);
    SqlStatement stmt = render(q);
    assertEquals("SELECT \"order\".\"id\" AS \"id\", \"order_customer\".\"name\" AS \"who\"" + JOIN
        + " WHERE (\"order\".\"total\" >= :b1 AND LOWER(\"order_customer\".\"name\") LIKE :b2 ESCAPE '\\')"
        + " OFFSET :b3 ROWS FETCH FIRST :b4 ROWS ONLY", stmt.sql());
    assertEquals(Arrays.asList(100, "%50\\%\\_off%", 10, 5), stmt.binds());
    assertEquals(List.of("id", "who"), stmt.columns());
  }

  @Test
  void nullRules() {
    RelationalQuery q = RelationalQuery.of("order").withFilters(Filters.and(
        Filters.eq("status", null),
        Filters.ne("total", null),
        Filters.on(null, "customer_id", ComparisonOp.IN, Arrays.asList(1, null, 2)),
        Filters.notIn("id", List.of()),
        Filters.lt("total", null)));
    SqlStatement stmt = render(q);
    assertEquals(" FROM \"order\" \"order\" WHERE (\"order\".\"status\" IS NULL AND \"order\".\"total\" IS NOT NULL"
        + " AND \"order\".\"customer_id\" IN (:b1, :b2) AND 1=1 AND 1=0)", from(stmt));
    assertEquals(List.of(1, 2), stmt.binds());

    SqlStatement notIn = render(RelationalQuery.of("order")
        .withFilters(Filters.on(null, "status", ComparisonOp.NOT_IN, Arrays.asList("x", null))));
    assertTrue(notIn.sql().endsWith(" WHERE 1=0"));
    assertTrue(notIn.binds().isEmpty());

    SqlStatement emptyIn = render(RelationalQuery.of("order").withFilters(Filters.in("status", List.of())));
    assertTrue(emptyIn.sql().endsWith(" WHERE 1=0"));
  }

  @Test
  void emptyLogicalGroups() {
    assertTrue(render(RelationalQuery.of("order").withFilters(Filters.and())).sql().endsWith(" WHERE 1=1"));
    assertTrue(render(RelationalQuery.of("order").withFilters(Filters.or())).sql().endsWith(" WHERE 1=0"));
  }

  @Test
  void textMatchesHonorCaseSensitivity() {
    SqlStatement sensitive = render(RelationalQuery.of("order")
        .withFilters(Filters.starts("status", "p"))
        .withCaseSensitivity(true));
    assertTrue(sensitive.sql().endsWith(" WHERE \"order\".\"status\" LIKE :b1 ESCAPE '\\'"));
    assertEquals(List.of("p%"), sensitive.binds());

    SqlStatement negated = render(RelationalQuery.of("order")
        .withFilters(Filters.on(null, "status", ComparisonOp.NOT_ENDS, "ED")));
    assertTrue(negated.sql().endsWith(" WHERE NOT (LOWER(\"order\".\"status\") LIKE :b1 ESCAPE '\\')"));
    assertEquals(List.of("%ed"), negated.binds());

    SqlStatement ilike = render(RelationalQuery.of("order")
        .withFilters(Filters.ilike("status", "Ship"))
        .withCaseSensitivity(true));
    assertEquals(List.of("%ship%"), ilike.binds());
  }

  @Test
  void dateColumnsCoerceIsoStrings() {
    SqlStatement stmt = render(RelationalQuery.of("order").withFilters(Filters.ge("placed_on", "2024-02-01")));
    assertEquals(List.of(LocalDate.of(2024, 2, 1)), stmt.binds());

    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> render(RelationalQuery.of("order").withFilters(Filters.eq("placed_on", "soon"))));
    assertTrue(ex.getMessage().contains("placed_on"));
  }

  @Test
  void semanticBoostOrdersByScoreThenKey() {
    RelationalQuery q = joined()
        .withSemanticClauses(List.of(SemanticClause.boost("customer", List.of("notes"), "pharma", null)))
        .withLimit(3);
    SqlStatement stmt = renderSemantic(q, List.of(
        new SemanticMatch("customer", 2, 0.9), new SemanticMatch("customer", 1, 0.4)));
    assertTrue(stmt.sql().endsWith(JOIN
        + " ORDER BY (CASE WHEN \"order_customer\".\"id\" = :b1 THEN CAST(:b2 AS DOUBLE PRECISION)"
        + " WHEN \"order_customer\".\"id\" = :b3 THEN CAST(:b4 AS DOUBLE PRECISION) ELSE 0 END) DESC,"
        + " \"order\".\"id\" ASC NULLS LAST FETCH FIRST :b5 ROWS ONLY"), stmt.sql());
    assertEquals(List.of(2, 0.9, 1, 0.4, 3), stmt.binds());
  }

  @Test
  void semanticFilterRestrictsToMatches() {
    RelationalQuery q = joined()
        .withSemanticClauses(List.of(SemanticClause.filter("customer", List.of(), "pharma", 0.5)));
    SqlStatement stmt = renderSemantic(q, List.of(
        new SemanticMatch("customer", 2, 0.9), new SemanticMatch("customer", 1, 0.4)));
    assertTrue(stmt.sql().contains(" WHERE \"order_customer\".\"id\" IN (:b1) ORDER BY (CASE"), stmt.sql());
    assertEquals(List.of(2, 2, 0.9), stmt.binds());

    SqlStatement none = renderSemantic(q, List.of());
    assertTrue(none.sql().endsWith(" WHERE 1=0 ORDER BY \"order\".\"id\" ASC NULLS LAST"), none.sql());
  }

  @Test
  void groupedQueryOrdersByKeysNullsFirst() {
    RelationalQuery q = joined()
        .withGroupBy(List.of(GroupBySpec.of("customer.name")))
        .withAggregations(List.of(new AggregationSpec("total", AggregationOp.SUM, "spend"),
            AggregationSpec.of(AggregationOp.AVG, "total")));
    SqlStatement stmt = render(q);
    assertEquals("SELECT \"order_customer\".\"name\" AS \"customer__name\", SUM(\"order\".\"total\") AS \"spend\","
        + " AVG(CAST(\"order\".\"total\" AS DOUBLE PRECISION)) AS \"avg_total\"" + JOIN
        + " GROUP BY \"order_customer\".\"name\" ORDER BY \"order_customer\".\"name\" ASC NULLS FIRST", stmt.sql());
    assertEquals(List.of("customer__name", "spend", "avg_total"), stmt.columns());
  }

  @Test
  void groupingWithoutAggregatesCounts() {
    SqlStatement stmt = render(RelationalQuery.of("order").withGroupBy(List.of(new GroupBySpec(null, "status", "s"))));
    assertTrue(stmt.sql().startsWith("SELECT \"order\".\"status\" AS \"s\", COUNT(*) AS \"count\" FROM"));
    assertEquals(List.of("s", "count"), stmt.columns());
  }

  @Test
  void groupedBoostOrdersByMaxScore() {
    RelationalQuery q = joined()
        .withGroupBy(List.of(GroupBySpec.of("status")))
        .withSemanticClauses(List.of(SemanticClause.boost("customer", List.of(), "q", null)))
        .withLimit(2);
    SqlStatement stmt = renderSemantic(q, List.of(new SemanticMatch("customer", 1, 0.5)));
    assertTrue(stmt.sql().endsWith(" GROUP BY \"order\".\"status\" ORDER BY MAX((CASE WHEN \"order_customer\".\"id\" = :b1"
        + " THEN CAST(:b2 AS DOUBLE PRECISION) ELSE 0 END)) DESC, \"order\".\"status\" ASC NULLS FIRST"
        + " FETCH FIRST :b3 ROWS ONLY"), stmt.sql());
    assertEquals(List.of(1, 0.5, 2), stmt.binds());
  }

  @Test
  void ungroupedAggregatesSkipPaging() {
    SqlStatement stmt = render(RelationalQuery.of("order")
        .withAggregations(List.of(AggregationSpec.of(AggregationOp.COUNT, "*"),
            AggregationSpec.of(AggregationOp.COUNT_DISTINCT, "status")))
        .withLimit(1)
        .withOffset(2));
    assertEquals("SELECT COUNT(*) AS \"count\", COUNT(DISTINCT \"order\".\"status\") AS \"count_distinct_status\""
        + " FROM \"order\" \"order\"", stmt.sql());
    assertTrue(stmt.binds().isEmpty());
  }

  @Test
  void quotingAndEscaping() {
    assertEquals("\"a\"\"b\"", new AnsiSqlDialect().quoteIdent("a\"b"));
    assertEquals("100\\%\\_x\\\\y", AbstractSqlDialect.escapeLike("100%_x\\y"));
  }
}
