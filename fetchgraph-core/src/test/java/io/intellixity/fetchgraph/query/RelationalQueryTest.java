package io.intellixity.fetchgraph.query;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RelationalQueryTest {
  @Test
  void groupingWithoutAggregationsCountsRows() {
    RelationalQuery q = RelationalQuery.of("order").withGroupBy(List.of(GroupBySpec.of("status")));
    List<AggregationSpec> aggs = q.effectiveAggregations();
    assertEquals(1, aggs.size());
    assertTrue(aggs.get(0).isCountAll());
    assertEquals("count", aggs.get(0).resolvedAlias());
    assertTrue(q.aggregations().isEmpty());
  }

  @Test
  void explicitAggregationsAreKept() {
    AggregationSpec sum = AggregationSpec.of(AggregationOp.SUM, "customer.total");
    RelationalQuery q = RelationalQuery.of("order")
        .withGroupBy(List.of(GroupBySpec.of("status")))
        .withAggregations(List.of(sum));
    assertEquals(List.of(sum), q.effectiveAggregations());
    assertEquals("sum_customer__total", sum.resolvedAlias());
    assertTrue(RelationalQuery.of("order").effectiveAggregations().isEmpty());
  }

  @Test
  void withersCopy() {
    RelationalQuery base = RelationalQuery.of("order");
    RelationalQuery limited = base.withLimit(5).withOffset(2).withCaseSensitivity(true);
    assertNull(base.limit());
    assertEquals(0, base.offset());
    assertEquals(5, limited.limit());
    assertEquals(2, limited.offset());
    assertTrue(limited.caseSensitivity());
    assertFalse(limited.isAggregate());
  }

  @Test
  void rejectsNegativePaging() {
    assertThrows(IllegalArgumentException.class, () -> RelationalQuery.of("order").withLimit(-1));
    assertThrows(IllegalArgumentException.class, () -> RelationalQuery.of("order").withOffset(-1));
  }
}
