package io.intellixity.fetchgraph.spi.exec;

import io.intellixity.fetchgraph.bind.UnknownRelationException;
import io.intellixity.fetchgraph.query.QueryValidationException;
import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.schema.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JoinPlannerTest {

  private static SchemaRegistry schema() {
    return SchemaRegistry.of(
        List.of(
            EntityDescriptor.of("customer",
                ColumnDescriptor.primaryKey("id", "int"),
                ColumnDescriptor.of("name", "string")),
            EntityDescriptor.of("order",
                ColumnDescriptor.primaryKey("id", "int"),
                ColumnDescriptor.foreignKey("customer_id", "int"),
                ColumnDescriptor.foreignKey("billing_id", "int"),
                ColumnDescriptor.of("total", "int")),
            EntityDescriptor.of("order_item",
                ColumnDescriptor.primaryKey("id", "int"),
                ColumnDescriptor.foreignKey("order_id", "int"),
                ColumnDescriptor.of("sku", "string")),
            EntityDescriptor.of("warehouse",
                ColumnDescriptor.primaryKey("id", "int"))),
        List.of(
            RelationDescriptor.of("order_customer", "order", "customer", "customer_id", "id", JoinType.INNER),
            RelationDescriptor.of("order_billing", "order", "customer", "billing_id", "id", JoinType.LEFT),
            RelationDescriptor.of("order_items", "order_item", "order", "order_id", "id", JoinType.INNER),
            RelationDescriptor.of("order", "order_item", "order", "order_id", "id", JoinType.INNER)));
  }

  @Test
  void forwardJoinUsesRelationNameAsAliasAndEntityAsLabel() {
    JoinPlan plan = new JoinPlanner().plan(schema(), RelationalQuery.of("order").withRelations(List.of("order_customer")));

    JoinStep step = plan.steps().get(0);
    assertEquals("order_customer", step.alias());
    assertEquals("customer", step.entity().name());
    assertEquals("order", step.leftAlias());
    assertEquals("customer_id", step.leftColumn());
    assertEquals("id", step.rightColumn());
    assertEquals("customer", step.label());
    assertEquals(List.of("order_customer"), plan.relationNames());
  }

  @Test
  void reverseJoinSwapsColumns() {
    JoinPlan plan = new JoinPlanner().plan(schema(), RelationalQuery.of("order").withRelations(List.of("order_items")));

    JoinStep step = plan.steps().get(0);
    assertEquals("order_item", step.entity().name());
    assertEquals("id", step.leftColumn());
    assertEquals("order_id", step.rightColumn());
  }

  @Test
  void sameEntityTwiceGetsIndependentAliasesLabelledByRelation() {
    JoinPlan plan = new JoinPlanner().plan(schema(),
        RelationalQuery.of("order").withRelations(List.of("order_customer", "order_billing")));

    assertEquals(List.of("order_customer", "order_billing"), plan.steps().stream().map(JoinStep::label).toList());
    assertEquals("order_billing", plan.resolve("order_billing", "name").alias());
    // the entity name addresses the first join that brought it in
    assertEquals("order_customer", plan.resolve("customer", "name").alias());
    assertEquals(JoinType.LEFT, plan.steps().get(1).type());
  }

  @Test
  void relationNamedLikeRootIsRejected() {
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> new JoinPlanner().plan(schema(), RelationalQuery.of("Order").withRelations(List.of("order"))));
    assertTrue(ex.getMessage().contains("'order'"));
  }

  @Test
  void relationNamedLikeJoinedEntityAddressesItsJoin() {
    JoinPlan plan = new JoinPlanner().plan(schema(), RelationalQuery.of("order_item").withRelations(List.of("order")));

    assertEquals("order", plan.steps().get(0).alias());
    assertEquals("order", plan.resolve("order", "total").alias());
    assertEquals("order_item", plan.resolve(null, "sku").alias());
  }

  @Test
  void duplicateRelationIsJoinedOnce() {
    JoinPlan plan = new JoinPlanner().plan(schema(),
        RelationalQuery.of("order").withRelations(List.of("order_customer", "order_customer")));
    assertEquals(1, plan.steps().size());
  }

  @Test
  void unknownAndDisconnectedRelationsFail() {
    JoinPlanner planner = new JoinPlanner();
    assertThrows(UnknownRelationException.class,
        () -> planner.plan(schema(), RelationalQuery.of("order").withRelations(List.of("nope"))));
    QueryValidationException ex = assertThrows(QueryValidationException.class,
        () -> planner.plan(schema(), RelationalQuery.of("warehouse").withRelations(List.of("order_customer"))));
    assertTrue(ex.getMessage().contains("order_customer"));
  }

  @Test
  void resolveSplitsDottedFieldAndNamesOutputs() {
    JoinPlan plan = new JoinPlanner().plan(schema(), RelationalQuery.of("order").withRelations(List.of("order_customer")));

    ColumnRef ref = plan.resolve(null, "customer.NAME");
    assertEquals("order_customer", ref.alias());
    assertEquals("name", ref.column());
    assertEquals("customer__name", plan.outputName(null, "customer.name"));
    assertEquals("total", plan.outputName("order", "total"));
    assertEquals("total", plan.outputName(null, "total"));
  }

  @Test
  void resolveRejectsUnknownFieldAndUnjoinedEntity() {
    JoinPlan plan = new JoinPlanner().plan(schema(), RelationalQuery.of("order"));

    QueryValidationException field = assertThrows(QueryValidationException.class, () -> plan.resolve(null, "nope"));
    assertTrue(field.getMessage().contains("Unknown field 'nope'"));
    QueryValidationException entity = assertThrows(QueryValidationException.class, () -> plan.resolve("customer", "name"));
    assertTrue(entity.getMessage().contains("not joined"));
  }

  @Test
  void defaultProjectionListsRootThenJoinedColumns() {
    JoinPlan plan = new JoinPlanner().plan(schema(), RelationalQuery.of("order").withRelations(List.of("order_customer")));

    List<String> names = plan.defaultProjection().stream().map(JoinPlan.Projection::outputName).toList();
    assertEquals(List.of("id", "customer_id", "billing_id", "total", "customer__id", "customer__name"), names);
  }
}
