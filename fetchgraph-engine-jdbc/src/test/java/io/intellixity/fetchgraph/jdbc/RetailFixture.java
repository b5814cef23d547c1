package io.intellixity.fetchgraph.jdbc;

import io.intellixity.fetchgraph.schema.*;
import io.intellixity.fetchgraph.spi.semantic.SemanticBackend;
import io.intellixity.fetchgraph.spi.semantic.SemanticMatch;
import io.intellixity.fetchgraph.tabular.ColumnTable;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Customers and orders shared by the SQL engine tests. Orders reach {@code customer} twice: through
 * {@code order_customer}, whose join type varies per test, and through the left-joined {@code order_billing}.
 */
final class RetailFixture {
  private RetailFixture() {}

  static SchemaRegistry schema(JoinType join) {
    return SchemaRegistry.of(
        List.of(
            EntityDescriptor.of("customer",
                ColumnDescriptor.primaryKey("id", "int"),
                ColumnDescriptor.of("name", "string"),
                ColumnDescriptor.semantic("notes")),
            EntityDescriptor.of("order",
                ColumnDescriptor.primaryKey("id", "int"),
                ColumnDescriptor.foreignKey("customer_id", "int"),
                ColumnDescriptor.foreignKey("billing_id", "int"),
                ColumnDescriptor.of("total", "int"),
                ColumnDescriptor.of("status", "string"),
                ColumnDescriptor.of("placed_on", "date"))),
        List.of(
            RelationDescriptor.of("order_customer", "order", "customer", "customer_id", "id", join),
            RelationDescriptor.of("order_billing", "order", "customer", "billing_id", "id", JoinType.LEFT)));
  }

  static Map<String, ColumnTable> tables() {
    return Map.of(
        "customer", ColumnTable.builder("customer", "id", "name", "notes")
            .row(1, "Alice", "pharma buyer")
            .row(2, "Bob", "retail")
            .row(3, "Grace", null)
            .build(),
        "order", ColumnTable.builder("order", "id", "customer_id", "billing_id", "total", "status", "placed_on")
            .row(101, 1, 2, 120, "shipped", LocalDate.of(2024, 1, 5))
            .row(102, 2, null, 80, "pending", LocalDate.of(2024, 2, 1))
            .row(103, 1, 3, 200, "pending", LocalDate.of(2024, 3, 9))
            .row(104, 9, 1, 15, null, null)
            .build());
  }

  static SemanticBackend scores(Object... idScorePairs) {
    return (entity, fields, query, topK) -> {
      List<SemanticMatch> out = new ArrayList<>();
      for (int i = 0; i < idScorePairs.length; i += 2) {
        out.add(new SemanticMatch(entity, idScorePairs[i], ((Number) idScorePairs[i + 1]).doubleValue()));
      }
      return out;
    };
  }
}
