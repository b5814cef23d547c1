package io.intellixity.fetchgraph.examples.semantic;

import io.intellixity.fetchgraph.schema.ColumnDescriptor;
import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.SchemaRegistry;
import io.intellixity.fetchgraph.spi.semantic.SemanticMatch;
import io.intellixity.fetchgraph.tabular.ColumnTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class KeywordSemanticBackendTest {
  private static KeywordSemanticBackend backend() {
    SchemaRegistry schema = SchemaRegistry.of(List.of(EntityDescriptor.of("customer",
        ColumnDescriptor.primaryKey("id", "int"),
        ColumnDescriptor.of("name", "string"),
        ColumnDescriptor.semantic("notes"))), List.of());
    ColumnTable customers = ColumnTable.builder("customer", "id", "name", "notes")
        .row(1, "Pharma Inc", "hospital buyer")
        .row(2, "Bolt", "Pharma buyer, big")
        .row(3, "Cedar", "pharma research")
        .row(4, "Dune", null)
        .build();
    return new KeywordSemanticBackend(schema, Map.of("customer", customers));
  }

  @Test
  void scoresShareOfQueryTokens() {
    List<SemanticMatch> m = backend().search("customer", List.of(), "pharma buyer", 10);
    assertEquals(List.of(2, 1, 3), m.stream().map(SemanticMatch::id).toList());
    assertEquals(1.0, m.get(0).score());
    assertEquals(0.5, m.get(1).score());
  }

  @Test
  void searchesOnlySemanticColumns() {
    assertTrue(backend().search("customer", List.of("name"), "pharma", 10).isEmpty());
    assertEquals(2, backend().search("customer", List.of(), "pharma", 2).size());
  }

  @Test
  void tokenizesOnNonWordCharacters() {
    assertEquals(Set.of("pharma", "buyer", "big"), KeywordSemanticBackend.tokens("Pharma buyer, big!"));
    assertTrue(backend().search("customer", null, "  ,, ", 10).isEmpty());
  }
}
