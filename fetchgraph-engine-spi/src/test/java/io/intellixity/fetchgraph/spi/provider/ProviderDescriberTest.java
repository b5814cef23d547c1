package io.intellixity.fetchgraph.spi.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.fetchgraph.schema.*;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ProviderDescriberTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private static SchemaRegistry schema() {
    return SchemaRegistry.of(
        List.of(
            new EntityDescriptor("customer", "Customer", List.of(
                ColumnDescriptor.primaryKey("id", "int"),
                ColumnDescriptor.of("name", "string"),
                ColumnDescriptor.semantic("notes"))),
            EntityDescriptor.of("order",
                ColumnDescriptor.primaryKey("id", "int"),
                ColumnDescriptor.foreignKey("customer_id", "int"))),
        List.of(new RelationDescriptor("order_customer", "order", "customer",
            new RelationJoin("customer_id", "id", JoinType.INNER), Cardinality.MANY_TO_ONE, "each order has one buyer")));
  }

  private static ProviderInfo info() {
    return ProviderDescriber.describe("orders", schema(), EnumSet.of(ProviderCapability.SCHEMA, ProviderCapability.ROW_QUERY));
  }

  @Test
  void descriptionListsEntitiesAndRelations() {
    String d = info().description();
    assertTrue(d.startsWith(ProviderDescriber.HEADER));
    assertTrue(d.contains("- customer: Customer; PK: id; semantic: notes"), d);
    assertTrue(d.contains("- order: order; PK: id"), d);
    assertTrue(d.contains("- order_customer: order.customer_id -> customer.id (many_to_1); each order has one buyer"), d);
  }

  @Test
  void selectorsSchemaOffersThreeShapesWithSchemaEnums() {
    JsonNode s = info().selectorsSchema();
    JsonNode oneOf = s.get("oneOf");
    assertEquals(3, oneOf.size());
    assertEquals("schema", oneOf.get(0).at("/properties/op/const").asText());
    assertEquals("customer", oneOf.get(1).at("/properties/entity/enum/0").asText());
    assertEquals("order_customer", oneOf.get(2).at("/properties/relations/items/enum/0").asText());
    assertEquals(2, oneOf.get(2).at("/properties/root_entity/enum").size());
    assertEquals("#/$defs/filter", oneOf.get(2).at("/properties/filters/$ref").asText());
    assertTrue(s.has("$defs"));
  }

  @Test
  void examplesUseRealNames() throws Exception {
    List<String> examples = info().examples();
    assertEquals(3, examples.size());
    assertEquals("{\"op\":\"schema\"}", examples.get(0));

    JsonNode relationExample = MAPPER.readTree(examples.get(1));
    assertEquals("order", relationExample.get("root_entity").asText());
    assertEquals("order_customer", relationExample.at("/relations/0").asText());
    assertEquals("notes", relationExample.at("/filters/field").asText());
    assertEquals("ilike", relationExample.at("/filters/op").asText());

    JsonNode semantic = MAPPER.readTree(examples.get(2));
    assertEquals("semantic_only", semantic.get("op").asText());
    assertEquals("customer", semantic.get("entity").asText());
  }

  @Test
  void sketchDialectEnvelopeIsValidJson() throws Exception {
    SelectorDialectInfo dialect = info().selectorDialects().get(0);
    assertEquals("fetchgraph.dsl.query_sketch@v0", dialect.id());
    assertEquals("json-object", dialect.payloadFormat());

    JsonNode envelope = MAPPER.readTree(dialect.envelopeExample());
    assertEquals(dialect.id(), envelope.get("$dsl").asText());
    assertEquals("order", envelope.at("/payload/from").asText());
    assertEquals("order_customer", envelope.at("/payload/with/0").asText());
    assertEquals(20, envelope.at("/payload/take").asInt());
  }

  @Test
  void providerInfoSerializesWithSnakeCaseKeys() {
    JsonNode n = MAPPER.valueToTree(info());
    assertTrue(n.has("selectors_schema"));
    assertTrue(n.has("selector_dialects"));
    assertEquals("schema", n.at("/capabilities/0").asText());
    assertEquals("order_customer", n.at("/relations/0/name").asText());
  }
}
