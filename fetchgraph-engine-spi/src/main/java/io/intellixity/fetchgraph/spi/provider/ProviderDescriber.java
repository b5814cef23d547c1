package io.intellixity.fetchgraph.spi.provider;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.fetchgraph.compile.SketchPipeline;
import io.intellixity.fetchgraph.query.AggregationOp;
import io.intellixity.fetchgraph.query.ComparisonOp;
import io.intellixity.fetchgraph.query.SemanticClause;
import io.intellixity.fetchgraph.schema.ColumnDescriptor;
import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.RelationDescriptor;
import io.intellixity.fetchgraph.schema.SchemaRegistry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/** Builds {@link ProviderInfo} from a schema: selector JSON Schema, text description and examples. */
final class ProviderDescriber {
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  static final String HEADER = "Relational data provider.";

  private ProviderDescriber() {}

  static ProviderInfo describe(String name, SchemaRegistry registry, Set<ProviderCapability> capabilities) {
    List<EntityDescriptor> entities = registry.entities();
    List<RelationDescriptor> relations = registry.relations();
    Optional<TextExample> textExample = textExample(registry);
    return new ProviderInfo(
        name,
        description(entities, relations),
        capabilities,
        selectorsSchema(entities, relations),
        entities,
        relations,
        examples(entities, textExample),
        List.of(sketchDialect(entities, relations, textExample)));
  }

  static String description(List<EntityDescriptor> entities, List<RelationDescriptor> relations) {
    List<String> lines = new ArrayList<>();
    lines.add(HEADER);
    if (!entities.isEmpty()) {
      lines.add("Entities:");
      for (EntityDescriptor e : entities) {
        List<String> parts = new ArrayList<>();
        parts.add(e.label());
        List<String> pk = e.columns().stream().filter(ColumnDescriptor::isPrimaryKey).map(ColumnDescriptor::name).toList();
        List<String> sem = e.columns().stream().filter(ColumnDescriptor::semantic).map(ColumnDescriptor::name).toList();
        if (!pk.isEmpty()) parts.add("PK: " + String.join(", ", pk));
        if (!sem.isEmpty()) parts.add("semantic: " + String.join(", ", sem));
        lines.add("- " + e.name() + ": " + String.join("; ", parts));
      }
    }
    if (!relations.isEmpty()) {
      lines.add("Relations:");
      for (RelationDescriptor r : relations) {
        String line = "- " + r.name() + ": " + r.fromEntity() + "." + r.join().fromColumn()
            + " -> " + r.toEntity() + "." + r.join().toColumn();
        if (r.cardinality() != null) line += " (" + r.cardinality().symbol() + ")";
        if (r.semanticHint() != null && !r.semanticHint().isBlank()) line += "; " + r.semanticHint();
        lines.add(line);
      }
    }
    return String.join("\n", lines);
  }

  static ObjectNode selectorsSchema(List<EntityDescriptor> entities, List<RelationDescriptor> relations) {
    ArrayNode entityNames = NODES.arrayNode();
    entities.forEach(e -> entityNames.add(e.name()));
    ArrayNode relationNames = NODES.arrayNode();
    relations.forEach(r -> relationNames.add(r.name()));

    ObjectNode schemaReq = request("SchemaRequest", "schema");

    ObjectNode semanticReq = request("SemanticOnlyRequest", "semantic_only");
    ObjectNode sp = (ObjectNode) semanticReq.get("properties");
    sp.set("entity", string().set("enum", entityNames.deepCopy()));
    sp.set("query", string());
    sp.set("fields", arrayOf(string()));
    sp.set("top_k", integer().put("default", SemanticClause.DEFAULT_TOP_K));
    ((ArrayNode) semanticReq.get("required")).add("entity").add("query");

    ObjectNode queryReq = request("RelationalQuery", "query");
    ObjectNode qp = (ObjectNode) queryReq.get("properties");
    qp.set("root_entity", string().set("enum", entityNames.deepCopy()));
    qp.set("select", arrayOf(object(List.of("expr", "alias"))));
    qp.set("filters", NODES.objectNode().put("$ref", "#/$defs/filter"));
    qp.set("relations", arrayOf(string().set("enum", relationNames.deepCopy())));
    ObjectNode semanticClause = object(List.of("entity", "query"));
    ObjectNode scp = (ObjectNode) semanticClause.get("properties");
    scp.set("fields", arrayOf(string()));
    scp.set("top_k", integer().put("default", SemanticClause.DEFAULT_TOP_K));
    scp.set("threshold", NODES.objectNode().put("type", "number"));
    scp.set("mode", string().set("enum", NODES.arrayNode().add("filter").add("boost")));
    qp.set("semantic_clauses", arrayOf(semanticClause));
    qp.set("group_by", arrayOf(object(List.of("entity", "field", "alias"))));
    ObjectNode agg = object(List.of("field", "alias"));
    ArrayNode aggOps = NODES.arrayNode();
    for (AggregationOp op : AggregationOp.values()) aggOps.add(op.symbol());
    ((ObjectNode) agg.get("properties")).set("agg", string().set("enum", aggOps));
    qp.set("aggregations", arrayOf(agg));
    qp.set("limit", integer());
    qp.set("offset", integer().put("default", 0));
    qp.set("case_sensitivity", NODES.objectNode().put("type", "boolean").put("default", false));
    ((ArrayNode) queryReq.get("required")).add("root_entity");

    ObjectNode out = NODES.objectNode();
    out.putArray("oneOf").add(schemaReq).add(semanticReq).add(queryReq);
    out.set("$defs", filterDefs());
    return out;
  }

  static List<String> examples(List<EntityDescriptor> entities, Optional<TextExample> textExample) {
    List<String> out = new ArrayList<>();
    out.add(NODES.objectNode().put("op", "schema").toString());

    if (textExample.isPresent()) {
      TextExample t = textExample.get();
      ObjectNode q = NODES.objectNode().put("op", "query").put("root_entity", t.root.name());
      q.putArray("relations").add(t.relation.name());
      ArrayNode select = q.putArray("select");
      select.addObject().put("expr", t.root.name() + "." + t.rootKey);
      select.addObject().put("expr", t.target.name() + "." + t.column);
      q.putObject("filters")
          .put("type", "comparison")
          .put("entity", t.target.name())
          .put("field", t.column)
          .put("op", ComparisonOp.ILIKE.symbol())
          .put("value", "<text>");
      q.put("limit", 20);
      out.add(q.toString());
    } else if (!entities.isEmpty()) {
      EntityDescriptor e0 = entities.get(0);
      String col = e0.columns().isEmpty() ? "id" : e0.columns().get(0).name();
      ObjectNode q = NODES.objectNode().put("op", "query").put("root_entity", e0.name());
      q.putObject("filters").put("type", "comparison").put("field", col).put("op", "=").put("value", "<value>");
      q.put("limit", 20);
      out.add(q.toString());
    }

    entities.stream()
        .filter(e -> e.columns().stream().anyMatch(ColumnDescriptor::semantic))
        .findFirst()
        .ifPresent(e -> out.add(NODES.objectNode()
            .put("op", "semantic_only")
            .put("entity", e.name())
            .put("query", "<natural language search text>")
            .put("top_k", 30)
            .toString()));
    return out;
  }

  static SelectorDialectInfo sketchDialect(List<EntityDescriptor> entities, List<RelationDescriptor> relations,
                                           Optional<TextExample> textExample) {
    ObjectNode payload = NODES.objectNode();
    if (textExample.isPresent()) {
      TextExample t = textExample.get();
      payload.put("from", t.root.name());
      payload.putArray("get").add(t.root.name() + "." + t.rootKey).add(t.target.name() + "." + t.column);
      payload.putArray("where").addArray().add(t.target.name() + "." + t.column).add("ilike").add("<text>");
      payload.putArray("with").add(t.relation.name());
    } else if (!entities.isEmpty()) {
      EntityDescriptor e0 = entities.get(0);
      payload.put("from", e0.name());
      if (!e0.columns().isEmpty()) {
        String col = e0.columns().get(0).name();
        payload.putArray("get").add(e0.name() + "." + col);
        payload.putArray("where").addArray().add(col).add("=").add("<value>");
      }
      if (!relations.isEmpty()) payload.putArray("with").add(relations.get(0).name());
    }
    payload.put("take", 20);

    ObjectNode envelope = NODES.objectNode().put("$dsl", SketchPipeline.DIALECT_ID);
    envelope.set("payload", payload);
    String ops = Arrays.stream(ComparisonOp.values()).map(ComparisonOp::symbol).collect(Collectors.joining(", "));
    return new SelectorDialectInfo(
        SketchPipeline.DIALECT_ID,
        "Compact JSON5-like sketch for relational queries.",
        "json-object",
        envelope.toString(),
        "payload keys: from, get, where, with, take; where: ['field','value'] or ['field','op','value']; ops: " + ops);
  }

  /** First relation (by name) whose target has a text column to filter on. */
  static Optional<TextExample> textExample(SchemaRegistry registry) {
    for (RelationDescriptor r : registry.relations()) {
      EntityDescriptor target = registry.entity(r.toEntity());
      Optional<String> column = target.columns().stream().filter(ColumnDescriptor::semantic).map(ColumnDescriptor::name).findFirst()
          .or(() -> target.columns().stream().map(ColumnDescriptor::name).findFirst());
      if (column.isEmpty()) continue;
      EntityDescriptor root = registry.entity(r.fromEntity());
      String rootKey = root.primaryKey().map(ColumnDescriptor::name).orElse("id");
      return Optional.of(new TextExample(root, r, target, column.get(), rootKey));
    }
    return Optional.empty();
  }

  record TextExample(EntityDescriptor root, RelationDescriptor relation, EntityDescriptor target, String column,
                     String rootKey) {}

  private static ObjectNode request(String title, String op) {
    ObjectNode n = NODES.objectNode().put("title", title).put("type", "object");
    n.putObject("properties").set("op", NODES.objectNode().put("const", op));
    n.putArray("required").add("op");
    return n;
  }

  private static ObjectNode object(List<String> stringProps) {
    ObjectNode n = NODES.objectNode().put("type", "object");
    ObjectNode props = n.putObject("properties");
    stringProps.forEach(p -> props.set(p, string()));
    return n;
  }

  private static ObjectNode filterDefs() {
    ArrayNode compOps = NODES.arrayNode();
    for (ComparisonOp op : ComparisonOp.values()) compOps.add(op.symbol());

    ObjectNode comparison = object(List.of("entity", "field"));
    ObjectNode cp = (ObjectNode) comparison.get("properties");
    cp.set("type", NODES.objectNode().put("const", "comparison"));
    cp.set("op", string().set("enum", compOps));
    cp.set("value", NODES.objectNode());
    comparison.putArray("required").add("type").add("field").add("op");

    ObjectNode logical = NODES.objectNode().put("type", "object");
    ObjectNode lp = logical.putObject("properties");
    lp.set("type", NODES.objectNode().put("const", "logical"));
    lp.set("op", string().set("enum", NODES.arrayNode().add("and").add("or")));
    lp.set("clauses", arrayOf(NODES.objectNode().put("$ref", "#/$defs/filter")));
    logical.putArray("required").add("type").add("op").add("clauses");

    ObjectNode defs = NODES.objectNode();
    defs.set("comparison", comparison);
    defs.set("logical", logical);
    ObjectNode filter = defs.putObject("filter");
    filter.putArray("oneOf")
        .add(NODES.objectNode().put("$ref", "#/$defs/comparison"))
        .add(NODES.objectNode().put("$ref", "#/$defs/logical"));
    return defs;
  }

  private static ObjectNode string() { return NODES.objectNode().put("type", "string"); }

  private static ObjectNode integer() { return NODES.objectNode().put("type", "integer"); }

  private static ObjectNode arrayOf(ObjectNode items) {
    ObjectNode n = NODES.objectNode().put("type", "array");
    n.set("items", items);
    return n;
  }
}
