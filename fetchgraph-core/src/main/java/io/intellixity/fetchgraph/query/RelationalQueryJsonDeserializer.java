package io.intellixity.fetchgraph.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.*;

/** Canonical selector JSON deserializer for {@link RelationalQuery}. */
public final class RelationalQueryJsonDeserializer extends JsonDeserializer<RelationalQuery> {
  @Override
  public RelationalQuery deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    return fromTree(root, codec);
  }

  static RelationalQuery fromTree(JsonNode root, ObjectCodec codec) throws IOException {
    if (!root.isObject()) throw new QueryValidationException("Query JSON must be an object");
    String op = textOrNull(root.get("op"));
    if (op != null && !op.equals("query")) {
      throw new QueryValidationException("Expected op=query, got op=" + op);
    }
    String rootEntity = textOrNull(root.get("root_entity"));
    if (rootEntity == null || rootEntity.isBlank()) {
      throw new QueryValidationException("Query requires 'root_entity'");
    }

    RelationalQuery q = RelationalQuery.of(rootEntity);

    JsonNode select = root.get("select");
    if (select != null && select.isArray()) {
      List<SelectExpr> out = new ArrayList<>();
      for (JsonNode s : select) {
        if (s.isTextual()) out.add(SelectExpr.of(s.asText()));
        else if (s.isObject() && textOrNull(s.get("expr")) != null) {
          out.add(new SelectExpr(textOrNull(s.get("expr")), textOrNull(s.get("alias"))));
        }
      }
      q = q.withSelect(out);
    }

    JsonNode filters = root.get("filters");
    if (filters != null && !filters.isNull()) {
      q = q.withFilters(parseFilter(filters, codec));
    }

    JsonNode relations = root.get("relations");
    if (relations != null && relations.isArray()) {
      List<String> out = new ArrayList<>();
      for (JsonNode r : relations) if (r.isTextual()) out.add(r.asText());
      q = q.withRelations(out);
    }

    JsonNode semantic = root.get("semantic_clauses");
    if (semantic != null && semantic.isArray()) {
      List<SemanticClause> out = new ArrayList<>();
      for (JsonNode s : semantic) {
        if (!s.isObject()) continue;
        List<String> fields = new ArrayList<>();
        JsonNode fs = s.get("fields");
        if (fs != null && fs.isArray()) for (JsonNode f : fs) fields.add(f.asText());
        JsonNode th = s.get("threshold");
        out.add(new SemanticClause(
            textOrNull(s.get("entity")),
            fields,
            textOrNull(s.get("query")),
            intOrDefault(s.get("top_k"), SemanticClause.DEFAULT_TOP_K),
            (th == null || th.isNull()) ? null : th.asDouble(),
            SemanticMode.parse(textOrNull(s.get("mode")))
        ));
      }
      q = q.withSemanticClauses(out);
    }

    JsonNode groupBy = root.get("group_by");
    if (groupBy != null && groupBy.isArray()) {
      List<GroupBySpec> out = new ArrayList<>();
      for (JsonNode gb : groupBy) {
        if (gb.isTextual()) out.add(GroupBySpec.of(gb.asText()));
        else if (gb.isObject() && textOrNull(gb.get("field")) != null) {
          out.add(new GroupBySpec(textOrNull(gb.get("entity")), textOrNull(gb.get("field")), textOrNull(gb.get("alias"))));
        }
      }
      q = q.withGroupBy(out);
    }

    JsonNode aggs = root.get("aggregations");
    if (aggs != null && aggs.isArray()) {
      List<AggregationSpec> out = new ArrayList<>();
      for (JsonNode a : aggs) {
        if (!a.isObject()) continue;
        out.add(new AggregationSpec(textOrNull(a.get("field")), AggregationOp.parse(textOrNull(a.get("agg"))),
            textOrNull(a.get("alias"))));
      }
      q = q.withAggregations(out);
    }

    JsonNode limit = root.get("limit");
    if (limit != null && !limit.isNull()) q = q.withLimit(limit.asInt());
    q = q.withOffset(intOrDefault(root.get("offset"), 0));
    q = q.withCaseSensitivity(boolOrDefault(root.get("case_sensitivity"), false));
    return q;
  }

  static FilterClause parseFilter(JsonNode n, ObjectCodec codec) throws IOException {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new QueryValidationException("Filter must be an object: " + n);
    String type = textOrNull(n.get("type"));
    if (type == null) type = n.has("clauses") ? "logical" : "comparison";

    if (type.equals("logical")) {
      List<FilterClause> children = new ArrayList<>();
      JsonNode clauses = n.get("clauses");
      if (clauses != null && clauses.isArray()) {
        for (JsonNode c : clauses) {
          FilterClause child = parseFilter(c, codec);
          if (child != null) children.add(child);
        }
      }
      return new LogicalFilter(LogicalOp.parse(textOrNull(n.get("op"))), children);
    }
    if (type.equals("comparison")) {
      String field = textOrNull(n.get("field"));
      if (field == null) throw new QueryValidationException("Comparison filter requires 'field'");
      String opRaw = textOrNull(n.get("op"));
      ComparisonOp op = ComparisonOp.fromSymbol(opRaw == null ? "=" : opRaw)
          .orElseThrow(() -> new QueryValidationException("Unknown comparison op: " + opRaw));
      JsonNode v = n.get("value");
      Object value = (v == null || v.isNull()) ? null : codec.treeToValue(v, Object.class);
      return new ComparisonFilter(textOrNull(n.get("entity")), field, op, value);
    }
    throw new QueryValidationException("Unknown filter type: " + type);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }

  private static int intOrDefault(JsonNode n, int def) {
    return (n == null || n.isNull()) ? def : n.asInt(def);
  }

  private static boolean boolOrDefault(JsonNode n, boolean def) {
    return (n == null || n.isNull()) ? def : n.asBoolean(def);
  }
}
