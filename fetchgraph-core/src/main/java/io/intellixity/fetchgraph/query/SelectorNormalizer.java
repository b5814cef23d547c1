package io.intellixity.fetchgraph.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient pre-pass over {@code op=query} selector JSON, applied before deserialization.
 * <p>
 * Accepts the shapes planners commonly emit instead of the canonical ones:
 * <ul>
 *   <li>{@code filters} as a list: flattened and AND-combined</li>
 *   <li>logical objects without {@code type}</li>
 *   <li>aggregations written as {@code {"field":"sum(total)"}}</li>
 *   <li>a lone {@code min}/{@code max} comparison without a value, which is really an aggregation</li>
 *   <li>group_by entries with a blank field (dropped)</li>
 * </ul>
 * The input node is not modified.
 */
public final class SelectorNormalizer {
  private static final Pattern AGG_CALL = Pattern.compile("^([A-Za-z_]\\w*)\\s*\\(\\s*([^)]+?)\\s*\\)$");
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private SelectorNormalizer() {}

  public static JsonNode normalize(JsonNode selectors) {
    if (selectors == null || !selectors.isObject()) return selectors;
    if (!"query".equals(selectors.path("op").asText(null))) return selectors;

    ObjectNode out = ((ObjectNode) selectors).deepCopy();
    if (out.has("aggregations")) out.set("aggregations", normalizeAggregations(out.get("aggregations")));
    if (out.has("group_by")) out.set("group_by", normalizeGroupBy(out.get("group_by")));
    if (out.has("filters")) out.set("filters", normalizeFilters(out.get("filters")));
    foldMinMaxFilter(out);
    return out;
  }

  private static JsonNode normalizeAggregations(JsonNode aggs) {
    if (!aggs.isArray()) return aggs;
    ArrayNode out = NODES.arrayNode();
    for (JsonNode a : aggs) {
      if (a.isObject() && a.path("agg").asText("").isBlank()) {
        Matcher m = AGG_CALL.matcher(a.path("field").asText("").trim());
        if (m.matches()) {
          ObjectNode copy = ((ObjectNode) a).deepCopy();
          copy.put("agg", m.group(1).toLowerCase(Locale.ROOT));
          copy.put("field", m.group(2).trim());
          out.add(copy);
          continue;
        }
      }
      out.add(a);
    }
    return out;
  }

  private static JsonNode normalizeGroupBy(JsonNode groupBy) {
    if (!groupBy.isArray()) return groupBy;
    ArrayNode out = NODES.arrayNode();
    for (JsonNode g : groupBy) {
      if (g.isObject() && g.path("field").asText("").isBlank()) continue;
      out.add(g);
    }
    return out;
  }

  private static JsonNode normalizeFilters(JsonNode filters) {
    if (filters.isArray()) {
      ArrayNode flat = NODES.arrayNode();
      flatten(filters, flat);
      if (flat.isEmpty()) return NODES.nullNode();
      if (flat.size() == 1) return flat.get(0);
      ObjectNode and = NODES.objectNode();
      and.put("type", "logical");
      and.put("op", "and");
      and.set("clauses", flat);
      return and;
    }
    if (filters.isObject() && filters.has("clauses") && !filters.has("type")) {
      ObjectNode copy = ((ObjectNode) filters).deepCopy();
      copy.put("type", "logical");
      if (!copy.has("op")) copy.put("op", "and");
      return copy;
    }
    return filters;
  }

  private static void flatten(JsonNode list, ArrayNode into) {
    for (JsonNode n : list) {
      if (n == null || n.isNull()) continue;
      if (n.isArray()) flatten(n, into);
      else into.add(n);
    }
  }

  private static void foldMinMaxFilter(ObjectNode selectors) {
    JsonNode f = selectors.get("filters");
    if (f == null || !f.isObject() || !"comparison".equals(f.path("type").asText(null))) return;
    String op = f.path("op").asText("").toLowerCase(Locale.ROOT);
    if (!op.equals("min") && !op.equals("max")) return;
    if (f.has("value") && !f.get("value").isNull()) return;
    String field = f.path("field").asText("");
    if (field.isBlank()) return;

    ArrayNode aggs = selectors.has("aggregations") && selectors.get("aggregations").isArray()
        ? (ArrayNode) selectors.get("aggregations")
        : NODES.arrayNode();
    ObjectNode agg = NODES.objectNode();
    agg.put("field", field);
    agg.put("agg", op);
    agg.put("alias", op + "_" + field);
    aggs.add(agg);
    selectors.set("aggregations", aggs);
    selectors.putNull("filters");
  }
}
