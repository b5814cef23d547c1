package io.intellixity.fetchgraph.spi.result;

import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.RelationDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Compact text rendering of provider results, meant for prompt contexts.
 * <p>
 * Row and match lists are cut after {@value #MAX_ITEMS} entries.
 */
public final class ResultSummaries {
  public static final int MAX_ITEMS = 10;

  private ResultSummaries() {}

  public static String toText(ProviderResult result) {
    if (result instanceof SchemaResult s) return schema(s);
    if (result instanceof SemanticOnlyResult s) return semantic(s);
    if (result instanceof QueryResult q) return query(q);
    return String.valueOf(result);
  }

  private static String schema(SchemaResult s) {
    String entities = s.entities().stream().map(EntityDescriptor::name).collect(Collectors.joining(", "));
    String relations = s.relations().stream().map(RelationDescriptor::name).collect(Collectors.joining(", "));
    return "Schema: entities=(" + entities + "); relations=(" + relations + ")";
  }

  private static String semantic(SemanticOnlyResult s) {
    return "Semantic matches: " + s.matches().stream()
        .limit(MAX_ITEMS)
        .map(m -> m.entity() + ":" + m.id() + " (" + String.format(Locale.ROOT, "%.2f", m.score()) + ")")
        .collect(Collectors.joining("; "));
  }

  private static String query(QueryResult q) {
    List<String> lines = new ArrayList<>();
    for (RowResult row : q.rows().subList(0, Math.min(MAX_ITEMS, q.rows().size()))) {
      List<String> parts = new ArrayList<>();
      row.data().forEach((k, v) -> parts.add(k + "=" + v));
      for (Map.Entry<String, Map<String, Object>> rel : row.related().entrySet()) {
        parts.add(rel.getKey() + "=" + rel.getValue().entrySet().stream()
            .map(e -> e.getKey() + ":" + e.getValue())
            .collect(Collectors.joining(",")));
      }
      lines.add(String.join(" | ", parts));
    }
    if (!q.aggregations().isEmpty()) {
      lines.add("Aggregations: " + q.aggregations().entrySet().stream()
          .map(e -> e.getKey() + "=" + e.getValue().value())
          .collect(Collectors.joining(", ")));
    }
    if (q.rows().size() > MAX_ITEMS) {
      lines.add("... trimmed " + (q.rows().size() - MAX_ITEMS) + " rows ...");
    }
    return lines.isEmpty() ? "(empty result)" : String.join("\n", lines);
  }
}
