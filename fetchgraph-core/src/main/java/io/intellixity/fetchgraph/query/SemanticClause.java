package io.intellixity.fetchgraph.query;

import java.util.List;
import java.util.Objects;

/**
 * Free-text similarity search against {@code entity}, resolved by the provider's semantic backend.
 *
 * @param threshold minimum score a match needs to count; null keeps every returned match
 */
public record SemanticClause(String entity, List<String> fields, String query, int topK, Double threshold,
                             SemanticMode mode) {
  public static final int DEFAULT_TOP_K = 100;

  public SemanticClause {
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(query, "query");
    fields = List.copyOf(fields == null ? List.of() : fields);
    if (topK <= 0) topK = DEFAULT_TOP_K;
    mode = (mode == null) ? SemanticMode.FILTER : mode;
  }

  public static SemanticClause filter(String entity, List<String> fields, String query, Double threshold) {
    return new SemanticClause(entity, fields, query, DEFAULT_TOP_K, threshold, SemanticMode.FILTER);
  }

  public static SemanticClause boost(String entity, List<String> fields, String query, Double threshold) {
    return new SemanticClause(entity, fields, query, DEFAULT_TOP_K, threshold, SemanticMode.BOOST);
  }
}
