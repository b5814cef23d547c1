package io.intellixity.fetchgraph.spi.semantic;

import java.util.List;

/**
 * External similarity search used to resolve semantic clauses.
 * <p>
 * Implementations are called synchronously on the querying thread and are expected to return at most
 * {@code topK} matches, best first.
 */
public interface SemanticBackend {
  List<SemanticMatch> search(String entity, List<String> fields, String query, int topK);
}
