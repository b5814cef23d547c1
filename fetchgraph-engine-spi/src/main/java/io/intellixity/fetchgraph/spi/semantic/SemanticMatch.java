package io.intellixity.fetchgraph.spi.semantic;

import java.util.Objects;

/**
 * One hit from a {@link SemanticBackend}.
 *
 * @param id primary-key value of the matched row
 */
public record SemanticMatch(String entity, Object id, double score) {
  public SemanticMatch {
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(id, "id");
  }
}
