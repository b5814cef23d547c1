package io.intellixity.fetchgraph.schema;

import java.util.List;

/**
 * One place a field name can resolve to: a column of {@code entity} reached from the root through
 * {@code joinPath} (empty for the root itself).
 */
public record FieldCandidate(String entity, String field, String fieldType, List<String> joinPath,
                             boolean declaredPrefix) {
  public FieldCandidate {
    joinPath = List.copyOf(joinPath);
  }

  public boolean isRoot() { return joinPath.isEmpty(); }

  /** Last relation of the path, or the entity for a root candidate. */
  public String qualifier() {
    return joinPath.isEmpty() ? entity : joinPath.get(joinPath.size() - 1);
  }

  public String qualifiedName() { return qualifier() + "." + field; }
}
