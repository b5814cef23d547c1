package io.intellixity.fetchgraph.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record RelationDescriptor(String name,
                                 @JsonProperty("from_entity") String fromEntity,
                                 @JsonProperty("to_entity") String toEntity,
                                 RelationJoin join,
                                 Cardinality cardinality,
                                 @JsonProperty("semantic_hint") String semanticHint) {
  public RelationDescriptor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(fromEntity, "fromEntity");
    Objects.requireNonNull(toEntity, "toEntity");
    Objects.requireNonNull(join, "join");
  }

  public static RelationDescriptor of(String name, String fromEntity, String toEntity,
                                      String fromColumn, String toColumn, JoinType type) {
    return new RelationDescriptor(name, fromEntity, toEntity, new RelationJoin(fromColumn, toColumn, type), null, null);
  }

  /** True when either endpoint is {@code entity} (normalized comparison). */
  public boolean touches(String entity) {
    String e = SchemaNames.normalize(entity);
    return SchemaNames.normalize(fromEntity).equals(e) || SchemaNames.normalize(toEntity).equals(e);
  }
}
