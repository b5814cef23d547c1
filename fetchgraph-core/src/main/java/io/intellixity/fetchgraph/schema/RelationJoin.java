package io.intellixity.fetchgraph.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** Equi-join {@code from_entity.from_column = to_entity.to_column}. */
public record RelationJoin(@JsonProperty("from_column") String fromColumn,
                           @JsonProperty("to_column") String toColumn,
                           @JsonProperty("type") JoinType type) {
  public RelationJoin {
    Objects.requireNonNull(fromColumn, "fromColumn");
    Objects.requireNonNull(toColumn, "toColumn");
    type = (type == null) ? JoinType.INNER : type;
  }
}
