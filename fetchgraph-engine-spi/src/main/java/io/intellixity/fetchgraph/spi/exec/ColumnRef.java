package io.intellixity.fetchgraph.spi.exec;

import io.intellixity.fetchgraph.schema.EntityDescriptor;

import java.util.Objects;

/**
 * A column of one joined table instance.
 *
 * @param alias  table alias in the join plan (root entity name or relation name)
 * @param column canonical column name as declared on {@code entity}
 */
public record ColumnRef(String alias, EntityDescriptor entity, String column) {
  public ColumnRef {
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(entity, "entity");
    Objects.requireNonNull(column, "column");
  }
}
