package io.intellixity.fetchgraph.schema;

import java.util.Objects;

/**
 * @param type     semantic type tag (e.g. "int", "string", "date"); informational only
 * @param semantic whether the column is eligible for semantic search
 */
public record ColumnDescriptor(String name, String type, ColumnRole role, boolean semantic) {
  public ColumnDescriptor {
    Objects.requireNonNull(name, "name");
    type = (type == null || type.isBlank()) ? "string" : type;
    role = (role == null) ? ColumnRole.NONE : role;
  }

  public static ColumnDescriptor of(String name, String type) {
    return new ColumnDescriptor(name, type, ColumnRole.NONE, false);
  }

  public static ColumnDescriptor primaryKey(String name, String type) {
    return new ColumnDescriptor(name, type, ColumnRole.PRIMARY_KEY, false);
  }

  public static ColumnDescriptor foreignKey(String name, String type) {
    return new ColumnDescriptor(name, type, ColumnRole.FOREIGN_KEY, false);
  }

  public static ColumnDescriptor semantic(String name) {
    return new ColumnDescriptor(name, "string", ColumnRole.NONE, true);
  }

  public boolean isPrimaryKey() { return role == ColumnRole.PRIMARY_KEY; }
}
