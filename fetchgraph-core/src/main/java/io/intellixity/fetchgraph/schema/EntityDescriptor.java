package io.intellixity.fetchgraph.schema;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Entity (table) with an ordered column list. {@code label} defaults to the name. */
public record EntityDescriptor(String name, String label, List<ColumnDescriptor> columns) {
  public EntityDescriptor {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("entity name must not be blank");
    label = (label == null || label.isBlank()) ? name : label;
    columns = List.copyOf(columns == null ? List.of() : columns);
  }

  public static EntityDescriptor of(String name, ColumnDescriptor... columns) {
    return new EntityDescriptor(name, null, List.of(columns));
  }

  public Optional<ColumnDescriptor> primaryKey() {
    return columns.stream().filter(ColumnDescriptor::isPrimaryKey).findFirst();
  }

  public Optional<ColumnDescriptor> column(String columnName) {
    String key = SchemaNames.normalize(columnName);
    return columns.stream().filter(c -> SchemaNames.normalize(c.name()).equals(key)).findFirst();
  }

  public List<String> columnNames() {
    return columns.stream().map(ColumnDescriptor::name).toList();
  }
}
