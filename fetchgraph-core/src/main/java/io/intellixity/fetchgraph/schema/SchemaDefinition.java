package io.intellixity.fetchgraph.schema;

import java.util.List;

/** Serializable entity/relation declaration, the input of {@link SchemaRegistry#of(SchemaDefinition)}. */
public record SchemaDefinition(List<EntityDescriptor> entities, List<RelationDescriptor> relations) {
  public SchemaDefinition {
    entities = List.copyOf(entities == null ? List.of() : entities);
    relations = List.copyOf(relations == null ? List.of() : relations);
  }
}
