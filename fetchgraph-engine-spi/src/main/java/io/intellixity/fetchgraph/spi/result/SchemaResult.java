package io.intellixity.fetchgraph.spi.result;

import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.RelationDescriptor;

import java.util.List;

public record SchemaResult(List<EntityDescriptor> entities, List<RelationDescriptor> relations) implements ProviderResult {
  public SchemaResult {
    entities = List.copyOf(entities);
    relations = List.copyOf(relations);
  }
}
