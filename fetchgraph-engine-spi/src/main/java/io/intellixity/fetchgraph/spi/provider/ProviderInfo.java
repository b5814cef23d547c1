package io.intellixity.fetchgraph.spi.provider;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.RelationDescriptor;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Result of {@link RelationalProvider#describe()}.
 *
 * @param selectorsSchema JSON Schema {@code oneOf} the schema, semantic_only and query request shapes
 * @param examples        selector examples as JSON strings, using real entity and relation names
 */
public record ProviderInfo(String name,
                           String description,
                           Set<ProviderCapability> capabilities,
                           @JsonProperty("selectors_schema") JsonNode selectorsSchema,
                           List<EntityDescriptor> entities,
                           List<RelationDescriptor> relations,
                           List<String> examples,
                           @JsonProperty("selector_dialects") List<SelectorDialectInfo> selectorDialects) {
  public ProviderInfo {
    EnumSet<ProviderCapability> caps = EnumSet.noneOf(ProviderCapability.class);
    caps.addAll(capabilities);
    capabilities = Collections.unmodifiableSet(caps);
    entities = List.copyOf(entities);
    relations = List.copyOf(relations);
    examples = List.copyOf(examples);
    selectorDialects = List.copyOf(selectorDialects);
  }
}
