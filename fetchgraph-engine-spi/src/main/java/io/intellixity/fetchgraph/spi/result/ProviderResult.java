package io.intellixity.fetchgraph.spi.result;

/** Output of {@code RelationalProvider.fetch}; one kind per selector op. */
public sealed interface ProviderResult permits SchemaResult, SemanticOnlyResult, QueryResult {
}
