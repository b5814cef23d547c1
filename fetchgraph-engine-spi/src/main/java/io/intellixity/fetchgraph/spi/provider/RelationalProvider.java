package io.intellixity.fetchgraph.spi.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.schema.SchemaRegistry;
import io.intellixity.fetchgraph.spi.result.ProviderResult;
import io.intellixity.fetchgraph.spi.result.QueryResult;

import java.util.Set;

/**
 * A relational data source answering structured selectors.
 * <p>
 * Calls are synchronous. Instances are read-mostly; a provider over a shared connection or mutable cache
 * must be used from one thread at a time unless the implementation says otherwise.
 */
public interface RelationalProvider {
  String name();

  Set<ProviderCapability> capabilities();

  SchemaRegistry schema();

  /** Discovery payload: accepted selector shapes, schema hints and examples. */
  ProviderInfo describe();

  /**
   * Answers a selector object: {@code {"op": "schema" | "semantic_only" | "query", ...}} or a
   * {@code {"$dsl": ..., "payload": ...}} sketch envelope.
   *
   * @throws IllegalArgumentException when the selector envelope itself is malformed
   */
  ProviderResult fetch(JsonNode selectors);

  QueryResult execute(RelationalQuery query);
}
