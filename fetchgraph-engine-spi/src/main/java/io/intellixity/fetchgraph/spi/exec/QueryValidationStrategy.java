package io.intellixity.fetchgraph.spi.exec;

import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.schema.SchemaRegistry;

/**
 * SPI hook to validate queries before engine execution.
 * <p>
 * Providers call this after join planning and before any backend work, so every engine rejects the same
 * queries with the same errors. Applications may plug in stricter rules.
 */
public interface QueryValidationStrategy {
  void validate(RelationalQuery query, SchemaRegistry registry, JoinPlan plan);
}
