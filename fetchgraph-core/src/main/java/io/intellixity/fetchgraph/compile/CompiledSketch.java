package io.intellixity.fetchgraph.compile;

import io.intellixity.fetchgraph.bind.BoundQuery;
import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.sketch.Diagnostics;

import java.util.Optional;

/**
 * Outcome of {@link SketchPipeline#compile}.
 *
 * @param query null when the sketch was too broken to bind (no root entity); see {@code diagnostics}
 */
public record CompiledSketch(RelationalQuery query, BoundQuery bound, Diagnostics diagnostics) {
  public Optional<RelationalQuery> queryIfPresent() { return Optional.ofNullable(query); }
}
