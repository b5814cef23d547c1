package io.intellixity.fetchgraph.bind;

import io.intellixity.fetchgraph.schema.FieldCandidate;

import java.util.List;

/**
 * Orders field candidates and decides which of them tie.
 * <p>
 * The binder takes the first of {@link #order} and treats {@link #topTier} with more than one entry as an
 * ambiguity. Implementations must be deterministic.
 */
public interface CandidateRanking {
  List<FieldCandidate> order(List<FieldCandidate> candidates, List<String> declaredWith, ResolutionPolicy policy);

  /** Leading candidates of {@code ordered} that tie with the first one. */
  List<FieldCandidate> topTier(List<FieldCandidate> ordered, List<String> declaredWith, ResolutionPolicy policy);
}
