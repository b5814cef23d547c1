package io.intellixity.fetchgraph.spi.exec;

import io.intellixity.fetchgraph.query.SemanticClause;
import io.intellixity.fetchgraph.query.SemanticMode;
import io.intellixity.fetchgraph.spi.semantic.SemanticMatch;

import java.util.*;

/**
 * A semantic clause after the backend call: its target primary-key column and the matches that passed the
 * threshold, one per id (highest score kept), in backend order.
 */
public final class ResolvedSemanticClause {
  private final SemanticClause clause;
  private final ColumnRef key;
  private final List<SemanticMatch> matches;
  private final Map<Object, Double> scores;

  public ResolvedSemanticClause(SemanticClause clause, ColumnRef key, List<SemanticMatch> rawMatches) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.key = Objects.requireNonNull(key, "key");
    Map<Object, SemanticMatch> byId = new LinkedHashMap<>();
    for (SemanticMatch m : rawMatches) {
      if (clause.threshold() != null && m.score() < clause.threshold()) continue;
      byId.merge(Values.key(m.id()), m, (a, b) -> b.score() > a.score() ? b : a);
    }
    this.matches = List.copyOf(byId.values());
    Map<Object, Double> s = new HashMap<>();
    byId.forEach((k, m) -> s.put(k, m.score()));
    this.scores = Collections.unmodifiableMap(s);
  }

  public SemanticClause clause() { return clause; }
  public ColumnRef key() { return key; }
  public List<SemanticMatch> matches() { return matches; }

  public boolean isFilter() { return clause.mode() == SemanticMode.FILTER; }

  /** Score for a key-column value; null when that row did not match. */
  public Double score(Object keyValue) {
    if (keyValue == null) return null;
    return scores.get(Values.key(keyValue));
  }
}
