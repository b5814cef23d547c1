package io.intellixity.fetchgraph.bind;

import io.intellixity.fetchgraph.schema.FieldCandidate;
import io.intellixity.fetchgraph.schema.SchemaNames;

import java.util.*;

/**
 * Default ranking.
 * <p>
 * Candidates the query can already see (the root, or a path made only of declared relations) form the first
 * tier and all tie with one another. The remaining candidates tie when their path length and
 * declared-prefix flag match. Within a tier, the registry order applies, which puts the root first.
 */
public final class DeclaredFirstRanking implements CandidateRanking {
  @Override
  public List<FieldCandidate> order(List<FieldCandidate> candidates, List<String> declaredWith, ResolutionPolicy policy) {
    List<FieldCandidate> out = new ArrayList<>(candidates);
    out.sort(Comparator.comparing((FieldCandidate c) -> tieKey(c, declaredWith, policy), DeclaredFirstRanking::compareKeys));
    return out;
  }

  @Override
  public List<FieldCandidate> topTier(List<FieldCandidate> ordered, List<String> declaredWith, ResolutionPolicy policy) {
    if (ordered.isEmpty()) return List.of();
    List<Integer> first = tieKey(ordered.get(0), declaredWith, policy);
    List<FieldCandidate> out = new ArrayList<>();
    for (FieldCandidate c : ordered) {
      if (tieKey(c, declaredWith, policy).equals(first)) out.add(c);
    }
    return out;
  }

  private static List<Integer> tieKey(FieldCandidate c, List<String> declaredWith, ResolutionPolicy policy) {
    if (c.isRoot() || (policy.preferDeclaredRelations() && allDeclared(c.joinPath(), declaredWith))) {
      return List.of(0);
    }
    return List.of(1, c.joinPath().size(), c.declaredPrefix() ? 0 : 1);
  }

  static boolean allDeclared(List<String> path, List<String> declaredWith) {
    if (path.isEmpty()) return true;
    Set<String> declared = new HashSet<>();
    for (String d : declaredWith) declared.add(SchemaNames.normalize(d));
    for (String r : path) {
      if (!declared.contains(SchemaNames.normalize(r))) return false;
    }
    return true;
  }

  private static int compareKeys(List<Integer> a, List<Integer> b) {
    for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
      int c = Integer.compare(a.get(i), b.get(i));
      if (c != 0) return c;
    }
    return Integer.compare(a.size(), b.size());
  }
}
