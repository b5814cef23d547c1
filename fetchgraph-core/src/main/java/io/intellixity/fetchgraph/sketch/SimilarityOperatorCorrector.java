package io.intellixity.fetchgraph.sketch;

import java.util.List;
import java.util.Optional;

/**
 * Picks the canonical operator with the highest Ratcliff/Obershelp similarity ({@code 2*M/T}), provided it
 * reaches the cutoff. Ties keep the earlier canonical operator.
 */
public final class SimilarityOperatorCorrector implements OperatorCorrector {
  private final double cutoff;

  public SimilarityOperatorCorrector(double cutoff) {
    if (cutoff < 0 || cutoff > 1) throw new IllegalArgumentException("cutoff must be within [0,1]");
    this.cutoff = cutoff;
  }

  @Override
  public Optional<String> correct(String raw, List<String> canonical) {
    if (raw == null || raw.isEmpty()) return Optional.empty();
    String best = null;
    double bestScore = -1;
    for (String c : canonical) {
      double score = ratio(raw, c);
      if (score >= cutoff && score > bestScore) {
        best = c;
        bestScore = score;
      }
    }
    return Optional.ofNullable(best);
  }

  static double ratio(String a, String b) {
    int total = a.length() + b.length();
    if (total == 0) return 1.0;
    return 2.0 * matches(a, 0, a.length(), b, 0, b.length()) / total;
  }

  private static int matches(String a, int alo, int ahi, String b, int blo, int bhi) {
    int bestI = alo;
    int bestJ = blo;
    int bestLen = 0;
    for (int i = alo; i < ahi; i++) {
      for (int j = blo; j < bhi; j++) {
        int k = 0;
        while (i + k < ahi && j + k < bhi && a.charAt(i + k) == b.charAt(j + k)) k++;
        if (k > bestLen) {
          bestI = i;
          bestJ = j;
          bestLen = k;
        }
      }
    }
    if (bestLen == 0) return 0;
    return bestLen
        + matches(a, alo, bestI, b, blo, bestJ)
        + matches(a, bestI + bestLen, ahi, b, bestJ + bestLen, bhi);
  }
}
