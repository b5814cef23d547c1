package io.intellixity.fetchgraph.bind;

import io.intellixity.fetchgraph.sketch.NormalizedSketch;

import java.util.List;

/** Schema-free conversions between {@link NormalizedSketch} and {@link BoundQuery}. */
public final class BoundQueries {
  private BoundQueries() {}

  /** Treats an already-qualified sketch as bound, with an empty trace. */
  public static BoundQuery boundFromNormalized(NormalizedSketch sketch) {
    return new BoundQuery(sketch.from(), sketch.where(), sketch.get(), sketch.with(), sketch.take(), sketch.skip(),
        sketch.caseSensitive(), List.of());
  }

  /** Drops the trace; paths and {@code with} are kept as bound. */
  public static NormalizedSketch normalizedFromBound(BoundQuery bound) {
    return new NormalizedSketch(bound.from(), bound.where(), bound.get(), bound.with(), bound.take(), bound.skip(),
        bound.caseSensitive());
  }
}
