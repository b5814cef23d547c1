package io.intellixity.fetchgraph.sketch;

import java.util.List;
import java.util.Objects;

/**
 * Canonical sketch: {@code from/where/get/with/take} plus the optional {@code skip} and case flag.
 *
 * @param where         null when the sketch had no usable filter
 * @param caseSensitive null keeps the engine default (case-insensitive text matching)
 */
public record NormalizedSketch(String from, WhereNode where, List<String> get, List<String> with, int take,
                               int skip, Boolean caseSensitive) {
  public NormalizedSketch {
    Objects.requireNonNull(from, "from");
    get = List.copyOf(get == null ? List.of("*") : get);
    with = List.copyOf(with == null ? List.of() : with);
  }

  public static NormalizedSketch empty(int take) {
    return new NormalizedSketch("", null, List.of("*"), List.of(), take, 0, null);
  }

  public boolean selectsAll() {
    return get.isEmpty() || (get.size() == 1 && "*".equals(get.get(0)));
  }
}
