package io.intellixity.fetchgraph.spi.result;

import java.util.Objects;

public record AggregationResult(String key, Object value) {
  public AggregationResult {
    Objects.requireNonNull(key, "key");
  }
}
