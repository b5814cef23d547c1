package io.intellixity.fetchgraph.spi.result;

import io.intellixity.fetchgraph.spi.semantic.SemanticMatch;

import java.util.List;

public record SemanticOnlyResult(List<SemanticMatch> matches) implements ProviderResult {
  public SemanticOnlyResult {
    matches = List.copyOf(matches);
  }
}
