package io.intellixity.fetchgraph.spi.provider;

import io.intellixity.fetchgraph.query.QueryValidationException;
import io.intellixity.fetchgraph.sketch.Diagnostic;

import java.util.List;

/** A {@code $dsl} payload compiled with error-level diagnostics. */
public final class SelectorDialectException extends QueryValidationException {
  private final String dialect;
  private final List<Diagnostic> diagnostics;

  public SelectorDialectException(String dialect, List<Diagnostic> diagnostics, String summary) {
    super("Selector dialect " + dialect + " rejected payload: " + summary);
    this.dialect = dialect;
    this.diagnostics = List.copyOf(diagnostics);
  }

  public String dialect() { return dialect; }
  public List<Diagnostic> diagnostics() { return diagnostics; }
}
