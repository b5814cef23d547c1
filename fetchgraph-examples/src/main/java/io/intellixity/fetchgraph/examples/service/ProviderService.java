package io.intellixity.fetchgraph.examples.service;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.fetchgraph.compile.CompiledSketch;
import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.sketch.Diagnostic;
import io.intellixity.fetchgraph.spi.provider.AbstractRelationalProvider;
import io.intellixity.fetchgraph.spi.provider.ProviderInfo;
import io.intellixity.fetchgraph.spi.provider.RelationalProvider;
import io.intellixity.fetchgraph.spi.result.ProviderResult;
import io.intellixity.fetchgraph.spi.result.ResultSummaries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public final class ProviderService {
  private static final Logger log = LoggerFactory.getLogger(ProviderService.class);

  private final RelationalProvider provider;

  public ProviderService(RelationalProvider provider) {
    this.provider = provider;
  }

  /**
   * @param query  null when the sketch had no usable root
   * @param result null when the sketch did not compile cleanly
   */
  public record SketchOutcome(RelationalQuery query, List<Diagnostic> diagnostics, ProviderResult result) {}

  public ProviderInfo describe() {
    return provider.describe();
  }

  public ProviderResult fetch(JsonNode selectors) {
    return provider.fetch(selectors);
  }

  /** Compiles the sketch and, when it has no error diagnostics, runs the compiled query. */
  public SketchOutcome sketch(String sketch) {
    CompiledSketch compiled = sketchCompiler().compileSketch(sketch);
    if (compiled.query() == null || compiled.diagnostics().hasErrors()) {
      log.debug("fetchgraph.examples op=sketch compiled=false errors={}", compiled.diagnostics().errors().size());
      return new SketchOutcome(compiled.query(), compiled.diagnostics().items(), null);
    }
    return new SketchOutcome(compiled.query(), compiled.diagnostics().items(), provider.execute(compiled.query()));
  }

  public String summary(String sketch) {
    SketchOutcome outcome = sketch(sketch);
    if (outcome.result() == null) {
      throw new IllegalArgumentException("Sketch did not compile: "
          + outcome.diagnostics().stream().filter(Diagnostic::isError).map(Diagnostic::toString).toList());
    }
    return ResultSummaries.toText(outcome.result());
  }

  private AbstractRelationalProvider sketchCompiler() {
    if (provider instanceof AbstractRelationalProvider p) return p;
    throw new IllegalStateException("Provider " + provider.name() + " does not compile sketches");
  }
}
