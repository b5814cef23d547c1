package io.intellixity.fetchgraph.compile;

import io.intellixity.fetchgraph.bind.BoundQuery;
import io.intellixity.fetchgraph.bind.ResolutionPolicy;
import io.intellixity.fetchgraph.bind.SchemaBinder;
import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.schema.SchemaRegistry;
import io.intellixity.fetchgraph.sketch.Diagnostics;
import io.intellixity.fetchgraph.sketch.SketchReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Raw sketch to canonical query: read, bind, compile.
 * <p>
 * Diagnostics from every stage are merged into the result. Hard binding and compile errors propagate.
 */
public final class SketchPipeline {
  private static final Logger log = LoggerFactory.getLogger(SketchPipeline.class);

  /** Selector dialect id of the sketch envelope. */
  public static final String DIALECT_ID = "fetchgraph.dsl.query_sketch@v0";

  private final SketchReader reader;
  private final SchemaBinder binder;
  private final SketchCompiler compiler;

  public SketchPipeline() {
    this(new SketchReader(), new SchemaBinder(), new SketchCompiler());
  }

  public SketchPipeline(SketchReader reader, SchemaBinder binder, SketchCompiler compiler) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.binder = Objects.requireNonNull(binder, "binder");
    this.compiler = Objects.requireNonNull(compiler, "compiler");
  }

  public CompiledSketch compile(Object input, SchemaRegistry registry, ResolutionPolicy policy) {
    SketchReader.Result read = reader.read(input);
    Diagnostics diagnostics = new Diagnostics().addAll(read.diagnostics());
    if (read.sketch().from().isEmpty()) {
      log.debug("fetchgraph.sketch op=compile skipped=no-root diagnostics={}", diagnostics.items().size());
      return new CompiledSketch(null, null, diagnostics);
    }
    SchemaBinder.Result bound = binder.bind(read.sketch(), registry, policy);
    diagnostics.addAll(bound.diagnostics());
    BoundQuery b = bound.query();
    RelationalQuery query = compiler.compile(b);
    log.debug("fetchgraph.sketch op=compile root={} relations={} diagnostics={}",
        query.rootEntity(), query.relations(), diagnostics.items().size());
    return new CompiledSketch(query, b, diagnostics);
  }
}
