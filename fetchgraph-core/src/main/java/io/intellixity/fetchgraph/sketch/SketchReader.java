package io.intellixity.fetchgraph.sketch;

import java.util.Objects;

/** Parse then normalize: raw input to {@link NormalizedSketch} plus diagnostics. Never throws on bad input. */
public final class SketchReader {
  private final SketchParser parser;
  private final SketchNormalizer normalizer;

  public SketchReader() {
    this(new SketchParser(), new SketchNormalizer());
  }

  public SketchReader(SketchParser parser, SketchNormalizer normalizer) {
    this.parser = Objects.requireNonNull(parser, "parser");
    this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
  }

  public record Result(NormalizedSketch sketch, Diagnostics diagnostics) {}

  public Result read(Object input) {
    SketchParser.Result parsed = parser.parse(input);
    Diagnostics diagnostics = parsed.diagnostics();
    if (diagnostics.hasErrors()) {
      return new Result(NormalizedSketch.empty(normalizer.settings().defaultTake()), diagnostics);
    }
    NormalizedSketch sketch = normalizer.normalize(parsed.data(), diagnostics);
    return new Result(sketch, diagnostics);
  }
}
