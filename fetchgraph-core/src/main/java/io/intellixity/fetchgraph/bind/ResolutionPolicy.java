package io.intellixity.fetchgraph.bind;

import java.util.Objects;

/**
 * Binder knobs.
 *
 * @param maxAutoJoinDepth         longest join path the binder may infer for an unqualified field
 * @param allowAutoAddRelations    whether inferred relations may be appended to {@code with}
 * @param ambiguityStrategy        what to do with tied candidates
 * @param preferDeclaredRelations  whether paths over declared relations rank ahead of inferred ones
 */
public record ResolutionPolicy(int maxAutoJoinDepth,
                               boolean allowAutoAddRelations,
                               AmbiguityStrategy ambiguityStrategy,
                               boolean preferDeclaredRelations) {
  public ResolutionPolicy {
    if (maxAutoJoinDepth < 0) throw new IllegalArgumentException("maxAutoJoinDepth must be >= 0");
    Objects.requireNonNull(ambiguityStrategy, "ambiguityStrategy");
  }

  public static ResolutionPolicy defaults() {
    return new ResolutionPolicy(2, true, AmbiguityStrategy.BEST, true);
  }

  public ResolutionPolicy withAmbiguityStrategy(AmbiguityStrategy strategy) {
    return new ResolutionPolicy(maxAutoJoinDepth, allowAutoAddRelations, strategy, preferDeclaredRelations);
  }

  public ResolutionPolicy withAllowAutoAddRelations(boolean allow) {
    return new ResolutionPolicy(maxAutoJoinDepth, allow, ambiguityStrategy, preferDeclaredRelations);
  }

  public ResolutionPolicy withMaxAutoJoinDepth(int depth) {
    return new ResolutionPolicy(depth, allowAutoAddRelations, ambiguityStrategy, preferDeclaredRelations);
  }
}
