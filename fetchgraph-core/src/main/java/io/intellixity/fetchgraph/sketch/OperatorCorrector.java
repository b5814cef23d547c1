package io.intellixity.fetchgraph.sketch;

import java.util.List;
import java.util.Optional;

/** Maps an unrecognized operator to a canonical one, or gives up. */
@FunctionalInterface
public interface OperatorCorrector {
  Optional<String> correct(String raw, List<String> canonical);

  /** Never corrects; every unknown operator is reported and dropped. */
  static OperatorCorrector none() {
    return (raw, canonical) -> Optional.empty();
  }
}
