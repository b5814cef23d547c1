package io.intellixity.fetchgraph.spi.result;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One result row.
 *
 * @param entity  root entity name
 * @param data    root columns, explicit select aliases, or group keys plus aggregate aliases
 * @param related joined columns keyed by label, only for the default projection
 */
public record RowResult(String entity, Map<String, Object> data, Map<String, Map<String, Object>> related) {
  public RowResult {
    Objects.requireNonNull(entity, "entity");
    data = Collections.unmodifiableMap(new LinkedHashMap<>(data == null ? Map.of() : data));
    Map<String, Map<String, Object>> rel = new LinkedHashMap<>();
    if (related != null) {
      related.forEach((k, v) -> rel.put(k, Collections.unmodifiableMap(new LinkedHashMap<>(v))));
    }
    related = Collections.unmodifiableMap(rel);
  }

  /**
   * Splits flat {@code label__column} keys into {@code related}; keys listed in {@code baseColumns} stay in
   * {@code data}.
   */
  public static RowResult fromFlat(String entity, Map<String, Object> flat, Collection<String> baseColumns) {
    Map<String, Object> data = new LinkedHashMap<>();
    Map<String, Map<String, Object>> related = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : flat.entrySet()) {
      String key = e.getKey();
      if (baseColumns.contains(key)) {
        data.put(key, e.getValue());
        continue;
      }
      int sep = key.indexOf("__");
      if (sep < 0) continue;
      related.computeIfAbsent(key.substring(0, sep), k -> new LinkedHashMap<>())
          .put(key.substring(sep + 2), e.getValue());
    }
    return new RowResult(entity, data, related);
  }
}
