package io.intellixity.fetchgraph.spi.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rows of a row or grouped query, or the single aggregate map of an ungrouped aggregation.
 *
 * @param meta engine name, relations used and similar execution facts
 */
public record QueryResult(List<RowResult> rows,
                          Map<String, AggregationResult> aggregations,
                          Map<String, Object> meta) implements ProviderResult {
  public QueryResult {
    rows = List.copyOf(rows == null ? List.of() : rows);
    aggregations = Collections.unmodifiableMap(new LinkedHashMap<>(aggregations == null ? Map.of() : aggregations));
    meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta == null ? Map.of() : meta));
  }

  public static QueryResult ofRows(List<RowResult> rows, Map<String, Object> meta) {
    return new QueryResult(rows, Map.of(), meta);
  }

  public static QueryResult ofAggregations(Map<String, AggregationResult> aggregations, Map<String, Object> meta) {
    return new QueryResult(List.of(), aggregations, meta);
  }
}
