package io.intellixity.fetchgraph.examples.semantic;

import io.intellixity.fetchgraph.schema.ColumnDescriptor;
import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.SchemaNames;
import io.intellixity.fetchgraph.schema.SchemaRegistry;
import io.intellixity.fetchgraph.spi.semantic.SemanticBackend;
import io.intellixity.fetchgraph.spi.semantic.SemanticMatch;
import io.intellixity.fetchgraph.tabular.ColumnTable;

import java.util.*;

/**
 * Token-overlap similarity over the semantic columns of in-memory tables.
 * <p>
 * A row scores the share of distinct query tokens found in its searched columns, so scores fall in
 * {@code (0, 1]}. Requested fields that are not semantic columns are ignored; with none requested every
 * semantic column of the entity is searched.
 */
public final class KeywordSemanticBackend implements SemanticBackend {
  private final SchemaRegistry schema;
  private final Map<String, ColumnTable> tables;

  public KeywordSemanticBackend(SchemaRegistry schema, Map<String, ColumnTable> tables) {
    this.schema = Objects.requireNonNull(schema, "schema");
    Map<String, ColumnTable> byName = new HashMap<>();
    tables.forEach((k, v) -> byName.put(SchemaNames.normalize(k), v));
    this.tables = Map.copyOf(byName);
  }

  @Override
  public List<SemanticMatch> search(String entity, List<String> fields, String query, int topK) {
    EntityDescriptor e = schema.entity(entity);
    ColumnTable table = tables.get(SchemaNames.normalize(e.name()));
    Optional<ColumnDescriptor> pk = e.primaryKey();
    Set<String> wanted = tokens(query);
    if (table == null || pk.isEmpty() || wanted.isEmpty()) return List.of();

    List<String> columns = searchedColumns(e, fields);
    List<SemanticMatch> out = new ArrayList<>();
    for (int r = 0; r < table.rowCount(); r++) {
      Set<String> found = new HashSet<>();
      for (String c : columns) {
        Object v = table.value(r, c);
        if (v != null) found.addAll(tokens(v.toString()));
      }
      found.retainAll(wanted);
      if (found.isEmpty()) continue;
      out.add(new SemanticMatch(e.name(), table.value(r, pk.get().name()), (double) found.size() / wanted.size()));
    }
    out.sort(Comparator.comparingDouble(SemanticMatch::score).reversed());
    return out.size() > topK ? List.copyOf(out.subList(0, topK)) : out;
  }

  private static List<String> searchedColumns(EntityDescriptor e, List<String> fields) {
    Set<String> requested = new HashSet<>();
    if (fields != null) fields.forEach(f -> requested.add(SchemaNames.normalize(f)));
    List<String> out = new ArrayList<>();
    for (ColumnDescriptor c : e.columns()) {
      if (!c.semantic()) continue;
      if (requested.isEmpty() || requested.contains(SchemaNames.normalize(c.name()))) out.add(c.name());
    }
    return out;
  }

  static Set<String> tokens(String text) {
    Set<String> out = new LinkedHashSet<>();
    if (text == null) return out;
    for (String t : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
      if (!t.isEmpty()) out.add(t);
    }
    return out;
  }
}
