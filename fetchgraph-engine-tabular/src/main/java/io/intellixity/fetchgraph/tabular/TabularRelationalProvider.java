package io.intellixity.fetchgraph.tabular;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.fetchgraph.bind.ResolutionPolicy;
import io.intellixity.fetchgraph.compile.SketchPipeline;
import io.intellixity.fetchgraph.query.AggregationSpec;
import io.intellixity.fetchgraph.query.GroupBySpec;
import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.query.SelectExpr;
import io.intellixity.fetchgraph.schema.ColumnDescriptor;
import io.intellixity.fetchgraph.schema.SchemaNames;
import io.intellixity.fetchgraph.schema.SchemaRegistry;
import io.intellixity.fetchgraph.spi.exec.*;
import io.intellixity.fetchgraph.spi.provider.AbstractRelationalProvider;
import io.intellixity.fetchgraph.spi.result.AggregationResult;
import io.intellixity.fetchgraph.spi.result.QueryResult;
import io.intellixity.fetchgraph.spi.result.RowResult;
import io.intellixity.fetchgraph.spi.semantic.SemanticBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;

/**
 * Relational provider over in-memory {@link ColumnTable}s, one per entity.
 * <p>
 * Execution order: join, filter, semantic filter, then either grouping or semantic ordering, then
 * offset/limit, then projection.
 */
public final class TabularRelationalProvider extends AbstractRelationalProvider {
  private static final Logger log = LoggerFactory.getLogger(TabularRelationalProvider.class);
  private static final Object ROW_MARKER = Boolean.TRUE;

  private final Map<String, ColumnTable> tables;

  public TabularRelationalProvider(String name,
                                   SchemaRegistry schema,
                                   Map<String, ColumnTable> tables,
                                   SemanticBackend semanticBackend) {
    this(name, schema, tables, semanticBackend, null, null, null, null, null);
  }

  public TabularRelationalProvider(String name,
                                   SchemaRegistry schema,
                                   Map<String, ColumnTable> tables,
                                   SemanticBackend semanticBackend,
                                   QueryValidationStrategy queryValidation,
                                   JoinPlanner joinPlanner,
                                   SketchPipeline sketchPipeline,
                                   ResolutionPolicy resolutionPolicy,
                                   ObjectMapper mapper) {
    super(name, schema, semanticBackend, queryValidation, joinPlanner, sketchPipeline, resolutionPolicy, mapper);
    Objects.requireNonNull(tables, "tables");
    Map<String, ColumnTable> byName = new HashMap<>();
    tables.forEach((entity, table) -> byName.put(SchemaNames.normalize(entity), table));
    this.tables = Collections.unmodifiableMap(byName);
  }

  @Override
  protected String engineName() { return "tabular"; }

  @Override
  protected QueryResult executeQuery(RelationalQuery query, JoinPlan plan, List<ResolvedSemanticClause> semantic) {
    JoinedFrame frame = JoinedFrame.join(plan, this::table);
    Predicate<int[]> filter = RowPredicates.compile(query.filters(), plan, frame, query.caseSensitivity());

    List<ScoredRow> rows = new ArrayList<>();
    for (int[] r : frame.rows()) {
      if (!filter.test(r)) continue;
      ScoredRow scored = score(r, frame, semantic);
      if (scored != null) rows.add(scored);
    }
    log.debug("fetchgraph.tabular op=filter root={} joined={} matched={}", plan.rootAlias(), frame.size(), rows.size());

    if (!query.groupBy().isEmpty()) {
      return QueryResult.ofRows(page(group(query, plan, frame, rows, !semantic.isEmpty()), query), meta(query, plan));
    }
    if (!query.aggregations().isEmpty()) {
      return QueryResult.ofAggregations(aggregate(query, plan, frame, rows), meta(query, plan));
    }
    if (!semantic.isEmpty()) orderByScore(rows, plan, frame);

    List<RowResult> out = new ArrayList<>();
    for (ScoredRow r : page(rows, query)) out.add(project(query, plan, frame, r.row()));
    return QueryResult.ofRows(out, meta(query, plan));
  }

  private ColumnTable table(String entity) {
    ColumnTable t = tables.get(SchemaNames.normalize(entity));
    if (t == null) throw new IllegalStateException("No table loaded for entity " + entity);
    return t;
  }

  /** Null when a filter-mode clause does not match the row. */
  private static ScoredRow score(int[] r, JoinedFrame frame, List<ResolvedSemanticClause> semantic) {
    double total = 0.0;
    for (ResolvedSemanticClause c : semantic) {
      Double s = c.score(frame.value(r, c.key()));
      if (s == null) {
        if (c.isFilter()) return null;
        continue;
      }
      total += s;
    }
    return new ScoredRow(r, total);
  }

  /** Total score descending, then root primary key ascending with nulls last. */
  private static void orderByScore(List<ScoredRow> rows, JoinPlan plan, JoinedFrame frame) {
    Comparator<ScoredRow> order = Comparator.comparingDouble(ScoredRow::score).reversed();
    Optional<ColumnDescriptor> pk = plan.root().primaryKey();
    if (pk.isPresent()) {
      ColumnRef ref = new ColumnRef(plan.rootAlias(), plan.root(), pk.get().name());
      order = order.thenComparing(r -> frame.value(r.row(), ref), Comparator.nullsLast(Values::compare));
    }
    rows.sort(order);
  }

  private static List<RowResult> group(RelationalQuery query, JoinPlan plan, JoinedFrame frame,
                                       List<ScoredRow> rows, boolean scored) {
    List<ColumnRef> keys = new ArrayList<>();
    List<String> keyNames = new ArrayList<>();
    for (GroupBySpec g : query.groupBy()) {
      keys.add(plan.resolve(g.entity(), g.field()));
      keyNames.add(g.alias() != null && !g.alias().isBlank() ? g.alias() : plan.outputName(g.entity(), g.field()));
    }
    List<AggregationSpec> aggs = query.effectiveAggregations();
    List<ColumnRef> aggRefs = aggregationRefs(aggs, plan);

    Map<List<Object>, Group> groups = new LinkedHashMap<>();
    for (ScoredRow r : rows) {
      List<Object> values = new ArrayList<>(keys.size());
      List<Object> hashKey = new ArrayList<>(keys.size());
      for (ColumnRef k : keys) {
        Object v = frame.value(r.row(), k);
        values.add(v);
        hashKey.add(Values.key(v));
      }
      Group g = groups.computeIfAbsent(hashKey, x -> new Group(values, aggs));
      g.add(r, frame, aggRefs);
    }

    List<Group> ordered = new ArrayList<>(groups.values());
    Comparator<Group> byKeys = (a, b) -> compareKeys(a.keys(), b.keys());
    ordered.sort(scored ? Comparator.comparingDouble(Group::maxScore).reversed().thenComparing(byKeys) : byKeys);

    List<RowResult> out = new ArrayList<>(ordered.size());
    for (Group g : ordered) {
      Map<String, Object> data = new LinkedHashMap<>();
      for (int i = 0; i < keyNames.size(); i++) data.put(keyNames.get(i), g.keys().get(i));
      for (int i = 0; i < aggs.size(); i++) data.put(aggs.get(i).resolvedAlias(), g.accumulators().get(i).result());
      out.add(new RowResult(plan.root().name(), data, Map.of()));
    }
    return out;
  }

  /** Group keys ascending, nulls first. */
  private static int compareKeys(List<Object> a, List<Object> b) {
    Comparator<Object> cmp = Comparator.nullsFirst(Values::compare);
    for (int i = 0; i < a.size(); i++) {
      int c = cmp.compare(a.get(i), b.get(i));
      if (c != 0) return c;
    }
    return 0;
  }

  private static Map<String, AggregationResult> aggregate(RelationalQuery query, JoinPlan plan, JoinedFrame frame,
                                                          List<ScoredRow> rows) {
    List<AggregationSpec> aggs = query.aggregations();
    List<ColumnRef> refs = aggregationRefs(aggs, plan);
    Group all = new Group(List.of(), aggs);
    for (ScoredRow r : rows) all.add(r, frame, refs);
    Map<String, AggregationResult> out = new LinkedHashMap<>();
    for (int i = 0; i < aggs.size(); i++) {
      String alias = aggs.get(i).resolvedAlias();
      out.put(alias, new AggregationResult(alias, all.accumulators().get(i).result()));
    }
    return out;
  }

  /** Null entries stand for {@code count(*)}. */
  private static List<ColumnRef> aggregationRefs(List<AggregationSpec> aggs, JoinPlan plan) {
    List<ColumnRef> refs = new ArrayList<>(aggs.size());
    for (AggregationSpec a : aggs) refs.add(a.isCountAll() ? null : plan.resolve(null, a.field()));
    return refs;
  }

  private static RowResult project(RelationalQuery query, JoinPlan plan, JoinedFrame frame, int[] r) {
    if (!query.select().isEmpty()) {
      Map<String, Object> data = new LinkedHashMap<>();
      for (SelectExpr s : query.select()) {
        String out = (s.alias() != null && !s.alias().isBlank()) ? s.alias() : plan.outputName(null, s.expr());
        data.put(out, frame.value(r, plan.resolve(null, s.expr())));
      }
      return new RowResult(plan.root().name(), data, Map.of());
    }
    Map<String, Object> flat = new LinkedHashMap<>();
    for (JoinPlan.Projection p : plan.defaultProjection()) flat.put(p.outputName(), frame.value(r, p.ref()));
    return RowResult.fromFlat(plan.root().name(), flat, plan.rootColumnNames());
  }

  private static <T> List<T> page(List<T> rows, RelationalQuery query) {
    int from = Math.min(query.offset(), rows.size());
    int to = (query.limit() == null) ? rows.size() : Math.min(rows.size(), from + query.limit());
    return rows.subList(from, to);
  }

  private record ScoredRow(int[] row, double score) {}

  private static final class Group {
    private final List<Object> keys;
    private final List<Accumulator> accumulators;
    private double maxScore = Double.NEGATIVE_INFINITY;

    Group(List<Object> keys, List<AggregationSpec> aggs) {
      this.keys = keys;
      this.accumulators = aggs.stream().map(a -> new Accumulator(a.agg())).toList();
    }

    void add(ScoredRow r, JoinedFrame frame, List<ColumnRef> refs) {
      maxScore = Math.max(maxScore, r.score());
      for (int i = 0; i < refs.size(); i++) {
        ColumnRef ref = refs.get(i);
        accumulators.get(i).add(ref == null ? ROW_MARKER : frame.value(r.row(), ref));
      }
    }

    List<Object> keys() { return keys; }
    List<Accumulator> accumulators() { return accumulators; }
    double maxScore() { return maxScore; }
  }
}
