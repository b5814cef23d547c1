package io.intellixity.fetchgraph.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.fetchgraph.bind.ResolutionPolicy;
import io.intellixity.fetchgraph.compile.SketchPipeline;
import io.intellixity.fetchgraph.jdbc.dialect.SqlDialect;
import io.intellixity.fetchgraph.query.AggregationSpec;
import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.schema.ColumnDescriptor;
import io.intellixity.fetchgraph.schema.SchemaRegistry;
import io.intellixity.fetchgraph.spi.exec.*;
import io.intellixity.fetchgraph.spi.provider.AbstractRelationalProvider;
import io.intellixity.fetchgraph.spi.result.AggregationResult;
import io.intellixity.fetchgraph.spi.result.QueryResult;
import io.intellixity.fetchgraph.spi.result.RowResult;
import io.intellixity.fetchgraph.spi.semantic.SemanticBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.*;
import java.util.*;

/**
 * Relational provider that renders each query as one SQL SELECT through a {@link SqlDialect} and runs it
 * over JDBC.
 */
public final class JdbcRelationalProvider extends AbstractRelationalProvider {
  private static final Logger log = LoggerFactory.getLogger(JdbcRelationalProvider.class);
  private static final Set<String> INTEGRAL_TYPES = Set.of("int", "integer", "long", "bigint", "smallint", "tinyint");

  private final JdbcHandle handle;
  private final SqlDialect dialect;

  public JdbcRelationalProvider(String name,
                                SchemaRegistry schema,
                                JdbcHandle handle,
                                SqlDialect dialect,
                                SemanticBackend semanticBackend) {
    this(name, schema, handle, dialect, semanticBackend, null, null, null, null, null);
  }

  public JdbcRelationalProvider(String name,
                                SchemaRegistry schema,
                                JdbcHandle handle,
                                SqlDialect dialect,
                                SemanticBackend semanticBackend,
                                QueryValidationStrategy queryValidation,
                                JoinPlanner joinPlanner,
                                SketchPipeline sketchPipeline,
                                ResolutionPolicy resolutionPolicy,
                                ObjectMapper mapper) {
    super(name, schema, semanticBackend, queryValidation, joinPlanner, sketchPipeline, resolutionPolicy, mapper);
    this.handle = Objects.requireNonNull(handle, "handle");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
  }

  @Override
  protected String engineName() { return "jdbc"; }

  public SqlDialect dialect() { return dialect; }

  @Override
  protected QueryResult executeQuery(RelationalQuery query, JoinPlan plan, List<ResolvedSemanticClause> semantic) {
    SqlStatement stmt = dialect.renderQuery(query, plan, semantic, handle.schema());
    List<Object[]> rows = select(stmt);

    Map<String, Object> meta = new LinkedHashMap<>(meta(query, plan));
    meta.put("dialect", dialect.id());
    String root = plan.root().name();

    if (!query.groupBy().isEmpty()) {
      List<AggregationSpec> aggs = query.effectiveAggregations();
      int keys = query.groupBy().size();
      List<RowResult> out = new ArrayList<>(rows.size());
      for (Object[] r : rows) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keys; i++) data.put(stmt.columns().get(i), r[i]);
        for (int i = 0; i < aggs.size(); i++) {
          data.put(stmt.columns().get(keys + i), aggregateValue(aggs.get(i), plan, r[keys + i]));
        }
        out.add(new RowResult(root, data, Map.of()));
      }
      return QueryResult.ofRows(out, meta);
    }

    if (!query.aggregations().isEmpty()) {
      Object[] r = rows.isEmpty() ? new Object[stmt.columns().size()] : rows.get(0);
      Map<String, AggregationResult> out = new LinkedHashMap<>();
      for (int i = 0; i < query.aggregations().size(); i++) {
        AggregationSpec a = query.aggregations().get(i);
        out.put(a.resolvedAlias(), new AggregationResult(a.resolvedAlias(), aggregateValue(a, plan, r[i])));
      }
      return QueryResult.ofAggregations(out, meta);
    }

    List<RowResult> out = new ArrayList<>(rows.size());
    for (Object[] r : rows) {
      Map<String, Object> flat = new LinkedHashMap<>();
      for (int i = 0; i < r.length; i++) flat.put(stmt.columns().get(i), r[i]);
      out.add(query.select().isEmpty()
          ? RowResult.fromFlat(root, flat, plan.rootColumnNames())
          : new RowResult(root, flat, Map.of()));
    }
    return QueryResult.ofRows(out, meta);
  }

  private List<Object[]> select(SqlStatement stmt) {
    int params = SqlParamCompiler.paramNames(stmt.sql()).size();
    if (params != stmt.binds().size()) {
      throw new IllegalStateException("Statement has " + params + " parameters but " + stmt.binds().size()
          + " binds: " + stmt.sql());
    }
    String jdbcSql = SqlParamCompiler.toJdbcSql(stmt.sql());
    long start = System.nanoTime();
    debugSql(stmt, jdbcSql);
    try (Connection c = handle.dataSource().getConnection();
         PreparedStatement ps = c.prepareStatement(jdbcSql)) {
      bindAll(ps, stmt);
      try (ResultSet rs = ps.executeQuery()) {
        int width = stmt.columns().size();
        List<Object[]> out = new ArrayList<>();
        while (rs.next()) {
          Object[] row = new Object[width];
          for (int i = 0; i < width; i++) row[i] = JdbcValues.read(rs, i + 1);
          out.add(row);
        }
        if (log.isDebugEnabled()) {
          log.debug("fetchgraph.jdbc_done op=query rows={} durationMs={}", out.size(), (System.nanoTime() - start) / 1_000_000.0);
        }
        return out;
      }
    } catch (SQLException e) {
      throw new IllegalStateException("SQL query failed: " + jdbcSql, e);
    }
  }

  private static void bindAll(PreparedStatement ps, SqlStatement stmt) throws SQLException {
    for (int i = 0; i < stmt.binds().size(); i++) {
      ps.setObject(i + 1, JdbcValues.toJdbc(stmt.binds().get(i)));
    }
  }

  private void debugSql(SqlStatement stmt, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("fetchgraph.jdbc op=query dialect={} bindCount={} handleId={} schema={} sql={}",
        dialect.id(), stmt.binds().size(), handle.id(), handle.schema(), jdbcSql);

    // bind summary only, never raw values
    if (log.isTraceEnabled()) {
      int idx = 1;
      for (Object v : stmt.binds()) {
        log.trace("fetchgraph.jdbc bind index={} valueType={} valueLen={}", idx++,
            v == null ? "null" : v.getClass().getName(), v instanceof CharSequence cs ? cs.length() : -1);
      }
    }
  }

  /**
   * Aligns driver aggregate types with the in-memory engine: counts are longs, averages doubles, and sums
   * over integral columns longs.
   */
  private static Object aggregateValue(AggregationSpec a, JoinPlan plan, Object v) {
    if (v == null) {
      return switch (a.agg()) {
        case COUNT, COUNT_DISTINCT -> 0L;
        default -> null;
      };
    }
    return switch (a.agg()) {
      case COUNT, COUNT_DISTINCT -> ((Number) v).longValue();
      case AVG -> ((Number) v).doubleValue();
      case SUM -> sum(plan.resolve(null, a.field()), (Number) v);
      case MIN, MAX -> v;
    };
  }

  private static Object sum(ColumnRef ref, Number n) {
    if (n instanceof Double || n instanceof Float) return n.doubleValue();
    if (n instanceof BigDecimal d) {
      String type = ref.entity().column(ref.column()).map(ColumnDescriptor::type).orElse("");
      return INTEGRAL_TYPES.contains(type.toLowerCase(Locale.ROOT)) ? d.longValueExact() : d;
    }
    if (n instanceof BigInteger i) return i.longValueExact();
    return n.longValue();
  }
}
