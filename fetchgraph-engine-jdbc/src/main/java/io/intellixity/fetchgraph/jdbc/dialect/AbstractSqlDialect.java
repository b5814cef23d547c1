package io.intellixity.fetchgraph.jdbc.dialect;

import io.intellixity.fetchgraph.jdbc.SqlStatement;
import io.intellixity.fetchgraph.query.*;
import io.intellixity.fetchgraph.schema.ColumnDescriptor;
import io.intellixity.fetchgraph.schema.JoinType;
import io.intellixity.fetchgraph.spi.exec.ColumnRef;
import io.intellixity.fetchgraph.spi.exec.JoinPlan;
import io.intellixity.fetchgraph.spi.exec.JoinStep;
import io.intellixity.fetchgraph.spi.exec.ResolvedSemanticClause;
import io.intellixity.fetchgraph.spi.semantic.SemanticMatch;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Generic SQL rendering for relational queries.
 * <p>
 * Renders, in statement order:
 * <ul>
 *   <li>the select list (default projection, explicit select, group keys plus aggregates)</li>
 *   <li>{@code FROM} with one join per plan step</li>
 *   <li>{@code WHERE} from the filter tree and semantic filter clauses</li>
 *   <li>{@code GROUP BY} and the semantic or group-key {@code ORDER BY}</li>
 *   <li>paging with bound values</li>
 * </ul>
 * Null handling mirrors the in-memory engine: a comparison with a null cell is never true and
 * {@code = null} / {@code != null} become {@code IS NULL} / {@code IS NOT NULL}.
 * <p>
 * Dialects override hooks for quoting, case-insensitive matching, outer joins and paging. Without
 * {@link #supportsFullOuterJoin()} a plan with an outer join is rendered over a flattened derived table.
 */
public abstract class AbstractSqlDialect implements SqlDialect {
  private static final String FLAT_ALIAS = "fg_rows";

  protected static final class RenderCtx {
    private int n = 1;
    private final List<Object> binds = new ArrayList<>();
    private boolean flat;

    public String add(Object value) {
      binds.add(value);
      return ":b" + (n++);
    }
  }

  @Override
  public final SqlStatement renderQuery(RelationalQuery query, JoinPlan plan, List<ResolvedSemanticClause> semantic,
                                        String schema) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(plan, "plan");
    List<ResolvedSemanticClause> clauses = (semantic == null) ? List.of() : semantic;
    RenderCtx ctx = new RenderCtx();
    ctx.flat = !supportsFullOuterJoin() && plan.steps().stream().anyMatch(s -> s.type() == JoinType.OUTER);
    boolean grouped = !query.groupBy().isEmpty();
    boolean aggregateOnly = !grouped && !query.aggregations().isEmpty();

    List<String> items = new ArrayList<>();
    List<String> labels = new ArrayList<>();
    List<String> groupExprs = new ArrayList<>();
    if (grouped) {
      for (GroupBySpec g : query.groupBy()) {
        String expr = qualified(plan.resolve(g.entity(), g.field()), ctx);
        groupExprs.add(expr);
        String label = (g.alias() != null && !g.alias().isBlank()) ? g.alias() : plan.outputName(g.entity(), g.field());
        items.add(expr + " AS " + quoteIdent(label));
        labels.add(label);
      }
    }
    if (grouped || aggregateOnly) {
      for (AggregationSpec a : query.effectiveAggregations()) {
        items.add(renderAggregate(a, plan, ctx) + " AS " + quoteIdent(a.resolvedAlias()));
        labels.add(a.resolvedAlias());
      }
    } else if (!query.select().isEmpty()) {
      for (SelectExpr s : query.select()) {
        String label = (s.alias() != null && !s.alias().isBlank()) ? s.alias() : plan.outputName(null, s.expr());
        items.add(qualified(plan.resolve(null, s.expr()), ctx) + " AS " + quoteIdent(label));
        labels.add(label);
      }
    } else {
      for (JoinPlan.Projection p : plan.defaultProjection()) {
        items.add(qualified(p.ref(), ctx) + " AS " + quoteIdent(p.outputName()));
        labels.add(p.outputName());
      }
    }

    StringBuilder sql = new StringBuilder("SELECT ").append(String.join(", ", items));
    sql.append(" FROM ").append(ctx.flat ? renderFlatFrom(plan, schema) : renderFrom(plan, schema));

    List<String> where = new ArrayList<>();
    if (query.filters() != null) where.add(renderFilter(query.filters(), plan, query.caseSensitivity(), ctx));
    for (ResolvedSemanticClause c : clauses) {
      if (c.isFilter()) where.add(renderSemanticFilter(c, ctx));
    }
    if (!where.isEmpty()) sql.append(" WHERE ").append(String.join(" AND ", where));

    if (grouped) {
      sql.append(" GROUP BY ").append(String.join(", ", groupExprs));
      List<String> order = new ArrayList<>();
      String score = renderScore(clauses, ctx);
      if (score != null) order.add("MAX(" + score + ") DESC");
      for (String g : groupExprs) order.add(g + " ASC NULLS FIRST");
      sql.append(" ORDER BY ").append(String.join(", ", order));
    } else if (!aggregateOnly && !clauses.isEmpty()) {
      List<String> order = new ArrayList<>();
      String score = renderScore(clauses, ctx);
      if (score != null) order.add(score + " DESC");
      Optional<ColumnDescriptor> pk = plan.root().primaryKey();
      pk.ifPresent(c -> order.add(qualified(new ColumnRef(plan.rootAlias(), plan.root(), c.name()), ctx) + " ASC NULLS LAST"));
      if (!order.isEmpty()) sql.append(" ORDER BY ").append(String.join(", ", order));
    }

    if (!aggregateOnly) sql.append(renderPage(query.limit(), query.offset(), ctx));
    return new SqlStatement(sql.toString(), ctx.binds, labels);
  }

  protected String renderFrom(JoinPlan plan, String schema) {
    StringBuilder from = new StringBuilder(table(plan.root().name(), schema))
        .append(' ').append(quoteIdent(plan.rootAlias()));
    for (JoinStep step : plan.steps()) {
      from.append(' ').append(joinKeyword(step.type())).append(' ')
          .append(table(step.entity().name(), schema)).append(' ').append(quoteIdent(step.alias()))
          .append(" ON ").append(quoteIdent(step.leftAlias())).append('.').append(quoteIdent(step.leftColumn()))
          .append(" = ").append(quoteIdent(step.alias())).append('.').append(quoteIdent(step.rightColumn()));
    }
    return from.toString();
  }

  /**
   * {@code FROM} for databases without {@code FULL OUTER JOIN}: each join stage becomes a derived table
   * whose columns are named {@code alias.column}, and an outer stage appends the right rows no left row
   * matched, with every earlier table null.
   */
  private String renderFlatFrom(JoinPlan plan, String schema) {
    List<ColumnRef> cols = new ArrayList<>();
    for (String c : plan.root().columnNames()) cols.add(new ColumnRef(plan.rootAlias(), plan.root(), c));
    String rows = "SELECT " + flatItems(cols) + " FROM " + table(plan.root().name(), schema)
        + " " + quoteIdent(plan.rootAlias());
    int stage = 0;
    for (JoinStep step : plan.steps()) {
      String prev = quoteIdent("fg_j" + (++stage));
      List<ColumnRef> added = new ArrayList<>();
      for (String c : step.entity().columnNames()) added.add(new ColumnRef(step.alias(), step.entity(), c));
      String right = table(step.entity().name(), schema) + " " + quoteIdent(step.alias());
      String on = prev + "." + quoteIdent(step.leftAlias() + "." + step.leftColumn())
          + " = " + quoteIdent(step.alias()) + "." + quoteIdent(step.rightColumn());

      List<String> carried = new ArrayList<>();
      List<String> nulls = new ArrayList<>();
      for (ColumnRef c : cols) {
        carried.add(prev + "." + flatName(c));
        nulls.add("NULL AS " + flatName(c));
      }
      StringBuilder next = new StringBuilder("SELECT ")
          .append(String.join(", ", carried)).append(", ").append(flatItems(added))
          .append(" FROM (").append(rows).append(") ").append(prev)
          .append(step.type() == JoinType.INNER ? " INNER JOIN " : " LEFT JOIN ").append(right)
          .append(" ON ").append(on);
      if (step.type() == JoinType.OUTER) {
        next.append(" UNION ALL SELECT ").append(String.join(", ", nulls)).append(", ").append(flatItems(added))
            .append(" FROM ").append(right)
            .append(" WHERE NOT EXISTS (SELECT 1 FROM (").append(rows).append(") ").append(prev)
            .append(" WHERE ").append(on).append(')');
      }
      cols.addAll(added);
      rows = next.toString();
    }
    return "(" + rows + ") " + quoteIdent(FLAT_ALIAS);
  }

  private String flatItems(List<ColumnRef> cols) {
    List<String> items = new ArrayList<>(cols.size());
    for (ColumnRef c : cols) items.add(column(c) + " AS " + flatName(c));
    return String.join(", ", items);
  }

  private String flatName(ColumnRef c) {
    return quoteIdent(c.alias() + "." + c.column());
  }

  /** True when the database accepts {@code FULL OUTER JOIN}; otherwise outer joins are emulated. */
  protected boolean supportsFullOuterJoin() {
    return true;
  }

  protected String joinKeyword(JoinType type) {
    return switch (type) {
      case INNER -> "INNER JOIN";
      case LEFT -> "LEFT JOIN";
      case OUTER -> "FULL OUTER JOIN";
    };
  }

  /** Paging suffix, including its leading space; empty when there is nothing to page. */
  protected String renderPage(Integer limit, int offset, RenderCtx ctx) {
    StringBuilder sb = new StringBuilder();
    if (offset > 0) sb.append(" OFFSET ").append(ctx.add(offset)).append(" ROWS");
    if (limit != null) sb.append(" FETCH FIRST ").append(ctx.add(limit)).append(" ROWS ONLY");
    return sb.toString();
  }

  /** Case-insensitive LIKE; {@code pattern} is already escaped with {@code \}. */
  protected String renderCaseInsensitiveLike(String expr, String pattern, RenderCtx ctx) {
    return "LOWER(" + expr + ") LIKE " + ctx.add(pattern.toLowerCase(Locale.ROOT)) + " ESCAPE '\\'";
  }

  protected abstract String quoteIdent(String ident);

  protected String table(String name, String schema) {
    return (schema == null) ? quoteIdent(name) : quoteIdent(schema) + "." + quoteIdent(name);
  }

  protected String column(ColumnRef ref) {
    return quoteIdent(ref.alias()) + "." + quoteIdent(ref.column());
  }

  private String qualified(ColumnRef ref, RenderCtx ctx) {
    return ctx.flat ? quoteIdent(FLAT_ALIAS) + "." + flatName(ref) : column(ref);
  }

  private String renderAggregate(AggregationSpec a, JoinPlan plan, RenderCtx ctx) {
    if (a.isCountAll()) return "COUNT(*)";
    String expr = qualified(plan.resolve(null, a.field()), ctx);
    return switch (a.agg()) {
      case COUNT -> "COUNT(" + expr + ")";
      case COUNT_DISTINCT -> "COUNT(DISTINCT " + expr + ")";
      case SUM -> "SUM(" + expr + ")";
      case MIN -> "MIN(" + expr + ")";
      case MAX -> "MAX(" + expr + ")";
      case AVG -> "AVG(CAST(" + expr + " AS DOUBLE PRECISION))";
    };
  }

  private String renderFilter(FilterClause filter, JoinPlan plan, boolean caseSensitive, RenderCtx ctx) {
    return filter.accept(new FilterVisitor<String>() {
      @Override
      public String visit(ComparisonFilter c) {
        return renderComparison(c, plan, caseSensitive, ctx);
      }

      @Override
      public String visit(LogicalFilter l) {
        List<String> parts = new ArrayList<>();
        for (FilterClause child : l.clauses()) parts.add(child.accept(this));
        if (parts.isEmpty()) return l.op() == LogicalOp.AND ? "1=1" : "1=0";
        if (parts.size() == 1) return parts.get(0);
        return "(" + String.join(l.op() == LogicalOp.AND ? " AND " : " OR ", parts) + ")";
      }
    });
  }

  private String renderComparison(ComparisonFilter c, JoinPlan plan, boolean caseSensitive, RenderCtx ctx) {
    ColumnRef ref = plan.resolve(c.entity(), c.field());
    String expr = qualified(ref, ctx);
    Object value = c.value();
    ComparisonOp op = c.op();
    return switch (op) {
      case EQ -> (value == null) ? expr + " IS NULL" : expr + " = " + ctx.add(coerce(ref, value));
      case NE -> (value == null) ? expr + " IS NOT NULL" : expr + " <> " + ctx.add(coerce(ref, value));
      case LT, LE, GT, GE -> (value == null) ? "1=0" : expr + " " + op.symbol() + " " + ctx.add(coerce(ref, value));
      case IN -> inSql(expr, ref, (Collection<?>) value, ctx);
      case NOT_IN -> notInSql(expr, ref, (Collection<?>) value, ctx);
      case LIKE, ILIKE, NOT_LIKE, NOT_ILIKE, STARTS, ENDS, NOT_STARTS, NOT_ENDS ->
          textMatchSql(expr, op, String.valueOf(value), caseSensitive, ctx);
    };
  }

  /** Nulls in the list never match, so they are dropped. */
  private String inSql(String expr, ColumnRef ref, Collection<?> values, RenderCtx ctx) {
    List<String> ph = new ArrayList<>();
    for (Object v : values) {
      if (v != null) ph.add(ctx.add(coerce(ref, v)));
    }
    if (ph.isEmpty()) return "1=0";
    return expr + " IN (" + String.join(", ", ph) + ")";
  }

  private String notInSql(String expr, ColumnRef ref, Collection<?> values, RenderCtx ctx) {
    if (values.isEmpty()) return "1=1";
    List<Object> nonNull = new ArrayList<>(values.size());
    for (Object v : values) {
      // x NOT IN (.., NULL) is never true
      if (v == null) return "1=0";
      nonNull.add(v);
    }
    List<String> ph = new ArrayList<>();
    for (Object v : nonNull) ph.add(ctx.add(coerce(ref, v)));
    return expr + " NOT IN (" + String.join(", ", ph) + ")";
  }

  private String textMatchSql(String expr, ComparisonOp op, String value, boolean caseSensitive, RenderCtx ctx) {
    String escaped = escapeLike(value);
    String pattern = switch (op) {
      case STARTS, NOT_STARTS -> escaped + "%";
      case ENDS, NOT_ENDS -> "%" + escaped;
      default -> "%" + escaped + "%";
    };
    boolean insensitive = op.alwaysCaseInsensitive() || !caseSensitive;
    String sql = insensitive
        ? renderCaseInsensitiveLike(expr, pattern, ctx)
        : expr + " LIKE " + ctx.add(pattern) + " ESCAPE '\\'";
    return op.isNegatedTextMatch() ? "NOT (" + sql + ")" : sql;
  }

  static String escapeLike(String s) {
    return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private String renderSemanticFilter(ResolvedSemanticClause c, RenderCtx ctx) {
    if (c.matches().isEmpty()) return "1=0";
    List<String> ph = new ArrayList<>();
    for (SemanticMatch m : c.matches()) ph.add(ctx.add(coerce(c.key(), m.id())));
    return qualified(c.key(), ctx) + " IN (" + String.join(", ", ph) + ")";
  }

  /**
   * Sum of per-clause scores; a row a clause did not match contributes 0. Null when no clause matched
   * anything, since every row then scores 0.
   */
  private String renderScore(List<ResolvedSemanticClause> clauses, RenderCtx ctx) {
    List<String> terms = new ArrayList<>();
    for (ResolvedSemanticClause c : clauses) {
      if (c.matches().isEmpty()) continue;
      StringBuilder sb = new StringBuilder("CASE");
      String key = qualified(c.key(), ctx);
      for (SemanticMatch m : c.matches()) {
        sb.append(" WHEN ").append(key).append(" = ").append(ctx.add(coerce(c.key(), m.id())))
            .append(" THEN CAST(").append(ctx.add(m.score())).append(" AS DOUBLE PRECISION)");
      }
      terms.add(sb.append(" ELSE 0 END").toString());
    }
    if (terms.isEmpty()) return null;
    return "(" + String.join(" + ", terms) + ")";
  }

  /** Converts ISO strings to temporal values for date columns; other values pass through. */
  protected Object coerce(ColumnRef ref, Object value) {
    if (!(value instanceof String s)) return value;
    String type = ref.entity().column(ref.column()).map(ColumnDescriptor::type).orElse("");
    try {
      return switch (type.toLowerCase(Locale.ROOT)) {
        case "date" -> LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
        case "datetime", "timestamp" -> LocalDateTime.parse(s.replace(' ', 'T'));
        default -> value;
      };
    } catch (DateTimeParseException e) {
      throw new QueryValidationException("Value '" + s + "' for '" + ref.column() + "' is not a valid " + type, e);
    }
  }
}
