package io.intellixity.fetchgraph.spi.exec;

import io.intellixity.fetchgraph.query.*;
import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.SchemaRegistry;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Default, backend-agnostic query validation.
 * <p>
 * Validates:
 * <ul>
 *   <li>filter field references and operand shapes</li>
 *   <li>select expressions</li>
 *   <li>group_by and aggregation fields</li>
 *   <li>semantic clause targets</li>
 * </ul>
 * Unknown references throw {@link QueryValidationException}; badly shaped operands throw
 * {@link OperandTypeException}.
 */
public final class DefaultQueryValidationStrategy implements QueryValidationStrategy {
  @Override
  public void validate(RelationalQuery query, SchemaRegistry registry, JoinPlan plan) {
    Objects.requireNonNull(query, "query");
    Objects.requireNonNull(plan, "plan");

    if (query.filters() != null) validateFilter(plan, query.filters());

    for (SelectExpr s : query.select()) {
      requireField(plan, null, s.expr(), "select");
    }
    for (GroupBySpec g : query.groupBy()) {
      requireField(plan, g.entity(), g.field(), "group_by");
    }
    for (AggregationSpec a : query.aggregations()) {
      if ("*".equals(a.field())) {
        if (a.agg() != AggregationOp.COUNT) {
          throw new QueryValidationException("Aggregation '" + a.agg().symbol() + "' requires a field, got '*'");
        }
        continue;
      }
      requireField(plan, null, a.field(), "aggregations");
    }
    for (SemanticClause c : query.semanticClauses()) {
      validateSemantic(plan, c);
    }
  }

  private static void validateFilter(JoinPlan plan, FilterClause filter) {
    filter.accept(new FilterVisitor<Void>() {
      @Override
      public Void visit(ComparisonFilter c) {
        requireField(plan, c.entity(), c.field(), "filter");
        requireOperand(c);
        return null;
      }

      @Override
      public Void visit(LogicalFilter l) {
        for (FilterClause child : l.clauses()) child.accept(this);
        return null;
      }
    });
  }

  private static void requireOperand(ComparisonFilter c) {
    Object v = c.value();
    if (c.op().isSetOp()) {
      if (!(v instanceof Collection<?>)) {
        throw new OperandTypeException(c.field(), c.op(),
            "Values for '" + c.op().symbol() + "' on '" + c.field() + "' must be a list");
      }
      return;
    }
    if (v instanceof Collection<?> || v instanceof Map<?, ?>) {
      throw new OperandTypeException(c.field(), c.op(),
          "Operator '" + c.op().symbol() + "' on '" + c.field() + "' takes a single value");
    }
    if (c.op().isTextMatch() && v == null) {
      throw new OperandTypeException(c.field(), c.op(),
          "Operator '" + c.op().symbol() + "' on '" + c.field() + "' requires a value");
    }
  }

  private static void validateSemantic(JoinPlan plan, SemanticClause c) {
    EntityDescriptor target = plan.entityFor(c.entity());
    if (target.primaryKey().isEmpty()) {
      throw new QueryValidationException("Semantic clause target '" + c.entity() + "' has no primary key");
    }
    for (String f : c.fields()) {
      if (target.column(f).isEmpty()) {
        throw new QueryValidationException("Unknown field '" + f + "' in semantic clause for entity '"
            + target.name() + "'");
      }
    }
  }

  private static void requireField(JoinPlan plan, String qualifier, String field, String where) {
    try {
      plan.resolve(qualifier, field);
    } catch (QueryValidationException e) {
      throw new QueryValidationException(e.getMessage() + " in " + where, e);
    }
  }
}
