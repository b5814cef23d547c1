package io.intellixity.fetchgraph.spi.exec;

import io.intellixity.fetchgraph.query.QueryValidationException;
import io.intellixity.fetchgraph.schema.ColumnDescriptor;
import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.SchemaNames;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Table instances of one query and the references that address them.
 * <p>
 * A reference is the root entity name, a joined relation name, or the name of a joined entity (which
 * addresses the first join that brought that entity in).
 */
public final class JoinPlan {
  private final EntityDescriptor root;
  private final List<JoinStep> steps;
  private final Map<String, Target> refs;

  record Target(EntityDescriptor entity, String alias) {}

  /** A default-projection column: {@code ref} read from its table under output name {@code outputName}. */
  public record Projection(ColumnRef ref, String outputName, boolean root) {}

  JoinPlan(EntityDescriptor root, List<JoinStep> steps, Map<String, Target> refs) {
    this.root = Objects.requireNonNull(root, "root");
    this.steps = List.copyOf(steps);
    this.refs = Collections.unmodifiableMap(refs);
  }

  public EntityDescriptor root() { return root; }

  public String rootAlias() { return root.name(); }

  public List<JoinStep> steps() { return steps; }

  public List<String> relationNames() {
    return steps.stream().map(s -> s.relation().name()).toList();
  }

  public boolean isRoot(String qualifier) {
    return qualifier == null || SchemaNames.normalize(qualifier).equals(SchemaNames.normalize(root.name()));
  }

  /** Alias addressed by {@code ref}; null means the root. */
  public String aliasFor(String ref) {
    return target(ref).alias();
  }

  public EntityDescriptor entityFor(String ref) {
    return target(ref).entity();
  }

  /**
   * Resolves a field reference. With no qualifier, a dotted {@code field} is split into
   * {@code qualifier.column}; otherwise the root is meant.
   */
  public ColumnRef resolve(String qualifier, String field) {
    FieldPath path = FieldPath.of(qualifier, field);
    Target t = target(path.qualifier());
    ColumnDescriptor col = t.entity().column(path.column()).orElseThrow(() -> new QueryValidationException(
        "Unknown field '" + path.column() + "' for entity '" + t.entity().name() + "'"));
    return new ColumnRef(t.alias(), t.entity(), col.name());
  }

  /** Output key for a flat column: the bare column on the root, else {@code qualifier__column}. */
  public String outputName(String qualifier, String field) {
    FieldPath path = FieldPath.of(qualifier, field);
    if (isRoot(path.qualifier())) return path.column();
    return path.qualifier() + "__" + path.column();
  }

  /** Root columns by name, then each joined table's columns as {@code label__column}. */
  public List<Projection> defaultProjection() {
    List<Projection> out = new ArrayList<>();
    for (ColumnDescriptor c : root.columns()) {
      out.add(new Projection(new ColumnRef(rootAlias(), root, c.name()), c.name(), true));
    }
    for (JoinStep step : steps) {
      for (ColumnDescriptor c : step.entity().columns()) {
        out.add(new Projection(new ColumnRef(step.alias(), step.entity(), c.name()), step.label() + "__" + c.name(), false));
      }
    }
    return out;
  }

  public List<String> rootColumnNames() {
    return root.columnNames();
  }

  private Target target(String ref) {
    if (isRoot(ref)) return new Target(root, rootAlias());
    Target t = refs.get(SchemaNames.normalize(ref));
    if (t == null) {
      throw new QueryValidationException("Entity or relation '" + ref + "' is not joined in query rooted at '"
          + root.name() + "'");
    }
    return t;
  }

  /** {@code qualifier} is null for unqualified references. */
  public record FieldPath(String qualifier, String column) {
    public static FieldPath of(String qualifier, String field) {
      Objects.requireNonNull(field, "field");
      if ((qualifier == null || qualifier.isBlank()) && field.contains(".")) {
        int dot = field.indexOf('.');
        return new FieldPath(field.substring(0, dot), field.substring(dot + 1));
      }
      return new FieldPath((qualifier == null || qualifier.isBlank()) ? null : qualifier, field);
    }
  }
}
