package io.intellixity.fetchgraph.spi.exec;

import io.intellixity.fetchgraph.bind.UnknownRelationException;
import io.intellixity.fetchgraph.query.QueryValidationException;
import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.RelationDescriptor;
import io.intellixity.fetchgraph.schema.SchemaNames;
import io.intellixity.fetchgraph.schema.SchemaRegistry;

import java.util.*;

/**
 * Lays out the joins of a query.
 * <p>
 * Relations are joined in list order. Each relation attaches to whichever endpoint is already present
 * ({@code from_entity} checked first) and brings in the other one under an alias equal to the relation name,
 * suffixed {@code _2}, {@code _3}... on collision. A relation listed twice is joined once; a relation named like
 * the root entity is rejected.
 */
public final class JoinPlanner {

  public JoinPlan plan(SchemaRegistry registry, RelationalQuery query) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(query, "query");
    EntityDescriptor root = registry.entity(query.rootEntity());

    Map<String, JoinPlan.Target> refs = new LinkedHashMap<>();
    Map<String, JoinPlan.Target> firstByEntity = new HashMap<>();
    JoinPlan.Target rootTarget = new JoinPlan.Target(root, root.name());
    refs.put(SchemaNames.normalize(root.name()), rootTarget);
    firstByEntity.put(SchemaNames.normalize(root.name()), rootTarget);
    Set<String> usedAliases = new HashSet<>();
    usedAliases.add(SchemaNames.normalize(root.name()));
    Set<String> joined = new HashSet<>();

    List<PendingStep> pending = new ArrayList<>();
    for (String relName : query.relations()) {
      RelationDescriptor rel = registry.findRelation(relName).orElseThrow(() -> new UnknownRelationException(relName));
      if (!joined.add(SchemaNames.normalize(rel.name()))) continue;
      // the root name always addresses the root table
      if (SchemaNames.normalize(rel.name()).equals(SchemaNames.normalize(root.name()))) {
        throw new QueryValidationException("Relation '" + rel.name() + "' has the same name as root entity '"
            + root.name() + "' and cannot be addressed");
      }

      boolean forward;
      if (firstByEntity.containsKey(SchemaNames.normalize(rel.fromEntity()))) forward = true;
      else if (firstByEntity.containsKey(SchemaNames.normalize(rel.toEntity()))) forward = false;
      else {
        throw new QueryValidationException("Neither entity of relation '" + rel.name()
            + "' is present in query rooted at '" + root.name() + "'");
      }

      String leftEntity = forward ? rel.fromEntity() : rel.toEntity();
      EntityDescriptor right = registry.entity(forward ? rel.toEntity() : rel.fromEntity());
      String alias = rel.name();
      for (int suffix = 2; usedAliases.contains(SchemaNames.normalize(alias)); suffix++) {
        alias = rel.name() + "_" + suffix;
      }
      usedAliases.add(SchemaNames.normalize(alias));

      String leftAlias = firstByEntity.get(SchemaNames.normalize(leftEntity)).alias();
      JoinPlan.Target target = new JoinPlan.Target(right, alias);
      refs.put(SchemaNames.normalize(rel.name()), target);
      refs.putIfAbsent(SchemaNames.normalize(right.name()), target);
      firstByEntity.putIfAbsent(SchemaNames.normalize(right.name()), target);

      pending.add(new PendingStep(rel, alias, right, leftAlias,
          forward ? rel.join().fromColumn() : rel.join().toColumn(),
          forward ? rel.join().toColumn() : rel.join().fromColumn()));
    }

    Map<String, Integer> instances = new HashMap<>();
    instances.merge(SchemaNames.normalize(root.name()), 1, Integer::sum);
    for (PendingStep p : pending) instances.merge(SchemaNames.normalize(p.entity.name()), 1, Integer::sum);

    List<JoinStep> steps = new ArrayList<>(pending.size());
    for (PendingStep p : pending) {
      boolean unique = instances.get(SchemaNames.normalize(p.entity.name())) == 1;
      String label = unique ? p.entity.name() : p.relation.name();
      steps.add(new JoinStep(p.relation, p.alias, p.entity, p.leftAlias, p.leftColumn, p.rightColumn,
          p.relation.join().type(), label));
    }
    return new JoinPlan(root, steps, refs);
  }

  private record PendingStep(RelationDescriptor relation, String alias, EntityDescriptor entity,
                             String leftAlias, String leftColumn, String rightColumn) {}
}
