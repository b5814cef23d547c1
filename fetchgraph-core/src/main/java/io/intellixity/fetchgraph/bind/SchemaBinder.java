package io.intellixity.fetchgraph.bind;

import io.intellixity.fetchgraph.schema.*;
import io.intellixity.fetchgraph.sketch.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Resolves sketch field references against a {@link SchemaRegistry}.
 * <p>
 * Output paths are always {@code <relation-or-root>.<column>}; relations needed to reach a column are appended
 * to {@code with} in path order. Unresolvable references raise; best-effort choices become diagnostics.
 */
public final class SchemaBinder {
  private static final Logger log = LoggerFactory.getLogger(SchemaBinder.class);

  private final CandidateRanking ranking;

  public SchemaBinder() {
    this(new DeclaredFirstRanking());
  }

  public SchemaBinder(CandidateRanking ranking) {
    this.ranking = Objects.requireNonNull(ranking, "ranking");
  }

  public record Result(BoundQuery query, Diagnostics diagnostics) {}

  public Result bind(NormalizedSketch sketch, SchemaRegistry registry, ResolutionPolicy policy) {
    Objects.requireNonNull(sketch, "sketch");
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(policy, "policy");

    EntityDescriptor root = registry.findEntity(sketch.from())
        .orElseThrow(() -> new UnknownEntityException(sketch.from()));
    State state = new State(registry, root, policy);
    for (String declared : sketch.with()) state.declare(declared);

    WhereNode where = bindWhere(sketch.where(), state);
    List<String> get = new ArrayList<>();
    for (String path : sketch.get()) get.add("*".equals(path) ? path : state.resolve(path));

    BoundQuery bound = new BoundQuery(root.name(), where, get, state.with, sketch.take(), sketch.skip(),
        sketch.caseSensitive(), state.trace);
    log.debug("fetchgraph.bind root={} with={} bindings={}", root.name(), state.with, state.trace.size());
    return new Result(bound, state.diagnostics);
  }

  private WhereNode bindWhere(WhereNode node, State state) {
    if (node == null) return null;
    if (node instanceof Clause c) return c.withPath(state.resolve(c.path()));
    WhereGroup g = (WhereGroup) node;
    List<WhereNode> all = new ArrayList<>();
    for (WhereNode n : g.all()) all.add(bindWhere(n, state));
    List<WhereNode> any = new ArrayList<>();
    for (WhereNode n : g.any()) any.add(bindWhere(n, state));
    return new WhereGroup(all, any, bindWhere(g.not(), state));
  }

  /** Resolution of a qualifier: the name written into paths, the entity it stands for, and how it was found. */
  private record Target(String qualifier, String entity, List<String> joinPath, BindingReason reason) {}

  private final class State {
    final SchemaRegistry registry;
    final EntityDescriptor root;
    final ResolutionPolicy policy;
    final List<String> with = new ArrayList<>();
    /** normalized relation name -> entity it reaches */
    final Map<String, String> aliasEntities = new HashMap<>();
    /** normalized relation name -> relations from root up to and including it */
    final Map<String, List<String>> aliasPaths = new HashMap<>();
    final Set<String> declared = new HashSet<>();
    final List<BindingTrace> trace = new ArrayList<>();
    final Diagnostics diagnostics = new Diagnostics();

    State(SchemaRegistry registry, EntityDescriptor root, ResolutionPolicy policy) {
      this.registry = registry;
      this.root = root;
      this.policy = policy;
    }

    void declare(String name) {
      RelationDescriptor rel = registry.findRelation(name).orElseThrow(() -> new UnknownRelationException(name));
      if (isJoined(rel.name())) return;
      String from = reachedFrom(rel);
      if (from == null) throw new RelationNotFromRootException(rel.name(), root.name(), rel.fromEntity());
      join(rel, from);
      declared.add(SchemaNames.normalize(rel.name()));
    }

    String resolve(String path) {
      int dot = path.lastIndexOf('.');
      if (dot < 0) return resolveUnqualified(path);
      String qualifier = path.substring(0, dot).trim();
      String field = path.substring(dot + 1).trim();
      Target target = qualifier.contains(".") ? resolveChain(path, qualifier) : resolveQualifier(path, field, qualifier);
      ColumnDescriptor column = registry.column(target.entity(), field)
          .orElseThrow(() -> new UnknownFieldException(path, root.name(), registry.findEntitiesWithField(field)));
      String out = target.qualifier() + "." + column.name();
      trace.add(new BindingTrace(path, out, target.entity(), target.joinPath(), target.reason()));
      return out;
    }

    private String resolveUnqualified(String field) {
      List<String> declaredNow = policy.preferDeclaredRelations() ? List.copyOf(with) : List.of();
      List<FieldCandidate> candidates = new ArrayList<>(
          registry.fieldCandidates(root.name(), field, policy.maxAutoJoinDepth(), declaredNow));
      addDeclaredAliasCandidates(field, candidates, declaredNow);
      if (!policy.allowAutoAddRelations()) {
        candidates.removeIf(c -> !DeclaredFirstRanking.allDeclared(c.joinPath(), with));
      }
      if (candidates.isEmpty()) {
        throw new UnknownFieldException(field, root.name(), registry.findEntitiesWithField(field));
      }
      candidates.sort(SchemaRegistry.CANDIDATE_ORDER);

      List<FieldCandidate> ordered = ranking.order(candidates, with, policy);
      List<FieldCandidate> top = ranking.topTier(ordered, with, policy);
      FieldCandidate chosen = ordered.get(0);
      if (top.size() > 1) {
        List<String> names = top.stream().map(this::displayName).toList();
        if (policy.ambiguityStrategy() == AmbiguityStrategy.ASK) throw new AmbiguousFieldException(field, names);
        diagnostics.warning(DiagnosticCodes.BIND_AMBIGUOUS_FIELD,
            "Field '" + field + "' is ambiguous " + names + "; chose " + displayName(chosen), field);
      }

      BindingReason reason = chosen.isRoot() ? BindingReason.ROOT
          : DeclaredFirstRanking.allDeclared(chosen.joinPath(), explicitlyDeclared()) ? BindingReason.DECLARED
          : BindingReason.AUTO;
      String entity = root.name();
      for (String relName : chosen.joinPath()) {
        RelationDescriptor rel = registry.findRelation(relName).orElseThrow(() -> new UnknownRelationException(relName));
        if (isJoined(rel.name())) {
          entity = aliasEntities.get(SchemaNames.normalize(rel.name()));
          continue;
        }
        entity = join(rel, entity);
      }
      String out = displayName(chosen);
      trace.add(new BindingTrace(field, out, chosen.entity(), chosen.joinPath(), reason));
      return out;
    }

    /** Declared aliases reaching an entity through a different path than the registry's shortest one. */
    private void addDeclaredAliasCandidates(String field, List<FieldCandidate> candidates, List<String> declaredNow) {
      Set<List<String>> seen = new HashSet<>();
      for (FieldCandidate c : candidates) seen.add(normalizedPath(c.joinPath()));
      List<String> declaredNorm = declaredNow.stream().map(SchemaNames::normalize).toList();
      for (String alias : with) {
        String key = SchemaNames.normalize(alias);
        List<String> path = aliasPaths.get(key);
        if (path.size() > policy.maxAutoJoinDepth() && !declared.contains(key)) continue;
        if (!seen.add(normalizedPath(path))) continue;
        String entity = aliasEntities.get(key);
        registry.column(entity, field).ifPresent(col -> candidates.add(
            new FieldCandidate(registry.entity(entity).name(), col.name(), col.type(), path,
                SchemaRegistry.isDeclaredPrefix(path, declaredNorm))));
      }
    }

    private String displayName(FieldCandidate c) {
      return (c.isRoot() ? root.name() : c.qualifier()) + "." + c.field();
    }

    private Target resolveQualifier(String path, String field, String qualifier) {
      String q = SchemaNames.normalize(qualifier);

      if (q.equals(SchemaNames.normalize(root.name())) || q.equals(SchemaNames.normalize(root.label()))) {
        return new Target(root.name(), root.name(), List.of(), BindingReason.ROOT);
      }

      if (aliasEntities.containsKey(q)) {
        return aliasTarget(q, declared.contains(q) ? BindingReason.DECLARED : BindingReason.AUTO);
      }

      Optional<RelationDescriptor> byName = registry.findRelation(qualifier);
      if (byName.isPresent()) {
        RelationDescriptor rel = byName.get();
        String from = reachedFromForward(rel);
        if (from == null) throw new RelationNotFromRootException(rel.name(), root.name(), rel.fromEntity());
        autoJoin(rel, from);
        return aliasTarget(SchemaNames.normalize(rel.name()), BindingReason.AUTO);
      }

      List<RelationDescriptor> toEntity = registry.relationsFrom(root.name()).stream()
          .filter(r -> SchemaNames.normalize(r.toEntity()).equals(q))
          .toList();
      if (!toEntity.isEmpty()) return pickRelation(path, field, toEntity);

      List<String> labelled = new ArrayList<>();
      for (EntityDescriptor e : registry.entitiesByLabel(qualifier)) labelled.add(SchemaNames.normalize(e.name()));
      if (!labelled.isEmpty()) {
        List<String> declaredHits = with.stream()
            .filter(a -> labelled.contains(SchemaNames.normalize(aliasEntities.get(SchemaNames.normalize(a)))))
            .toList();
        if (declaredHits.size() == 1) {
          return aliasTarget(SchemaNames.normalize(declaredHits.get(0)), BindingReason.QUALIFIED);
        }
        List<RelationDescriptor> direct = registry.relationsFrom(root.name()).stream()
            .filter(r -> labelled.contains(SchemaNames.normalize(r.toEntity())))
            .toList();
        if (!direct.isEmpty()) return pickRelation(path, field, direct);
      }
      throw new UnknownRelationException(qualifier);
    }

    /** {@code a.b.field}: each segment is a relation continuing from the previous one. */
    private Target resolveChain(String path, String qualifier) {
      List<String> hops = new ArrayList<>();
      String last = null;
      for (String segment : qualifier.split("\\.")) {
        RelationDescriptor rel = registry.findRelation(segment.trim())
            .orElseThrow(() -> new UnknownRelationException(segment.trim()));
        String key = SchemaNames.normalize(rel.name());
        if (!isJoined(rel.name())) {
          String from = reachedFrom(rel);
          if (from == null) throw new RelationNotFromRootException(rel.name(), root.name(), rel.fromEntity());
          autoJoin(rel, from);
        }
        hops.add(rel.name());
        last = key;
      }
      Target t = aliasTarget(last, BindingReason.QUALIFIED);
      log.trace("fetchgraph.bind chain path={} hops={}", path, hops);
      return t;
    }

    private Target pickRelation(String path, String field, List<RelationDescriptor> options) {
      RelationDescriptor chosen = options.get(0);
      if (options.size() > 1) {
        List<String> names = options.stream().map(r -> r.name() + "." + field).toList();
        if (policy.ambiguityStrategy() == AmbiguityStrategy.ASK) throw new AmbiguousFieldException(path, names);
        diagnostics.warning(DiagnosticCodes.BIND_AMBIGUOUS_FIELD,
            "Qualifier in '" + path + "' matches " + names + "; chose " + chosen.name(), path);
      }
      String key = SchemaNames.normalize(chosen.name());
      if (!isJoined(chosen.name())) autoJoin(chosen, root.name());
      return aliasTarget(key, declared.contains(key) ? BindingReason.DECLARED : BindingReason.QUALIFIED);
    }

    private Target aliasTarget(String key, BindingReason reason) {
      String relName = registry.findRelation(key).map(RelationDescriptor::name).orElse(key);
      return new Target(relName, aliasEntities.get(key), aliasPaths.get(key), reason);
    }

    private void autoJoin(RelationDescriptor rel, String from) {
      if (!policy.allowAutoAddRelations()) {
        throw new UnknownRelationException(rel.name(),
            "Relation '" + rel.name() + "' is not declared in 'with' and auto-add is disabled");
      }
      join(rel, from);
    }

    /** Records the relation as joined from entity {@code from}; returns the entity it reaches. */
    private String join(RelationDescriptor rel, String from) {
      String key = SchemaNames.normalize(rel.name());
      String target = SchemaNames.normalize(rel.fromEntity()).equals(SchemaNames.normalize(from))
          ? rel.toEntity() : rel.fromEntity();
      List<String> path = new ArrayList<>(pathTo(from));
      path.add(rel.name());
      with.add(rel.name());
      aliasEntities.put(key, registry.entity(target).name());
      aliasPaths.put(key, List.copyOf(path));
      return registry.entity(target).name();
    }

    /** Relations from root to an already reached entity; the shortest known one. */
    private List<String> pathTo(String entity) {
      if (SchemaNames.normalize(entity).equals(SchemaNames.normalize(root.name()))) return List.of();
      List<String> best = null;
      for (Map.Entry<String, String> e : aliasEntities.entrySet()) {
        if (!SchemaNames.normalize(e.getValue()).equals(SchemaNames.normalize(entity))) continue;
        List<String> p = aliasPaths.get(e.getKey());
        if (best == null || p.size() < best.size()) best = p;
      }
      return best == null ? List.of() : best;
    }

    private List<String> explicitlyDeclared() {
      return with.stream().filter(r -> declared.contains(SchemaNames.normalize(r))).toList();
    }

    private boolean isJoined(String relation) {
      return aliasEntities.containsKey(SchemaNames.normalize(relation));
    }

    /** Endpoint of {@code rel} already present (either direction), or null. */
    private String reachedFrom(RelationDescriptor rel) {
      if (isReached(rel.fromEntity())) return rel.fromEntity();
      if (isReached(rel.toEntity())) return rel.toEntity();
      return null;
    }

    /** {@code rel.from_entity} when it is already present, or null. */
    private String reachedFromForward(RelationDescriptor rel) {
      return isReached(rel.fromEntity()) ? rel.fromEntity() : null;
    }

    private boolean isReached(String entity) {
      String e = SchemaNames.normalize(entity);
      if (e.equals(SchemaNames.normalize(root.name()))) return true;
      for (String v : aliasEntities.values()) {
        if (SchemaNames.normalize(v).equals(e)) return true;
      }
      return false;
    }

    private List<String> normalizedPath(List<String> path) {
      return path.stream().map(SchemaNames::normalize).toList();
    }
  }
}
