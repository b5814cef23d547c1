package io.intellixity.fetchgraph.schema;

import java.util.*;

/**
 * Index over a fixed set of entities and relations.
 * <p>
 * Entities and relations are stored in arrays and addressed by dense ids; relation ids follow relation-name
 * order, and each entity's adjacency is an {@code int[]} of relation ids in that order, so traversal never
 * depends on declaration order. The relation graph is undirected for path finding.
 * <p>
 * Instances are immutable and safe to share.
 */
public final class SchemaRegistry {
  private static final Comparator<List<String>> PATH_ORDER = SchemaRegistry::comparePaths;

  /** {@code (path length, declared-prefix first, path, entity, field)}. */
  public static final Comparator<FieldCandidate> CANDIDATE_ORDER = Comparator
      .comparingInt((FieldCandidate c) -> c.joinPath().size())
      .thenComparing(c -> c.declaredPrefix() ? 0 : 1)
      .thenComparing(FieldCandidate::joinPath, PATH_ORDER)
      .thenComparing(FieldCandidate::entity)
      .thenComparing(FieldCandidate::field);

  private final EntityDescriptor[] entities;
  private final RelationDescriptor[] relations;
  private final Map<String, Integer> entityIds;
  private final Map<String, Integer> relationIds;
  private final List<Map<String, ColumnDescriptor>> columns;
  private final int[] relFrom;
  private final int[] relTo;
  private final int[][] adjacency;

  private SchemaRegistry(List<EntityDescriptor> entityList, List<RelationDescriptor> relationList) {
    this.entities = entityList.toArray(new EntityDescriptor[0]);
    this.entityIds = new HashMap<>();
    this.columns = new ArrayList<>(entities.length);
    for (int i = 0; i < entities.length; i++) {
      String key = SchemaNames.normalize(entities[i].name());
      if (entityIds.putIfAbsent(key, i) != null) {
        throw new IllegalArgumentException("Duplicate entity name: " + entities[i].name());
      }
      Map<String, ColumnDescriptor> cols = new LinkedHashMap<>();
      for (ColumnDescriptor c : entities[i].columns()) {
        if (cols.putIfAbsent(SchemaNames.normalize(c.name()), c) != null) {
          throw new IllegalArgumentException("Duplicate column " + c.name() + " on entity " + entities[i].name());
        }
      }
      columns.add(Collections.unmodifiableMap(cols));
    }

    List<RelationDescriptor> sorted = new ArrayList<>(relationList);
    sorted.sort(Comparator.comparing(RelationDescriptor::name));
    this.relations = sorted.toArray(new RelationDescriptor[0]);
    this.relationIds = new HashMap<>();
    this.relFrom = new int[relations.length];
    this.relTo = new int[relations.length];

    List<List<Integer>> adj = new ArrayList<>(entities.length);
    for (int i = 0; i < entities.length; i++) adj.add(new ArrayList<>());

    for (int r = 0; r < relations.length; r++) {
      RelationDescriptor rel = relations[r];
      if (relationIds.putIfAbsent(SchemaNames.normalize(rel.name()), r) != null) {
        throw new IllegalArgumentException("Duplicate relation name: " + rel.name());
      }
      Integer from = entityIds.get(SchemaNames.normalize(rel.fromEntity()));
      Integer to = entityIds.get(SchemaNames.normalize(rel.toEntity()));
      if (from == null || to == null) {
        throw new IllegalArgumentException("Relation " + rel.name() + " references unknown entity: "
            + (from == null ? rel.fromEntity() : rel.toEntity()));
      }
      relFrom[r] = from;
      relTo[r] = to;
      adj.get(from).add(r);
      if (!from.equals(to)) adj.get(to).add(r);
    }

    this.adjacency = new int[entities.length][];
    for (int i = 0; i < entities.length; i++) {
      adjacency[i] = adj.get(i).stream().mapToInt(Integer::intValue).toArray();
    }
  }

  public static SchemaRegistry of(List<EntityDescriptor> entities, List<RelationDescriptor> relations) {
    return new SchemaRegistry(
        List.copyOf(Objects.requireNonNull(entities, "entities")),
        List.copyOf(Objects.requireNonNull(relations, "relations")));
  }

  public static SchemaRegistry of(SchemaDefinition definition) {
    Objects.requireNonNull(definition, "definition");
    return of(definition.entities(), definition.relations());
  }

  public List<EntityDescriptor> entities() { return List.of(entities); }

  /** Relations in name order. */
  public List<RelationDescriptor> relations() { return List.of(relations); }

  public boolean hasEntity(String name) {
    return entityIds.containsKey(SchemaNames.normalize(name));
  }

  public EntityDescriptor entity(String name) {
    return entities[entityId(name)];
  }

  public Optional<EntityDescriptor> findEntity(String name) {
    Integer id = entityIds.get(SchemaNames.normalize(name));
    return id == null ? Optional.empty() : Optional.of(entities[id]);
  }

  public boolean hasRelation(String name) {
    return relationIds.containsKey(SchemaNames.normalize(name));
  }

  public Optional<RelationDescriptor> findRelation(String name) {
    Integer id = relationIds.get(SchemaNames.normalize(name));
    return id == null ? Optional.empty() : Optional.of(relations[id]);
  }

  public Optional<ColumnDescriptor> column(String entity, String field) {
    return Optional.ofNullable(columns.get(entityId(entity)).get(SchemaNames.normalize(field)));
  }

  public boolean hasField(String entity, String field) {
    return column(entity, field).isPresent();
  }

  /** Entities declaring a column named {@code field}, by name. */
  public List<String> findEntitiesWithField(String field) {
    String key = SchemaNames.normalize(field);
    List<String> out = new ArrayList<>();
    for (int i = 0; i < entities.length; i++) {
      if (columns.get(i).containsKey(key)) out.add(entities[i].name());
    }
    out.sort(Comparator.naturalOrder());
    return out;
  }

  /** Relations whose {@code from_entity} is {@code entity}, in name order. */
  public List<RelationDescriptor> relationsFrom(String entity) {
    int id = entityId(entity);
    List<RelationDescriptor> out = new ArrayList<>();
    for (int r : adjacency[id]) {
      if (relFrom[r] == id) out.add(relations[r]);
    }
    return out;
  }

  /** Entities whose label (or name) normalizes to {@code label}. */
  public List<EntityDescriptor> entitiesByLabel(String label) {
    String key = SchemaNames.normalize(label);
    List<EntityDescriptor> out = new ArrayList<>();
    for (EntityDescriptor e : entities) {
      if (SchemaNames.normalize(e.label()).equals(key) || SchemaNames.normalize(e.name()).equals(key)) out.add(e);
    }
    return out;
  }

  /**
   * All minimum-length join paths from {@code root} to {@code target}, sorted by relation-name tuple.
   * <p>
   * {@code root == target} yields one empty path; a negative {@code maxDepth} or an unreachable target
   * yields an empty list.
   */
  public List<List<String>> findPaths(String root, String target, int maxDepth) {
    int start = entityId(root);
    int goal = entityId(target);
    if (maxDepth < 0) return List.of();
    if (start == goal) return List.of(List.of());

    int[] bestDepth = new int[entities.length];
    Arrays.fill(bestDepth, Integer.MAX_VALUE);
    bestDepth[start] = 0;

    Deque<Step> queue = new ArrayDeque<>();
    queue.add(new Step(start, new int[0]));
    Set<List<String>> found = new TreeSet<>(PATH_ORDER);
    int foundDepth = -1;

    while (!queue.isEmpty()) {
      Step step = queue.poll();
      int depth = step.path.length;
      if (foundDepth >= 0 && depth >= foundDepth) break;
      if (depth >= maxDepth) continue;
      for (int r : adjacency[step.entity]) {
        int next = relFrom[r] == step.entity ? relTo[r] : relFrom[r];
        int nextDepth = depth + 1;
        if (nextDepth > bestDepth[next]) continue;
        bestDepth[next] = nextDepth;
        int[] path = Arrays.copyOf(step.path, nextDepth);
        path[depth] = r;
        if (next == goal) {
          found.add(names(path));
          foundDepth = nextDepth;
        } else {
          queue.add(new Step(next, path));
        }
      }
    }
    return List.copyOf(found);
  }

  /**
   * Ranked places {@code field} can resolve to from {@code root}: the root's own column first, then each other
   * entity with that column whose shortest path is within {@code maxDepth}.
   * <p>
   * Order is {@code (path length, declared-prefix first, path, entity, field)}. Among equal-length shortest paths
   * to one entity, a path matching a prefix of {@code declaredWith} is preferred.
   */
  public List<FieldCandidate> fieldCandidates(String root, String field, int maxDepth, List<String> declaredWith) {
    int rootId = entityId(root);
    String key = SchemaNames.normalize(field);
    List<String> declared = declaredWith == null ? List.of()
        : declaredWith.stream().map(SchemaNames::normalize).toList();

    List<FieldCandidate> out = new ArrayList<>();
    ColumnDescriptor own = columns.get(rootId).get(key);
    if (own != null) {
      out.add(new FieldCandidate(entities[rootId].name(), own.name(), own.type(), List.of(), false));
    }

    for (int i = 0; i < entities.length; i++) {
      if (i == rootId) continue;
      ColumnDescriptor col = columns.get(i).get(key);
      if (col == null) continue;
      List<List<String>> paths = findPaths(entities[rootId].name(), entities[i].name(), maxDepth);
      if (paths.isEmpty()) continue;
      List<String> chosen = paths.stream().filter(p -> isDeclaredPrefix(p, declared)).findFirst().orElse(paths.get(0));
      out.add(new FieldCandidate(entities[i].name(), col.name(), col.type(), chosen, isDeclaredPrefix(chosen, declared)));
    }

    out.sort(CANDIDATE_ORDER);
    return out;
  }

  /** True when {@code path} is non-empty and equals the first {@code path.size()} declared relations. */
  public static boolean isDeclaredPrefix(List<String> path, List<String> declaredNormalized) {
    if (path.isEmpty() || declaredNormalized.size() < path.size()) return false;
    for (int i = 0; i < path.size(); i++) {
      if (!SchemaNames.normalize(path.get(i)).equals(declaredNormalized.get(i))) return false;
    }
    return true;
  }

  private int entityId(String name) {
    Integer id = entityIds.get(SchemaNames.normalize(name));
    if (id == null) throw new UnknownEntityException(name);
    return id;
  }

  private List<String> names(int[] path) {
    List<String> out = new ArrayList<>(path.length);
    for (int r : path) out.add(relations[r].name());
    return List.copyOf(out);
  }

  private static int comparePaths(List<String> a, List<String> b) {
    int n = Math.min(a.size(), b.size());
    for (int i = 0; i < n; i++) {
      int c = a.get(i).compareTo(b.get(i));
      if (c != 0) return c;
    }
    return Integer.compare(a.size(), b.size());
  }

  private record Step(int entity, int[] path) {}
}
