package io.intellixity.fetchgraph.spi.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.fetchgraph.bind.ResolutionPolicy;
import io.intellixity.fetchgraph.compile.CompiledSketch;
import io.intellixity.fetchgraph.compile.SketchPipeline;
import io.intellixity.fetchgraph.query.QueryValidationException;
import io.intellixity.fetchgraph.query.RelationalQuery;
import io.intellixity.fetchgraph.query.SelectorNormalizer;
import io.intellixity.fetchgraph.query.SemanticClause;
import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.SchemaRegistry;
import io.intellixity.fetchgraph.spi.exec.*;
import io.intellixity.fetchgraph.spi.result.ProviderResult;
import io.intellixity.fetchgraph.spi.result.QueryResult;
import io.intellixity.fetchgraph.spi.result.SchemaResult;
import io.intellixity.fetchgraph.spi.result.SemanticOnlyResult;
import io.intellixity.fetchgraph.spi.semantic.SemanticBackend;
import io.intellixity.fetchgraph.spi.semantic.SemanticMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Template-method base for relational providers.
 * <p>
 * Responsibilities:
 * <ul>
 *   <li>selector dispatch ({@code op} or {@code $dsl} envelope) in {@link #fetch(JsonNode)}</li>
 *   <li>join planning via {@link JoinPlanner} and validation via {@link QueryValidationStrategy}</li>
 *   <li>semantic clause resolution against the {@link SemanticBackend}</li>
 *   <li>delegating execution of the planned query to {@link #executeQuery}</li>
 * </ul>
 * Engines only implement the hook; everything before it is shared, so all engines accept and reject the same
 * queries.
 */
public abstract class AbstractRelationalProvider implements RelationalProvider {
  private static final Logger log = LoggerFactory.getLogger(AbstractRelationalProvider.class);

  private final String name;
  private final SchemaRegistry schema;
  private final SemanticBackend semanticBackend;
  private final QueryValidationStrategy queryValidation;
  private final JoinPlanner joinPlanner;
  private final SketchPipeline sketchPipeline;
  private final ResolutionPolicy resolutionPolicy;
  private final ObjectMapper mapper;

  /**
   * DI-friendly constructor: callers provide the supporting strategies.
   *
   * @param semanticBackend may be null; semantic clauses then fail with {@link IllegalStateException}
   */
  protected AbstractRelationalProvider(String name,
                                       SchemaRegistry schema,
                                       SemanticBackend semanticBackend,
                                       QueryValidationStrategy queryValidation,
                                       JoinPlanner joinPlanner,
                                       SketchPipeline sketchPipeline,
                                       ResolutionPolicy resolutionPolicy,
                                       ObjectMapper mapper) {
    this.name = Objects.requireNonNull(name, "name");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.semanticBackend = semanticBackend;
    this.queryValidation = (queryValidation == null) ? new DefaultQueryValidationStrategy() : queryValidation;
    this.joinPlanner = (joinPlanner == null) ? new JoinPlanner() : joinPlanner;
    this.sketchPipeline = (sketchPipeline == null) ? new SketchPipeline() : sketchPipeline;
    this.resolutionPolicy = (resolutionPolicy == null) ? ResolutionPolicy.defaults() : resolutionPolicy;
    this.mapper = (mapper == null) ? new ObjectMapper() : mapper;
  }

  protected AbstractRelationalProvider(String name, SchemaRegistry schema, SemanticBackend semanticBackend) {
    this(name, schema, semanticBackend, null, null, null, null, null);
  }

  /** Short engine id reported in result metadata, e.g. {@code tabular}. */
  protected abstract String engineName();

  /**
   * Template hook: run an already planned and validated query.
   *
   * @param semantic resolved semantic clauses, in query order
   */
  protected abstract QueryResult executeQuery(RelationalQuery query, JoinPlan plan, List<ResolvedSemanticClause> semantic);

  @Override
  public final String name() { return name; }

  @Override
  public final SchemaRegistry schema() { return schema; }

  @Override
  public Set<ProviderCapability> capabilities() {
    EnumSet<ProviderCapability> caps = EnumSet.of(ProviderCapability.SCHEMA, ProviderCapability.ROW_QUERY,
        ProviderCapability.AGGREGATE, ProviderCapability.SKETCH_DIALECT);
    if (semanticBackend != null) caps.add(ProviderCapability.SEMANTIC_SEARCH);
    return Collections.unmodifiableSet(caps);
  }

  @Override
  public ProviderInfo describe() {
    return ProviderDescriber.describe(name, schema, capabilities());
  }

  protected QueryValidationStrategy queryValidation() { return queryValidation; }
  protected final JoinPlanner joinPlanner() { return joinPlanner; }
  protected final SemanticBackend semanticBackendOrNull() { return semanticBackend; }
  protected final ObjectMapper mapper() { return mapper; }

  @Override
  public final ProviderResult fetch(JsonNode selectors) {
    if (selectors == null || !selectors.isObject()) {
      throw new IllegalArgumentException("Relational selectors must be a JSON object");
    }
    boolean hasOp = selectors.hasNonNull("op");
    boolean hasDsl = selectors.has("$dsl");
    if (hasOp && hasDsl) {
      throw new IllegalArgumentException("Relational selectors must not contain both 'op' and '$dsl'");
    }
    if (hasDsl) return execute(compileEnvelope(selectors));
    if (!hasOp) throw new IllegalArgumentException("Relational selectors must include 'op' field.");

    String op = selectors.get("op").asText();
    return switch (op) {
      case "schema" -> new SchemaResult(schema.entities(), schema.relations());
      case "semantic_only" -> semanticOnly(selectors);
      case "query" -> execute(readQuery(selectors));
      default -> throw new IllegalArgumentException("Unsupported op: " + op);
    };
  }

  /** Compiles a raw sketch (text, JSON or map) against this provider's schema. Never executes it. */
  public final CompiledSketch compileSketch(Object sketch) {
    Object input = (sketch instanceof JsonNode n && n.isTextual()) ? n.asText() : sketch;
    return sketchPipeline.compile(input, schema, resolutionPolicy);
  }

  @Override
  public final QueryResult execute(RelationalQuery query) {
    Objects.requireNonNull(query, "query");
    long start = System.nanoTime();
    JoinPlan plan = joinPlanner.plan(schema, query);
    queryValidation().validate(query, schema, plan);
    List<ResolvedSemanticClause> semantic = resolveSemantic(query, plan);
    QueryResult result = executeQuery(query, plan, semantic);
    if (log.isDebugEnabled()) {
      log.debug("fetchgraph.provider op=query provider={} engine={} root={} relations={} semantic={} rows={} durationMs={}",
          name, engineName(), query.rootEntity(), plan.relationNames(), semantic.size(), result.rows().size(),
          (System.nanoTime() - start) / 1_000_000L);
    }
    return result;
  }

  public final SemanticOnlyResult semanticOnly(String entity, String query, List<String> fields, int topK) {
    EntityDescriptor e = schema.entity(entity);
    List<SemanticMatch> matches = requireSemanticBackend().search(e.name(), fields == null ? List.of() : fields, query,
        topK <= 0 ? SemanticClause.DEFAULT_TOP_K : topK);
    log.debug("fetchgraph.provider op=semantic_only provider={} entity={} matches={}", name, e.name(), matches.size());
    return new SemanticOnlyResult(matches);
  }

  /** Metadata common to every query result. */
  protected final Map<String, Object> meta(RelationalQuery query, JoinPlan plan) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("relations_used", plan.relationNames());
    meta.put("engine", engineName());
    if (!query.groupBy().isEmpty()) {
      meta.put("group_by", query.groupBy().stream().map(g -> g.entity() == null ? g.field() : g.entity() + "." + g.field()).toList());
    }
    return meta;
  }

  private RelationalQuery compileEnvelope(JsonNode selectors) {
    String dialect = selectors.get("$dsl").asText();
    if (!SketchPipeline.DIALECT_ID.equals(dialect)) {
      throw new IllegalArgumentException("Unsupported selector dialect: " + dialect);
    }
    JsonNode payload = selectors.get("payload");
    if (payload == null || payload.isNull()) {
      throw new IllegalArgumentException("Selector envelope requires 'payload'");
    }
    CompiledSketch compiled = compileSketch(payload);
    if (compiled.diagnostics().hasErrors() || compiled.query() == null) {
      throw new SelectorDialectException(dialect, compiled.diagnostics().errors(),
          compiled.diagnostics().hasErrors() ? compiled.diagnostics().errorSummary() : "no root entity");
    }
    return compiled.query();
  }

  private RelationalQuery readQuery(JsonNode selectors) {
    try {
      return mapper.treeToValue(SelectorNormalizer.normalize(selectors), RelationalQuery.class);
    } catch (JsonProcessingException e) {
      if (e.getCause() instanceof QueryValidationException qve) throw qve;
      throw new QueryValidationException("Malformed query selectors: " + e.getOriginalMessage(), e);
    }
  }

  private SemanticOnlyResult semanticOnly(JsonNode selectors) {
    JsonNode entity = selectors.get("entity");
    JsonNode query = selectors.get("query");
    if (entity == null || !entity.isTextual() || query == null || !query.isTextual()) {
      throw new QueryValidationException("semantic_only requires string 'entity' and 'query'");
    }
    List<String> fields = new ArrayList<>();
    JsonNode f = selectors.get("fields");
    if (f != null && f.isArray()) f.forEach(n -> fields.add(n.asText()));
    JsonNode topK = selectors.get("top_k");
    int k = (topK != null && topK.canConvertToInt()) ? topK.asInt() : SemanticClause.DEFAULT_TOP_K;
    return semanticOnly(entity.asText(), query.asText(), fields, k);
  }

  private List<ResolvedSemanticClause> resolveSemantic(RelationalQuery query, JoinPlan plan) {
    if (query.semanticClauses().isEmpty()) return List.of();
    SemanticBackend backend = requireSemanticBackend();
    List<ResolvedSemanticClause> out = new ArrayList<>(query.semanticClauses().size());
    for (SemanticClause c : query.semanticClauses()) {
      EntityDescriptor target = plan.entityFor(c.entity());
      String pk = target.primaryKey()
          .orElseThrow(() -> new QueryValidationException("Semantic clause target '" + c.entity() + "' has no primary key"))
          .name();
      ColumnRef key = plan.resolve(c.entity(), pk);
      List<SemanticMatch> matches = backend.search(target.name(), c.fields(), c.query(), c.topK());
      out.add(new ResolvedSemanticClause(c, key, matches == null ? List.of() : matches));
    }
    return out;
  }

  private SemanticBackend requireSemanticBackend() {
    if (semanticBackend == null) throw new IllegalStateException("Semantic backend is not configured");
    return semanticBackend;
  }
}
