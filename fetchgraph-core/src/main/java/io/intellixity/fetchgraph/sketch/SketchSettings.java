package io.intellixity.fetchgraph.sketch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Sketch DSL vocabulary: defaults, key aliases, operator aliases and the autocorrect cutoff.
 * <p>
 * {@link #load()} reads {@value #RESOURCE} from the classpath when present and falls back to the built-in
 * table otherwise.
 */
public record SketchSettings(int defaultTake,
                             List<String> defaultGet,
                             Map<String, String> keyAliases,
                             List<String> canonicalOperators,
                             Map<String, String> operatorAliases,
                             double autocorrectCutoff) {
  private static final Logger log = LoggerFactory.getLogger(SketchSettings.class);

  public static final String RESOURCE = "META-INF/fetchgraph/sketch-dsl.json";

  public static final List<String> CANONICAL_KEYS = List.of("from", "where", "get", "with", "take", "skip", "case_sensitive");

  public SketchSettings {
    if (defaultTake < 0) throw new IllegalArgumentException("defaultTake must be >= 0");
    defaultGet = List.copyOf(defaultGet);
    keyAliases = Map.copyOf(keyAliases);
    canonicalOperators = List.copyOf(canonicalOperators);
    operatorAliases = Map.copyOf(operatorAliases);
    if (autocorrectCutoff < 0 || autocorrectCutoff > 1) {
      throw new IllegalArgumentException("autocorrectCutoff must be within [0,1]");
    }
  }

  public static SketchSettings builtIn() {
    Map<String, String> keys = new HashMap<>();
    for (String k : CANONICAL_KEYS) keys.put(k, k);
    aliasAll(keys, "from", "root", "entity", "root_entity");
    aliasAll(keys, "where", "find", "filter", "filters");
    aliasAll(keys, "get", "select", "fields");
    aliasAll(keys, "with", "include", "joins", "join", "relations");
    aliasAll(keys, "take", "limit", "top");
    aliasAll(keys, "skip", "offset");
    aliasAll(keys, "case_sensitive", "case_sensitivity");

    Map<String, String> ops = new HashMap<>();
    ops.put("eq", "=");
    ops.put("equals", "=");
    ops.put("==", "=");
    ops.put("neq", "!=");
    ops.put("ne", "!=");
    ops.put("not_equals", "!=");
    ops.put("<>", "!=");
    ops.put("gt", ">");
    ops.put("gte", ">=");
    ops.put("lt", "<");
    ops.put("lte", "<=");
    ops.put("like", "is");
    ops.put("ilike", "is");
    ops.put("startswith", "starts");
    ops.put("endswith", "ends");
    ops.put("has", "contains");

    return new SketchSettings(200, List.of("*"), keys,
        List.of("=", "!=", "<", ">", "<=", ">=", "contains", "starts", "ends", "in", "between", "before", "after",
            "is", "similar", "related"),
        ops, 0.8);
  }

  public static SketchSettings load() {
    return load(new ObjectMapper(), Thread.currentThread().getContextClassLoader());
  }

  public static SketchSettings load(ObjectMapper mapper, ClassLoader cl) {
    ClassLoader loader = (cl == null) ? SketchSettings.class.getClassLoader() : cl;
    try (InputStream in = loader.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.debug("fetchgraph.sketch settings resource={} missing, using built-in", RESOURCE);
        return builtIn();
      }
      return fromJson(mapper.readTree(in));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
  }

  /** Overlays the given JSON on the built-in table; absent sections keep their defaults. */
  public static SketchSettings fromJson(JsonNode root) {
    SketchSettings base = builtIn();
    if (root == null || !root.isObject()) return base;

    int take = root.path("defaults").path("take").asInt(base.defaultTake());
    List<String> get = new ArrayList<>();
    root.path("defaults").path("get").forEach(n -> get.add(n.asText()));

    Map<String, String> keys = new HashMap<>(base.keyAliases());
    root.path("key_aliases").fields().forEachRemaining(e -> {
      keys.put(e.getKey(), e.getKey());
      e.getValue().forEach(alias -> keys.put(alias.asText().toLowerCase(Locale.ROOT), e.getKey()));
    });

    List<String> canonical = new ArrayList<>();
    root.path("operators").forEach(n -> canonical.add(n.asText()));

    Map<String, String> ops = new HashMap<>(base.operatorAliases());
    root.path("operator_aliases").fields().forEachRemaining(e -> ops.put(e.getKey().toLowerCase(Locale.ROOT), e.getValue().asText()));

    double cutoff = root.path("autocorrect_cutoff").asDouble(base.autocorrectCutoff());
    return new SketchSettings(take, get.isEmpty() ? base.defaultGet() : get, keys,
        canonical.isEmpty() ? base.canonicalOperators() : canonical, ops, cutoff);
  }

  public SketchSettings withDefaultTake(int take) {
    return new SketchSettings(take, defaultGet, keyAliases, canonicalOperators, operatorAliases, autocorrectCutoff);
  }

  /** Canonical key for a raw sketch key, or null when unrecognized. */
  public String canonicalKey(String raw) {
    if (raw == null) return null;
    return keyAliases.get(raw.trim().toLowerCase(Locale.ROOT));
  }

  private static void aliasAll(Map<String, String> into, String canonical, String... aliases) {
    for (String a : aliases) into.put(a, canonical);
  }
}
