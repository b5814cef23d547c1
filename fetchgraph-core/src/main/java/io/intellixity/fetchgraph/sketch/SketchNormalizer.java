package io.intellixity.fetchgraph.sketch;

import java.math.BigDecimal;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Canonicalizes a parsed sketch map: key aliases, {@code where} shapes, operators, {@code take}.
 * <p>
 * Problems are reported through {@link Diagnostics}; the result is always a usable (possibly partial)
 * {@link NormalizedSketch}.
 */
public final class SketchNormalizer {
  static final Pattern ISO_DATE = Pattern.compile(
      "^\\d{4}-\\d{2}-\\d{2}(?:[T ]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?)?$");

  private static final Set<String> GROUP_KEYS = Set.of("all", "any", "not");

  private final SketchSettings settings;
  private final OperatorCorrector corrector;

  public SketchNormalizer() {
    this(SketchSettings.load());
  }

  public SketchNormalizer(SketchSettings settings) {
    this(settings, new SimilarityOperatorCorrector(settings.autocorrectCutoff()));
  }

  public SketchNormalizer(SketchSettings settings, OperatorCorrector corrector) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.corrector = Objects.requireNonNull(corrector, "corrector");
  }

  public SketchSettings settings() { return settings; }

  public NormalizedSketch normalize(Map<String, Object> data, Diagnostics diagnostics) {
    Map<String, Object> canonical = new LinkedHashMap<>();
    for (Map.Entry<String, Object> e : data.entrySet()) {
      String key = settings.canonicalKey(e.getKey());
      if (key == null) {
        diagnostics.warning(DiagnosticCodes.UNKNOWN_KEY, "Unknown sketch key '" + e.getKey() + "' ignored", e.getKey());
        continue;
      }
      if (canonical.containsKey(key)) {
        diagnostics.warning(DiagnosticCodes.DUPLICATE_KEY,
            "Key '" + e.getKey() + "' repeats '" + key + "'; first value kept", e.getKey());
        continue;
      }
      canonical.put(key, e.getValue());
    }

    String from = "";
    Object rawFrom = canonical.get("from");
    if (rawFrom instanceof String s && !s.isBlank()) {
      from = s.trim();
    } else {
      diagnostics.error(DiagnosticCodes.MISSING_REQUIRED_KEY, "Sketch requires 'from' (root entity)", "from");
    }

    WhereNode where = null;
    if (!canonical.containsKey("where")) {
      diagnostics.warning(DiagnosticCodes.MISSING_WHERE, "Sketch has no 'where'; all rows match", "where");
    } else {
      where = normalizeWhere(canonical.get("where"), "where", diagnostics);
    }

    List<String> get = normalizeGet(canonical.get("get"), canonical.containsKey("get"), diagnostics);
    List<String> with = normalizeWith(canonical.get("with"), diagnostics);
    int take = coerceCount(canonical, "take", settings.defaultTake(), DiagnosticCodes.INVALID_TAKE, diagnostics);
    int skip = coerceCount(canonical, "skip", 0, DiagnosticCodes.INVALID_SKIP, diagnostics);
    Boolean caseSensitive = normalizeCaseFlag(canonical, diagnostics);

    return new NormalizedSketch(from, where, get, with, take, skip, caseSensitive);
  }

  WhereNode normalizeWhere(Object value, String path, Diagnostics diagnostics) {
    if (value == null) return null;
    if (value instanceof List<?> list) {
      return WhereGroup.allOf(normalizeItems(list, path, diagnostics));
    }
    if (value instanceof Map<?, ?> map) {
      WhereNode node = normalizeObject(map, path, diagnostics);
      return node == null ? WhereGroup.allOf(List.of()) : node;
    }
    diagnostics.error(DiagnosticCodes.BAD_WHERE_TYPE,
        "'where' must be a list or an object, got " + value.getClass().getSimpleName(), path);
    return null;
  }

  private List<WhereNode> normalizeItems(List<?> list, String path, Diagnostics diagnostics) {
    List<WhereNode> out = new ArrayList<>();
    for (int i = 0; i < list.size(); i++) {
      WhereNode node = normalizeNode(list.get(i), path + "[" + i + "]", diagnostics);
      if (node != null) out.add(node);
    }
    return out;
  }

  private WhereNode normalizeNode(Object item, String path, Diagnostics diagnostics) {
    if (item instanceof List<?> list) {
      if (!list.isEmpty() && list.get(0) instanceof List<?>) {
        return WhereGroup.allOf(normalizeItems(list, path, diagnostics));
      }
      return normalizeClause(list, path, diagnostics);
    }
    if (item instanceof Map<?, ?> map) {
      return normalizeObject(map, path, diagnostics);
    }
    diagnostics.error(DiagnosticCodes.BAD_CLAUSE,
        "Clause must be a list or an object, got " + (item == null ? "null" : item.getClass().getSimpleName()), path);
    return null;
  }

  private WhereNode normalizeObject(Map<?, ?> map, String path, Diagnostics diagnostics) {
    if (isComparisonShape(map)) return normalizeFlatComparison(map, path, diagnostics);

    boolean hasGroupKey = map.keySet().stream().anyMatch(k -> GROUP_KEYS.contains(String.valueOf(k)));
    if (!hasGroupKey) {
      diagnostics.warning(DiagnosticCodes.EMPTY_WHERE_OBJECT,
          "Where object has none of all/any/not or a comparison; ignored", path);
      return null;
    }
    for (Object k : map.keySet()) {
      if (!GROUP_KEYS.contains(String.valueOf(k))) {
        diagnostics.warning(DiagnosticCodes.WHERE_UNKNOWN_KEY, "Unknown where key '" + k + "' ignored", path + "." + k);
      }
    }
    List<WhereNode> all = groupList(map.get("all"), path + ".all", diagnostics);
    List<WhereNode> any = groupList(map.get("any"), path + ".any", diagnostics);
    WhereNode not = map.get("not") == null ? null : normalizeNode(map.get("not"), path + ".not", diagnostics);
    return new WhereGroup(all, any, not);
  }

  private List<WhereNode> groupList(Object value, String path, Diagnostics diagnostics) {
    if (value == null) return List.of();
    if (value instanceof List<?> list) return normalizeItems(list, path, diagnostics);
    diagnostics.error(DiagnosticCodes.BAD_WHERE_GROUP_TYPE, "Group must be a list", path);
    return List.of();
  }

  private static boolean isComparisonShape(Map<?, ?> map) {
    return "comparison".equals(map.get("type")) || (map.containsKey("field") && map.containsKey("value"));
  }

  private WhereNode normalizeFlatComparison(Map<?, ?> map, String path, Diagnostics diagnostics) {
    Object field = map.get("field");
    if (!(field instanceof String f) || f.isBlank()) {
      diagnostics.error(DiagnosticCodes.BAD_CLAUSE_PATH, "Comparison requires a string 'field'", path + ".field");
      return null;
    }
    String fieldPath = f.trim();
    Object entity = map.get("entity");
    if (entity instanceof String e && !e.isBlank() && !fieldPath.contains(".")) {
      fieldPath = e.trim() + "." + fieldPath;
    }
    Object value = map.get("value");
    Object rawOp = map.get("op");
    if (rawOp == null) return new Clause(fieldPath, inferOperator(value), value);
    if (!(rawOp instanceof String op)) {
      diagnostics.error(DiagnosticCodes.BAD_OPERATOR, "Operator must be a string", path + ".op");
      return null;
    }
    String canonical = canonicalOperator(op, path + ".op", diagnostics);
    return canonical == null ? null : new Clause(fieldPath, canonical, value);
  }

  private WhereNode normalizeClause(List<?> list, String path, Diagnostics diagnostics) {
    if (list.size() != 2 && list.size() != 3) {
      diagnostics.error(DiagnosticCodes.BAD_CLAUSE_ARITY,
          "Clause must be [path, value] or [path, op, value], got " + list.size() + " items", path);
      return null;
    }
    if (!(list.get(0) instanceof String p) || p.isBlank()) {
      diagnostics.error(DiagnosticCodes.BAD_CLAUSE_PATH, "Clause path must be a non-empty string", path + "[0]");
      return null;
    }
    String fieldPath = p.trim();
    if (list.size() == 2) {
      Object value = list.get(1);
      return new Clause(fieldPath, inferOperator(value), value);
    }
    if (!(list.get(1) instanceof String op)) {
      diagnostics.error(DiagnosticCodes.BAD_OPERATOR, "Operator must be a string", path + "[1]");
      return null;
    }
    String canonical = canonicalOperator(op, path + "[1]", diagnostics);
    return canonical == null ? null : new Clause(fieldPath, canonical, list.get(2));
  }

  /** string -> is; number/bool/null -> =; two ISO dates -> between; other list -> in. */
  static String inferOperator(Object value) {
    if (value == null || value instanceof Number || value instanceof Boolean) return "=";
    if (value instanceof String) return "is";
    if (value instanceof List<?> list) {
      if (list.size() == 2 && list.stream().allMatch(v -> v instanceof String s && ISO_DATE.matcher(s.trim()).matches())) {
        return "between";
      }
      return "in";
    }
    return "is";
  }

  private String canonicalOperator(String raw, String path, Diagnostics diagnostics) {
    String op = raw.trim().toLowerCase(Locale.ROOT);
    if (settings.canonicalOperators().contains(op)) return op;
    String aliased = settings.operatorAliases().get(op);
    if (aliased != null) return aliased;
    Optional<String> corrected = corrector.correct(op, settings.canonicalOperators());
    if (corrected.isPresent()) {
      diagnostics.warning(DiagnosticCodes.OP_AUTOCORRECT,
          "Operator '" + raw + "' corrected to '" + corrected.get() + "'", path);
      return corrected.get();
    }
    diagnostics.error(DiagnosticCodes.UNKNOWN_OP, "Unknown operator '" + raw + "'; clause dropped", path);
    return null;
  }

  private List<String> normalizeGet(Object value, boolean present, Diagnostics diagnostics) {
    if (!present || value == null) return settings.defaultGet();
    List<?> items;
    if (value instanceof String s) items = List.of(s);
    else if (value instanceof List<?> list) items = list;
    else {
      diagnostics.warning(DiagnosticCodes.BAD_GET, "'get' must be a list of field paths", "get");
      return settings.defaultGet();
    }
    List<String> out = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      Object item = items.get(i);
      String expr = null;
      if (item instanceof String s) expr = s;
      else if (item instanceof Map<?, ?> m && m.get("expr") instanceof String s) expr = s;
      if (expr == null || expr.isBlank()) {
        diagnostics.warning(DiagnosticCodes.BAD_GET, "Unusable 'get' item ignored", "get[" + i + "]");
        continue;
      }
      out.add(expr.trim());
    }
    return out.isEmpty() ? settings.defaultGet() : out;
  }

  private static List<String> normalizeWith(Object value, Diagnostics diagnostics) {
    if (value == null) return List.of();
    List<?> items;
    if (value instanceof String s) items = List.of(s);
    else if (value instanceof List<?> list) items = list;
    else {
      diagnostics.warning(DiagnosticCodes.BAD_WITH, "'with' must be a list of relation names", "with");
      return List.of();
    }
    LinkedHashSet<String> out = new LinkedHashSet<>();
    for (int i = 0; i < items.size(); i++) {
      if (items.get(i) instanceof String s && !s.isBlank()) out.add(s.trim());
      else diagnostics.warning(DiagnosticCodes.BAD_WITH, "Unusable 'with' item ignored", "with[" + i + "]");
    }
    return List.copyOf(out);
  }

  private static int coerceCount(Map<String, Object> canonical, String key, int def, String code, Diagnostics diagnostics) {
    if (!canonical.containsKey(key) || canonical.get(key) == null) return def;
    Object value = canonical.get(key);
    Integer n = toInt(value);
    if (n == null || n < 0) {
      diagnostics.error(code, "'" + key + "' must be a non-negative integer, got " + value + "; using " + def, key);
      return def;
    }
    return n;
  }

  private static Integer toInt(Object value) {
    if (value instanceof Boolean) return null;
    try {
      if (value instanceof Number num) return new BigDecimal(num.toString()).intValueExact();
      if (value instanceof String s) return new BigDecimal(s.trim()).intValueExact();
    } catch (ArithmeticException | NumberFormatException e) {
      return null;
    }
    return null;
  }

  private static Boolean normalizeCaseFlag(Map<String, Object> canonical, Diagnostics diagnostics) {
    Object value = canonical.get("case_sensitive");
    if (value == null) return null;
    if (value instanceof Boolean b) return b;
    if (value instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
      return Boolean.parseBoolean(s);
    }
    diagnostics.warning(DiagnosticCodes.BAD_CASE_FLAG, "'case_sensitive' must be a boolean; ignored", "case_sensitive");
    return null;
  }
}
