package io.intellixity.fetchgraph.sketch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Turns raw sketch input (text, {@link Map} or {@link JsonNode}) into a loose key/value map.
 * <p>
 * Never throws on malformed input: failures become a {@link DiagnosticCodes#PARSE_ERROR} error and an empty
 * map. Text is tried as strict JSON first, then as an extracted block, then after {@link SketchTextRepair}.
 */
public final class SketchParser {
  private static final Logger log = LoggerFactory.getLogger(SketchParser.class);
  private static final TypeReference<Object> ANY = new TypeReference<>() {};

  private final ObjectMapper strict;
  private final ObjectMapper lenient;

  public SketchParser() {
    this(new ObjectMapper());
  }

  public SketchParser(ObjectMapper mapper) {
    this.strict = Objects.requireNonNull(mapper, "mapper");
    this.lenient = JsonMapper.builder()
        .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
        .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
        .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
        .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .build();
  }

  public record Result(Map<String, Object> data, Diagnostics diagnostics) {}

  public Result parse(Object input) {
    Diagnostics diagnostics = new Diagnostics();
    if (input instanceof Map<?, ?> m) {
      return new Result(stringKeys(m), diagnostics);
    }
    if (input instanceof JsonNode node) {
      return fromValue(strict.convertValue(node, ANY), diagnostics);
    }
    if (input instanceof String text) {
      return parseText(text, diagnostics);
    }
    diagnostics.error(DiagnosticCodes.PARSE_ERROR,
        "Sketch must be a string or an object, got " + (input == null ? "null" : input.getClass().getSimpleName()),
        null);
    return new Result(Map.of(), diagnostics);
  }

  private Result parseText(String text, Diagnostics diagnostics) {
    if (text.isBlank()) {
      diagnostics.error(DiagnosticCodes.PARSE_ERROR, "Sketch text is empty", null);
      return new Result(Map.of(), diagnostics);
    }
    String trimmed = text.trim();
    Object value = tryRead(strict, trimmed);
    if (value == null) {
      String block = SketchTextRepair.extractBlock(trimmed);
      if (block != null) value = tryRead(strict, block);
      String candidate = (block != null) ? block : trimmed;
      if (value == null) value = tryRead(lenient, candidate);
      if (value == null) {
        String repaired = SketchTextRepair.repair(candidate);
        log.debug("fetchgraph.sketch op=repair before={} after={}", candidate.length(), repaired.length());
        value = tryRead(lenient, repaired);
      }
    }
    if (value == null) {
      diagnostics.error(DiagnosticCodes.PARSE_ERROR, "Could not parse sketch text as JSON", null);
      return new Result(Map.of(), diagnostics);
    }
    return fromValue(value, diagnostics);
  }

  private static Result fromValue(Object value, Diagnostics diagnostics) {
    if (value instanceof Map<?, ?> m) return new Result(stringKeys(m), diagnostics);
    diagnostics.error(DiagnosticCodes.PARSE_ERROR, "Sketch must be a JSON object", null);
    return new Result(Map.of(), diagnostics);
  }

  private static Object tryRead(ObjectMapper mapper, String text) {
    try {
      return mapper.readValue(text, ANY);
    } catch (JsonProcessingException e) {
      log.trace("fetchgraph.sketch op=parse failed={}", e.getOriginalMessage());
      return null;
    }
  }

  private static Map<String, Object> stringKeys(Map<?, ?> m) {
    Map<String, Object> out = new LinkedHashMap<>();
    m.forEach((k, v) -> out.put(String.valueOf(k), v));
    return out;
  }
}
