package io.intellixity.fetchgraph.examples.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.fetchgraph.schema.ColumnDescriptor;
import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.schema.SchemaDefinition;
import io.intellixity.fetchgraph.schema.SchemaRegistry;
import io.intellixity.fetchgraph.tabular.ColumnTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;

/**
 * Schema and rows read from {@code <location>/schema.json} and {@code <location>/data.json} on the classpath.
 * Date and timestamp cells are parsed from their ISO strings so both engines see temporal values.
 */
public record RetailDataset(SchemaRegistry schema, Map<String, ColumnTable> tables) {
  private static final Logger log = LoggerFactory.getLogger(RetailDataset.class);

  public RetailDataset {
    Objects.requireNonNull(schema, "schema");
    tables = Map.copyOf(tables);
  }

  public static RetailDataset load(ObjectMapper mapper, String location) {
    String base = (location == null || location.isBlank()) ? "retail" : location.replaceAll("/+$", "");
    SchemaDefinition def = read(mapper, base + "/schema.json", new TypeReference<SchemaDefinition>() {});
    SchemaRegistry schema = SchemaRegistry.of(def);
    Map<String, List<Map<String, Object>>> rows =
        read(mapper, base + "/data.json", new TypeReference<Map<String, List<Map<String, Object>>>>() {});

    Map<String, ColumnTable> tables = new LinkedHashMap<>();
    for (EntityDescriptor e : schema.entities()) {
      List<Map<String, Object>> entityRows = rows.getOrDefault(e.name(), List.of());
      ColumnTable.Builder b = ColumnTable.builder(e.name(), e.columnNames().toArray(String[]::new));
      for (Map<String, Object> r : entityRows) {
        Object[] values = new Object[e.columns().size()];
        for (int i = 0; i < values.length; i++) {
          ColumnDescriptor c = e.columns().get(i);
          values[i] = typed(c, r.get(c.name()));
        }
        b.row(values);
      }
      tables.put(e.name(), b.build());
    }
    log.info("fetchgraph.examples op=load location={} entities={} rows={}", base, tables.size(),
        tables.values().stream().mapToInt(ColumnTable::rowCount).sum());
    return new RetailDataset(schema, tables);
  }

  private static Object typed(ColumnDescriptor c, Object raw) {
    if (!(raw instanceof String s)) return raw;
    return switch (c.type().toLowerCase(Locale.ROOT)) {
      case "date" -> LocalDate.parse(s);
      case "datetime", "timestamp" -> LocalDateTime.parse(s);
      default -> s;
    };
  }

  private static <T> T read(ObjectMapper mapper, String path, TypeReference<T> type) {
    ClassPathResource resource = new ClassPathResource(path);
    try (InputStream in = resource.getInputStream()) {
      return mapper.readValue(in, type);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read classpath:" + path, e);
    }
  }
}
