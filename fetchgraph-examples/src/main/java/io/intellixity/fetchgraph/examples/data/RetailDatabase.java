package io.intellixity.fetchgraph.examples.data;

import io.intellixity.fetchgraph.schema.ColumnDescriptor;
import io.intellixity.fetchgraph.schema.EntityDescriptor;
import io.intellixity.fetchgraph.tabular.ColumnTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/** Creates one table per entity and copies the dataset rows into it. Existing tables are replaced. */
public final class RetailDatabase {
  private static final Logger log = LoggerFactory.getLogger(RetailDatabase.class);

  private RetailDatabase() {}

  public static void load(DataSource ds, String schema, RetailDataset dataset) {
    try (Connection c = ds.getConnection()) {
      for (EntityDescriptor e : dataset.schema().entities()) {
        ColumnTable t = dataset.tables().get(e.name());
        String table = qualified(schema, e.name());
        try (Statement st = c.createStatement()) {
          st.execute("DROP TABLE IF EXISTS " + table);
          st.execute("CREATE TABLE " + table + " (" + columnsDdl(e) + ")");
        }
        int rows = (t == null) ? 0 : insert(c, table, e, t);
        log.debug("fetchgraph.examples op=load_table table={} rows={}", table, rows);
      }
    } catch (SQLException ex) {
      throw new IllegalStateException("Failed to load example tables", ex);
    }
  }

  private static int insert(Connection c, String table, EntityDescriptor e, ColumnTable t) throws SQLException {
    List<String> names = e.columnNames();
    String sql = "INSERT INTO " + table + " (" + String.join(", ", names.stream().map(RetailDatabase::q).toList())
        + ") VALUES (" + String.join(", ", Collections.nCopies(names.size(), "?")) + ")";
    try (PreparedStatement ps = c.prepareStatement(sql)) {
      for (int r = 0; r < t.rowCount(); r++) {
        for (int i = 0; i < names.size(); i++) ps.setObject(i + 1, t.value(r, names.get(i)));
        ps.addBatch();
      }
      ps.executeBatch();
    }
    return t.rowCount();
  }

  private static String columnsDdl(EntityDescriptor e) {
    List<String> cols = new ArrayList<>();
    for (ColumnDescriptor col : e.columns()) {
      cols.add(q(col.name()) + " " + sqlType(col.type()) + (col.isPrimaryKey() ? " PRIMARY KEY" : ""));
    }
    return String.join(", ", cols);
  }

  private static String sqlType(String type) {
    return switch (type.toLowerCase(Locale.ROOT)) {
      case "int", "integer" -> "INT";
      case "long", "bigint" -> "BIGINT";
      case "decimal" -> "DECIMAL(12,2)";
      case "double", "float" -> "DOUBLE PRECISION";
      case "date" -> "DATE";
      case "timestamp", "datetime" -> "TIMESTAMP";
      case "bool", "boolean" -> "BOOLEAN";
      default -> "VARCHAR(1024)";
    };
  }

  private static String qualified(String schema, String name) {
    return (schema == null || schema.isBlank()) ? q(name) : q(schema) + "." + q(name);
  }

  private static String q(String ident) {
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }
}
