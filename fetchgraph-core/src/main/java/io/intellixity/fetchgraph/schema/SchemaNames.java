package io.intellixity.fetchgraph.schema;

import java.util.Locale;

/** Lookup-key normalization for entity, relation and column names. */
public final class SchemaNames {
  private SchemaNames() {}

  /** Trim, lower-case, collapse internal whitespace. Null becomes "". */
  public static String normalize(String name) {
    if (name == null) return "";
    return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
  }
}
