package io.intellixity.fetchgraph.tabular;

import io.intellixity.fetchgraph.schema.SchemaNames;

import java.util.*;

/**
 * Immutable in-memory table stored column by column.
 * <p>
 * Column lookup is case-insensitive. Cells may be null; a column missing from the source rows reads as all
 * nulls.
 */
public final class ColumnTable {
  private final String name;
  private final List<String> columns;
  private final Map<String, Integer> index;
  private final Object[][] data;
  private final int rowCount;

  private ColumnTable(String name, List<String> columns, Object[][] data, int rowCount) {
    this.name = Objects.requireNonNull(name, "name");
    this.columns = List.copyOf(columns);
    this.index = new HashMap<>();
    for (int i = 0; i < columns.size(); i++) {
      if (index.putIfAbsent(SchemaNames.normalize(columns.get(i)), i) != null) {
        throw new IllegalArgumentException("Duplicate column " + columns.get(i) + " in table " + name);
      }
    }
    this.data = data;
    this.rowCount = rowCount;
  }

  public static Builder builder(String name, String... columns) {
    return new Builder(name, List.of(columns));
  }

  /** Column set is the union of the rows' keys, in first-seen order. */
  public static ColumnTable fromRows(String name, List<? extends Map<String, ?>> rows) {
    LinkedHashSet<String> cols = new LinkedHashSet<>();
    for (Map<String, ?> r : rows) cols.addAll(r.keySet());
    Builder b = new Builder(name, new ArrayList<>(cols));
    for (Map<String, ?> r : rows) {
      Object[] values = new Object[cols.size()];
      int i = 0;
      for (String c : cols) values[i++] = r.get(c);
      b.row(values);
    }
    return b.build();
  }

  public String name() { return name; }
  public List<String> columns() { return columns; }
  public int rowCount() { return rowCount; }

  public boolean hasColumn(String column) {
    return index.containsKey(SchemaNames.normalize(column));
  }

  /** Cell value; null for a null cell or an absent column. */
  public Object value(int row, String column) {
    Integer c = index.get(SchemaNames.normalize(column));
    if (c == null) return null;
    Objects.checkIndex(row, rowCount);
    return data[c][row];
  }

  public List<Object> column(String column) {
    Integer c = index.get(SchemaNames.normalize(column));
    if (c == null) return Collections.nCopies(rowCount, null);
    return Collections.unmodifiableList(Arrays.asList(data[c]));
  }

  public Map<String, Object> row(int row) {
    Objects.checkIndex(row, rowCount);
    Map<String, Object> out = new LinkedHashMap<>();
    for (int c = 0; c < columns.size(); c++) out.put(columns.get(c), data[c][row]);
    return out;
  }

  @Override
  public String toString() {
    return "ColumnTable{" + name + ", columns=" + columns + ", rows=" + rowCount + "}";
  }

  public static final class Builder {
    private final String name;
    private final List<String> columns;
    private final List<Object[]> rows = new ArrayList<>();

    private Builder(String name, List<String> columns) {
      this.name = Objects.requireNonNull(name, "name");
      this.columns = List.copyOf(columns);
    }

    public Builder row(Object... values) {
      if (values.length != columns.size()) {
        throw new IllegalArgumentException("Table " + name + " expects " + columns.size() + " values per row, got "
            + values.length);
      }
      rows.add(values.clone());
      return this;
    }

    public ColumnTable build() {
      Object[][] data = new Object[columns.size()][rows.size()];
      for (int r = 0; r < rows.size(); r++) {
        Object[] row = rows.get(r);
        for (int c = 0; c < columns.size(); c++) data[c][r] = row[c];
      }
      return new ColumnTable(name, columns, data, rows.size());
    }
  }
}
