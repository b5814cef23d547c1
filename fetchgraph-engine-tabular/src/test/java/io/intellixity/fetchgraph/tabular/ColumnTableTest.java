package io.intellixity.fetchgraph.tabular;

import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

final class ColumnTableTest {

  @Test
  void fromRowsUsesUnionOfKeys() {
    Map<String, Object> a = new LinkedHashMap<>();
    a.put("id", 1);
    a.put("name", "x");
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("id", 2);
    b.put("extra", true);

    ColumnTable t = ColumnTable.fromRows("t", List.of(a, b));
    assertEquals(List.of("id", "name", "extra"), t.columns());
    assertEquals(2, t.rowCount());
    assertNull(t.value(1, "name"));
    assertEquals(true, t.value(1, "EXTRA"));
  }

  @Test
  void absentColumnReadsAsNull() {
    ColumnTable t = ColumnTable.builder("t", "id").row(1).build();
    assertFalse(t.hasColumn("missing"));
    assertNull(t.value(0, "missing"));
    assertEquals(Collections.singletonList(null), t.column("missing"));
  }

  @Test
  void rejectsBadShapes() {
    assertThrows(IllegalArgumentException.class, () -> ColumnTable.builder("t", "id", "ID").build());
    assertThrows(IllegalArgumentException.class, () -> ColumnTable.builder("t", "id", "name").row(1));
    ColumnTable t = ColumnTable.builder("t", "id").row(1).build();
    assertThrows(IndexOutOfBoundsException.class, () -> t.value(3, "id"));
  }

  @Test
  void rowKeepsColumnOrder() {
    ColumnTable t = ColumnTable.builder("t", "b", "a").row(2, 1).build();
    assertEquals(List.of("b", "a"), new ArrayList<>(t.row(0).keySet()));
  }
}
