package io.intellixity.fetchgraph.tabular;

import io.intellixity.fetchgraph.schema.JoinType;
import io.intellixity.fetchgraph.spi.exec.ColumnRef;
import io.intellixity.fetchgraph.spi.exec.JoinPlan;
import io.intellixity.fetchgraph.spi.exec.JoinStep;
import io.intellixity.fetchgraph.spi.exec.Values;

import java.util.*;
import java.util.function.Function;

/**
 * Result of joining a {@link JoinPlan} over column tables.
 * <p>
 * Each joined row is an {@code int[]} with one source-row index per table instance (slot 0 is the root);
 * {@code -1} marks the null side of an outer join.
 */
final class JoinedFrame {
  private final Map<String, Integer> slots;
  private final List<ColumnTable> tables;
  private final List<int[]> rows;

  private JoinedFrame(Map<String, Integer> slots, List<ColumnTable> tables, List<int[]> rows) {
    this.slots = slots;
    this.tables = tables;
    this.rows = rows;
  }

  /** Hash-joins the plan's steps in order. Null join keys never match. */
  static JoinedFrame join(JoinPlan plan, Function<String, ColumnTable> tableFor) {
    Map<String, Integer> slots = new HashMap<>();
    List<ColumnTable> tables = new ArrayList<>();
    slots.put(plan.rootAlias(), 0);
    tables.add(tableFor.apply(plan.root().name()));
    int width = 1 + plan.steps().size();

    List<int[]> rows = new ArrayList<>(tables.get(0).rowCount());
    for (int i = 0; i < tables.get(0).rowCount(); i++) {
      int[] r = new int[width];
      Arrays.fill(r, -1);
      r[0] = i;
      rows.add(r);
    }

    for (JoinStep step : plan.steps()) {
      int leftSlot = slots.get(step.leftAlias());
      ColumnTable left = tables.get(leftSlot);
      ColumnTable right = tableFor.apply(step.entity().name());
      int slot = tables.size();
      slots.put(step.alias(), slot);
      tables.add(right);

      Map<Object, List<Integer>> index = new HashMap<>();
      for (int j = 0; j < right.rowCount(); j++) {
        Object k = right.value(j, step.rightColumn());
        if (k != null) index.computeIfAbsent(Values.key(k), x -> new ArrayList<>()).add(j);
      }

      boolean keepLeft = step.type() != JoinType.INNER;
      boolean[] rightMatched = new boolean[right.rowCount()];
      List<int[]> next = new ArrayList<>();
      for (int[] r : rows) {
        Object k = r[leftSlot] < 0 ? null : left.value(r[leftSlot], step.leftColumn());
        List<Integer> matches = (k == null) ? List.of() : index.getOrDefault(Values.key(k), List.of());
        if (matches.isEmpty()) {
          if (keepLeft) next.add(r.clone());
          continue;
        }
        for (int j : matches) {
          int[] out = r.clone();
          out[slot] = j;
          rightMatched[j] = true;
          next.add(out);
        }
      }
      if (step.type() == JoinType.OUTER) {
        for (int j = 0; j < right.rowCount(); j++) {
          if (rightMatched[j]) continue;
          int[] out = new int[width];
          Arrays.fill(out, -1);
          out[slot] = j;
          next.add(out);
        }
      }
      rows = next;
    }
    return new JoinedFrame(Collections.unmodifiableMap(slots), List.copyOf(tables), rows);
  }

  int size() { return rows.size(); }

  int[] row(int i) { return rows.get(i); }

  List<int[]> rows() { return rows; }

  Object value(int[] row, ColumnRef ref) {
    Integer slot = slots.get(ref.alias());
    if (slot == null) throw new IllegalStateException("No table instance for alias " + ref.alias());
    int source = row[slot];
    return source < 0 ? null : tables.get(slot).value(source, ref.column());
  }
}
