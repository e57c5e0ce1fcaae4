package io.boxofports.table;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Decides what kind of data a column holds. An explicit {@link ColumnSpec#hint()} wins. Otherwise a
 * column is a port column when more than half of its non-blank cells are ports, and a timestamp
 * column when it holds at least one timestamp and no more numbers or ports than timestamps. Text
 * cells never outvote timestamps: in a timestamp column they are unreadable values that sort
 * last. Anything else is {@link SemanticHint#GENERIC}.
 */
public final class ColumnClassifier {

  /** Rows inspected per column. */
  static final int SAMPLE_ROWS = 1000;

  private ColumnClassifier() {}

  public static List<SemanticHint> classifyAll(List<ColumnSpec> columns, List<Row> rows) {
    List<SemanticHint> kinds = new ArrayList<>(columns.size());
    for (ColumnSpec c : columns) {
      kinds.add(classify(c, rows));
    }
    return kinds;
  }

  public static SemanticHint classify(ColumnSpec column, List<Row> rows) {
    if (column.hasHint()) {
      return column.hint();
    }
    Map<SortableValue.Kind, Integer> counts = new EnumMap<>(SortableValue.Kind.class);
    int present = 0;
    int sample = Math.min(rows.size(), SAMPLE_ROWS);
    for (int i = 0; i < sample; i++) {
      SortableValue v = ValueCoercer.coerce(rows.get(i).get(column.index()));
      if (v.isSortable()) {
        counts.merge(v.kind(), 1, Integer::sum);
        present++;
      }
    }
    int ports = counts.getOrDefault(SortableValue.Kind.PORT, 0);
    int timestamps = counts.getOrDefault(SortableValue.Kind.TIMESTAMP, 0);
    int numbers = counts.getOrDefault(SortableValue.Kind.NUMBER, 0);
    if (ports * 2 > present) {
      return SemanticHint.PORT;
    }
    if (timestamps > 0 && timestamps >= numbers && timestamps >= ports) {
      return SemanticHint.TIMESTAMP;
    }
    return SemanticHint.GENERIC;
  }

  /**
   * Hint to coerce cells with while sorting: the explicit or inferred type, or null for a generic
   * column without an explicit hint so each cell is classified on its own.
   */
  static SemanticHint sortHint(ColumnSpec column, SemanticHint classified) {
    if (column.hasHint() || classified != SemanticHint.GENERIC) {
      return classified;
    }
    return null;
  }
}
