package io.boxofports.table;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Stable multi-column sort of result rows. Each sort term coerces its column's cells with {@link
 * ValueCoercer}; ties fall through to the next term and full ties keep their input order.
 */
public final class RowSorter {

  private RowSorter() {}

  /** Sorts with classification done here; diagnostics are discarded. */
  public static List<Row> sort(List<Row> rows, List<ColumnSpec> columns, SortKey key) {
    return sort(rows, columns, key, ColumnClassifier.classifyAll(columns, rows), new ArrayList<>());
  }

  /**
   * Returns a sorted copy of the rows. The input list is left untouched.
   *
   * @param rows the rows
   * @param columns displayed columns; sort terms index into this list
   * @param key sort terms, terms naming a missing column are skipped
   * @param columnKinds classified kind per column, from {@link ColumnClassifier}
   * @param diagnostics receives one entry per column whose cells did not match the column type
   */
  public static List<Row> sort(
      List<Row> rows,
      List<ColumnSpec> columns,
      SortKey key,
      List<SemanticHint> columnKinds,
      List<Diagnostic> diagnostics) {
    List<SortTerm> terms = new ArrayList<>();
    for (SortTerm t : key.terms()) {
      if (t.column() >= 0 && t.column() < columns.size()) {
        terms.add(t);
      }
    }
    if (rows.size() < 2 || terms.isEmpty()) {
      return new ArrayList<>(rows);
    }

    List<Decorated> decorated = new ArrayList<>(rows.size());
    int[] degraded = new int[terms.size()];
    SemanticHint[] hints = new SemanticHint[terms.size()];
    for (int t = 0; t < terms.size(); t++) {
      ColumnSpec col = columns.get(terms.get(t).column());
      hints[t] = ColumnClassifier.sortHint(col, columnKinds.get(terms.get(t).column()));
    }
    for (Row row : rows) {
      SortableValue[] values = new SortableValue[terms.size()];
      for (int t = 0; t < terms.size(); t++) {
        ColumnSpec col = columns.get(terms.get(t).column());
        values[t] = ValueCoercer.coerce(row.get(col.index()), hints[t]);
        if (values[t].isDegraded()) {
          degraded[t]++;
        }
      }
      decorated.add(new Decorated(row, values));
    }
    for (int t = 0; t < terms.size(); t++) {
      if (degraded[t] > 0) {
        diagnostics.add(fallback(columns.get(terms.get(t).column()), hints[t], degraded[t]));
      }
    }

    Comparator<Decorated> comparator = comparatorFor(terms);
    decorated.sort(comparator);

    List<Row> sorted = new ArrayList<>(rows.size());
    for (Decorated d : decorated) {
      sorted.add(d.row);
    }
    return sorted;
  }

  private static Comparator<Decorated> comparatorFor(List<SortTerm> terms) {
    return (a, b) -> {
      for (int t = 0; t < terms.size(); t++) {
        int c = SortableValue.compare(a.values[t], b.values[t], terms.get(t).isAscending());
        if (c != 0) {
          return c;
        }
      }
      return 0;
    };
  }

  private static Diagnostic fallback(ColumnSpec column, SemanticHint hint, int count) {
    String what =
        hint == SemanticHint.TIMESTAMP
            ? "not timestamps and were sorted last"
            : "not ports and were sorted as text";
    return new Diagnostic(
        Diagnostic.Kind.COERCION_FALLBACK,
        count + " cell(s) in column '" + column.displayName() + "' are " + what);
  }

  private static final class Decorated {
    final Row row;
    final SortableValue[] values;

    Decorated(Row row, SortableValue[] values) {
      this.row = row;
      this.values = values;
    }
  }
}
