package io.boxofports.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One result row: raw cell values by column index. Cells may be strings, numbers, temporal values,
 * ports or null. Reading past the row's arity yields null.
 */
public final class Row {

  private final List<Object> cells;

  private Row(List<Object> cells) {
    this.cells = cells;
  }

  public static Row of(Object... cells) {
    return new Row(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(cells))));
  }

  public static Row of(List<?> cells) {
    return new Row(Collections.unmodifiableList(new ArrayList<>(cells)));
  }

  public Object get(int index) {
    return index >= 0 && index < cells.size() ? cells.get(index) : null;
  }

  public int size() {
    return cells.size();
  }

  public List<Object> cells() {
    return cells;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Row && ((Row) o).cells.equals(cells);
  }

  @Override
  public int hashCode() {
    return cells.hashCode();
  }

  @Override
  public String toString() {
    return cells.toString();
  }
}
