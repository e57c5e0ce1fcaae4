package io.boxofports.table;

import java.util.Objects;

/**
 * A displayed column.
 *
 * @param displayName header text, also the JSON key
 * @param index position of the column's value in each {@link Row}
 * @param hint optional override of automatic cell classification, may be null
 */
public record ColumnSpec(String displayName, int index, SemanticHint hint) {

  public ColumnSpec {
    Objects.requireNonNull(displayName, "displayName");
    if (index < 0) {
      throw new IllegalArgumentException("column index must be >= 0: " + index);
    }
  }

  public static ColumnSpec of(String displayName, int index) {
    return new ColumnSpec(displayName, index, null);
  }

  public static ColumnSpec of(String displayName, int index, SemanticHint hint) {
    return new ColumnSpec(displayName, index, hint);
  }

  public boolean hasHint() {
    return hint != null;
  }
}
