package io.boxofports.table;

/**
 * One sort criterion.
 *
 * @param column 0-based position in the column list
 * @param direction sort direction
 */
public record SortTerm(int column, Direction direction) {

  /** Sort direction. */
  public enum Direction {
    ASCENDING,
    DESCENDING
  }

  public static SortTerm ascending(int column) {
    return new SortTerm(column, Direction.ASCENDING);
  }

  public static SortTerm descending(int column) {
    return new SortTerm(column, Direction.DESCENDING);
  }

  public boolean isAscending() {
    return direction == Direction.ASCENDING;
  }

  /** Directive form, e.g. {@code 2d}. */
  @Override
  public String toString() {
    return (column + 1) + (isAscending() ? "a" : "d");
  }
}
