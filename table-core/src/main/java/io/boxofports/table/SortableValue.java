package io.boxofports.table;

import io.boxofports.ports.CanonicalPort;
import io.boxofports.ports.PortComparator;
import java.math.BigDecimal;
import java.util.Locale;

/**
 * A cell value converted into something comparable. Values of different kinds order by kind
 * (ports, then timestamps, numbers, text); {@link Kind#UNSORTABLE} values always trail.
 */
public final class SortableValue {

  /** Value kinds in ascending rank order. */
  public enum Kind {
    PORT,
    TIMESTAMP,
    NUMBER,
    TEXT,
    /** Missing, blank, or an unreadable timestamp. */
    UNSORTABLE
  }

  private static final SortableValue MISSING = new SortableValue(Kind.UNSORTABLE, null, false);

  private final Kind kind;
  private final Object key;
  private final boolean degraded;

  private SortableValue(Kind kind, Object key, boolean degraded) {
    this.kind = kind;
    this.key = key;
    this.degraded = degraded;
  }

  static SortableValue port(CanonicalPort port) {
    return new SortableValue(Kind.PORT, port, false);
  }

  static SortableValue timestamp(long epochMillis) {
    return new SortableValue(Kind.TIMESTAMP, epochMillis, false);
  }

  static SortableValue number(BigDecimal value) {
    return new SortableValue(Kind.NUMBER, value, false);
  }

  static SortableValue text(String raw, boolean degraded) {
    return new SortableValue(Kind.TEXT, raw.toLowerCase(Locale.ROOT), degraded);
  }

  static SortableValue missing() {
    return MISSING;
  }

  static SortableValue unreadable() {
    return new SortableValue(Kind.UNSORTABLE, null, true);
  }

  public Kind kind() {
    return kind;
  }

  /** The comparison key: a port, epoch millis, a BigDecimal, lower-cased text, or null. */
  public Object key() {
    return key;
  }

  /** True when the cell could not be read as the type its column asked for. */
  public boolean isDegraded() {
    return degraded;
  }

  public boolean isSortable() {
    return kind != Kind.UNSORTABLE;
  }

  /**
   * Compares two values. Direction reorders sortable values only; unsortable values stay at the
   * tail either way.
   */
  public static int compare(SortableValue a, SortableValue b, boolean ascending) {
    if (!a.isSortable() || !b.isSortable()) {
      return Boolean.compare(!a.isSortable(), !b.isSortable());
    }
    int c = a.kind.compareTo(b.kind);
    if (c == 0) {
      c = compareKeys(a, b);
    }
    return ascending ? c : -c;
  }

  private static int compareKeys(SortableValue a, SortableValue b) {
    switch (a.kind) {
      case PORT:
        return PortComparator.INSTANCE.compare((CanonicalPort) a.key, (CanonicalPort) b.key);
      case TIMESTAMP:
        return Long.compare((Long) a.key, (Long) b.key);
      case NUMBER:
        return ((BigDecimal) a.key).compareTo((BigDecimal) b.key);
      case TEXT:
        return ((String) a.key).compareTo((String) b.key);
      default:
        return 0;
    }
  }

  @Override
  public String toString() {
    return kind + "(" + key + ")";
  }
}
