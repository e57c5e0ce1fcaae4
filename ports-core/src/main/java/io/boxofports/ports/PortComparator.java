package io.boxofports.ports;

import java.util.Comparator;

/**
 * Total order over ports: board first, then slot, both numerically. Board 10 sorts after board 2.
 * Used for range expansion and when sorting port-typed table columns.
 */
public final class PortComparator implements Comparator<CanonicalPort> {

  public static final PortComparator INSTANCE = new PortComparator();

  private PortComparator() {}

  /** Returns -1, 0 or 1. */
  @Override
  public int compare(CanonicalPort a, CanonicalPort b) {
    int c = Integer.compare(a.board(), b.board());
    if (c == 0) {
      c = Integer.compare(a.slot(), b.slot());
    }
    return Integer.signum(c);
  }
}
