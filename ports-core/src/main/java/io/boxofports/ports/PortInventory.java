package io.boxofports.ports;

import java.util.ArrayList;
import java.util.List;

/**
 * Supplies the full list of ports a device has, used to expand {@code *} and {@code all}. The
 * resolver never discovers topology itself; an inventory is injected by the caller.
 */
@FunctionalInterface
public interface PortInventory {

  List<CanonicalPort> ports();

  /** A fixed list of ports. */
  static PortInventory of(List<CanonicalPort> ports) {
    List<CanonicalPort> copy = List.copyOf(ports);
    return () -> copy;
  }

  /** Every slot of every board, boards and slots numbered from 1, in letter form where possible. */
  static PortInventory grid(int boards, int slotsPerBoard) {
    if (boards < 1 || slotsPerBoard < 1) {
      throw new IllegalArgumentException(
          "inventory needs at least one board and one slot: " + boards + "x" + slotsPerBoard);
    }
    List<CanonicalPort> ports = new ArrayList<>(boards * slotsPerBoard);
    for (int b = 1; b <= boards; b++) {
      for (int s = 1; s <= slotsPerBoard; s++) {
        ports.add(CanonicalPort.of(b, s));
      }
    }
    return of(ports);
  }
}
