package io.boxofports.ports;

import java.util.Objects;

/**
 * A single addressable port on the gateway, identified by its board and slot.
 *
 * <p>Equality, hashing and ordering only look at {@code (board, slot)}: {@code 1A} and {@code
 * 1.01} are the same port. The {@link PortNotation} remembers how the operator wrote the port so
 * it can be echoed back in the same form.
 */
public final class CanonicalPort implements Comparable<CanonicalPort> {

  private final int board;
  private final int slot;
  private final PortNotation notation;

  private CanonicalPort(int board, int slot, PortNotation notation) {
    if (board < 1) {
      throw new IllegalArgumentException("board must be >= 1: " + board);
    }
    if (slot < 1) {
      throw new IllegalArgumentException("slot must be >= 1: " + slot);
    }
    Objects.requireNonNull(notation, "notation");
    if (!notation.supports(slot)) {
      throw new IllegalArgumentException(
          "slot " + slot + " cannot be written in " + notation + " notation");
    }
    this.board = board;
    this.slot = slot;
    this.notation = notation;
  }

  /** Creates a port displayed in letter form when the slot allows it, decimal form otherwise. */
  public static CanonicalPort of(int board, int slot) {
    PortNotation notation =
        PortNotation.ALPHA.supports(slot) ? PortNotation.ALPHA : PortNotation.DECIMAL;
    return new CanonicalPort(board, slot, notation);
  }

  public static CanonicalPort of(int board, int slot, PortNotation notation) {
    return new CanonicalPort(board, slot, notation);
  }

  public int board() {
    return board;
  }

  public int slot() {
    return slot;
  }

  public PortNotation notation() {
    return notation;
  }

  /**
   * Letter form, e.g. {@code 2D}.
   *
   * @throws IllegalStateException if the slot is beyond {@code Z}
   */
  public String toAlpha() {
    if (!PortNotation.ALPHA.supports(slot)) {
      throw new IllegalStateException("Port " + toDecimal() + " has no letter form");
    }
    return PortNotation.ALPHA.format(board, slot);
  }

  /** Decimal form, e.g. {@code 2.04}. */
  public String toDecimal() {
    return PortNotation.DECIMAL.format(board, slot);
  }

  /** The next slot on the same board, keeping this port's notation where possible. */
  CanonicalPort nextSlot() {
    int next = slot + 1;
    return notation.supports(next)
        ? new CanonicalPort(board, next, notation)
        : CanonicalPort.of(board, next);
  }

  /** Slot 1 of the next board. */
  CanonicalPort nextBoard() {
    return new CanonicalPort(board + 1, 1, notation);
  }

  @Override
  public int compareTo(CanonicalPort other) {
    return PortComparator.INSTANCE.compare(this, other);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CanonicalPort)) return false;
    CanonicalPort that = (CanonicalPort) o;
    return board == that.board && slot == that.slot;
  }

  @Override
  public int hashCode() {
    return 31 * board + slot;
  }

  @Override
  public String toString() {
    return notation.format(board, slot);
  }
}
