package io.boxofports.ports;

/**
 * Surface syntaxes a port identifier can be written in. Both denote the same (board, slot) pair;
 * the notation only affects how a {@link CanonicalPort} is displayed.
 */
public enum PortNotation {
  /** Board number followed by a slot letter, {@code A} being slot 1 (e.g. {@code 2B}). */
  ALPHA {
    @Override
    public boolean supports(int slot) {
      return slot >= 1 && slot <= MAX_ALPHA_SLOT;
    }

    @Override
    String format(int board, int slot) {
      return board + String.valueOf((char) ('A' + slot - 1));
    }
  },

  /** Board number, a dot and a zero-padded two digit slot (e.g. {@code 2.02}). */
  DECIMAL {
    @Override
    public boolean supports(int slot) {
      return slot >= 1 && slot <= MAX_DECIMAL_SLOT;
    }

    @Override
    String format(int board, int slot) {
      return String.format("%d.%02d", board, slot);
    }
  };

  public static final int MAX_ALPHA_SLOT = 26;
  public static final int MAX_DECIMAL_SLOT = 99;

  /** Whether the given slot number can be written in this notation. */
  public abstract boolean supports(int slot);

  abstract String format(int board, int slot);
}
