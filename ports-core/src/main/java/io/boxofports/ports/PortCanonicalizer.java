package io.boxofports.ports;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts a single port token into a {@link CanonicalPort}. Accepted grammars:
 *
 * <ul>
 *   <li>letter form {@code <digits><letter>}, case-insensitive, {@code A} = slot 1
 *   <li>decimal form {@code <digits>.<two digits>}
 *   <li>bare board {@code <digits>}, slot 1 assumed
 * </ul>
 *
 * A one-digit decimal slot such as {@code 2.2} is rejected rather than read as slot 2 or 20.
 */
public final class PortCanonicalizer {

  private static final Pattern ALPHA = Pattern.compile("(\\d+)([A-Za-z])");
  private static final Pattern DECIMAL = Pattern.compile("(\\d+)\\.(\\d{2})");
  private static final Pattern DECIMAL_LOOSE = Pattern.compile("(\\d+)\\.(\\d*)");
  private static final Pattern BARE = Pattern.compile("\\d+");

  private PortCanonicalizer() {}

  /**
   * Canonicalizes one token.
   *
   * @param token the raw token, surrounding whitespace ignored
   * @return the port, in the notation the token used (bare boards come back in letter form)
   * @throws PortSpecException with kind {@code MALFORMED_TOKEN} when no grammar matches
   */
  public static CanonicalPort canonicalize(String token) throws PortSpecException {
    String t = token == null ? "" : token.trim();
    Matcher m = ALPHA.matcher(t);
    if (m.matches()) {
      int slot = Character.toUpperCase(m.group(2).charAt(0)) - 'A' + 1;
      return CanonicalPort.of(parseBoard(t, m.group(1)), slot, PortNotation.ALPHA);
    }
    m = DECIMAL.matcher(t);
    if (m.matches()) {
      int slot = Integer.parseInt(m.group(2));
      if (slot < 1) {
        throw PortSpecException.malformedToken(t, "slot must be 01 or greater");
      }
      return CanonicalPort.of(parseBoard(t, m.group(1)), slot, PortNotation.DECIMAL);
    }
    if (DECIMAL_LOOSE.matcher(t).matches()) {
      throw PortSpecException.malformedToken(
          t, "decimal slots need exactly two digits (write 2.02 or 2.20, not 2.2)");
    }
    if (BARE.matcher(t).matches()) {
      return CanonicalPort.of(parseBoard(t, t), 1, PortNotation.ALPHA);
    }
    throw PortSpecException.malformedToken(
        t, "unrecognized port format, " + PortSpecException.TOKEN_GRAMMAR);
  }

  /** Whether the token is a bare board number whose slot would be assumed. */
  public static boolean isBareBoard(String token) {
    return token != null && BARE.matcher(token.trim()).matches();
  }

  /**
   * Lenient variant used when classifying table cells: letter and decimal forms only, never a bare
   * number, and no exception.
   */
  public static Optional<CanonicalPort> tryParseQualified(String token) {
    if (token == null) return Optional.empty();
    String t = token.trim();
    if (!ALPHA.matcher(t).matches() && !DECIMAL.matcher(t).matches()) {
      return Optional.empty();
    }
    return tryCanonicalize(t);
  }

  /** Like {@link #canonicalize(String)} but returns empty instead of throwing. */
  public static Optional<CanonicalPort> tryCanonicalize(String token) {
    try {
      return Optional.of(canonicalize(token));
    } catch (PortSpecException e) {
      return Optional.empty();
    }
  }

  private static int parseBoard(String token, String digits) throws PortSpecException {
    int board;
    try {
      board = Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      throw PortSpecException.malformedToken(token, "board number is too large");
    }
    if (board < 1) {
      throw PortSpecException.malformedToken(token, "board must be 1 or greater");
    }
    return board;
  }
}
