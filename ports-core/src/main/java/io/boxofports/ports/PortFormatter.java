package io.boxofports.ports;

import java.util.stream.Collectors;

/** Renders port lists the way the device API expects them. */
public final class PortFormatter {

  private PortFormatter() {}

  /**
   * Joins ports with commas in the given notation, e.g. {@code 1A,1B} or {@code 1.01,1.02}.
   *
   * @throws IllegalStateException if letter form is requested for a slot beyond {@code Z}
   */
  public static String formatForApi(Iterable<CanonicalPort> ports, PortNotation notation) {
    StringBuilder sb = new StringBuilder();
    for (CanonicalPort p : ports) {
      if (sb.length() > 0) sb.append(',');
      sb.append(notation == PortNotation.ALPHA ? p.toAlpha() : p.toDecimal());
    }
    return sb.toString();
  }

  /** Ports in their own notation, separated by ", ". */
  public static String describe(PortSet ports) {
    return ports.stream().map(CanonicalPort::toString).collect(Collectors.joining(", "));
  }
}
