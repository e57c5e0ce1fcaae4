package io.boxofports.ports;

import java.util.List;

/** Result of resolving a port specification. */
public record Resolution(PortSet ports, List<ResolveWarning> warnings) {

  public Resolution {
    warnings = List.copyOf(warnings);
  }
}
