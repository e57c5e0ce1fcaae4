package io.boxofports.ports;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Immutable, duplicate-free sequence of ports in first-occurrence order. The set is never sorted;
 * sorting only applies to rendered result rows.
 */
public final class PortSet implements Iterable<CanonicalPort> {

  private static final PortSet EMPTY = new PortSet(List.of());

  private final List<CanonicalPort> ports;

  private PortSet(List<CanonicalPort> ports) {
    this.ports = ports;
  }

  /** Builds a set from the given ports, keeping the first occurrence of each. */
  public static PortSet of(Collection<CanonicalPort> ports) {
    Builder b = new Builder();
    ports.forEach(b::add);
    return b.build();
  }

  public static PortSet of(CanonicalPort... ports) {
    return of(List.of(ports));
  }

  public int size() {
    return ports.size();
  }

  public boolean isEmpty() {
    return ports.isEmpty();
  }

  public CanonicalPort get(int index) {
    return ports.get(index);
  }

  public boolean contains(CanonicalPort port) {
    return ports.contains(port);
  }

  public List<CanonicalPort> asList() {
    return ports;
  }

  public Stream<CanonicalPort> stream() {
    return ports.stream();
  }

  @Override
  public Iterator<CanonicalPort> iterator() {
    return ports.iterator();
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof PortSet && ((PortSet) o).ports.equals(ports);
  }

  @Override
  public int hashCode() {
    return ports.hashCode();
  }

  @Override
  public String toString() {
    return ports.toString();
  }

  /** Accumulates ports, dropping repeats. */
  static final class Builder {
    private final Set<CanonicalPort> seen = new LinkedHashSet<>();

    /** Returns false when the port was already present. */
    boolean add(CanonicalPort port) {
      return seen.add(port);
    }

    int size() {
      return seen.size();
    }

    PortSet build() {
      return seen.isEmpty()
          ? EMPTY
          : new PortSet(Collections.unmodifiableList(new ArrayList<>(seen)));
    }
  }
}
