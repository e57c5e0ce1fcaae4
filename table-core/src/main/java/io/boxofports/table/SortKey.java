package io.boxofports.table;

import java.util.List;
import java.util.stream.Collectors;

/** Ordered sort criteria for one render pass. Earlier terms take precedence. */
public record SortKey(List<SortTerm> terms) {

  private static final SortKey NONE = new SortKey(List.of());

  public SortKey {
    terms = List.copyOf(terms);
  }

  public static SortKey none() {
    return NONE;
  }

  public static SortKey of(SortTerm... terms) {
    return new SortKey(List.of(terms));
  }

  public boolean isEmpty() {
    return terms.isEmpty();
  }

  @Override
  public String toString() {
    return terms.stream().map(SortTerm::toString).collect(Collectors.joining(","));
  }
}
