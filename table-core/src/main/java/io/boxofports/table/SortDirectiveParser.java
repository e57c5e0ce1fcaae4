package io.boxofports.table;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses sort directives such as {@code 2,1d,4}: comma-separated 1-based column numbers, each
 * optionally followed by {@code a} (ascending, the default) or {@code d} (descending).
 *
 * <p>Bad tokens are dropped with a {@link Diagnostic}; the rest of the directive still applies.
 * When nothing usable remains the default policy picks the key: the first timestamp column
 * descending, else the first port column ascending, else the second column ascending, else the
 * first column ascending.
 */
public final class SortDirectiveParser {

  private static final Pattern TOKEN = Pattern.compile("(\\d{1,9})([aAdD]?)");

  private SortDirectiveParser() {}

  /**
   * Computes the sort key for a render pass.
   *
   * @param text the directive, may be null or blank
   * @param columnKinds classified kind of each displayed column
   * @param diagnostics receives one entry per discarded token
   */
  public static SortKey parse(
      String text, List<SemanticHint> columnKinds, List<Diagnostic> diagnostics) {
    if (text != null && !text.isBlank()) {
      SortKey explicit = parseExplicit(text, columnKinds.size(), diagnostics);
      if (!explicit.isEmpty()) {
        return explicit;
      }
    }
    return defaultKey(columnKinds);
  }

  /** Parses the directive alone, without falling back to the default policy. */
  public static SortKey parseExplicit(String text, int columnCount, List<Diagnostic> diagnostics) {
    List<SortTerm> terms = new ArrayList<>();
    Set<Integer> used = new HashSet<>();
    for (String raw : text.split(",")) {
      String token = raw.trim();
      if (token.isEmpty()) {
        continue;
      }
      Matcher m = TOKEN.matcher(token);
      if (!m.matches()) {
        diagnostics.add(
            Diagnostic.badDirectiveToken(token, "expected <column number>[a|d], e.g. 2d"));
        continue;
      }
      int number = Integer.parseInt(m.group(1));
      if (number < 1 || number > columnCount) {
        diagnostics.add(
            Diagnostic.badDirectiveToken(
                token, "column " + number + " is out of range 1-" + columnCount));
        continue;
      }
      if (!used.add(number - 1)) {
        diagnostics.add(Diagnostic.badDirectiveToken(token, "column " + number + " repeated"));
        continue;
      }
      boolean descending = m.group(2).equalsIgnoreCase("d");
      terms.add(descending ? SortTerm.descending(number - 1) : SortTerm.ascending(number - 1));
    }
    return new SortKey(terms);
  }

  /** The default sort key for columns of the given kinds. */
  public static SortKey defaultKey(List<SemanticHint> columnKinds) {
    int timestamp = columnKinds.indexOf(SemanticHint.TIMESTAMP);
    if (timestamp >= 0) {
      return SortKey.of(SortTerm.descending(timestamp));
    }
    int port = columnKinds.indexOf(SemanticHint.PORT);
    if (port >= 0) {
      return SortKey.of(SortTerm.ascending(port));
    }
    if (columnKinds.size() > 1) {
      return SortKey.of(SortTerm.ascending(1));
    }
    if (columnKinds.size() == 1) {
      return SortKey.of(SortTerm.ascending(0));
    }
    return SortKey.none();
  }
}
