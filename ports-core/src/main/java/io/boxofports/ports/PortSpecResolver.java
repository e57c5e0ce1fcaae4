package io.boxofports.ports;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands a comma-separated port specification into a {@link PortSet}.
 *
 * <p>Fragment kinds:
 *
 * <ul>
 *   <li>single port: {@code 1A}, {@code 1.01}, {@code 3}
 *   <li>range: {@code 1A-1D}, {@code 2.01-2.04} (same board and notation on both ends) or {@code
 *       1-4} (board by board)
 *   <li>wildcard: {@code *} or {@code all}, expanded from the injected {@link PortInventory}
 *   <li>CSV file: a path ending in {@code .csv}, or any existing file
 * </ul>
 *
 * Duplicates are dropped, first occurrence wins. Ports given without a slot produce a single
 * aggregated {@link ResolveWarning.Kind#DEFAULT_SLOT_ASSUMED} warning.
 */
public final class PortSpecResolver {

  private static final Logger LOG = LoggerFactory.getLogger(PortSpecResolver.class);

  /** Upper bound on ports produced by one range fragment. */
  static final int MAX_RANGE_SIZE = 4096;

  private static final Pattern ALPHA_END = Pattern.compile("\\d+[A-Za-z]");
  private static final Pattern DECIMAL_END = Pattern.compile("\\d+\\.\\d+");
  private static final Pattern BARE_END = Pattern.compile("\\d+");

  private final PortInventory inventory;

  /** A resolver without inventory; wildcards fail with {@code UNRESOLVED_WILDCARD}. */
  public PortSpecResolver() {
    this(null);
  }

  /**
   * @param inventory the device's ports, or null when unknown
   */
  public PortSpecResolver(PortInventory inventory) {
    this.inventory = inventory;
  }

  /** Convenience for one-off resolution without an inventory. */
  public static Resolution resolveSpec(String spec) throws PortSpecException {
    return new PortSpecResolver().resolve(spec);
  }

  /**
   * Resolves a specification.
   *
   * @param spec comma-separated fragments
   * @return the ports in first-occurrence order, plus warnings
   * @throws PortSpecException on the first fragment that cannot be resolved
   */
  public Resolution resolve(String spec) throws PortSpecException {
    if (spec == null || spec.isBlank()) {
      throw PortSpecException.malformedToken("", "empty port specification");
    }
    PortSet.Builder ports = new PortSet.Builder();
    List<String> assumedSlot = new ArrayList<>();

    for (String raw : spec.split(",")) {
      String fragment = raw.trim();
      if (fragment.isEmpty()) {
        continue;
      }
      int before = ports.size();
      expandFragment(fragment, ports, assumedSlot);
      LOG.debug("Fragment '{}' added {} new port(s)", fragment, ports.size() - before);
    }

    PortSet result = ports.build();
    if (result.isEmpty()) {
      throw PortSpecException.malformedToken(spec.trim(), "no ports found in specification");
    }
    List<ResolveWarning> warnings = new ArrayList<>();
    if (!assumedSlot.isEmpty()) {
      warnings.add(ResolveWarning.defaultSlotAssumed(assumedSlot));
    }
    return new Resolution(result, warnings);
  }

  private void expandFragment(String fragment, PortSet.Builder ports, List<String> assumedSlot)
      throws PortSpecException {
    String lower = fragment.toLowerCase(Locale.ROOT);
    if (lower.equals("*") || lower.equals("all")) {
      expandWildcard(fragment, ports);
    } else if (CsvPortFileReader.looksLikeCsvFile(fragment)) {
      expandCsv(Path.of(fragment), ports, assumedSlot);
    } else if (isRange(fragment)) {
      expandRange(fragment, ports, assumedSlot);
    } else if (isToken(fragment)) {
      ports.add(PortCanonicalizer.canonicalize(fragment));
      if (PortCanonicalizer.isBareBoard(fragment)) {
        noteAssumed(assumedSlot, fragment);
      }
    } else {
      Path file = existingFile(fragment);
      if (file != null) {
        expandCsv(file, ports, assumedSlot);
      } else {
        // reports the grammar mismatch
        ports.add(PortCanonicalizer.canonicalize(fragment));
      }
    }
  }

  private void expandWildcard(String fragment, PortSet.Builder ports) throws PortSpecException {
    List<CanonicalPort> all = inventory == null ? null : inventory.ports();
    if (all == null || all.isEmpty()) {
      throw PortSpecException.unresolvedWildcard(fragment);
    }
    all.forEach(ports::add);
  }

  private static void expandCsv(Path file, PortSet.Builder ports, List<String> assumedSlot)
      throws PortSpecException {
    for (CsvPortFileReader.Entry e : CsvPortFileReader.read(file)) {
      ports.add(e.port());
      if (e.slotAssumed()) {
        noteAssumed(assumedSlot, file.getFileName() + " row " + e.rowNumber());
      }
    }
  }

  private static void expandRange(
      String fragment, PortSet.Builder ports, List<String> assumedSlot) throws PortSpecException {
    int dash = fragment.indexOf('-');
    String startText = fragment.substring(0, dash).trim();
    String endText = fragment.substring(dash + 1).trim();
    CanonicalPort start = PortCanonicalizer.canonicalize(startText);
    CanonicalPort end = PortCanonicalizer.canonicalize(endText);

    boolean bare = BARE_END.matcher(startText).matches();
    if (bare != BARE_END.matcher(endText).matches()
        || ALPHA_END.matcher(startText).matches() != ALPHA_END.matcher(endText).matches()) {
      throw PortSpecException.malformedToken(
          fragment, "both ends of a range must use the same notation");
    }
    if (!bare && start.board() != end.board()) {
      throw PortSpecException.malformedToken(
          fragment, "both ends of a slot range must be on the same board");
    }
    if (PortComparator.INSTANCE.compare(start, end) > 0) {
      throw PortSpecException.invertedRange(fragment);
    }
    long size =
        bare ? (long) end.board() - start.board() + 1 : (long) end.slot() - start.slot() + 1;
    if (size > MAX_RANGE_SIZE) {
      throw PortSpecException.malformedToken(
          fragment, "range covers " + size + " ports, more than " + MAX_RANGE_SIZE);
    }

    CanonicalPort p = start;
    for (long i = 0; i < size; i++) {
      ports.add(p);
      if (i + 1 < size) {
        p = bare ? p.nextBoard() : p.nextSlot();
      }
    }
    if (bare) {
      noteAssumed(assumedSlot, fragment);
    }
  }

  private static void noteAssumed(List<String> assumedSlot, String source) {
    if (!assumedSlot.contains(source)) {
      assumedSlot.add(source);
    }
  }

  private static boolean isRange(String fragment) {
    int dash = fragment.indexOf('-');
    return dash > 0 && dash < fragment.length() - 1 && isToken(fragment.substring(0, dash).trim());
  }

  private static boolean isToken(String fragment) {
    return ALPHA_END.matcher(fragment).matches()
        || DECIMAL_END.matcher(fragment).matches()
        || BARE_END.matcher(fragment).matches();
  }

  private static Path existingFile(String fragment) {
    try {
      Path p = Path.of(fragment);
      return Files.isRegularFile(p) ? p : null;
    } catch (InvalidPathException e) {
      return null;
    }
  }
}
