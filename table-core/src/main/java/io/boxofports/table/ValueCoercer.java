package io.boxofports.table;

import io.boxofports.ports.CanonicalPort;
import io.boxofports.ports.PortCanonicalizer;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * Classifies raw cells for sorting.
 *
 * <p>Without a hint a cell is tried, in order, as a port ({@code 1A}, {@code 1.01}), a timestamp
 * (ISO-8601, epoch seconds, common date-time patterns), a number, and finally case-insensitive
 * text. A hint skips classification. A port-hinted cell that is not a port degrades to text; a
 * timestamp-hinted cell that is not a timestamp becomes unsortable and trails the sort.
 */
public final class ValueCoercer {

  /** Epoch seconds accepted as timestamps: 1980-01-01 up to 2100-01-01. */
  static final long EPOCH_SECONDS_MIN = 315_532_800L;

  static final long EPOCH_SECONDS_MAX = 4_102_444_800L;

  private static final Pattern EPOCH_DIGITS = Pattern.compile("\\d{9,10}");

  private static final List<DateTimeFormatter> DATE_TIMES =
      List.of(
          pattern("uuuu-MM-dd HH:mm:ss"),
          pattern("uuuu-MM-dd HH:mm"),
          pattern("uuuu/MM/dd HH:mm:ss"),
          pattern("uuuu/MM/dd HH:mm"),
          new DateTimeFormatterBuilder()
              .appendPattern("MM-dd HH:mm[:ss]")
              .parseDefaulting(ChronoField.YEAR, 1900)
              .toFormatter()
              .withResolverStyle(ResolverStyle.STRICT));

  private static final List<DateTimeFormatter> DATES =
      List.of(DateTimeFormatter.ISO_LOCAL_DATE, pattern("uuuu/MM/dd"));

  private ValueCoercer() {}

  public static SortableValue coerce(Object raw) {
    return coerce(raw, null);
  }

  /**
   * Converts a raw cell.
   *
   * @param raw the cell, may be null
   * @param hint column hint, or null to classify the cell by its content
   */
  public static SortableValue coerce(Object raw, SemanticHint hint) {
    if (isMissing(raw)) {
      return SortableValue.missing();
    }
    if (hint == SemanticHint.PORT) {
      return portOf(raw)
          .map(SortableValue::port)
          .orElseGet(() -> SortableValue.text(String.valueOf(raw).trim(), true));
    }
    if (hint == SemanticHint.TIMESTAMP) {
      OptionalLong millis = timestampOf(raw);
      return millis.isPresent()
          ? SortableValue.timestamp(millis.getAsLong())
          : SortableValue.unreadable();
    }
    if (hint == null) {
      Optional<CanonicalPort> port = qualifiedPortOf(raw);
      if (port.isPresent()) {
        return SortableValue.port(port.get());
      }
      OptionalLong millis = timestampOf(raw);
      if (millis.isPresent()) {
        return SortableValue.timestamp(millis.getAsLong());
      }
    }
    Optional<BigDecimal> number = numberOf(raw);
    if (number.isPresent()) {
      return SortableValue.number(number.get());
    }
    return SortableValue.text(String.valueOf(raw).trim(), false);
  }

  static boolean isMissing(Object raw) {
    return raw == null || (raw instanceof CharSequence cs && cs.toString().isBlank());
  }

  private static Optional<CanonicalPort> qualifiedPortOf(Object raw) {
    if (raw instanceof CanonicalPort p) {
      return Optional.of(p);
    }
    if (raw instanceof CharSequence cs) {
      return PortCanonicalizer.tryParseQualified(cs.toString());
    }
    return Optional.empty();
  }

  /** Port-hinted cells may hold a list or range; the first port decides the order. */
  private static Optional<CanonicalPort> portOf(Object raw) {
    if (raw instanceof CanonicalPort p) {
      return Optional.of(p);
    }
    String s = String.valueOf(raw).trim();
    int comma = s.indexOf(',');
    if (comma >= 0) {
      s = s.substring(0, comma).trim();
    }
    int dash = s.indexOf('-');
    if (dash > 0) {
      s = s.substring(0, dash).trim();
    }
    return PortCanonicalizer.tryCanonicalize(s);
  }

  /** Epoch millis of the cell, treating zone-less date-times as UTC. */
  static OptionalLong timestampOf(Object raw) {
    if (raw instanceof Instant i) {
      return OptionalLong.of(i.toEpochMilli());
    }
    if (raw instanceof OffsetDateTime odt) {
      return OptionalLong.of(odt.toInstant().toEpochMilli());
    }
    if (raw instanceof ZonedDateTime zdt) {
      return OptionalLong.of(zdt.toInstant().toEpochMilli());
    }
    if (raw instanceof LocalDateTime ldt) {
      return OptionalLong.of(ldt.toInstant(ZoneOffset.UTC).toEpochMilli());
    }
    if (raw instanceof LocalDate ld) {
      return OptionalLong.of(ld.atStartOfDay().toInstant(ZoneOffset.UTC).toEpochMilli());
    }
    if (raw instanceof Date d) {
      return OptionalLong.of(d.getTime());
    }
    if (raw instanceof Integer || raw instanceof Long || raw instanceof BigInteger) {
      return epochSeconds(((Number) raw).longValue(), raw);
    }
    if (!(raw instanceof CharSequence)) {
      return OptionalLong.empty();
    }
    String s = raw.toString().trim();
    if (EPOCH_DIGITS.matcher(s).matches()) {
      return epochSeconds(Long.parseLong(s), s);
    }
    return parseTimestampText(s);
  }

  private static OptionalLong epochSeconds(long seconds, Object raw) {
    if (raw instanceof BigInteger bi && bi.bitLength() >= 64) {
      return OptionalLong.empty();
    }
    if (seconds < EPOCH_SECONDS_MIN || seconds > EPOCH_SECONDS_MAX) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(seconds * 1000L);
  }

  private static OptionalLong parseTimestampText(String s) {
    OptionalLong millis = attempt(() -> OffsetDateTime.parse(s).toInstant());
    if (millis.isEmpty()) {
      millis = attempt(() -> LocalDateTime.parse(s).toInstant(ZoneOffset.UTC));
    }
    for (int i = 0; millis.isEmpty() && i < DATE_TIMES.size(); i++) {
      DateTimeFormatter f = DATE_TIMES.get(i);
      millis = attempt(() -> LocalDateTime.parse(s, f).toInstant(ZoneOffset.UTC));
    }
    for (int i = 0; millis.isEmpty() && i < DATES.size(); i++) {
      DateTimeFormatter f = DATES.get(i);
      millis = attempt(() -> LocalDate.parse(s, f).atStartOfDay().toInstant(ZoneOffset.UTC));
    }
    return millis;
  }

  private static OptionalLong attempt(Supplier<Instant> parser) {
    try {
      return OptionalLong.of(parser.get().toEpochMilli());
    } catch (DateTimeParseException e) {
      return OptionalLong.empty();
    }
  }

  private static Optional<BigDecimal> numberOf(Object raw) {
    if (raw instanceof BigDecimal bd) {
      return Optional.of(bd);
    }
    if (raw instanceof Double || raw instanceof Float) {
      double d = ((Number) raw).doubleValue();
      return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
    }
    if (raw instanceof Number n) {
      return Optional.of(new BigDecimal(n.toString()));
    }
    if (raw instanceof CharSequence cs) {
      try {
        return Optional.of(new BigDecimal(cs.toString().trim()));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  private static DateTimeFormatter pattern(String p) {
    return DateTimeFormatter.ofPattern(p).withResolverStyle(ResolverStyle.STRICT);
  }
}
