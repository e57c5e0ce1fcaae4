package io.boxofports.table.render;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;

/** Text form of a cell, shared by the table and CSV renderers. */
final class CellFormatter {

  private static final DateTimeFormatter LOCAL =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private CellFormatter() {}

  static String toText(Object v) {
    if (v == null) return "";
    if (v instanceof String s) return s;
    if (v instanceof LocalDateTime ldt) return LOCAL.format(ldt);
    if (v instanceof TemporalAccessor) return v.toString();
    if (v instanceof Date d) return d.toInstant().toString();
    if (v instanceof Collection<?> coll) {
      StringBuilder sb = new StringBuilder();
      boolean first = true;
      for (Object item : coll) {
        if (!first) sb.append(", ");
        first = false;
        sb.append(toText(item));
      }
      return sb.toString();
    }
    if (v instanceof Object[] arr) return Arrays.deepToString(arr);
    return String.valueOf(v);
  }
}
