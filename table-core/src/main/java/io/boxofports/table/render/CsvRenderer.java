package io.boxofports.table.render;

import io.boxofports.table.ColumnSpec;
import io.boxofports.table.OutputWriter;
import io.boxofports.table.Row;
import java.util.ArrayList;
import java.util.List;

/** CSV renderer. RFC 4180 quoting; the header row holds the column display names. */
public final class CsvRenderer implements RowRenderer {

  @Override
  public void render(List<ColumnSpec> columns, List<Row> rows, OutputWriter out) {
    List<String> headers = new ArrayList<>(columns.size());
    for (ColumnSpec c : columns) {
      headers.add(c.displayName());
    }
    out.println(toCsvLine(headers));

    for (Row row : rows) {
      List<String> values = new ArrayList<>(columns.size());
      for (ColumnSpec c : columns) {
        values.add(CellFormatter.toText(row.get(c.index())));
      }
      out.println(toCsvLine(values));
    }
  }

  static String toCsvLine(List<String> values) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < values.size(); i++) {
      if (i > 0) sb.append(',');
      sb.append(escapeCsv(values.get(i)));
    }
    return sb.toString();
  }

  static String escapeCsv(String s) {
    if (s == null) return "";
    if (s.contains(",") || s.contains("\"") || s.contains("\n") || s.contains("\r")) {
      return '"' + s.replace("\"", "\"\"") + '"';
    }
    return s;
  }
}
