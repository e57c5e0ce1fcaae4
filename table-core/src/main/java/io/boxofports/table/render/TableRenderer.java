package io.boxofports.table.render;

import io.boxofports.table.ColumnSpec;
import io.boxofports.table.OutputWriter;
import io.boxofports.table.Row;
import java.util.ArrayList;
import java.util.List;

/** Boxed, column-aligned table for interactive display. */
public final class TableRenderer implements RowRenderer {

  public static final int DEFAULT_MAX_CELL_WIDTH = 40;

  private final int maxCellWidth;
  private final boolean paged;
  private final int pageSize;

  public TableRenderer() {
    this(DEFAULT_MAX_CELL_WIDTH, false, 0);
  }

  /**
   * @param maxCellWidth cells wider than this are truncated with an ellipsis
   * @param paged pause between pages when attached to a console
   * @param pageSize lines per page, 0 for the environment default
   */
  public TableRenderer(int maxCellWidth, boolean paged, int pageSize) {
    this.maxCellWidth = Math.max(4, maxCellWidth);
    this.paged = paged;
    this.pageSize = pageSize;
  }

  @Override
  public void render(List<ColumnSpec> columns, List<Row> rows, OutputWriter out) {
    PagedPrinter pager =
        paged ? PagedPrinter.create(out, true, pageSize) : PagedPrinter.plain(out);
    if (rows.isEmpty()) {
      pager.println("(no rows)");
      return;
    }
    List<String> headers = new ArrayList<>(columns.size());
    for (ColumnSpec c : columns) {
      headers.add(c.displayName());
    }

    // Prepare cell strings, multi-line cells split per line
    List<List<String[]>> prepared = new ArrayList<>(rows.size());
    int[] widths = new int[headers.size()];
    for (int c = 0; c < headers.size(); c++) {
      widths[c] = Math.min(maxCellWidth, headers.get(c).length());
    }
    for (Row row : rows) {
      List<String[]> rowCells = new ArrayList<>(headers.size());
      for (int c = 0; c < columns.size(); c++) {
        String[] lines = CellFormatter.toText(row.get(columns.get(c).index())).split("\\R", -1);
        rowCells.add(lines);
        for (String ln : lines) {
          widths[c] = Math.max(widths[c], Math.min(maxCellWidth, ln.length()));
        }
      }
      prepared.add(rowCells);
    }

    printSingleLine(headers, widths, pager);
    StringBuilder sep = new StringBuilder();
    for (int w : widths) {
      sep.append("+").append("-".repeat(w + 2));
    }
    sep.append("+");
    pager.println(sep.toString());

    for (List<String[]> rowCells : prepared) {
      int maxLines = 1;
      for (String[] cellLines : rowCells) maxLines = Math.max(maxLines, cellLines.length);
      for (int line = 0; line < maxLines && !pager.isAborted(); line++) {
        StringBuilder sb = new StringBuilder();
        for (int c = 0; c < headers.size(); c++) {
          String[] cellLines = rowCells.get(c);
          String piece = line < cellLines.length ? cellLines[line] : "";
          sb.append("| ").append(pad(truncate(piece, widths[c]), widths[c])).append(" ");
        }
        sb.append("|");
        pager.println(sb.toString());
      }
    }
  }

  private static void printSingleLine(List<String> cols, int[] widths, PagedPrinter pager) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < cols.size(); i++) {
      String v = truncate(cols.get(i), widths[i]);
      sb.append("| ").append(pad(v, widths[i])).append(" ");
    }
    sb.append("|");
    pager.println(sb.toString());
  }

  private static String pad(String s, int w) {
    if (s.length() >= w) return s;
    return s + " ".repeat(w - s.length());
  }

  private static String truncate(String s, int w) {
    if (s.length() <= w) return s;
    if (w <= 1) return s.substring(0, w);
    return s.substring(0, w - 1) + "\u2026"; // ellipsis character
  }
}
