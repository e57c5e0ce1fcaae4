package io.boxofports.table;

import io.boxofports.table.render.ExportFormat;

/**
 * What one render pass produces. Commands build a mode and hand it to {@link TablePipeline};
 * whether anything besides the machine-readable stream may reach stdout is decided from this value
 * alone.
 *
 * @param showTable whether the interactive table is wanted
 * @param csv CSV export target, null when not exporting CSV
 * @param json JSON export target, null when not exporting JSON
 */
public record RenderMode(boolean showTable, ExportTarget csv, ExportTarget json) {

  public RenderMode {
    if (csv != null && json != null && csv.isConsole() && json.isConsole()) {
      throw new IllegalArgumentException(
          "CSV and JSON cannot both be written to standard output; give one of them a filename");
    }
  }

  /** Interactive table only. */
  public static RenderMode table() {
    return new RenderMode(true, null, null);
  }

  public RenderMode withCsv(ExportTarget target) {
    return new RenderMode(showTable, target, json);
  }

  public RenderMode withJson(ExportTarget target) {
    return new RenderMode(showTable, csv, target);
  }

  public RenderMode withoutTable() {
    return new RenderMode(false, csv, json);
  }

  /** The target for a format, or null when that format is not requested. */
  public ExportTarget target(ExportFormat format) {
    return format == ExportFormat.CSV ? csv : json;
  }

  /**
   * True when an export streams to stdout. The table, summaries and confirmations are then
   * suppressed for the whole invocation.
   */
  public boolean isConsoleOnly() {
    return (csv != null && csv.isConsole()) || (json != null && json.isConsole());
  }
}
