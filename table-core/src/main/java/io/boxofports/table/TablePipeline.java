package io.boxofports.table;

import io.boxofports.table.render.ExportFormat;
import io.boxofports.table.render.TableRenderer;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sorts result rows once and renders the same sequence to every requested facet: the interactive
 * table, CSV and JSON, each to stdout or a file.
 *
 * <p>When an export streams to stdout the table and all confirmation output are suppressed, so the
 * stream can be piped. File exports leave the table alone and print one confirmation line each.
 * Diagnostics go to the error stream only.
 */
public final class TablePipeline {

  private static final Logger LOG = LoggerFactory.getLogger(TablePipeline.class);

  private final OutputWriter out;
  private final TableRenderer table;
  private final boolean ansiDiagnostics;

  public TablePipeline(OutputWriter out) {
    this(out, new TableRenderer(), DiagnosticStyle.terminalAttached());
  }

  public TablePipeline(OutputWriter out, TableRenderer table, boolean ansiDiagnostics) {
    this.out = out;
    this.table = table;
    this.ansiDiagnostics = ansiDiagnostics;
  }

  /**
   * Sorts and renders.
   *
   * @param columns displayed columns, in display order
   * @param rows result rows, left unmodified
   * @param sortText sort directive, null or blank for the default order
   * @param mode requested facets
   * @return the applied key, the sorted rows and any diagnostics
   * @throws UncheckedIOException if an export file cannot be written
   */
  public RenderOutcome render(
      List<ColumnSpec> columns, List<Row> rows, String sortText, RenderMode mode) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    List<SemanticHint> kinds = ColumnClassifier.classifyAll(columns, rows);
    SortKey key = SortDirectiveParser.parse(sortText, kinds, diagnostics);
    List<Row> sorted = RowSorter.sort(rows, columns, key, kinds, diagnostics);
    LOG.debug("Sorted {} row(s) by [{}], column kinds {}", sorted.size(), key, kinds);

    OutputWriter human = humanOutput(mode);
    if (mode.showTable() && !mode.isConsoleOnly()) {
      table.render(columns, sorted, out);
    }

    List<Path> written = new ArrayList<>();
    try {
      for (ExportFormat format : ExportFormat.values()) {
        ExportTarget target = mode.target(format);
        if (target == null) {
          continue;
        }
        if (target.isConsole()) {
          format.renderer().render(columns, sorted, out);
        } else {
          writeFile(format, target.file(), columns, sorted);
          written.add(target.file());
          human.println("✓ " + format.label() + " export written to: " + target.file());
        }
      }
    } finally {
      for (Diagnostic d : diagnostics) {
        out.error(DiagnosticStyle.format(d, ansiDiagnostics));
      }
    }
    return new RenderOutcome(key, sorted, diagnostics, written);
  }

  /**
   * Writer for summaries and confirmations around a render: {@code out} normally, stdout discarded
   * in console-only mode.
   */
  public OutputWriter humanOutput(RenderMode mode) {
    return mode.isConsoleOnly() ? OutputWriter.quiet(out) : out;
  }

  /** Writes to a sibling temp file first, then moves it into place. */
  private void writeFile(ExportFormat format, Path file, List<ColumnSpec> columns, List<Row> rows) {
    LOG.debug("Writing {} export to {}", format.label(), file);
    Path dir = file.toAbsolutePath().getParent();
    Path tmp = null;
    try {
      tmp = Files.createTempFile(dir, "." + file.getFileName(), ".tmp");
      try (BufferedWriter w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
        format.renderer().render(columns, rows, OutputWriter.forWriter(w, out));
      }
      try {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      LOG.warn("Failed to write {} export to {}: {}", format.label(), file, e.getMessage());
      throw new UncheckedIOException(
          "Failed to write " + format.label() + " export to " + file, e);
    } catch (UncheckedIOException e) {
      LOG.warn("Failed to write {} export to {}: {}", format.label(), file, e.getMessage());
      throw e;
    } finally {
      deleteQuietly(tmp);
    }
  }

  private static void deleteQuietly(Path tmp) {
    if (tmp == null) return;
    try {
      Files.deleteIfExists(tmp);
    } catch (IOException e) {
      LOG.debug("Could not remove temp file {}: {}", tmp, e.getMessage());
    }
  }
}
