package io.boxofports.cli;

import io.boxofports.ports.CsvPortFileReader;
import io.boxofports.table.ColumnSpec;
import io.boxofports.table.DiagnosticStyle;
import io.boxofports.table.OutputWriter;
import io.boxofports.table.RenderMode;
import io.boxofports.table.Row;
import io.boxofports.table.SemanticHint;
import io.boxofports.table.TablePipeline;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Renders collected result rows. The input is a CSV file whose first record names the columns;
 * every following non-blank record is one row.
 */
@CommandLine.Command(
    name = "render",
    description = "Sort and render result rows from a CSV file as a table, CSV or JSON",
    mixinStandardHelpOptions = true)
class RenderCommand implements Callable<Integer> {

  private static final Logger LOG = LoggerFactory.getLogger(RenderCommand.class);

  @CommandLine.ParentCommand private Main parent;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(index = "0", paramLabel = "ROWS", description = "CSV file of rows")
  private Path rowsFile;

  @CommandLine.Option(
      names = "--hint",
      paramLabel = "COL=KIND",
      description =
          "Column type, KIND one of port, timestamp, generic; COL is a column number or header."
              + " Repeatable.")
  private List<String> hints = new ArrayList<>();

  @CommandLine.Mixin private ExportOptions export = new ExportOptions();

  @Override
  public Integer call() {
    OutputWriter out = OutputWriter.system();
    BopConfig config;
    try {
      config = parent.config();
    } catch (IOException | IllegalArgumentException e) {
      out.error("Error: cannot load configuration: " + e.getMessage());
      return Main.EXIT_IO;
    }
    RenderMode mode = export.toMode(spec.commandLine(), config, "render", LocalDateTime.now());

    List<List<String>> records;
    try {
      records = readRecords(rowsFile);
    } catch (IOException e) {
      out.error("Error: cannot read " + rowsFile + ": " + e.getMessage());
      return Main.EXIT_IO;
    }
    if (records.isEmpty()) {
      out.error("Error: " + rowsFile + " has no header row");
      return Main.EXIT_IO;
    }

    List<String> header = records.get(0);
    Map<Integer, SemanticHint> columnHints = parseHints(header);
    List<ColumnSpec> columns = new ArrayList<>(header.size());
    for (int i = 0; i < header.size(); i++) {
      columns.add(ColumnSpec.of(header.get(i).trim(), i, columnHints.get(i)));
    }
    List<Row> rows = new ArrayList<>(records.size() - 1);
    for (List<String> record : records.subList(1, records.size())) {
      if (!isBlank(record)) {
        rows.add(Row.of(record));
      }
    }
    LOG.debug("Read {} row(s) with {} column(s) from {}", rows.size(), columns.size(), rowsFile);

    TablePipeline pipeline =
        new TablePipeline(out, config.tableRenderer(), DiagnosticStyle.terminalAttached());
    try {
      pipeline.render(columns, rows, export.sort, mode);
    } catch (UncheckedIOException e) {
      out.error("Error: " + e.getMessage());
      return Main.EXIT_IO;
    }
    return Main.EXIT_OK;
  }

  private static List<List<String>> readRecords(Path file) throws IOException {
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return CsvPortFileReader.parseRecords(reader);
    }
  }

  /** Maps column index to hint; column given by 1-based number or case-insensitive header. */
  private Map<Integer, SemanticHint> parseHints(List<String> header) {
    Map<Integer, SemanticHint> result = new HashMap<>();
    for (String h : hints) {
      int eq = h.lastIndexOf('=');
      if (eq <= 0 || eq == h.length() - 1) {
        throw badHint(h, "expected COL=KIND");
      }
      String col = h.substring(0, eq).trim();
      String kind = h.substring(eq + 1).trim().toUpperCase(Locale.ROOT);
      SemanticHint hint;
      try {
        hint = SemanticHint.valueOf(kind);
      } catch (IllegalArgumentException e) {
        throw badHint(h, "KIND must be port, timestamp or generic");
      }
      result.put(columnIndex(col, header, h), hint);
    }
    return result;
  }

  private int columnIndex(String col, List<String> header, String hint) {
    if (col.chars().allMatch(Character::isDigit)) {
      int n = Integer.parseInt(col);
      if (n < 1 || n > header.size()) {
        throw badHint(hint, "column " + n + " is out of range 1-" + header.size());
      }
      return n - 1;
    }
    for (int i = 0; i < header.size(); i++) {
      if (header.get(i).trim().equalsIgnoreCase(col)) {
        return i;
      }
    }
    throw badHint(hint, "no column named '" + col + "'");
  }

  private CommandLine.ParameterException badHint(String hint, String reason) {
    return new CommandLine.ParameterException(
        spec.commandLine(), "Invalid --hint '" + hint + "': " + reason);
  }

  private static boolean isBlank(List<String> record) {
    for (String c : record) {
      if (c != null && !c.isBlank()) return false;
    }
    return true;
  }
}
