package io.boxofports.cli;

import io.boxofports.ports.CanonicalPort;
import io.boxofports.ports.PortInventory;
import io.boxofports.ports.PortSpecException;
import io.boxofports.ports.PortSpecResolver;
import io.boxofports.ports.Resolution;
import io.boxofports.ports.ResolveWarning;
import io.boxofports.table.ColumnSpec;
import io.boxofports.table.DiagnosticStyle;
import io.boxofports.table.OutputWriter;
import io.boxofports.table.RenderMode;
import io.boxofports.table.Row;
import io.boxofports.table.SemanticHint;
import io.boxofports.table.TablePipeline;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/** Resolves a port specification and lists the ports it names. */
@CommandLine.Command(
    name = "ports",
    description = "Resolve a port specification and list the resulting ports",
    mixinStandardHelpOptions = true)
class PortsCommand implements Callable<Integer> {

  private static final Logger LOG = LoggerFactory.getLogger(PortsCommand.class);

  static final List<ColumnSpec> COLUMNS =
      List.of(
          ColumnSpec.of("#", 0),
          ColumnSpec.of("Port", 1, SemanticHint.PORT),
          ColumnSpec.of("Board", 2),
          ColumnSpec.of("Slot", 3),
          ColumnSpec.of("Decimal", 4));

  @CommandLine.ParentCommand private Main parent;

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Parameters(
      index = "0",
      paramLabel = "SPEC",
      description =
          "Comma-separated ports (1A, 1.01, 3), ranges (1A-1D), CSV files, or '*' for all ports")
  private String portSpec;

  @CommandLine.Option(
      names = "--inventory-boards",
      paramLabel = "N",
      description = "Boards on the device, for '*' (overrides inventory.boards)")
  private Integer inventoryBoards;

  @CommandLine.Option(
      names = "--inventory-slots",
      paramLabel = "M",
      description = "Slots per board, for '*' (overrides inventory.slots)")
  private Integer inventorySlots;

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
    RenderMode mode = export.toMode(spec.commandLine(), config, "ports", LocalDateTime.now());
    TablePipeline pipeline =
        new TablePipeline(out, config.tableRenderer(), DiagnosticStyle.terminalAttached());

    Resolution resolution;
    try {
      resolution = new PortSpecResolver(inventory(config)).resolve(portSpec);
    } catch (PortSpecException e) {
      LOG.debug("Resolution of '{}' failed", portSpec, e);
      out.error("Error: " + e.getMessage());
      return Main.EXIT_RESOLUTION;
    }
    for (ResolveWarning w : resolution.warnings()) {
      out.error("Warning: " + w.message());
    }

    List<Row> rows = new ArrayList<>(resolution.ports().size());
    int n = 0;
    for (CanonicalPort p : resolution.ports()) {
      rows.add(Row.of(++n, p, p.board(), p.slot(), p.toDecimal()));
    }
    try {
      pipeline.render(COLUMNS, rows, export.sort, mode);
    } catch (UncheckedIOException e) {
      out.error("Error: " + e.getMessage());
      return Main.EXIT_IO;
    }
    pipeline.humanOutput(mode).println("Resolved " + rows.size() + " port(s)");
    return Main.EXIT_OK;
  }

  private PortInventory inventory(BopConfig config) {
    if (inventoryBoards != null || inventorySlots != null) {
      if (inventoryBoards == null || inventorySlots == null) {
        throw new CommandLine.ParameterException(
            spec.commandLine(), "--inventory-boards and --inventory-slots must be given together");
      }
      try {
        return PortInventory.grid(inventoryBoards, inventorySlots);
      } catch (IllegalArgumentException e) {
        throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
      }
    }
    return config.inventory().orElse(null);
  }
}
