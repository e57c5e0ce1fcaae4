package io.boxofports.cli;

import io.boxofports.table.ExportTarget;
import io.boxofports.table.RenderMode;
import io.boxofports.table.render.ExportFormat;
import java.nio.file.Path;
import java.time.LocalDateTime;
import picocli.CommandLine;

/** Sort and export options shared by commands that render a table. */
public class ExportOptions {

  static final String STDOUT = "-";

  @CommandLine.Option(
      names = "--sort",
      paramLabel = "S",
      description =
          "Sort by column numbers, e.g. '2,1d,4'. Use 'a' & 'd' for ascending/descending.")
  String sort;

  @CommandLine.Option(
      names = "--csv",
      arity = "0..1",
      fallbackValue = STDOUT,
      paramLabel = "FILE",
      description = "Export CSV to FILE, or to stdout without a value or with '-'")
  String csv;

  @CommandLine.Option(
      names = "--json",
      arity = "0..1",
      fallbackValue = STDOUT,
      paramLabel = "FILE",
      description = "Export JSON to FILE, or to stdout without a value or with '-'")
  String json;

  @CommandLine.Option(
      names = "--output-dir",
      paramLabel = "DIR",
      description =
          "Write exports to DIR; exports without a file name get a generated"
              + " <profile>-<command>-<timestamp> name there instead of going to stdout")
  Path outputDir;

  /**
   * Builds the render mode for one invocation.
   *
   * @throws CommandLine.ParameterException if both exports would go to stdout
   */
  RenderMode toMode(CommandLine cmd, BopConfig config, String command, LocalDateTime now) {
    RenderMode mode = RenderMode.table();
    try {
      if (csv != null) {
        mode = mode.withCsv(target(csv, ExportFormat.CSV, config, command, now));
      }
      if (json != null) {
        mode = mode.withJson(target(json, ExportFormat.JSON, config, command, now));
      }
    } catch (IllegalArgumentException e) {
      throw new CommandLine.ParameterException(cmd, e.getMessage(), e);
    }
    return mode;
  }

  private ExportTarget target(
      String value, ExportFormat format, BopConfig config, String command, LocalDateTime now) {
    if (STDOUT.equals(value) || value.isBlank()) {
      if (outputDir == null) {
        return ExportTarget.stdout();
      }
      return ExportTarget.file(
          outputDir.resolve(
              ExportFileNames.defaultName(
                  config.profileOrDefault(), command, format.extension(), now)));
    }
    Path file = ExportFileNames.withExtension(value, format.extension());
    if (outputDir != null && !file.isAbsolute()) {
      file = outputDir.resolve(file);
    }
    return ExportTarget.file(file);
  }
}
