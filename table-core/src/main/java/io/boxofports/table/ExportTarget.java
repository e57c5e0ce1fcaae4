package io.boxofports.table;

import java.nio.file.Path;

/**
 * Where an export goes: standard output (console-only mode) or a file.
 *
 * @param file the destination file, null for standard output
 */
public record ExportTarget(Path file) {

  private static final ExportTarget STDOUT = new ExportTarget(null);

  public static ExportTarget stdout() {
    return STDOUT;
  }

  public static ExportTarget file(Path file) {
    if (file == null) {
      throw new IllegalArgumentException("file must not be null, use stdout()");
    }
    return new ExportTarget(file);
  }

  public boolean isConsole() {
    return file == null;
  }

  @Override
  public String toString() {
    return isConsole() ? "stdout" : file.toString();
  }
}
