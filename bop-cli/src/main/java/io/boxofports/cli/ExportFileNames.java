package io.boxofports.cli;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** File names for exports. */
final class ExportFileNames {

  private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

  private ExportFileNames() {}

  /** {@code <profile>-<command>-<yyyyMMdd_HHmmss>.<ext>}. */
  static String defaultName(String profile, String command, String extension, LocalDateTime now) {
    return profile + "-" + command + "-" + STAMP.format(now) + "." + extension;
  }

  /** The user's file name, with {@code .<ext>} appended unless it already ends that way. */
  static Path withExtension(String name, String extension) {
    String suffix = "." + extension;
    if (name.toLowerCase(Locale.ROOT).endsWith(suffix)) {
      return Path.of(name);
    }
    return Path.of(name + suffix);
  }
}
