package io.boxofports.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.LocalDateTime;
import org.junit.jupiter.api.Test;

class ExportFileNamesTest {

  @Test
  void generatedNameCarriesProfileCommandAndTimestamp() {
    assertEquals(
        "lab-ports-20240506_070809.csv",
        ExportFileNames.defaultName("lab", "ports", "csv", LocalDateTime.of(2024, 5, 6, 7, 8, 9)));
  }

  @Test
  void appendsMissingExtension() {
    assertEquals(Path.of("report.json"), ExportFileNames.withExtension("report", "json"));
    assertEquals(Path.of("report.v2.csv"), ExportFileNames.withExtension("report.v2", "csv"));
  }

  @Test
  void keepsExistingExtensionAnyCase() {
    assertEquals(Path.of("out.csv"), ExportFileNames.withExtension("out.csv", "csv"));
    assertEquals(Path.of("OUT.CSV"), ExportFileNames.withExtension("OUT.CSV", "csv"));
  }
}
