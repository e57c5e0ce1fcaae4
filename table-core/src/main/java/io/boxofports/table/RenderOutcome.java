package io.boxofports.table;

import java.nio.file.Path;
import java.util.List;

/**
 * What a render pass did.
 *
 * @param sortKey the key actually applied, explicit or default
 * @param rows the rows in rendered order
 * @param diagnostics non-fatal issues, already reported on the error stream
 * @param writtenFiles export files written
 */
public record RenderOutcome(
    SortKey sortKey, List<Row> rows, List<Diagnostic> diagnostics, List<Path> writtenFiles) {

  public RenderOutcome {
    rows = List.copyOf(rows);
    diagnostics = List.copyOf(diagnostics);
    writtenFiles = List.copyOf(writtenFiles);
  }
}
