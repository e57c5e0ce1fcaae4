package io.boxofports.table.render;

import io.boxofports.table.ColumnSpec;
import io.boxofports.table.OutputWriter;
import io.boxofports.table.Row;
import java.util.List;

/**
 * Writes an already sorted row sequence in one output format. Every facet of a render pass is fed
 * the same list, so all formats share one row order.
 */
public interface RowRenderer {

  void render(List<ColumnSpec> columns, List<Row> rows, OutputWriter out);
}
