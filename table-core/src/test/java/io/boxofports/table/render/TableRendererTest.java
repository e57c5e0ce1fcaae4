package io.boxofports.table.render;

import static org.junit.jupiter.api.Assertions.*;

import io.boxofports.table.ColumnSpec;
import io.boxofports.table.OutputWriter;
import io.boxofports.table.Row;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class TableRendererTest {

  private static String render(TableRenderer renderer, List<ColumnSpec> columns, List<Row> rows) {
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    PrintStream ps = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    renderer.render(columns, rows, OutputWriter.forPrintStream(ps));
    return bytes.toString(StandardCharsets.UTF_8).replace("\r\n", "\n");
  }

  @Test
  void alignsColumns() {
    String out =
        render(
            new TableRenderer(),
            List.of(ColumnSpec.of("Port", 0), ColumnSpec.of("Device", 1)),
            List.of(Row.of("1A", "switch"), Row.of("10.12", null)));

    assertEquals(
        "| Port  | Device |\n"
            + "+-------+--------+\n"
            + "| 1A    | switch |\n"
            + "| 10.12 |        |\n",
        out);
  }

  @Test
  void displaysColumnsByIndex() {
    String out =
        render(
            new TableRenderer(),
            List.of(ColumnSpec.of("B", 1), ColumnSpec.of("A", 0)),
            List.of(Row.of("a", "b")));
    assertTrue(out.endsWith("| b | a |\n"));
  }

  @Test
  void truncatesWideCells() {
    String out =
        render(
            new TableRenderer(5, false, 0),
            List.of(ColumnSpec.of("Name", 0)),
            List.of(Row.of("abcdefgh")));
    assertTrue(out.contains("| abcd… |"));
  }

  @Test
  void splitsMultiLineCells() {
    String out =
        render(
            new TableRenderer(),
            List.of(ColumnSpec.of("Note", 0), ColumnSpec.of("N", 1)),
            List.of(Row.of("one\ntwo", 1)));
    assertTrue(out.contains("| one  | 1 |\n| two  |   |\n"));
  }

  @Test
  void emptyTable() {
    assertEquals(
        "(no rows)\n", render(new TableRenderer(), List.of(ColumnSpec.of("X", 0)), List.of()));
  }
}
