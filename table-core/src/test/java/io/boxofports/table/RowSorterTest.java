package io.boxofports.table;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class RowSorterTest {

  private static final List<ColumnSpec> PORT_DEVICE_STATUS =
      List.of(ColumnSpec.of("Port", 0), ColumnSpec.of("Device", 1), ColumnSpec.of("Status", 2));

  private static List<Object> column(List<Row> rows, int index) {
    List<Object> values = new ArrayList<>();
    for (Row r : rows) {
      values.add(r.get(index));
    }
    return values;
  }

  private static List<Row> sort(List<Row> rows, List<ColumnSpec> columns, String directive) {
    List<Diagnostic> diagnostics = new ArrayList<>();
    List<SemanticHint> kinds = ColumnClassifier.classifyAll(columns, rows);
    SortKey key = SortDirectiveParser.parse(directive, kinds, diagnostics);
    return RowSorter.sort(rows, columns, key, kinds, diagnostics);
  }

  @Test
  void sortsByMultipleKeys() {
    List<Row> rows =
        List.of(
            Row.of("1A", "switch", "up"),
            Row.of("2A", "router", "down"),
            Row.of("1B", "router", "up"),
            Row.of("3A", "switch", "down"));

    List<Row> sorted = sort(rows, PORT_DEVICE_STATUS, "2,1d");

    assertEquals(List.of("2A", "1B", "3A", "1A"), column(sorted, 0));
  }

  @Test
  void portsSortNumericallyAcrossNotations() {
    List<Row> rows = List.of(Row.of("10A"), Row.of("2.03"), Row.of("2B"), Row.of("1.30"));
    List<Row> sorted = sort(rows, List.of(ColumnSpec.of("Port", 0)), "1");
    assertEquals(List.of("1.30", "2B", "2.03", "10A"), column(sorted, 0));
  }

  @Test
  void equalKeysKeepInputOrder() {
    List<Row> rows =
        List.of(
            Row.of("a", "x", 1),
            Row.of("b", "y", 1),
            Row.of("c", "x", 1),
            Row.of("d", "y", 1),
            Row.of("e", "x", 1));
    List<ColumnSpec> columns =
        List.of(ColumnSpec.of("Id", 0), ColumnSpec.of("Group", 1), ColumnSpec.of("N", 2));

    assertEquals(List.of("a", "b", "c", "d", "e"), column(sort(rows, columns, "3d"), 0));
    assertEquals(List.of("a", "c", "e", "b", "d"), column(sort(rows, columns, "2"), 0));
    assertEquals(List.of("b", "d", "a", "c", "e"), column(sort(rows, columns, "2d"), 0));
  }

  @Test
  void unreadableTimestampsTrailInBothDirections() {
    List<ColumnSpec> columns =
        List.of(ColumnSpec.of("Id", 0), ColumnSpec.of("Time", 1, SemanticHint.TIMESTAMP));
    List<Row> rows =
        List.of(
            Row.of("late", "2023-01-02 08:00"),
            Row.of("bad", "yesterday-ish"),
            Row.of("early", "2023-01-01T08:00:00"),
            Row.of("none", null));

    List<Diagnostic> diagnostics = new ArrayList<>();
    List<SemanticHint> kinds = ColumnClassifier.classifyAll(columns, rows);
    List<Row> asc =
        RowSorter.sort(rows, columns, SortKey.of(SortTerm.ascending(1)), kinds, diagnostics);
    List<Row> desc =
        RowSorter.sort(rows, columns, SortKey.of(SortTerm.descending(1)), kinds, diagnostics);

    assertEquals(List.of("early", "late", "bad", "none"), column(asc, 0));
    assertEquals(List.of("late", "early", "bad", "none"), column(desc, 0));
    assertEquals(2, diagnostics.size());
    assertEquals(Diagnostic.Kind.COERCION_FALLBACK, diagnostics.get(0).kind());
    assertEquals(
        "1 cell(s) in column 'Time' are not timestamps and were sorted last",
        diagnostics.get(0).message());
  }

  @Test
  void inferredTimestampColumnSortsNewestFirstByDefault() {
    List<ColumnSpec> columns =
        List.of(ColumnSpec.of("Id", 0), ColumnSpec.of("Name", 1), ColumnSpec.of("Time", 2));
    List<Row> rows =
        List.of(
            Row.of(1, "a", "2023-12-25T10:30:45"),
            Row.of(2, "b", "garbage"),
            Row.of(3, "c", "2024-01-01 00:00:00"),
            Row.of(4, "d", "2023-06-01"));

    assertEquals(List.of(3, 1, 4, 2), column(sort(rows, columns, null), 0));
  }

  @Test
  void singleUnreadableTimestampTrailsAgainstOneValidOne() {
    List<ColumnSpec> columns = List.of(ColumnSpec.of("ID", 0), ColumnSpec.of("Time", 1));
    List<Row> rows = List.of(Row.of("bad", "pending"), Row.of("ok", "2024-01-01T10:00:00"));

    assertEquals(List.of("ok", "bad"), column(sort(rows, columns, "2d"), 0));
    assertEquals(List.of("ok", "bad"), column(sort(rows, columns, "2a"), 0));
    assertEquals(List.of("ok", "bad"), column(sort(rows, columns, null), 0));

    List<SemanticHint> kinds = ColumnClassifier.classifyAll(columns, rows);
    assertEquals(
        SortKey.of(SortTerm.descending(1)),
        SortDirectiveParser.parse(null, kinds, new ArrayList<>()));
  }

  @Test
  void missingCellsTrailInBothDirections() {
    List<ColumnSpec> columns = List.of(ColumnSpec.of("N", 0));
    List<Row> rows = List.of(Row.of("5"), Row.of((Object) null), Row.of(""), Row.of("2"));

    List<Object> asc = column(sort(rows, columns, "1a"), 0);
    List<Object> desc = column(sort(rows, columns, "1d"), 0);
    assertEquals(List.of("2", "5"), asc.subList(0, 2));
    assertEquals(List.of("5", "2"), desc.subList(0, 2));
    assertNull(desc.get(2));
    assertEquals("", desc.get(3));
  }

  @Test
  void mixedKindsRankNumbersBeforeText() {
    List<ColumnSpec> columns = List.of(ColumnSpec.of("V", 0));
    List<Row> rows = List.of(Row.of("abc"), Row.of("10"), Row.of("9"), Row.of("ABB"));

    assertEquals(List.of("9", "10", "ABB", "abc"), column(sort(rows, columns, "1"), 0));
    assertEquals(List.of("abc", "ABB", "10", "9"), column(sort(rows, columns, "1d"), 0));
  }

  @Test
  void portHintedColumnDegradesToText() {
    List<ColumnSpec> columns = List.of(ColumnSpec.of("Port", 0, SemanticHint.PORT));
    List<Row> rows = List.of(Row.of("n/a"), Row.of("3"), Row.of("1A-1D"), Row.of("2B,1A"));
    List<Diagnostic> diagnostics = new ArrayList<>();

    List<Row> sorted =
        RowSorter.sort(
            rows,
            columns,
            SortKey.of(SortTerm.ascending(0)),
            ColumnClassifier.classifyAll(columns, rows),
            diagnostics);

    assertEquals(List.of("1A-1D", "2B,1A", "3", "n/a"), column(sorted, 0));
    assertEquals(1, diagnostics.size());
    assertTrue(diagnostics.get(0).message().contains("not ports"));
  }

  @Test
  void termsNamingMissingColumnsAreSkipped() {
    List<Row> rows = List.of(Row.of("b"), Row.of("a"));
    List<Row> sorted =
        RowSorter.sort(rows, List.of(ColumnSpec.of("X", 0)), SortKey.of(SortTerm.ascending(4)));
    assertEquals(rows, sorted);
  }

  @Test
  void leavesInputUntouched() {
    List<Row> rows = new ArrayList<>(List.of(Row.of("b"), Row.of("a")));
    List<Row> sorted =
        RowSorter.sort(rows, List.of(ColumnSpec.of("X", 0)), SortKey.of(SortTerm.ascending(0)));
    assertEquals(List.of(Row.of("a"), Row.of("b")), sorted);
    assertEquals(List.of(Row.of("b"), Row.of("a")), rows);
  }

  @Test
  void emptyAndSingleRowInputs() {
    List<ColumnSpec> columns = List.of(ColumnSpec.of("X", 0));
    assertTrue(RowSorter.sort(List.of(), columns, SortKey.of(SortTerm.ascending(0))).isEmpty());
    assertEquals(
        List.of(Row.of("x")),
        RowSorter.sort(List.of(Row.of("x")), columns, SortKey.of(SortTerm.ascending(0))));
  }
}
