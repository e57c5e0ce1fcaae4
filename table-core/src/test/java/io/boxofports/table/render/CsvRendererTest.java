package io.boxofports.table.render;

import static org.junit.jupiter.api.Assertions.*;

import io.boxofports.table.ColumnSpec;
import io.boxofports.table.OutputWriter;
import io.boxofports.table.Row;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class CsvRendererTest {

  @Test
  void quotesWhereNeeded() {
    assertEquals("plain", CsvRenderer.escapeCsv("plain"));
    assertEquals("\"a,b\"", CsvRenderer.escapeCsv("a,b"));
    assertEquals("\"say \"\"hi\"\"\"", CsvRenderer.escapeCsv("say \"hi\""));
    assertEquals("\"two\nlines\"", CsvRenderer.escapeCsv("two\nlines"));
    assertEquals("", CsvRenderer.escapeCsv(null));
  }

  @Test
  void writesHeaderAndRows() {
    StringWriter sw = new StringWriter();
    OutputWriter err = Mockito.mock(OutputWriter.class);
    List<ColumnSpec> columns =
        List.of(ColumnSpec.of("Port", 0), ColumnSpec.of("Seen", 1), ColumnSpec.of("Tags", 2));

    new CsvRenderer()
        .render(
            columns,
            List.of(
                Row.of("1A", LocalDateTime.of(2024, 5, 6, 7, 8, 9), List.of("uplink", "lab")),
                Row.of("1B", null, null)),
            OutputWriter.forWriter(sw, err));

    assertEquals(
        "Port,Seen,Tags\n" + "1A,2024-05-06 07:08:09,\"uplink, lab\"\n" + "1B,,\n",
        sw.toString());
    Mockito.verifyNoInteractions(err);
  }

  @Test
  void headerOnlyForNoRows() {
    StringWriter sw = new StringWriter();
    new CsvRenderer()
        .render(
            List.of(ColumnSpec.of("A", 0), ColumnSpec.of("B, C", 1)),
            List.of(),
            OutputWriter.forWriter(sw, Mockito.mock(OutputWriter.class)));
    assertEquals("A,\"B, C\"\n", sw.toString());
  }
}
