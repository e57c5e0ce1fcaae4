package io.boxofports.table.render;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.boxofports.ports.CanonicalPort;
import io.boxofports.table.ColumnSpec;
import io.boxofports.table.Row;
import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

class JsonRendererTest {

  private final JsonRenderer renderer = new JsonRenderer();

  @Test
  void keysByDisplayNameAndKeepsTypes() {
    List<ColumnSpec> columns =
        List.of(
            ColumnSpec.of("Port", 0),
            ColumnSpec.of("Count", 1),
            ColumnSpec.of("Up", 2),
            ColumnSpec.of("Note", 3));
    JsonArray array =
        renderer.toJson(
            columns,
            List.of(
                Row.of(CanonicalPort.of(3, 2), 7, true, null),
                Row.of("1.30", new BigDecimal("2.50"), false, "<ok>")));

    assertEquals(2, array.size());
    JsonObject first = array.get(0).getAsJsonObject();
    assertEquals("3B", first.get("Port").getAsString());
    assertEquals(7, first.get("Count").getAsInt());
    assertTrue(first.get("Up").getAsBoolean());
    assertTrue(first.get("Note").isJsonNull());

    JsonObject second = array.get(1).getAsJsonObject();
    assertEquals(new BigDecimal("2.50"), second.get("Count").getAsBigDecimal());
    assertEquals("<ok>", second.get("Note").getAsString());
    assertEquals(List.of("Port", "Count", "Up", "Note"), List.copyOf(first.keySet()));
  }

  @Test
  void nonFiniteNumbersBecomeStrings() {
    JsonArray array =
        renderer.toJson(List.of(ColumnSpec.of("V", 0)), List.of(Row.of(Double.NaN)));
    assertEquals("NaN", array.get(0).getAsJsonObject().get("V").getAsString());
    assertTrue(array.get(0).getAsJsonObject().get("V").getAsJsonPrimitive().isString());
  }
}
