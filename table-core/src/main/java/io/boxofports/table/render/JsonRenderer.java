package io.boxofports.table.render;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import io.boxofports.table.ColumnSpec;
import io.boxofports.table.OutputWriter;
import io.boxofports.table.Row;
import java.util.List;

/**
 * JSON renderer: an array of objects keyed by column display name, in row order. Numbers and
 * booleans stay typed, everything else is written as its text form.
 */
public final class JsonRenderer implements RowRenderer {

  private final Gson gson =
      new GsonBuilder().setPrettyPrinting().serializeNulls().disableHtmlEscaping().create();

  @Override
  public void render(List<ColumnSpec> columns, List<Row> rows, OutputWriter out) {
    out.println(gson.toJson(toJson(columns, rows)));
  }

  JsonArray toJson(List<ColumnSpec> columns, List<Row> rows) {
    JsonArray array = new JsonArray(rows.size());
    for (Row row : rows) {
      JsonObject obj = new JsonObject();
      for (ColumnSpec c : columns) {
        obj.add(c.displayName(), toElement(row.get(c.index())));
      }
      array.add(obj);
    }
    return array;
  }

  private static JsonElement toElement(Object v) {
    if (v == null) return JsonNull.INSTANCE;
    if (v instanceof Number n) {
      double d = n.doubleValue();
      return Double.isFinite(d) ? new JsonPrimitive(n) : new JsonPrimitive(n.toString());
    }
    if (v instanceof Boolean b) return new JsonPrimitive(b);
    return new JsonPrimitive(CellFormatter.toText(v));
  }
}
