package io.boxofports.table.render;

/** Machine-readable export formats, one renderer each. */
public enum ExportFormat {
  CSV("csv", "CSV", new CsvRenderer()),
  JSON("json", "JSON", new JsonRenderer());

  private final String extension;
  private final String label;
  private final RowRenderer renderer;

  ExportFormat(String extension, String label, RowRenderer renderer) {
    this.extension = extension;
    this.label = label;
    this.renderer = renderer;
  }

  /** File extension without the dot. */
  public String extension() {
    return extension;
  }

  public String label() {
    return label;
  }

  public RowRenderer renderer() {
    return renderer;
  }
}
