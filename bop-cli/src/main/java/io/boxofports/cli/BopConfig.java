package io.boxofports.cli;

import io.boxofports.ports.PortInventory;
import io.boxofports.table.render.TableRenderer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Settings for the {@code bop} command. Loads from {@code ~/.boxofports/config.properties} by
 * default; {@code BOP_CONFIG} or {@code --config} point elsewhere.
 *
 * @param profile device profile name, used in default export file names
 * @param inventoryBoards boards of the device, null when unknown
 * @param inventorySlots slots per board, null when unknown
 * @param maxCellWidth widest table cell before truncation
 * @param pager pause the table between pages on a terminal
 */
public record BopConfig(
    String profile,
    Integer inventoryBoards,
    Integer inventorySlots,
    int maxCellWidth,
    boolean pager) {

  static final String ENV_CONFIG = "BOP_CONFIG";

  public static BopConfig defaults() {
    return new BopConfig(null, null, null, TableRenderer.DEFAULT_MAX_CELL_WIDTH, false);
  }

  /**
   * Loads the configuration.
   *
   * @param explicit file given on the command line, or null for the default location
   * @return loaded configuration, or defaults if the default file doesn't exist
   * @throws IOException if an explicit file is missing or any file cannot be read
   */
  public static BopConfig load(Path explicit) throws IOException {
    Path configPath = explicit != null ? explicit : defaultPath(System.getenv(), userHome());
    if (!Files.exists(configPath)) {
      if (explicit != null) {
        throw new NoSuchFileException(explicit.toString(), null, "configuration file not found");
      }
      return defaults();
    }

    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  static Path defaultPath(Map<String, String> env, String home) {
    String fromEnv = env.get(ENV_CONFIG);
    if (fromEnv != null && !fromEnv.isBlank()) {
      return Path.of(fromEnv.trim());
    }
    return Path.of(home, ".boxofports", "config.properties");
  }

  static BopConfig fromProperties(Properties props) {
    String profile = props.getProperty("profile");
    if (profile != null && profile.isBlank()) {
      profile = null;
    }
    Integer boards = positive(props, "inventory.boards");
    Integer slots = positive(props, "inventory.slots");
    Integer width = positive(props, "table.maxCellWidth");
    String pager = props.getProperty("pager", "off").trim();
    return new BopConfig(
        profile == null ? null : profile.trim(),
        boards,
        slots,
        width == null ? TableRenderer.DEFAULT_MAX_CELL_WIDTH : width,
        pager.equalsIgnoreCase("on") || Boolean.parseBoolean(pager));
  }

  /** The configured device inventory; present only when both dimensions are set. */
  public Optional<PortInventory> inventory() {
    if (inventoryBoards == null || inventorySlots == null) {
      return Optional.empty();
    }
    return Optional.of(PortInventory.grid(inventoryBoards, inventorySlots));
  }

  /** Table renderer honouring the width and pager settings. */
  public TableRenderer tableRenderer() {
    return new TableRenderer(maxCellWidth, pager, 0);
  }

  public String profileOrDefault() {
    return profile == null ? "default" : profile;
  }

  private static Integer positive(Properties props, String key) {
    String v = props.getProperty(key);
    if (v == null || v.isBlank()) {
      return null;
    }
    try {
      int n = Integer.parseInt(v.trim());
      if (n < 1) {
        throw new IllegalArgumentException(key + " must be at least 1: " + v.trim());
      }
      return n;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " is not a number: " + v.trim(), e);
    }
  }

  private static String userHome() {
    return System.getProperty("user.home");
  }
}
