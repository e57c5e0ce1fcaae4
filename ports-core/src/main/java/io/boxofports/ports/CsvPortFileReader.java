package io.boxofports.ports;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads port lists from a UTF-8 CSV file with a header row. A {@code port} column is required, a
 * {@code slot} column is optional; header names are case-insensitive.
 *
 * <pre>
 * port,slot
 * 1,A
 * 2,02
 * 3.01,
 * 4
 * </pre>
 *
 * Rows with a blank port cell are skipped. A bare board with no slot gets slot 1 and is reported
 * back through {@link Entry#slotAssumed()}.
 */
public final class CsvPortFileReader {

  private static final Logger LOG = LoggerFactory.getLogger(CsvPortFileReader.class);

  private static final Pattern SLOT_DIGITS = Pattern.compile("\\d{1,2}");
  private static final Pattern SLOT_DOTTED = Pattern.compile("\\.\\d{2}");
  private static final Pattern SLOT_LETTER = Pattern.compile("[A-Za-z]");

  /**
   * One port read from the file.
   *
   * @param port the port
   * @param rowNumber 1-based row number, the header being row 1
   * @param slotAssumed true when no slot was given and slot 1 was assumed
   */
  public record Entry(CanonicalPort port, int rowNumber, boolean slotAssumed) {}

  private CsvPortFileReader() {}

  /** Whether a specification fragment looks like a reference to a CSV file. */
  public static boolean looksLikeCsvFile(String fragment) {
    return fragment != null && fragment.trim().toLowerCase(Locale.ROOT).endsWith(".csv");
  }

  /**
   * Reads all ports from the file, in file order, duplicates included.
   *
   * @throws PortSpecException {@code FILE_NOT_FOUND} if the file is missing, {@code
   *     INVALID_CSV_ROW} for a bad header, a bad row, or a file with no data rows
   */
  public static List<Entry> read(Path file) throws PortSpecException {
    if (!Files.isRegularFile(file)) {
      throw PortSpecException.fileNotFound(file);
    }
    List<List<String>> records;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      records = parseRecords(reader);
    } catch (NoSuchFileException e) {
      throw PortSpecException.fileNotFound(file);
    } catch (CharacterCodingException e) {
      throw PortSpecException.invalidCsvRow(file, 1, "file is not valid UTF-8", e);
    } catch (JsonProcessingException e) {
      JsonLocation where = e.getLocation();
      int row = where != null && where.getLineNr() > 0 ? where.getLineNr() : 1;
      throw PortSpecException.invalidCsvRow(
          file, row, "malformed CSV: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw PortSpecException.invalidCsvRow(file, 1, "cannot read file: " + e.getMessage(), e);
    }

    if (records.isEmpty()) {
      throw PortSpecException.invalidCsvRow(file, 1, "file is empty or has no header", null);
    }
    List<String> header = records.get(0);
    int portCol = -1;
    int slotCol = -1;
    for (int i = 0; i < header.size(); i++) {
      String name = header.get(i).trim().toLowerCase(Locale.ROOT);
      if (name.equals("port") && portCol < 0) {
        portCol = i;
      } else if (name.equals("slot") && slotCol < 0) {
        slotCol = i;
      }
    }
    if (portCol < 0) {
      throw PortSpecException.invalidCsvRow(
          file, 1, "header must contain a 'port' column, found " + header, null);
    }

    List<Entry> entries = new ArrayList<>();
    for (int r = 1; r < records.size(); r++) {
      int rowNumber = r + 1;
      List<String> cells = records.get(r);
      if (isBlankRecord(cells)) {
        continue;
      }
      if (portCol >= cells.size()) {
        throw PortSpecException.invalidCsvRow(file, rowNumber, "missing 'port' value", null);
      }
      String portValue = cells.get(portCol).trim();
      if (portValue.isEmpty()) {
        continue;
      }
      String slotValue = slotCol >= 0 && slotCol < cells.size() ? cells.get(slotCol).trim() : "";
      entries.add(toEntry(file, rowNumber, portValue, slotValue));
    }
    if (entries.isEmpty()) {
      throw PortSpecException.invalidCsvRow(file, 1, "no ports found below the header", null);
    }
    LOG.debug("Read {} port(s) from {}", entries.size(), file);
    return entries;
  }

  private static Entry toEntry(Path file, int rowNumber, String portValue, String slotValue)
      throws PortSpecException {
    try {
      if (slotValue.isEmpty()) {
        CanonicalPort port = PortCanonicalizer.canonicalize(portValue);
        return new Entry(port, rowNumber, PortCanonicalizer.isBareBoard(portValue));
      }
      if (!PortCanonicalizer.isBareBoard(portValue)) {
        throw PortSpecException.invalidCsvRow(
            file,
            rowNumber,
            "port '" + portValue + "' already names a slot but slot '" + slotValue + "' was given",
            null);
      }
      return new Entry(combine(portValue, slotValue), rowNumber, false);
    } catch (PortSpecException e) {
      if (e.getKind() == PortSpecException.ErrorKind.INVALID_CSV_ROW) {
        throw e;
      }
      throw PortSpecException.invalidCsvRow(file, rowNumber, e.getMessage(), e);
    }
  }

  private static CanonicalPort combine(String board, String slot) throws PortSpecException {
    if (SLOT_LETTER.matcher(slot).matches()) {
      return PortCanonicalizer.canonicalize(board + slot);
    }
    if (SLOT_DOTTED.matcher(slot).matches()) {
      return PortCanonicalizer.canonicalize(board + slot);
    }
    if (SLOT_DIGITS.matcher(slot).matches()) {
      // A separate slot column is unambiguous, so "2" and "02" both mean slot 2.
      return PortCanonicalizer.canonicalize(
          board + "." + String.format("%02d", Integer.parseInt(slot)));
    }
    throw PortSpecException.malformedToken(
        board + "/" + slot, "slot must be a letter (A), a number (1, 01) or .NN");
  }

  private static boolean isBlankRecord(List<String> cells) {
    for (String c : cells) {
      if (c != null && !c.isBlank()) return false;
    }
    return true;
  }

  /**
   * Splits CSV text into records of raw cells: quoted fields, doubled quotes, CRLF or LF line
   * endings. Blank lines come back as blank records so that record index + 1 stays the row
   * number. A leading byte order mark is dropped.
   */
  public static List<List<String>> parseRecords(Reader in) throws IOException {
    CsvMapper mapper = new CsvMapper();
    List<List<String>> records = new ArrayList<>();
    try (MappingIterator<String[]> it =
        mapper
            .readerFor(String[].class)
            .with(CsvParser.Feature.WRAP_AS_ARRAY)
            .readValues(in)) {
      for (String[] cells : it.readAll()) {
        List<String> record = new ArrayList<>(cells.length);
        for (String c : cells) {
          record.add(c == null ? "" : c);
        }
        records.add(record);
      }
    }
    if (!records.isEmpty() && !records.get(0).isEmpty()) {
      List<String> header = records.get(0);
      String first = header.get(0);
      if (first.startsWith("\uFEFF")) {
        header.set(0, first.substring(1));
      }
    }
    return records;
  }
}
