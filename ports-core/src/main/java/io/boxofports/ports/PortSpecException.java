package io.boxofports.ports;

import java.nio.file.Path;

/**
 * Thrown when a port specification cannot be resolved. Always fatal for the invoking command: the
 * message names the offending token or CSV row and the grammar that was expected.
 */
public class PortSpecException extends Exception {

  static final String TOKEN_GRAMMAR =
      "expected <board><letter> (1A), <board>.<2-digit slot> (1.01) or <board> (1)";
  static final String SPEC_GRAMMAR =
      "expected comma-separated ports (1A, 1.01, 3), ranges (1A-1D, 2.01-2.04, 1-4),"
          + " '*'/'all' or a .csv file";

  /** Failure categories of port specification resolution. */
  public enum ErrorKind {
    MALFORMED_TOKEN,
    INVERTED_RANGE,
    INVALID_CSV_ROW,
    UNRESOLVED_WILDCARD,
    FILE_NOT_FOUND
  }

  private final ErrorKind kind;
  private final String token;
  private final int rowNumber;

  private PortSpecException(
      ErrorKind kind, String token, int rowNumber, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.token = token;
    this.rowNumber = rowNumber;
  }

  public static PortSpecException malformedToken(String token, String detail) {
    return new PortSpecException(
        ErrorKind.MALFORMED_TOKEN,
        token,
        -1,
        "Invalid port specification '" + token + "': " + detail + " (" + SPEC_GRAMMAR + ")",
        null);
  }

  public static PortSpecException invertedRange(String token) {
    return new PortSpecException(
        ErrorKind.INVERTED_RANGE,
        token,
        -1,
        "Invalid range '" + token + "': start must not come after end (e.g. 1A-1D, not 1D-1A)",
        null);
  }

  public static PortSpecException invalidCsvRow(
      Path file, int rowNumber, String detail, Throwable cause) {
    return new PortSpecException(
        ErrorKind.INVALID_CSV_ROW,
        file.toString(),
        rowNumber,
        "Invalid data in " + file + " row " + rowNumber + ": " + detail
            + " (expected a 'port' column with an optional 'slot' column)",
        cause);
  }

  public static PortSpecException unresolvedWildcard(String token) {
    return new PortSpecException(
        ErrorKind.UNRESOLVED_WILDCARD,
        token,
        -1,
        "Cannot expand '" + token + "': no port inventory is available for this device",
        null);
  }

  public static PortSpecException fileNotFound(Path file) {
    return new PortSpecException(
        ErrorKind.FILE_NOT_FOUND,
        file.toString(),
        -1,
        "CSV file not found: " + file,
        null);
  }

  public ErrorKind getKind() {
    return kind;
  }

  /** The offending fragment, or the CSV file path for file related errors. */
  public String getToken() {
    return token;
  }

  /** 1-based CSV row (the header is row 1), or -1 when not a CSV row error. */
  public int getRowNumber() {
    return rowNumber;
  }
}
