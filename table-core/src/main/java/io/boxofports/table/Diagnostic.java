package io.boxofports.table;

/**
 * A non-fatal rendering issue. Diagnostics never stop a render; they are reported on the error
 * stream after the fact.
 */
public record Diagnostic(Kind kind, String message) {

  /** Diagnostic categories. */
  public enum Kind {
    /** A sort directive token was malformed or out of range and was ignored. */
    BAD_DIRECTIVE_TOKEN,
    /** Cells of a typed column could not be read as that type. */
    COERCION_FALLBACK
  }

  public static Diagnostic badDirectiveToken(String token, String reason) {
    return new Diagnostic(
        Kind.BAD_DIRECTIVE_TOKEN, "Ignoring sort token '" + token + "': " + reason);
  }

  @Override
  public String toString() {
    return message;
  }
}
