package io.boxofports.table;

import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;

/** De-emphasizes diagnostic lines: faint ANSI text on terminals, plain text elsewhere. */
public final class DiagnosticStyle {

  private static final AttributedStyle FAINT = AttributedStyle.DEFAULT.faint();

  private DiagnosticStyle() {}

  public static String format(Diagnostic d, boolean ansi) {
    String text = "note: " + d.message();
    return ansi ? new AttributedString(text, FAINT).toAnsi() : text;
  }

  /** Whether the process looks attached to an interactive terminal. */
  public static boolean terminalAttached() {
    return System.console() != null;
  }
}
