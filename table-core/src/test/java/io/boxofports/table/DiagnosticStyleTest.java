package io.boxofports.table;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class DiagnosticStyleTest {

  private final Diagnostic d = Diagnostic.badDirectiveToken("9z", "expected <column number>[a|d]");

  @Test
  void plainTextWithoutTerminal() {
    assertEquals(
        "note: Ignoring sort token '9z': expected <column number>[a|d]",
        DiagnosticStyle.format(d, false));
  }

  @Test
  void faintOnTerminal() {
    String styled = DiagnosticStyle.format(d, true);
    assertTrue(styled.contains("\u001B["));
    assertTrue(styled.contains("note: Ignoring sort token '9z'"));
  }
}
