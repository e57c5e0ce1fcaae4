package io.boxofports.table;

import static io.boxofports.table.SemanticHint.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class SortDirectiveParserTest {

  private static final List<SemanticHint> FIVE =
      List.of(GENERIC, GENERIC, PORT, TIMESTAMP, GENERIC);

  private final List<Diagnostic> diagnostics = new ArrayList<>();

  @Test
  void parsesColumnsAndDirections() {
    SortKey key = SortDirectiveParser.parse("2,1d,4", FIVE, diagnostics);
    assertEquals(
        List.of(SortTerm.ascending(1), SortTerm.descending(0), SortTerm.ascending(3)), key.terms());
    assertTrue(diagnostics.isEmpty());
  }

  @Test
  void directionIsCaseInsensitiveAndWhitespaceTolerated() {
    SortKey key = SortDirectiveParser.parse("  2D , 1A , 4  ", FIVE, diagnostics);
    assertEquals("2d,1a,4a", key.toString());
  }

  @Test
  void discardsBadTokensIndividually() {
    SortKey key = SortDirectiveParser.parse("2,invalid,99,1d,0,3x", FIVE, diagnostics);
    assertEquals(List.of(SortTerm.ascending(1), SortTerm.descending(0)), key.terms());
    assertEquals(4, diagnostics.size());
    assertTrue(diagnostics.stream().allMatch(d -> d.kind() == Diagnostic.Kind.BAD_DIRECTIVE_TOKEN));
    assertTrue(diagnostics.get(0).message().contains("invalid"));
  }

  @Test
  void repeatedColumnKeepsFirstOccurrence() {
    SortKey key = SortDirectiveParser.parse("3d,3a", FIVE, diagnostics);
    assertEquals(List.of(SortTerm.descending(2)), key.terms());
    assertEquals(1, diagnostics.size());
  }

  @Test
  void allBadTokensFallBackToDefault() {
    SortKey key = SortDirectiveParser.parse("invalid,99", FIVE, diagnostics);
    assertEquals(List.of(SortTerm.descending(3)), key.terms());
    assertEquals(2, diagnostics.size());
  }

  @Test
  void blankUsesDefault() {
    SortKey expected = SortKey.of(SortTerm.descending(3));
    assertEquals(expected, SortDirectiveParser.parse(null, FIVE, diagnostics));
    assertEquals(expected, SortDirectiveParser.parse(" ", FIVE, diagnostics));
    assertTrue(diagnostics.isEmpty());
  }

  @Test
  void defaultPrefersFirstTimestampDescending() {
    // ID, Name, Time, Port
    assertEquals(
        SortKey.of(SortTerm.descending(2)),
        SortDirectiveParser.defaultKey(List.of(GENERIC, GENERIC, TIMESTAMP, PORT)));
    assertEquals(
        SortKey.of(SortTerm.descending(2)),
        SortDirectiveParser.defaultKey(List.of(GENERIC, GENERIC, TIMESTAMP, TIMESTAMP)));
  }

  @Test
  void defaultFallsBackToFirstPortAscending() {
    // ID, Port, Status
    assertEquals(
        SortKey.of(SortTerm.ascending(1)),
        SortDirectiveParser.defaultKey(List.of(GENERIC, PORT, GENERIC)));
  }

  @Test
  void defaultFallsBackToSecondColumn() {
    // ID, Name
    assertEquals(
        SortKey.of(SortTerm.ascending(1)),
        SortDirectiveParser.defaultKey(List.of(GENERIC, GENERIC)));
  }

  @Test
  void defaultUsesOnlyColumn() {
    assertEquals(
        SortKey.of(SortTerm.ascending(0)), SortDirectiveParser.defaultKey(List.of(GENERIC)));
    assertTrue(SortDirectiveParser.defaultKey(List.of()).isEmpty());
  }
}
