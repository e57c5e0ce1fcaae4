package io.boxofports.ports;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CanonicalPortTest {

  @Test
  void notationDoesNotAffectEquality() {
    CanonicalPort alpha = CanonicalPort.of(3, 2, PortNotation.ALPHA);
    CanonicalPort decimal = CanonicalPort.of(3, 2, PortNotation.DECIMAL);
    assertEquals(alpha, decimal);
    assertEquals("3B", alpha.toString());
    assertEquals("3.02", decimal.toString());
  }

  @Test
  void slotsBeyondZOnlyHaveDecimalForm() {
    CanonicalPort p = CanonicalPort.of(1, 30);
    assertEquals(PortNotation.DECIMAL, p.notation());
    assertEquals("1.30", p.toString());
    assertThrows(IllegalStateException.class, p::toAlpha);
    assertThrows(
        IllegalArgumentException.class, () -> CanonicalPort.of(1, 30, PortNotation.ALPHA));
  }

  @Test
  void rejectsNonPositiveComponents() {
    assertThrows(IllegalArgumentException.class, () -> CanonicalPort.of(0, 1));
    assertThrows(IllegalArgumentException.class, () -> CanonicalPort.of(1, 0));
  }

  @Test
  void sortsNumericallyByBoardThenSlot() {
    List<CanonicalPort> ports =
        new ArrayList<>(
            List.of(
                CanonicalPort.of(10, 1),
                CanonicalPort.of(2, 3),
                CanonicalPort.of(2, 1),
                CanonicalPort.of(1, 4)));
    ports.sort(PortComparator.INSTANCE);
    assertEquals("[1D, 2A, 2C, 10A]", ports.toString());
  }

  @Test
  void formatsForApiInEitherNotation() {
    PortSet set = PortSet.of(CanonicalPort.of(1, 1), CanonicalPort.of(2, 4, PortNotation.DECIMAL));
    assertEquals("1A,2D", PortFormatter.formatForApi(set, PortNotation.ALPHA));
    assertEquals("1.01,2.04", PortFormatter.formatForApi(set, PortNotation.DECIMAL));
    assertEquals("1A, 2.04", PortFormatter.describe(set));
  }

  @Test
  void gridInventoryListsEverySlot() {
    assertEquals(
        "[1A, 1B, 1C, 2A, 2B, 2C]", PortInventory.grid(2, 3).ports().toString());
    assertThrows(IllegalArgumentException.class, () -> PortInventory.grid(0, 4));
  }
}
