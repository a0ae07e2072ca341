package ca.gc.dfo.tides.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void analyzeDefaultsIncludeCommonAndHarmonicKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("Analyze");

    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("text", defaults.get("format"));
    assertEquals(DefaultsForMode.DEFAULT_CONSTITUENTS, defaults.get("constituents"));
    assertEquals("EXCLUDE", defaults.get("harmonic.missingPolicy"));
    assertFalse(defaults.containsKey("year"));
  }

  @Test
  void extractDefaultsLeaveSelectionBlank() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("extract");

    assertEquals("", defaults.get("year"));
    assertEquals("", defaults.get("start"));
    assertFalse(defaults.containsKey("constituents"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
