package ca.gc.dfo.tides.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.dfo.tides.application.analysis.MissingValuePolicy;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnalyzeConfigTest {

  @Test
  void defaultsProduceAUsableConfig() {
    AnalyzeConfig config = AnalyzeConfig.fromMap(options(Map.of("dir", "/data/station")));

    assertEquals(Path.of("/data/station"), config.source());
    assertEquals(List.of("M2", "S2", "N2", "K1", "O1"), config.constituents());
    assertTrue(config.epoch().isEmpty());
    assertEquals(ReportFormat.TEXT, config.format());
    assertTrue(config.output().isEmpty());
    assertTrue(config.astronomicalArguments());
    assertEquals(MissingValuePolicy.EXCLUDE, config.missingPolicy());
    assertEquals(Duration.ofHours(1), config.contiguityInterval());
    assertEquals(Duration.ofMinutes(1), config.contiguityTolerance());
    assertFalse(config.dryRun());
  }

  @Test
  void parsesOverrides() {
    AnalyzeConfig config = AnalyzeConfig.fromMap(options(Map.of(
        "dir", "/data/station",
        "constituents", "M2, K1",
        "epoch", "2020-01-01T06:00:00-03:00",
        "format", "JSON",
        "out", "/tmp/report.json",
        "astronomicalArguments", "no",
        "harmonic.missingPolicy", "interpolate",
        "contiguity.intervalMinutes", "15",
        "contiguity.toleranceSeconds", "30",
        "dryRun", "yes")));

    assertEquals(List.of("M2", "K1"), config.constituents());
    assertEquals(ZonedDateTime.of(2020, 1, 1, 9, 0, 0, 0, ZoneOffset.UTC).toInstant(),
        config.epoch().orElseThrow().toInstant());
    assertEquals(ReportFormat.JSON, config.format());
    assertEquals(Path.of("/tmp/report.json"), config.output().orElseThrow());
    assertFalse(config.astronomicalArguments());
    assertEquals(MissingValuePolicy.INTERPOLATE, config.missingPolicy());
    assertEquals(Duration.ofMinutes(15), config.contiguityInterval());
    assertTrue(config.dryRun());
  }

  @Test
  void dateOnlyEpochIsUtcMidnight() {
    AnalyzeConfig config = AnalyzeConfig.fromMap(options(Map.of("dir", "/d", "epoch", "2021-07-04")));

    assertEquals(ZonedDateTime.of(2021, 7, 4, 0, 0, 0, 0, ZoneOffset.UTC), config.epoch().orElseThrow());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class, () -> AnalyzeConfig.fromMap(options(Map.of())));
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(options(Map.of("dir", "/d", "constituents", "M2,,S2"))));
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(options(Map.of("dir", "/d", "constituents", "M2,m2"))));
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(options(Map.of("dir", "/d", "epoch", "yesterday"))));
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(options(Map.of("dir", "/d", "astronomicalArguments", "maybe"))));
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(options(Map.of("dir", "/d", "harmonic.missingPolicy", "guess"))));
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(options(Map.of("dir", "/d", "contiguity.toleranceSeconds", "3600"))));
    assertThrows(IllegalArgumentException.class,
        () -> AnalyzeConfig.fromMap(options(Map.of("dir", "/d", "format", "xml"))));
  }

  private static Map<String, String> options(Map<String, String> overrides) {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("analyze"));
    options.putAll(overrides);
    return options;
  }
}
