package ca.gc.dfo.tides.application.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.dfo.tides.domain.error.ErrorKind;
import ca.gc.dfo.tides.domain.error.InvalidSeriesException;
import ca.gc.dfo.tides.domain.series.ContiguousBlock;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ContiguityScannerTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2020, 1, 1, 0, 0);

  private final ContiguityScanner scanner = new ContiguityScanner();

  @Test
  void picksLongestOfSeparatedBlocks() {
    List<Sample> samples = new ArrayList<>();
    addHourly(samples, T0, 3);
    addHourly(samples, T0.plusDays(1), 7);
    addHourly(samples, T0.plusDays(2), 2);

    TimeSeries run = scanner.longestContiguousRun(TimeSeries.seaLevel(samples));

    assertEquals(7, run.size());
    assertEquals(T0.plusDays(1), run.firstTimestamp().orElseThrow());
    assertEquals(T0.plusDays(1).plusHours(6), run.lastTimestamp().orElseThrow());
  }

  @Test
  void missingSampleBreaksTheRun() {
    List<Sample> samples = new ArrayList<>();
    addHourly(samples, T0, 4);
    samples.add(Sample.missing(T0.plusHours(4)));
    addHourly(samples, T0.plusHours(5), 2);

    List<ContiguousBlock> blocks = scanner.blocks(TimeSeries.seaLevel(samples));

    assertEquals(2, blocks.size());
    assertEquals(4, blocks.get(0).size());
    assertEquals(2, blocks.get(1).size());
  }

  @Test
  void gapsWithinToleranceContinueTheRun() {
    List<Sample> samples = List.of(
        Sample.of(T0, 1.0),
        Sample.of(T0.plusMinutes(60).plusSeconds(30), 1.0),
        Sample.of(T0.plusMinutes(120), 1.0),
        Sample.of(T0.plusMinutes(182), 1.0));

    List<ContiguousBlock> blocks = scanner.blocks(TimeSeries.seaLevel(samples));

    assertEquals(2, blocks.size());
    assertEquals(3, blocks.get(0).size());
  }

  @Test
  void tiesGoToTheEarliestBlock() {
    List<Sample> samples = new ArrayList<>();
    addHourly(samples, T0, 3);
    addHourly(samples, T0.plusDays(1), 3);

    ContiguousBlock block = scanner.longestBlock(TimeSeries.seaLevel(samples)).orElseThrow();

    assertEquals(T0, block.start());
  }

  @Test
  void emptyOrAllMissingSeriesHasNoRun() {
    TimeSeries missing = TimeSeries.seaLevel(List.of(Sample.missing(T0), Sample.missing(T0.plusHours(1))));

    assertTrue(scanner.longestBlock(missing).isEmpty());
    assertTrue(scanner.longestContiguousRun(TimeSeries.empty(TimeSeries.SEA_LEVEL)).isEmpty());
  }

  @Test
  void customIntervalIsHonoured() {
    ContiguityScanner quarterHourly = new ContiguityScanner(Duration.ofMinutes(15), Duration.ZERO);
    List<Sample> samples = List.of(
        Sample.of(T0, 1.0), Sample.of(T0.plusMinutes(15), 1.0), Sample.of(T0.plusMinutes(30), 1.0),
        Sample.of(T0.plusMinutes(60), 1.0));

    assertEquals(3, quarterHourly.longestBlock(TimeSeries.seaLevel(samples)).orElseThrow().size());
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class, () -> new ContiguityScanner(Duration.ZERO, Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> new ContiguityScanner(Duration.ofHours(1), Duration.ofSeconds(-1)));
  }

  private static void addHourly(List<Sample> samples, LocalDateTime start, int count) {
    for (int i = 0; i < count; i++) {
      samples.add(Sample.of(start.plusHours(i), i));
    }
  }

  @Test
  void unorderedSeriesIsStructurallyInvalid() {
    TimeSeries unordered = TimeSeries.seaLevel(List.of(
        Sample.of(T0.plusHours(2), 1.0), Sample.of(T0.plusHours(1), 1.0), Sample.of(T0, 1.0)));

    InvalidSeriesException ex =
        assertThrows(InvalidSeriesException.class, () -> scanner.longestContiguousRun(unordered));
    assertEquals(ErrorKind.STRUCTURAL_INVALID, ex.kind());
  }
}
