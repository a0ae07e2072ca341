package ca.gc.dfo.tides.domain.series;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import org.junit.jupiter.api.Test;

class TimeSeriesTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2020, 1, 1, 0, 0);

  @Test
  void nonFiniteLevelBecomesMissing() {
    Sample nan = new Sample(T0, OptionalDouble.of(Double.NaN));
    Sample nullLevel = new Sample(T0, null);

    assertFalse(nan.isPresent());
    assertFalse(nullLevel.isPresent());
  }

  @Test
  void minusLeavesMissingSamplesUntouched() {
    Sample missing = Sample.missing(T0);

    assertEquals(missing, missing.minus(2.0));
    assertEquals(1.5, Sample.of(T0, 3.5).minus(2.0).value(), 1e-12);
  }

  @Test
  void sortedOrdersByTimestampThenPresentBeforeMissing() {
    List<Sample> samples = new ArrayList<>();
    samples.add(Sample.of(T0.plusHours(1), 2.0));
    samples.add(Sample.missing(T0));
    samples.add(Sample.of(T0, 1.0));

    TimeSeries series = TimeSeries.sorted(TimeSeries.SEA_LEVEL, samples);

    assertTrue(series.isChronological());
    assertEquals(List.of(T0, T0, T0.plusHours(1)), series.timestamps());
    assertTrue(series.samples().get(0).isPresent());
    assertFalse(series.samples().get(1).isPresent());
  }

  @Test
  void reportsCountsAndBounds() {
    TimeSeries series = TimeSeries.seaLevel(List.of(
        Sample.of(T0, 1.0), Sample.missing(T0.plusHours(1)), Sample.of(T0.plusHours(2), 3.0)));

    assertEquals(3, series.size());
    assertEquals(2, series.presentCount());
    assertEquals(T0, series.firstTimestamp().orElseThrow());
    assertEquals(T0.plusHours(2), series.lastTimestamp().orElseThrow());
    assertTrue(TimeSeries.empty(TimeSeries.SEA_LEVEL).firstTimestamp().isEmpty());
  }

  @Test
  void unorderedInputIsKeptButFlagged() {
    TimeSeries series = TimeSeries.seaLevel(List.of(Sample.of(T0.plusHours(1), 1.0), Sample.of(T0, 2.0)));

    assertFalse(series.isChronological());
  }

  @Test
  void samplesAreImmutable() {
    TimeSeries series = TimeSeries.seaLevel(List.of(Sample.of(T0, 1.0)));

    assertThrows(UnsupportedOperationException.class, () -> series.samples().add(Sample.of(T0, 2.0)));
  }

  @Test
  void contiguousBlockRejectsEmptyRuns() {
    assertThrows(IllegalArgumentException.class, () -> new ContiguousBlock(List.of()));
  }
}
