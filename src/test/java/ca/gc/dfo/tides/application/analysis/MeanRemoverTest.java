package ca.gc.dfo.tides.application.analysis;

import static ca.gc.dfo.tides.testutil.SeriesFixtures.at;
import static ca.gc.dfo.tides.testutil.SeriesFixtures.hourly;
import static ca.gc.dfo.tides.testutil.SeriesFixtures.missingAt;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.dfo.tides.domain.error.ErrorKind;
import ca.gc.dfo.tides.domain.error.InvalidSeriesException;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;

class MeanRemoverTest {
  private final MeanRemover remover = new MeanRemover();

  @Test
  void yearOfHourlyCountsHasZeroMean() {
    TimeSeries series = hourly(LocalDateTime.of(2020, 1, 1, 0, 0), 8760, i -> i + 1);

    TimeSeries year = remover.extractYearRemoveMean(2020, series);

    assertEquals(8760, year.size());
    assertEquals(0.0, MeanRemover.meanOf(year).orElseThrow(), 1e-9);
    assertEquals(1.0 - 4380.5, year.samples().get(0).value(), 1e-9);
  }

  @Test
  void yearSelectionExcludesNeighbouringYears() {
    TimeSeries series = TimeSeries.seaLevel(List.of(
        at("2019-12-31T23:00:00", 100.0),
        at("2020-01-01T00:00:00", 1.0),
        at("2020-12-31T23:00:00", 3.0),
        at("2021-01-01T00:00:00", 100.0)));

    TimeSeries year = remover.extractYearRemoveMean(2020, series);

    assertEquals(2, year.size());
    assertEquals(-1.0, year.samples().get(0).value(), 1e-12);
    assertEquals(1.0, year.samples().get(1).value(), 1e-12);
  }

  @Test
  void missingSamplesAreKeptAndIgnoredByTheMean() {
    TimeSeries series = TimeSeries.seaLevel(List.of(
        at("2020-03-01T00:00:00", 2.0),
        missingAt("2020-03-01T01:00:00"),
        at("2020-03-01T02:00:00", 4.0)));

    TimeSeries year = remover.extractYearRemoveMean(2020, series);

    assertEquals(3, year.size());
    assertFalse(year.samples().get(1).isPresent());
    assertEquals(-1.0, year.samples().get(0).value(), 1e-12);
    assertEquals(1.0, year.samples().get(2).value(), 1e-12);
  }

  @Test
  void fullRangeKeepsTimestampsAndShiftsByMean() {
    TimeSeries series = hourly(LocalDateTime.of(2021, 6, 1, 0, 0), 24, i -> 10.0 + i);

    TimeSeries range = remover.extractRangeRemoveMean(
        series.firstTimestamp().orElseThrow(), series.lastTimestamp().orElseThrow(), series);

    assertEquals(series.timestamps(), range.timestamps());
    double mean = MeanRemover.meanOf(series).orElseThrow();
    for (int i = 0; i < series.size(); i++) {
      assertEquals(series.samples().get(i).value() - mean, range.samples().get(i).value(), 1e-12);
    }
  }

  @Test
  void dateRangeIncludesTheWholeEndDay() {
    TimeSeries series = hourly(LocalDateTime.of(2021, 6, 1, 0, 0), 72, i -> i);

    TimeSeries range = remover.extractRangeRemoveMean(LocalDate.of(2021, 6, 2), LocalDate.of(2021, 6, 2), series);

    assertEquals(24, range.size());
    assertEquals(LocalDateTime.of(2021, 6, 2, 23, 0), range.lastTimestamp().orElseThrow());
  }

  @Test
  void emptySelectionReturnsEmptySeries() {
    TimeSeries series = hourly(LocalDateTime.of(2020, 1, 1, 0, 0), 5, i -> i);

    TimeSeries year = remover.extractYearRemoveMean(1999, series);

    assertTrue(year.isEmpty());
    assertEquals(TimeSeries.SEA_LEVEL, year.quantity());
  }

  @Test
  void allMissingSelectionIsReturnedUnchanged() {
    List<Sample> samples = List.of(missingAt("2020-01-01T00:00:00"), missingAt("2020-01-01T01:00:00"));

    TimeSeries year = remover.extractYearRemoveMean(2020, TimeSeries.seaLevel(samples));

    assertEquals(samples, year.samples());
  }

  @Test
  void startAfterEndIsRejected() {
    TimeSeries series = hourly(LocalDateTime.of(2020, 1, 1, 0, 0), 5, i -> i);

    assertThrows(IllegalArgumentException.class, () -> remover.extractRangeRemoveMean(
        LocalDateTime.of(2020, 2, 1, 0, 0), LocalDateTime.of(2020, 1, 1, 0, 0), series));
  }

  @Test
  void otherQuantitiesAreRejected() {
    TimeSeries residual = TimeSeries.of("Residual", List.of(at("2020-01-01T00:00:00", 1.0)));

    assertThrows(InvalidSeriesException.class, () -> remover.extractYearRemoveMean(2020, residual));
  }

  @Test
  void unorderedSeriesIsStructurallyInvalid() {
    TimeSeries unordered = TimeSeries.seaLevel(List.of(
        at("2020-01-01T02:00:00", 1.0), at("2020-01-01T01:00:00", 2.0)));

    InvalidSeriesException byYear =
        assertThrows(InvalidSeriesException.class, () -> remover.extractYearRemoveMean(2020, unordered));
    assertEquals(ErrorKind.STRUCTURAL_INVALID, byYear.kind());

    InvalidSeriesException byRange = assertThrows(InvalidSeriesException.class, () -> remover.extractRangeRemoveMean(
        LocalDateTime.of(2020, 1, 1, 0, 0), LocalDateTime.of(2020, 1, 2, 0, 0), unordered));
    assertEquals(ErrorKind.STRUCTURAL_INVALID, byRange.kind());
  }
}
