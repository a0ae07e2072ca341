package ca.gc.dfo.tides.application.analysis;

import static ca.gc.dfo.tides.testutil.SeriesFixtures.at;
import static ca.gc.dfo.tides.testutil.SeriesFixtures.missingAt;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.dfo.tides.domain.error.InvalidSeriesException;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import java.util.List;
import org.junit.jupiter.api.Test;

class SeriesMergerTest {
  private final SeriesMerger merger = new SeriesMerger();

  @Test
  void joinIsOrderedAndSymmetric() {
    TimeSeries a = TimeSeries.seaLevel(List.of(
        at("2020-01-01T00:00:00", 1.0), at("2020-01-01T02:00:00", 3.0)));
    TimeSeries b = TimeSeries.seaLevel(List.of(
        at("2020-01-01T01:00:00", 2.0), at("2020-01-01T02:00:00", 2.5), missingAt("2020-01-01T02:00:00")));

    TimeSeries ab = merger.join(a, b);
    TimeSeries ba = merger.join(b, a);

    assertEquals(ab, ba);
    assertEquals(5, ab.size());
    assertTrue(ab.isChronological());
    assertEquals(2.5, ab.samples().get(2).value(), 1e-12);
    assertEquals(3.0, ab.samples().get(3).value(), 1e-12);
  }

  @Test
  void joinAllMergesEveryPart() {
    TimeSeries a = TimeSeries.seaLevel(List.of(at("2021-01-01T00:00:00", 1.0)));
    TimeSeries b = TimeSeries.seaLevel(List.of(at("2020-01-01T00:00:00", 2.0)));
    TimeSeries c = TimeSeries.seaLevel(List.of());

    TimeSeries merged = merger.joinAll(List.of(a, b, c));

    assertEquals(2, merged.size());
    assertEquals(2.0, merged.samples().get(0).value(), 1e-12);
  }

  @Test
  void mismatchedQuantityIsRejected() {
    TimeSeries a = TimeSeries.seaLevel(List.of());
    TimeSeries other = TimeSeries.of("Residual", List.of());

    assertThrows(InvalidSeriesException.class, () -> merger.join(a, other));
  }
}
