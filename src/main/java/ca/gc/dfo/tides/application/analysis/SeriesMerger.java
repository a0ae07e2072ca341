package ca.gc.dfo.tides.application.analysis;

import ca.gc.dfo.tides.domain.error.InvalidSeriesException;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Combines series into one chronologically sorted series.
 * <p><strong>Why:</strong> Station records arrive as one file per year; analysis needs the whole record.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Concatenate samples without deduplication or gap filling.</li>
 *   <li>Sort with {@link TimeSeries#CHRONOLOGICAL} so argument order never changes the result.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> O(n log n) in the combined sample count.</p>
 *
 * @since 0.1.0
 */
public final class SeriesMerger {

  /**
   * Joins two series.
   *
   * @param first first series; must measure sea level
   * @param second second series; must measure the same quantity as {@code first}
   * @return new sorted series holding every sample of both inputs
   * @throws InvalidSeriesException if either series is not a sea-level series
   */
  public TimeSeries join(TimeSeries first, TimeSeries second) {
    SeriesPreconditions.requireSeaLevelQuantity(first, "join");
    SeriesPreconditions.requireSeaLevelQuantity(second, "join");
    List<Sample> combined = new ArrayList<>(first.size() + second.size());
    combined.addAll(first.samples());
    combined.addAll(second.samples());
    return TimeSeries.sorted(first.quantity(), combined);
  }

  /**
   * Joins any number of series; an empty collection yields an empty sea-level series.
   *
   * @param series series to merge
   * @return new sorted series
   * @throws InvalidSeriesException if any series is not a sea-level series
   */
  public TimeSeries joinAll(Collection<TimeSeries> series) {
    Objects.requireNonNull(series, "series");
    List<Sample> combined = new ArrayList<>();
    for (TimeSeries part : series) {
      SeriesPreconditions.requireSeaLevelQuantity(part, "join");
      combined.addAll(part.samples());
    }
    return TimeSeries.sorted(TimeSeries.SEA_LEVEL, combined);
  }
}
