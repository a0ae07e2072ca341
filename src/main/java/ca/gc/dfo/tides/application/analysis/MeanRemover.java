package ca.gc.dfo.tides.application.analysis;

import ca.gc.dfo.tides.domain.error.InvalidSeriesException;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Extracts a calendar year or a time range and removes its arithmetic mean.
 * <p><strong>Why:</strong> Mean-removed sections let records from different datums and years be compared directly.</p>
 * <p><strong>Role:</strong> Analysis component; pure function over an immutable series.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select samples by calendar year or inclusive time range.</li>
 *   <li>Subtract the mean of the present values from every present value; missing samples stay missing.</li>
 *   <li>Return an empty series, never an exception, when nothing matches.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Two linear passes over the input.</p>
 * <p><strong>Observability:</strong> Logs an INFO notice for empty selections.</p>
 *
 * @since 0.1.0
 */
public final class MeanRemover {
  private static final Logger log = LoggerFactory.getLogger(MeanRemover.class);

  /**
   * Selects every sample in {@code year} and removes the selection's mean.
   *
   * @param year calendar year to keep
   * @param series sea-level series ordered by timestamp
   * @return mean-removed selection; empty when no sample falls in {@code year}
   * @throws InvalidSeriesException if the series is not an ordered sea-level series
   */
  public TimeSeries extractYearRemoveMean(int year, TimeSeries series) {
    SeriesPreconditions.requireSeaLevel(series, "extractYearRemoveMean");
    return extractRemoveMean(series, sample -> sample.timestamp().getYear() == year, "year " + year);
  }

  /**
   * Selects samples with {@code start <= timestamp <= end} and removes the selection's mean.
   *
   * @param start inclusive lower bound
   * @param end inclusive upper bound
   * @param series sea-level series ordered by timestamp
   * @return mean-removed selection; empty when no sample falls in the range
   * @throws InvalidSeriesException if the series is not an ordered sea-level series
   * @throws IllegalArgumentException if {@code start} is after {@code end}
   */
  public TimeSeries extractRangeRemoveMean(LocalDateTime start, LocalDateTime end, TimeSeries series) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    SeriesPreconditions.requireSeaLevel(series, "extractRangeRemoveMean");
    if (start.isAfter(end)) {
      throw new IllegalArgumentException("range start " + start + " is after end " + end);
    }
    return extractRemoveMean(
        series,
        sample -> !sample.timestamp().isBefore(start) && !sample.timestamp().isAfter(end),
        "range " + start + " .. " + end);
  }

  /**
   * Date variant of {@link #extractRangeRemoveMean(LocalDateTime, LocalDateTime, TimeSeries)}; {@code end} covers
   * the whole day.
   *
   * @param start first day, from midnight
   * @param end last day, through {@link LocalTime#MAX}
   * @param series sea-level series ordered by timestamp
   * @return mean-removed selection; empty when no sample falls in the range
   */
  public TimeSeries extractRangeRemoveMean(LocalDate start, LocalDate end, TimeSeries series) {
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    return extractRangeRemoveMean(start.atStartOfDay(), end.atTime(LocalTime.MAX), series);
  }

  private TimeSeries extractRemoveMean(TimeSeries series, Predicate<Sample> filter, String description) {
    List<Sample> selected = new ArrayList<>();
    double sum = 0.0;
    int present = 0;
    for (Sample sample : series.samples()) {
      if (!filter.test(sample)) {
        continue;
      }
      selected.add(sample);
      if (sample.isPresent()) {
        sum += sample.value();
        present++;
      }
    }

    if (selected.isEmpty()) {
      log.info("No samples found for {}; returning empty series", description);
      return TimeSeries.empty(series.quantity());
    }
    if (present == 0) {
      log.info("Selection for {} holds {} samples but no valid levels; mean not removed",
          description, selected.size());
      return series.withSamples(selected);
    }

    double mean = sum / present;
    List<Sample> shifted = new ArrayList<>(selected.size());
    for (Sample sample : selected) {
      shifted.add(sample.minus(mean));
    }
    log.debug("Removed mean {} from {} samples for {}", mean, selected.size(), description);
    return series.withSamples(shifted);
  }

  /**
   * Computes the arithmetic mean of the present values.
   *
   * @param series series to average
   * @return mean, or empty when no value is present
   */
  public static OptionalDouble meanOf(TimeSeries series) {
    double sum = 0.0;
    int present = 0;
    for (Sample sample : series.samples()) {
      if (sample.isPresent()) {
        sum += sample.value();
        present++;
      }
    }
    return present == 0 ? OptionalDouble.empty() : OptionalDouble.of(sum / present);
  }
}
