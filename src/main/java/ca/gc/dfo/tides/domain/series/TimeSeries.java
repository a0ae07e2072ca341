package ca.gc.dfo.tides.domain.series;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Ordered sequence of {@link Sample}s for a single named quantity.
 * <p><strong>Why:</strong> Replaces a labelled-column table with the one shape the analysis layer needs:
 * (timestamp, optional level) pairs tagged with the quantity they measure.</p>
 * <p><strong>Role:</strong> Domain aggregate passed between ingestion, analysis components and reports.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold samples in the order supplied; duplicate timestamps are kept.</li>
 *   <li>Report whether the order is chronological so analysis components can reject unordered input.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; the sample list is an unmodifiable copy.</p>
 * <p><strong>Performance:</strong> Construction copies the input list once; chronology is checked eagerly.</p>
 *
 * @since 0.1.0
 */
public final class TimeSeries {
  /** Name of the only quantity the analysis layer understands. */
  public static final String SEA_LEVEL = "Sea Level";

  /**
   * Total order used whenever samples are sorted: timestamp first, then present levels ascending, then missing.
   */
  public static final Comparator<Sample> CHRONOLOGICAL = Comparator
      .comparing(Sample::timestamp)
      .thenComparing(sample -> sample.isPresent() ? 0 : 1)
      .thenComparingDouble(sample -> sample.level().orElse(0.0));

  private final String quantity;
  private final List<Sample> samples;
  private final boolean chronological;

  private TimeSeries(String quantity, List<Sample> samples) {
    this.quantity = Objects.requireNonNull(quantity, "quantity");
    this.samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
    this.chronological = checkChronological(this.samples);
  }

  /**
   * Creates a series keeping the supplied order.
   *
   * @param quantity quantity name (for example {@link #SEA_LEVEL}); must not be {@code null}
   * @param samples samples in caller order; must not contain {@code null}
   * @return new series
   */
  public static TimeSeries of(String quantity, List<Sample> samples) {
    return new TimeSeries(quantity, samples);
  }

  /**
   * Creates a sea-level series keeping the supplied order.
   *
   * @param samples samples in caller order
   * @return new series
   */
  public static TimeSeries seaLevel(List<Sample> samples) {
    return new TimeSeries(SEA_LEVEL, samples);
  }

  /**
   * Creates a series sorted with {@link #CHRONOLOGICAL}.
   *
   * @param quantity quantity name; must not be {@code null}
   * @param samples samples in any order
   * @return new, sorted series
   */
  public static TimeSeries sorted(String quantity, Collection<Sample> samples) {
    List<Sample> copy = new ArrayList<>(samples);
    copy.sort(CHRONOLOGICAL);
    return new TimeSeries(quantity, copy);
  }

  /**
   * Returns an empty series of the given quantity.
   *
   * @param quantity quantity name
   * @return empty series
   */
  public static TimeSeries empty(String quantity) {
    return new TimeSeries(quantity, List.of());
  }

  /**
   * Returns a new series of the same quantity holding {@code replacement}.
   *
   * @param replacement samples for the new series
   * @return new series
   */
  public TimeSeries withSamples(List<Sample> replacement) {
    return new TimeSeries(quantity, replacement);
  }

  public String quantity() {
    return quantity;
  }

  public List<Sample> samples() {
    return samples;
  }

  public int size() {
    return samples.size();
  }

  public boolean isEmpty() {
    return samples.isEmpty();
  }

  /**
   * Indicates whether timestamps are non-decreasing.
   *
   * @return {@code true} for empty series and series sorted by timestamp
   */
  public boolean isChronological() {
    return chronological;
  }

  /**
   * Counts samples that carry a level.
   *
   * @return number of present samples
   */
  public int presentCount() {
    int count = 0;
    for (Sample sample : samples) {
      if (sample.isPresent()) {
        count++;
      }
    }
    return count;
  }

  /**
   * Returns the timestamps in series order.
   *
   * @return unmodifiable list of timestamps
   */
  public List<LocalDateTime> timestamps() {
    List<LocalDateTime> result = new ArrayList<>(samples.size());
    for (Sample sample : samples) {
      result.add(sample.timestamp());
    }
    return List.copyOf(result);
  }

  public Optional<LocalDateTime> firstTimestamp() {
    return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(0).timestamp());
  }

  public Optional<LocalDateTime> lastTimestamp() {
    return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(samples.size() - 1).timestamp());
  }

  private static boolean checkChronological(List<Sample> samples) {
    for (int i = 1; i < samples.size(); i++) {
      if (samples.get(i).timestamp().isBefore(samples.get(i - 1).timestamp())) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeSeries other)) {
      return false;
    }
    return quantity.equals(other.quantity) && samples.equals(other.samples);
  }

  @Override
  public int hashCode() {
    return Objects.hash(quantity, samples);
  }

  @Override
  public String toString() {
    return "TimeSeries{" + quantity + ", size=" + samples.size()
        + firstTimestamp().map(ts -> ", from=" + ts).orElse("")
        + lastTimestamp().map(ts -> ", to=" + ts).orElse("") + '}';
  }
}
