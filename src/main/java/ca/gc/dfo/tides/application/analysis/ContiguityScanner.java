package ca.gc.dfo.tides.application.analysis;

import ca.gc.dfo.tides.domain.error.InvalidSeriesException;
import ca.gc.dfo.tides.domain.series.ContiguousBlock;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Finds runs of present samples spaced by the nominal sampling interval.
 * <p><strong>Why:</strong> Harmonic fits behave best on an unbroken record; the longest run is the cleanest
 * sub-range a station offers.</p>
 * <p><strong>Role:</strong> Analysis component consulted before {@link HarmonicAnalyzer}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open a new block at the first sample, at every missing sample and at every gap whose distance from the
 *   nominal interval exceeds the tolerance.</li>
 *   <li>Pick the largest block; ties go to the earliest.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 * <p><strong>Performance:</strong> Single linear pass.</p>
 *
 * @since 0.1.0
 */
public final class ContiguityScanner {
  /** Hourly records. */
  public static final Duration DEFAULT_INTERVAL = Duration.ofHours(1);
  /** Allowed clock drift between consecutive hourly samples. */
  public static final Duration DEFAULT_TOLERANCE = Duration.ofMinutes(1);

  private final Duration interval;
  private final Duration tolerance;

  /** Creates a scanner for hourly data with a one-minute tolerance. */
  public ContiguityScanner() {
    this(DEFAULT_INTERVAL, DEFAULT_TOLERANCE);
  }

  /**
   * Creates a scanner for a custom sampling interval.
   *
   * @param interval nominal spacing; must be positive
   * @param tolerance allowed deviation from {@code interval}; must not be negative
   */
  public ContiguityScanner(Duration interval, Duration tolerance) {
    this.interval = Objects.requireNonNull(interval, "interval");
    this.tolerance = Objects.requireNonNull(tolerance, "tolerance");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive (was " + interval + ")");
    }
    if (tolerance.isNegative()) {
      throw new IllegalArgumentException("tolerance must not be negative (was " + tolerance + ")");
    }
  }

  public Duration interval() {
    return interval;
  }

  public Duration tolerance() {
    return tolerance;
  }

  /**
   * Returns the samples of the longest contiguous block.
   *
   * @param series sea-level series ordered by timestamp
   * @return winning block as a series; empty when the input is empty or entirely missing
   * @throws InvalidSeriesException if the series is not an ordered sea-level series
   */
  public TimeSeries longestContiguousRun(TimeSeries series) {
    return longestBlock(series)
        .map(block -> series.withSamples(block.samples()))
        .orElseGet(() -> TimeSeries.empty(series.quantity()));
  }

  /**
   * Returns the longest contiguous block.
   *
   * @param series sea-level series ordered by timestamp
   * @return winning block, or empty when no sample is present
   * @throws InvalidSeriesException if the series is not an ordered sea-level series
   */
  public Optional<ContiguousBlock> longestBlock(TimeSeries series) {
    ContiguousBlock best = null;
    for (ContiguousBlock block : blocks(series)) {
      if (best == null || block.size() > best.size()) {
        best = block;
      }
    }
    return Optional.ofNullable(best);
  }

  /**
   * Partitions the present samples into contiguous blocks.
   *
   * @param series sea-level series ordered by timestamp
   * @return blocks in chronological order; empty when no sample is present
   * @throws InvalidSeriesException if the series is not an ordered sea-level series
   */
  public List<ContiguousBlock> blocks(TimeSeries series) {
    SeriesPreconditions.requireSeaLevel(series, "longestContiguousRun");
    List<ContiguousBlock> blocks = new ArrayList<>();
    List<Sample> current = new ArrayList<>();
    for (Sample sample : series.samples()) {
      if (!sample.isPresent()) {
        close(current, blocks);
        continue;
      }
      if (!current.isEmpty() && !isContinuation(current.get(current.size() - 1), sample)) {
        close(current, blocks);
      }
      current.add(sample);
    }
    close(current, blocks);
    return List.copyOf(blocks);
  }

  private boolean isContinuation(Sample previous, Sample next) {
    Duration gap = Duration.between(previous.timestamp(), next.timestamp());
    return gap.minus(interval).abs().compareTo(tolerance) <= 0;
  }

  private static void close(List<Sample> current, List<ContiguousBlock> blocks) {
    if (!current.isEmpty()) {
      blocks.add(new ContiguousBlock(current));
      current.clear();
    }
  }
}
