package ca.gc.dfo.tides.domain.series;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Maximal run of present samples spaced by the nominal sampling interval.
 *
 * @param samples samples in the run, chronological; never empty
 * @since 0.1.0
 */
public record ContiguousBlock(List<Sample> samples) {

  public ContiguousBlock {
    samples = List.copyOf(Objects.requireNonNull(samples, "samples"));
    if (samples.isEmpty()) {
      throw new IllegalArgumentException("contiguous block must contain at least one sample");
    }
  }

  public LocalDateTime start() {
    return samples.get(0).timestamp();
  }

  public LocalDateTime end() {
    return samples.get(samples.size() - 1).timestamp();
  }

  public int size() {
    return samples.size();
  }

  /**
   * Returns the time covered from first to last sample.
   *
   * @return span of the block; zero for a single-sample block
   */
  public Duration span() {
    return Duration.between(start(), end());
  }
}
