package ca.gc.dfo.tides.domain.tide;

import ca.gc.dfo.tides.domain.series.ContiguousBlock;
import ca.gc.dfo.tides.domain.station.StationMetadata;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything produced for one station directory: span of the merged record plus each analytical product
 * that could be computed.
 *
 * @param station station metadata taken from the first file header
 * @param fileCount number of files merged
 * @param sampleCount samples in the merged series
 * @param presentCount samples carrying a level
 * @param firstTimestamp earliest sample, empty for an empty record
 * @param lastTimestamp latest sample, empty for an empty record
 * @param trend rise-rate fit, empty when fewer than two annual means exist
 * @param longestBlock longest contiguous run, empty when no sample is present
 * @param harmonics harmonic decomposition of the longest run, empty when it was not computed
 * @since 0.1.0
 */
public record StationReport(
    StationMetadata station,
    int fileCount,
    int sampleCount,
    int presentCount,
    Optional<LocalDateTime> firstTimestamp,
    Optional<LocalDateTime> lastTimestamp,
    Optional<TrendResult> trend,
    Optional<ContiguousBlock> longestBlock,
    Optional<HarmonicResult> harmonics) {

  public StationReport {
    Objects.requireNonNull(station, "station");
    firstTimestamp = Objects.requireNonNullElse(firstTimestamp, Optional.empty());
    lastTimestamp = Objects.requireNonNullElse(lastTimestamp, Optional.empty());
    trend = Objects.requireNonNullElse(trend, Optional.empty());
    longestBlock = Objects.requireNonNullElse(longestBlock, Optional.empty());
    harmonics = Objects.requireNonNullElse(harmonics, Optional.empty());
  }
}
