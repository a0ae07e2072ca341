package ca.gc.dfo.tides.domain.station;

import ca.gc.dfo.tides.domain.series.TimeSeries;
import java.util.Objects;

/**
 * A station's metadata paired with the sea-level series read for it.
 *
 * @param station station metadata
 * @param series sea-level series
 * @param fileCount number of source files that contributed to {@code series}
 * @since 0.1.0
 */
public record StationRecord(StationMetadata station, TimeSeries series, int fileCount) {
  public StationRecord {
    Objects.requireNonNull(station, "station");
    Objects.requireNonNull(series, "series");
  }
}
