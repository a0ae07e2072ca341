package ca.gc.dfo.tides.application.pipeline;

import ca.gc.dfo.tides.application.analysis.MeanRemover;
import ca.gc.dfo.tides.application.port.MetricsPort;
import ca.gc.dfo.tides.application.port.ReportWriter;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.domain.station.StationRecord;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a station and writes a mean-removed year or range; backs {@code tides extract}.
 *
 * <p>An empty selection is written as an empty series and counted under {@code tides.extract.empty}.
 *
 * @since 0.1.0
 */
public final class SeriesExtractionUseCase {
  private static final Logger log = LoggerFactory.getLogger(SeriesExtractionUseCase.class);

  private final StationLoader loader;
  private final MeanRemover meanRemover;
  private final MetricsPort metrics;

  public SeriesExtractionUseCase(StationLoader loader, MeanRemover meanRemover, MetricsPort metrics) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.meanRemover = Objects.requireNonNull(meanRemover, "meanRemover");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Extracts and writes the selection.
   *
   * @param source station directory or single data file
   * @param selection year or range
   * @param writer destination
   * @return mean-removed selection, possibly empty
   * @throws IOException if loading or writing fails
   */
  public TimeSeries run(Path source, ExtractionSelection selection, ReportWriter writer) throws IOException {
    Objects.requireNonNull(selection, "selection");
    Objects.requireNonNull(writer, "writer");
    StationRecord record = loader.load(source);
    TimeSeries extracted = selection.isYear()
        ? meanRemover.extractYearRemoveMean(selection.year().getAsInt(), record.series())
        : meanRemover.extractRangeRemoveMean(selection.start().get(), selection.end().get(), record.series());
    if (extracted.isEmpty()) {
      metrics.increment("tides.extract.empty");
    } else {
      log.info("Extracted {} samples for {}", extracted.size(), selection.describe());
    }
    writer.writeSeries(record.station(), selection.describe(), extracted);
    return extracted;
  }
}
