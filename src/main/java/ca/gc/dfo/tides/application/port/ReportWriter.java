package ca.gc.dfo.tides.application.port;

import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.domain.station.StationMetadata;
import ca.gc.dfo.tides.domain.tide.StationReport;
import java.io.IOException;

/**
 * <strong>What:</strong> Output boundary rendering analysis results for operators.
 * <p><strong>Role:</strong> Application port implemented by text and JSON adapters.</p>
 * <p><strong>Thread-safety:</strong> Not required; pipelines write from a single thread.</p>
 *
 * @since 0.1.0
 */
public interface ReportWriter extends AutoCloseable {
  /**
   * Writes a full station report.
   *
   * @param report report to render
   * @throws IOException if the destination cannot be written
   */
  void writeStationReport(StationReport report) throws IOException;

  /**
   * Writes a series, typically a mean-removed extraction.
   *
   * @param station station the series belongs to
   * @param description short label of the selection (for example {@code "year 2020"})
   * @param series series to write; may be empty
   * @throws IOException if the destination cannot be written
   */
  void writeSeries(StationMetadata station, String description, TimeSeries series) throws IOException;

  /**
   * Flushes and releases the destination.
   *
   * @throws IOException if flushing fails
   */
  @Override
  void close() throws IOException;
}
