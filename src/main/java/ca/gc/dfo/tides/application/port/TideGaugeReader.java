package ca.gc.dfo.tides.application.port;

import ca.gc.dfo.tides.domain.station.StationRecord;
import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Port turning one tide-gauge file into a sea-level series.
 * <p><strong>Role:</strong> Input boundary of the analysis layer; everything past this port sees explicit missing
 * markers, never raw sentinels.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be stateless or thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface TideGaugeReader {
  /**
   * Reads a single file.
   *
   * @param file file to read
   * @return station metadata and its sea-level series in file order
   * @throws java.nio.file.NoSuchFileException if the file does not exist
   * @throws IOException if the file cannot be read or a row is malformed
   */
  StationRecord read(Path file) throws IOException;
}
