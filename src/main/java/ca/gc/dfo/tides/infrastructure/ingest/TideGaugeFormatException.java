package ca.gc.dfo.tides.infrastructure.ingest;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Signals a tide-gauge row that cannot be parsed.
 *
 * @since 0.1.0
 */
public final class TideGaugeFormatException extends IOException {
  private final Path file;
  private final int lineNumber;

  /**
   * Creates an exception pointing at the offending line.
   *
   * @param file file being read
   * @param lineNumber one-based line number
   * @param message description of the problem
   * @param cause parse failure, may be {@code null}
   */
  public TideGaugeFormatException(Path file, int lineNumber, String message, Throwable cause) {
    super("Error parsing tidal data from '" + file + "' line " + lineNumber + ": " + message, cause);
    this.file = file;
    this.lineNumber = lineNumber;
  }

  public Path file() {
    return file;
  }

  public int lineNumber() {
    return lineNumber;
  }
}
