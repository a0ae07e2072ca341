package ca.gc.dfo.tides.domain.error;

/**
 * <strong>What:</strong> Failure categories shared by ingestion, analysis and the CLI.
 * <p><strong>Why:</strong> Lets callers tell malformed input from "no data" without parsing messages.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ErrorKind {
  /** Input resource is absent; raised by ingestion as {@link java.nio.file.NoSuchFileException}. */
  NOT_FOUND,
  /** Input series lacks the sea-level quantity or chronological ordering. */
  STRUCTURAL_INVALID,
  /** A selection produced no samples; reported as an empty result, never thrown. */
  EMPTY_SELECTION,
  /** Too few annual means to fit a trend. */
  INSUFFICIENT_DATA,
  /** Harmonic solver failure or array shape mismatch. */
  ANALYSIS_ERROR
}
