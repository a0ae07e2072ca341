package ca.gc.dfo.tides.domain.error;

/**
 * Thrown when harmonic decomposition cannot produce a solution.
 *
 * @since 0.1.0
 */
public final class HarmonicAnalysisException extends TidalAnalysisException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public HarmonicAnalysisException(String message) {
    super(ErrorKind.ANALYSIS_ERROR, message);
  }

  /**
   * Creates an exception with a message and underlying solver cause.
   *
   * @param message human-readable error
   * @param cause root cause raised by the solver
   */
  public HarmonicAnalysisException(String message, Throwable cause) {
    super(ErrorKind.ANALYSIS_ERROR, message, cause);
  }
}
