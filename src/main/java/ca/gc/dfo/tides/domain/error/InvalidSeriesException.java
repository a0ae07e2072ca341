package ca.gc.dfo.tides.domain.error;

/**
 * Thrown when a series is structurally unusable: wrong quantity or timestamps out of order.
 *
 * @since 0.1.0
 */
public final class InvalidSeriesException extends TidalAnalysisException {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public InvalidSeriesException(String message) {
    super(ErrorKind.STRUCTURAL_INVALID, message);
  }
}
