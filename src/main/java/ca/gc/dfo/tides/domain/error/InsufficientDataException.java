package ca.gc.dfo.tides.domain.error;

/**
 * Thrown when too few valid points remain to fit a model.
 *
 * @since 0.1.0
 */
public final class InsufficientDataException extends TidalAnalysisException {
  private final int available;
  private final int required;

  /**
   * Creates an exception describing how many points were found versus needed.
   *
   * @param message human-readable error
   * @param available number of usable points found
   * @param required minimum number of points needed
   */
  public InsufficientDataException(String message, int available, int required) {
    super(ErrorKind.INSUFFICIENT_DATA, message);
    this.available = available;
    this.required = required;
  }

  public int available() {
    return available;
  }

  public int required() {
    return required;
  }
}
