package ca.gc.dfo.tides.domain.error;

import java.util.Objects;

/**
 * Base unchecked exception for analysis failures, tagged with an {@link ErrorKind}.
 *
 * @since 0.1.0
 */
public class TidalAnalysisException extends RuntimeException {
  private final ErrorKind kind;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param kind failure category; must not be {@code null}
   * @param message human-readable error
   */
  public TidalAnalysisException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param kind failure category; must not be {@code null}
   * @param message human-readable error
   * @param cause root cause
   */
  public TidalAnalysisException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  /**
   * Returns the failure category.
   *
   * @return error kind
   */
  public ErrorKind kind() {
    return kind;
  }
}
