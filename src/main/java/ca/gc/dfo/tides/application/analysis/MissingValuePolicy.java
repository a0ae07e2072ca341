package ca.gc.dfo.tides.application.analysis;

import java.util.Locale;

/**
 * How {@link HarmonicAnalyzer} treats missing samples before invoking the solver.
 *
 * @since 0.1.0
 */
public enum MissingValuePolicy {
  /** Drop missing samples; the solver sees an irregular time axis. */
  EXCLUDE,
  /** Fail the analysis when any sample is missing. */
  REJECT,
  /** Linearly fill interior gaps from the neighbouring present samples; leading and trailing gaps are dropped. */
  INTERPOLATE;

  /**
   * Parses a policy name case-insensitively.
   *
   * @param value policy name such as {@code "exclude"}
   * @return matching policy
   * @throws IllegalArgumentException if the name is unknown
   */
  public static MissingValuePolicy parse(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("missing-value policy must not be blank");
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException(
          "Unknown missing-value policy '" + value + "' (expected EXCLUDE, REJECT or INTERPOLATE)", ex);
    }
  }
}
