package ca.gc.dfo.tides.domain.tide;

import java.util.Objects;

/**
 * Amplitude and phase estimated for one tidal constituent.
 *
 * @param name constituent identifier as requested by the caller (for example {@code "M2"})
 * @param amplitude amplitude in the series' physical unit (metres for sea level)
 * @param phaseDegrees phase lag in degrees relative to the reference epoch
 * @since 0.1.0
 */
public record ConstituentEstimate(String name, double amplitude, double phaseDegrees) {
  public ConstituentEstimate {
    Objects.requireNonNull(name, "name");
  }
}
