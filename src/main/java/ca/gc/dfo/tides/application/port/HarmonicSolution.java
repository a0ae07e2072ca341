package ca.gc.dfo.tides.application.port;

import java.util.Objects;

/**
 * Raw solver output: amplitudes in the input unit and phases in radians, positionally aligned with the configured
 * constituents.
 *
 * @param amplitudes amplitude per constituent
 * @param phasesRadians phase lag per constituent in radians
 * @param meanLevel fitted constant term
 * @since 0.1.0
 */
public record HarmonicSolution(double[] amplitudes, double[] phasesRadians, double meanLevel) {
  public HarmonicSolution {
    amplitudes = Objects.requireNonNull(amplitudes, "amplitudes").clone();
    phasesRadians = Objects.requireNonNull(phasesRadians, "phasesRadians").clone();
  }

  @Override
  public double[] amplitudes() {
    return amplitudes.clone();
  }

  @Override
  public double[] phasesRadians() {
    return phasesRadians.clone();
  }
}
