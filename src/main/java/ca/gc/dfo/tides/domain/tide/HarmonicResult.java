package ca.gc.dfo.tides.domain.tide;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Outcome of a harmonic analysis: one {@link ConstituentEstimate} per requested constituent.
 * <p><strong>Why:</strong> Keeps the caller's constituent order so reports line up with the request.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @since 0.1.0
 */
public final class HarmonicResult {
  private final Map<String, ConstituentEstimate> estimates;
  private final ZonedDateTime referenceEpoch;
  private final int samplesUsed;
  private final double meanLevel;

  /**
   * Creates a result.
   *
   * @param estimates estimates in requested order; names must be unique
   * @param referenceEpoch time origin for the phases; must not be {@code null}
   * @param samplesUsed number of samples handed to the solver
   * @param meanLevel constant term fitted alongside the constituents
   */
  public HarmonicResult(
      List<ConstituentEstimate> estimates, ZonedDateTime referenceEpoch, int samplesUsed, double meanLevel) {
    Objects.requireNonNull(estimates, "estimates");
    Map<String, ConstituentEstimate> ordered = new LinkedHashMap<>();
    for (ConstituentEstimate estimate : estimates) {
      if (ordered.put(estimate.name(), estimate) != null) {
        throw new IllegalArgumentException("duplicate constituent: " + estimate.name());
      }
    }
    this.estimates = Collections.unmodifiableMap(ordered);
    this.referenceEpoch = Objects.requireNonNull(referenceEpoch, "referenceEpoch");
    this.samplesUsed = samplesUsed;
    this.meanLevel = meanLevel;
  }

  /**
   * Returns the estimates keyed by constituent name in requested order.
   *
   * @return unmodifiable ordered map
   */
  public Map<String, ConstituentEstimate> estimates() {
    return estimates;
  }

  public List<String> names() {
    return List.copyOf(estimates.keySet());
  }

  public Optional<ConstituentEstimate> estimate(String name) {
    return Optional.ofNullable(estimates.get(name));
  }

  /**
   * Returns amplitudes positionally aligned with {@link #names()}.
   *
   * @return amplitude array
   */
  public double[] amplitudes() {
    List<ConstituentEstimate> values = new ArrayList<>(estimates.values());
    double[] result = new double[values.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = values.get(i).amplitude();
    }
    return result;
  }

  /**
   * Returns phases in degrees positionally aligned with {@link #names()}.
   *
   * @return phase array
   */
  public double[] phasesDegrees() {
    List<ConstituentEstimate> values = new ArrayList<>(estimates.values());
    double[] result = new double[values.size()];
    for (int i = 0; i < result.length; i++) {
      result[i] = values.get(i).phaseDegrees();
    }
    return result;
  }

  public ZonedDateTime referenceEpoch() {
    return referenceEpoch;
  }

  public int samplesUsed() {
    return samplesUsed;
  }

  public double meanLevel() {
    return meanLevel;
  }
}
