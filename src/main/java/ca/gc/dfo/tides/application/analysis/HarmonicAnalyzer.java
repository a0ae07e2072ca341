package ca.gc.dfo.tides.application.analysis;

import ca.gc.dfo.tides.application.port.HarmonicSolution;
import ca.gc.dfo.tides.application.port.HarmonicSolver;
import ca.gc.dfo.tides.domain.error.HarmonicAnalysisException;
import ca.gc.dfo.tides.domain.error.InvalidSeriesException;
import ca.gc.dfo.tides.domain.error.TidalAnalysisException;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.domain.tide.ConstituentEstimate;
import ca.gc.dfo.tides.domain.tide.HarmonicResult;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Decomposes a sea-level series into per-constituent amplitude and phase.
 * <p><strong>Why:</strong> Keeps sample preparation and unit conversion out of the solver so any
 * {@link HarmonicSolver} can be plugged in.</p>
 * <p><strong>Role:</strong> Analysis component wrapping the {@link HarmonicSolver} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Convert timestamps (read as UTC) to seconds elapsed since the reference epoch.</li>
 *   <li>Apply the configured {@link MissingValuePolicy}.</li>
 *   <li>Convert solver phases from radians to degrees and pair them with the requested names.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; thread-safe when the solver is.</p>
 * <p><strong>Performance:</strong> Linear preparation; cost is dominated by the solver.</p>
 * <p><strong>Observability:</strong> Logs sample counts at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class HarmonicAnalyzer {
  private static final Logger log = LoggerFactory.getLogger(HarmonicAnalyzer.class);

  private final HarmonicSolver solver;
  private final MissingValuePolicy missingPolicy;

  /**
   * Creates an analyzer that drops missing samples.
   *
   * @param solver decomposition routine
   */
  public HarmonicAnalyzer(HarmonicSolver solver) {
    this(solver, MissingValuePolicy.EXCLUDE);
  }

  /**
   * Creates an analyzer.
   *
   * @param solver decomposition routine
   * @param missingPolicy treatment of missing samples
   */
  public HarmonicAnalyzer(HarmonicSolver solver, MissingValuePolicy missingPolicy) {
    this.solver = Objects.requireNonNull(solver, "solver");
    this.missingPolicy = Objects.requireNonNull(missingPolicy, "missingPolicy");
  }

  public MissingValuePolicy missingPolicy() {
    return missingPolicy;
  }

  /**
   * Estimates amplitude and phase for each named constituent.
   *
   * @param series sea-level series ordered by timestamp
   * @param constituentNames constituents to fit, in the order the result must follow
   * @param referenceEpoch time origin for phases
   * @return one estimate per name; amplitudes in metres, phases in degrees
   * @throws IllegalArgumentException if {@code constituentNames} is empty or holds duplicates
   * @throws InvalidSeriesException if the series is not an ordered sea-level series
   * @throws HarmonicAnalysisException if no usable samples remain or the solver fails
   */
  public HarmonicResult analyzeConstituents(
      TimeSeries series, List<String> constituentNames, ZonedDateTime referenceEpoch) {
    Objects.requireNonNull(constituentNames, "constituentNames");
    Objects.requireNonNull(referenceEpoch, "referenceEpoch");
    SeriesPreconditions.requireSeaLevel(series, "analyzeConstituents");
    List<String> names = validateNames(constituentNames);

    List<Sample> usable = prepare(series.samples());
    if (usable.isEmpty()) {
      throw new HarmonicAnalysisException("no valid samples available for harmonic analysis");
    }
    long epochSecond = referenceEpoch.toEpochSecond();
    double[] elapsed = new double[usable.size()];
    double[] values = new double[usable.size()];
    for (int i = 0; i < usable.size(); i++) {
      Sample sample = usable.get(i);
      elapsed[i] = sample.timestamp().toEpochSecond(ZoneOffset.UTC) - epochSecond;
      values[i] = sample.value();
    }
    log.debug("Harmonic analysis of {} constituents over {} samples (policy={}, epoch={})",
        names.size(), usable.size(), missingPolicy, referenceEpoch);

    HarmonicSolution solution;
    try {
      solution = solver.configure(names, referenceEpoch).analyze(elapsed, values);
    } catch (TidalAnalysisException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      throw new HarmonicAnalysisException("harmonic solver failed: " + ex.getMessage(), ex);
    }
    if (solution == null) {
      throw new HarmonicAnalysisException("harmonic solver returned no solution");
    }

    double[] amplitudes = solution.amplitudes();
    double[] phases = solution.phasesRadians();
    if (amplitudes.length != names.size() || phases.length != names.size()) {
      throw new HarmonicAnalysisException("solver returned " + amplitudes.length + " amplitudes and "
          + phases.length + " phases for " + names.size() + " constituents");
    }
    List<ConstituentEstimate> estimates = new ArrayList<>(names.size());
    for (int i = 0; i < names.size(); i++) {
      estimates.add(new ConstituentEstimate(names.get(i), amplitudes[i], Math.toDegrees(phases[i])));
    }
    return new HarmonicResult(estimates, referenceEpoch, usable.size(), solution.meanLevel());
  }

  private static List<String> validateNames(List<String> constituentNames) {
    if (constituentNames.isEmpty()) {
      throw new IllegalArgumentException("at least one constituent is required");
    }
    Set<String> seen = new HashSet<>();
    for (String name : constituentNames) {
      if (name == null || name.isBlank()) {
        throw new IllegalArgumentException("constituent names must not be blank");
      }
      // Constituent names are case-insensitive in the solver.
      if (!seen.add(name.trim().toUpperCase(Locale.ROOT))) {
        throw new IllegalArgumentException("duplicate constituent: " + name);
      }
    }
    return List.copyOf(constituentNames);
  }

  private List<Sample> prepare(List<Sample> samples) {
    return switch (missingPolicy) {
      case EXCLUDE -> presentOnly(samples);
      case REJECT -> {
        for (Sample sample : samples) {
          if (!sample.isPresent()) {
            throw new HarmonicAnalysisException(
                "missing sample at " + sample.timestamp() + " and policy is REJECT");
          }
        }
        yield samples;
      }
      case INTERPOLATE -> interpolate(samples);
    };
  }

  private static List<Sample> presentOnly(List<Sample> samples) {
    List<Sample> present = new ArrayList<>(samples.size());
    for (Sample sample : samples) {
      if (sample.isPresent()) {
        present.add(sample);
      }
    }
    return present;
  }

  private static List<Sample> interpolate(List<Sample> samples) {
    int first = -1;
    int last = -1;
    for (int i = 0; i < samples.size(); i++) {
      if (samples.get(i).isPresent()) {
        if (first < 0) {
          first = i;
        }
        last = i;
      }
    }
    if (first < 0) {
      return List.of();
    }
    List<Sample> filled = new ArrayList<>(last - first + 1);
    Sample before = samples.get(first);
    int i = first;
    while (i <= last) {
      Sample sample = samples.get(i);
      if (sample.isPresent()) {
        filled.add(sample);
        before = sample;
        i++;
        continue;
      }
      int next = i;
      while (!samples.get(next).isPresent()) {
        next++;
      }
      Sample after = samples.get(next);
      for (int k = i; k < next; k++) {
        filled.add(linear(before, after, samples.get(k).timestamp()));
      }
      i = next;
    }
    return filled;
  }

  private static Sample linear(Sample before, Sample after, LocalDateTime at) {
    long t0 = before.timestamp().toEpochSecond(ZoneOffset.UTC);
    long t1 = after.timestamp().toEpochSecond(ZoneOffset.UTC);
    if (t1 == t0) {
      return Sample.of(at, before.value());
    }
    double ratio = (double) (at.toEpochSecond(ZoneOffset.UTC) - t0) / (t1 - t0);
    return Sample.of(at, before.value() + ratio * (after.value() - before.value()));
  }
}
