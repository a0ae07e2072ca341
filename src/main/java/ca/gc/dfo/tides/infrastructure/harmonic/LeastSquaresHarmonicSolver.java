package ca.gc.dfo.tides.infrastructure.harmonic;

import ca.gc.dfo.tides.application.port.HarmonicSolution;
import ca.gc.dfo.tides.application.port.HarmonicSolver;
import ca.gc.dfo.tides.domain.error.HarmonicAnalysisException;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.QRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link HarmonicSolver} fitting {@code h(t) = Z0 + sum f A cos(w t + V0 + u - g)} by
 * ordinary least squares.
 * <p><strong>Why:</strong> A direct QR solve of the cosine/sine design matrix handles irregular sampling and gaps
 * without resampling.</p>
 * <p><strong>Role:</strong> Infrastructure adapter behind the solver port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Resolve constituent codes against the built-in catalogue.</li>
 *   <li>When astronomical arguments are enabled, reference phases to Greenwich equilibrium (V0) with nodal
 *   corrections evaluated at the epoch; otherwise phases are relative to the epoch itself.</li>
 *   <li>Recover amplitude {@code sqrt(a^2 + b^2) / f} and phase {@code atan2(b, a)} per constituent.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; sessions are immutable.</p>
 * <p><strong>Performance:</strong> Builds an {@code n x (2K + 1)} dense matrix; QR costs O(n K^2).</p>
 *
 * @since 0.1.0
 */
public final class LeastSquaresHarmonicSolver implements HarmonicSolver {
  private static final Logger log = LoggerFactory.getLogger(LeastSquaresHarmonicSolver.class);
  private static final double SINGULARITY_THRESHOLD = 1e-10;

  private final boolean astronomicalArguments;

  /** Creates a solver that references phases to the astronomical equilibrium argument. */
  public LeastSquaresHarmonicSolver() {
    this(true);
  }

  /**
   * Creates a solver.
   *
   * @param astronomicalArguments {@code true} to apply V0 and nodal corrections; {@code false} for phases relative
   *     to the epoch with unit nodal factors
   */
  public LeastSquaresHarmonicSolver(boolean astronomicalArguments) {
    this.astronomicalArguments = astronomicalArguments;
  }

  public boolean astronomicalArguments() {
    return astronomicalArguments;
  }

  /**
   * Lists the constituent codes this solver can fit.
   *
   * @return codes in catalogue order
   */
  public static List<String> knownConstituents() {
    List<String> codes = new ArrayList<>();
    for (Constituent constituent : Constituent.values()) {
      codes.add(constituent.code());
    }
    return List.copyOf(codes);
  }

  /**
   * Indicates whether {@code name} names a catalogued constituent, ignoring case.
   *
   * @param name constituent code
   * @return {@code true} when the solver can fit it
   */
  public static boolean isKnown(String name) {
    return Constituent.lookup(name).isPresent();
  }

  @Override
  public Session configure(List<String> constituentNames, ZonedDateTime referenceEpoch) {
    Objects.requireNonNull(constituentNames, "constituentNames");
    Objects.requireNonNull(referenceEpoch, "referenceEpoch");
    if (constituentNames.isEmpty()) {
      throw new HarmonicAnalysisException("no constituents requested");
    }
    AstronomicalArguments args = astronomicalArguments ? AstronomicalArguments.at(referenceEpoch) : null;
    List<Term> terms = new ArrayList<>(constituentNames.size());
    for (String name : constituentNames) {
      Constituent constituent = Constituent.lookup(name)
          .orElseThrow(() -> new HarmonicAnalysisException("unknown tidal constituent: " + name));
      terms.add(term(constituent, args));
    }
    return new LeastSquaresSession(List.copyOf(constituentNames), List.copyOf(terms));
  }

  private static Term term(Constituent constituent, AstronomicalArguments args) {
    if (args == null) {
      return new Term(constituent, constituent.radiansPerSecond(), 0.0, 1.0);
    }
    NodalGroup.NodalFactor nodal = constituent.nodalGroup().evaluate(args.n());
    double phase = constituent.equilibriumArgumentDegrees(args) + nodal.uDegrees();
    return new Term(
        constituent,
        constituent.radiansPerSecond(),
        Math.toRadians(AstronomicalArguments.normalize(phase)),
        nodal.f());
  }

  /** One fitted constituent: speed, phase offset (V0 + u) and amplitude factor. */
  private record Term(Constituent constituent, double omega, double phaseOffset, double f) {}

  private static final class LeastSquaresSession implements Session {
    private final List<String> names;
    private final List<Term> terms;

    private LeastSquaresSession(List<String> names, List<Term> terms) {
      this.names = names;
      this.terms = terms;
    }

    @Override
    public List<String> constituents() {
      return names;
    }

    @Override
    public HarmonicSolution analyze(double[] elapsedSeconds, double[] values) {
      Objects.requireNonNull(elapsedSeconds, "elapsedSeconds");
      Objects.requireNonNull(values, "values");
      if (elapsedSeconds.length != values.length) {
        throw new HarmonicAnalysisException("time axis has " + elapsedSeconds.length
            + " entries but values have " + values.length);
      }
      int unknowns = 2 * terms.size() + 1;
      int rows = values.length;
      if (rows < unknowns) {
        throw new HarmonicAnalysisException("harmonic fit of " + terms.size() + " constituents needs at least "
            + unknowns + " samples (found " + rows + ")");
      }

      RealMatrix design = new Array2DRowRealMatrix(rows, unknowns);
      for (int i = 0; i < rows; i++) {
        design.setEntry(i, 0, 1.0);
        for (int k = 0; k < terms.size(); k++) {
          Term term = terms.get(k);
          double theta = term.omega() * elapsedSeconds[i] + term.phaseOffset();
          design.setEntry(i, 1 + 2 * k, Math.cos(theta));
          design.setEntry(i, 2 + 2 * k, Math.sin(theta));
        }
      }

      RealVector coefficients;
      try {
        DecompositionSolver solver = new QRDecomposition(design, SINGULARITY_THRESHOLD).getSolver();
        coefficients = solver.solve(new ArrayRealVector(values, false));
      } catch (MathIllegalArgumentException ex) {
        throw new HarmonicAnalysisException(
            "harmonic design matrix is singular; constituents cannot be separated over this record", ex);
      }

      double[] amplitudes = new double[terms.size()];
      double[] phases = new double[terms.size()];
      for (int k = 0; k < terms.size(); k++) {
        double a = coefficients.getEntry(1 + 2 * k);
        double b = coefficients.getEntry(2 + 2 * k);
        amplitudes[k] = Math.hypot(a, b) / terms.get(k).f();
        phases[k] = Math.atan2(b, a);
      }
      log.debug("Least-squares fit of {} constituents over {} samples; Z0={}",
          terms.size(), rows, coefficients.getEntry(0));
      return new HarmonicSolution(amplitudes, phases, coefficients.getEntry(0));
    }
  }
}
