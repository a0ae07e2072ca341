package ca.gc.dfo.tides.application.port;

import ca.gc.dfo.tides.domain.error.HarmonicAnalysisException;
import java.time.ZonedDateTime;
import java.util.List;

/**
 * <strong>What:</strong> Port abstracting a tidal constituent decomposition routine.
 * <p><strong>Why:</strong> Lets the harmonic analyzer run against a deterministic fake in tests and against a real
 * least-squares solver in production.</p>
 * <p><strong>Role:</strong> Application port implemented by adapters such as {@code LeastSquaresHarmonicSolver}.</p>
 * <p><strong>Contract:</strong>
 * <ul>
 *   <li>{@link #configure(List, ZonedDateTime)} fixes the constituent set and the epoch anchoring phases.</li>
 *   <li>{@link Session#analyze(double[], double[])} fits the configured constituents and returns one amplitude and
 *   one phase (radians) per constituent, in configured order.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent {@code configure} calls; sessions are
 * immutable.</p>
 *
 * @since 0.1.0
 */
public interface HarmonicSolver {

  /**
   * Prepares a solver session for the named constituents.
   *
   * @param constituentNames constituent identifiers in the order results must be returned; must not be empty
   * @param referenceEpoch time origin for phases; its offset shifts the phase convention
   * @return configured session
   * @throws HarmonicAnalysisException if a constituent is unknown to the solver
   */
  Session configure(List<String> constituentNames, ZonedDateTime referenceEpoch);

  /**
   * Solver configured for a fixed constituent set and epoch.
   */
  interface Session {
    /**
     * Returns the configured constituent names.
     *
     * @return names in configured order
     */
    List<String> constituents();

    /**
     * Fits the configured constituents.
     *
     * @param elapsedSeconds seconds since the reference epoch for each value
     * @param values observed levels; same length as {@code elapsedSeconds}, no missing entries
     * @return amplitudes and phases ordered as {@link #constituents()}
     * @throws HarmonicAnalysisException if the arrays mismatch or the fit cannot be solved
     */
    HarmonicSolution analyze(double[] elapsedSeconds, double[] values);
  }
}
