/**
 * <strong>Purpose:</strong> Least-squares tidal harmonic solver with a built-in constituent catalogue.
 * <p><strong>Pipeline role:</strong> Infrastructure adapter for
 * {@link ca.gc.dfo.tides.application.port.HarmonicSolver}.
 * <p><strong>Concurrency:</strong> Solver and sessions are immutable.
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.infrastructure.harmonic;
