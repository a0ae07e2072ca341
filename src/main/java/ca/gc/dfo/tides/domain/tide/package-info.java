/**
 * Result types for tidal analysis: harmonic constituents, trend fits and station reports.
 * <p><strong>Concurrency:</strong> Immutable values; safe to share.</p>
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.domain.tide;
