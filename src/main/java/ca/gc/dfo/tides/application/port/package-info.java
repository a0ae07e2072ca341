/**
 * <strong>Purpose:</strong> Ports defining the ingestion, solver, reporting and metrics contracts.
 * <p><strong>Pipeline role:</strong> Application layer; adapters in {@code ca.gc.dfo.tides.infrastructure} implement
 * these interfaces.</p>
 * <p><strong>Concurrency:</strong> Port implementations must be thread-safe unless documented otherwise.</p>
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.application.port;
