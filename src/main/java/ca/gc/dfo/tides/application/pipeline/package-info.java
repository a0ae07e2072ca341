/**
 * <strong>Purpose:</strong> Use cases wiring ingestion, the analytical core and report output.
 * <p><strong>Pipeline role:</strong> Application layer invoked by the CLI; collaborators arrive through ports.
 * <p><strong>Concurrency:</strong> Each run is synchronous and single-threaded.
 * <p><strong>Metrics:</strong> Emits {@code tides.*} counters through {@link ca.gc.dfo.tides.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.application.pipeline;
