/**
 * <strong>Purpose:</strong> Tide-gauge file ingestion.
 * <p><strong>Pipeline role:</strong> Infrastructure adapter for {@link ca.gc.dfo.tides.application.port.TideGaugeReader};
 * the only place the {@code -99.0} sentinel is recognised.
 * <p><strong>Concurrency:</strong> Readers are stateless.
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.infrastructure.ingest;
