/**
 * Metrics adapters bridging {@link ca.gc.dfo.tides.application.port.MetricsPort} to OpenTelemetry or a no-op sink.
 * <p><strong>Concurrency:</strong> Implementations are thread-safe.</p>
 * <p><strong>Metrics:</strong> Publishes under the {@code tides.*} namespace.</p>
 */
package ca.gc.dfo.tides.infrastructure.metrics;
