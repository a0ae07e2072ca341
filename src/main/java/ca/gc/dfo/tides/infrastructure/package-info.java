/**
 * Infrastructure adapters binding tides ports to files, numerics libraries and telemetry.
 * <p><strong>Role:</strong> Tide-gauge file ingestion, least-squares harmonic solving, text/JSON reports and
 * OpenTelemetry metrics.</p>
 * <p><strong>Concurrency:</strong> Each adapter documents its guarantees; none start background threads except the
 * OTLP metric reader.</p>
 */
package ca.gc.dfo.tides.infrastructure;
