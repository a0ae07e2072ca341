/**
 * <strong>Purpose:</strong> Analytical core: extraction with mean removal, merging, contiguity, trend and harmonic
 * decomposition.
 * <p><strong>Pipeline role:</strong> Application layer; components are pure functions over immutable
 * {@link ca.gc.dfo.tides.domain.series.TimeSeries} values and never perform I/O.
 * <p><strong>Concurrency:</strong> Components hold no mutable state and may be shared across threads.
 * <p><strong>Errors:</strong> Structural problems raise
 * {@link ca.gc.dfo.tides.domain.error.InvalidSeriesException}; empty selections return empty series.
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.application.analysis;
