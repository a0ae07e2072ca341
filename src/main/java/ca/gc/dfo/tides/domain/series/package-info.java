/**
 * <strong>Purpose:</strong> Time-series value types shared by ingestion, analysis and reporting.
 * <p><strong>Pipeline role:</strong> Domain layer; no infrastructure dependencies.
 * <p><strong>Concurrency:</strong> All types are immutable and safe to share across threads.
 * <p><strong>Performance:</strong> Series are fully materialized lists; there is no streaming mode.
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.domain.series;
