/**
 * Core domain model for tide-gauge ingestion, analysis and reporting.
 * <p><strong>Role:</strong> Domain layer describing series, stations and analytical results without infrastructure
 * dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; safe to share across threads.</p>
 * <p><strong>Performance:</strong> Whole series are materialized; copies happen once at construction.</p>
 */
package ca.gc.dfo.tides.domain;
