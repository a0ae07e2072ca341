/**
 * Application layer for the tides toolkit.
 * <p><strong>Role:</strong> Hosts the analytical components, the use cases that chain them and the ports they depend
 * on.</p>
 * <p><strong>Concurrency:</strong> Components are stateless or immutable; use cases run synchronously.</p>
 * <p><strong>Metrics:</strong> Emits {@code tides.*} counters and histograms through the metrics port.</p>
 */
package ca.gc.dfo.tides.application;
