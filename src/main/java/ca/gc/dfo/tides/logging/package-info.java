/**
 * <strong>Purpose:</strong> Runtime logging controls for the CLI.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.logging;
