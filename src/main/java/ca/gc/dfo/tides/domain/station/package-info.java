/**
 * Station identification carried alongside ingested series.
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.domain.station;
