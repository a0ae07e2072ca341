package ca.gc.dfo.tides.domain.tide;

/**
 * Mean of all present samples within one calendar year.
 *
 * @param year calendar year
 * @param meanLevel arithmetic mean level in metres
 * @param sampleCount number of present samples averaged
 * @since 0.1.0
 */
public record AnnualMean(int year, double meanLevel, int sampleCount) {}
