package ca.gc.dfo.tides.application.analysis;

import ca.gc.dfo.tides.domain.error.InvalidSeriesException;
import ca.gc.dfo.tides.domain.series.TimeSeries;

/**
 * Structural checks shared by the analysis components.
 */
final class SeriesPreconditions {

  private SeriesPreconditions() {}

  /**
   * Ensures the series measures sea level and is ordered by timestamp.
   *
   * @param series candidate series
   * @param operation operation name used in diagnostics
   * @return the same series
   * @throws InvalidSeriesException if the series is {@code null}, measures another quantity or is unordered
   */
  static TimeSeries requireSeaLevel(TimeSeries series, String operation) {
    requireSeaLevelQuantity(series, operation);
    if (!series.isChronological()) {
      throw new InvalidSeriesException(operation + " requires a series ordered by timestamp");
    }
    return series;
  }

  /**
   * Ensures the series measures sea level; ordering is not checked.
   *
   * @param series candidate series
   * @param operation operation name used in diagnostics
   * @return the same series
   * @throws InvalidSeriesException if the series is {@code null} or measures another quantity
   */
  static TimeSeries requireSeaLevelQuantity(TimeSeries series, String operation) {
    if (series == null) {
      throw new InvalidSeriesException(operation + " requires a series");
    }
    if (!TimeSeries.SEA_LEVEL.equals(series.quantity())) {
      throw new InvalidSeriesException(
          operation + " requires quantity '" + TimeSeries.SEA_LEVEL + "' (was '" + series.quantity() + "')");
    }
    return series;
  }
}
