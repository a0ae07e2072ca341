package ca.gc.dfo.tides.application.analysis;

import ca.gc.dfo.tides.domain.error.InsufficientDataException;
import ca.gc.dfo.tides.domain.error.InvalidSeriesException;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.domain.tide.AnnualMean;
import ca.gc.dfo.tides.domain.tide.TrendResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Estimates the long-term sea-level rise rate from annual means.
 * <p><strong>Why:</strong> Averaging per calendar year removes the tidal and seasonal signal before the linear fit.</p>
 * <p><strong>Role:</strong> Analysis component producing {@link TrendResult}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Average present samples per calendar year; years with no valid sample are dropped.</li>
 *   <li>Fit an ordinary least-squares line of annual mean against year.</li>
 *   <li>Report the slope in millimetres per year.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; a fresh regression is built per call.</p>
 *
 * @since 0.1.0
 */
public final class TrendEstimator {
  /** Minimum number of annual means needed for a line. */
  public static final int MIN_ANNUAL_MEANS = 2;

  private static final Logger log = LoggerFactory.getLogger(TrendEstimator.class);
  private static final double MILLIMETRES_PER_METRE = 1000.0;

  /**
   * Fits the rise rate.
   *
   * @param series sea-level series ordered by timestamp
   * @return trend with the rate in mm/yr and fit diagnostics
   * @throws InvalidSeriesException if the series is not an ordered sea-level series
   * @throws InsufficientDataException if fewer than two years carry a valid sample
   */
  public TrendResult seaLevelRiseRate(TimeSeries series) {
    SeriesPreconditions.requireSeaLevel(series, "seaLevelRiseRate");
    List<AnnualMean> means = annualMeans(series);
    if (means.size() < MIN_ANNUAL_MEANS) {
      throw new InsufficientDataException(
          "sea-level trend needs at least " + MIN_ANNUAL_MEANS + " annual means (found " + means.size() + ")",
          means.size(),
          MIN_ANNUAL_MEANS);
    }

    SimpleRegression regression = new SimpleRegression(true);
    for (AnnualMean mean : means) {
      regression.addData(mean.year(), mean.meanLevel());
    }
    double slope = regression.getSlope();
    log.debug("Fitted trend over {} annual means: slope={} m/yr r={}", means.size(), slope, regression.getR());
    return new TrendResult(
        slope * MILLIMETRES_PER_METRE,
        slope,
        regression.getIntercept(),
        regression.getR(),
        regression.getSlopeStdErr(),
        regression.getSignificance(),
        means);
  }

  /**
   * Computes calendar-year means of the present samples.
   *
   * @param series sea-level series
   * @return annual means ascending by year; years without a present sample are omitted
   */
  public List<AnnualMean> annualMeans(TimeSeries series) {
    Map<Integer, double[]> sums = new TreeMap<>();
    for (Sample sample : series.samples()) {
      if (!sample.isPresent()) {
        continue;
      }
      double[] acc = sums.computeIfAbsent(sample.timestamp().getYear(), year -> new double[2]);
      acc[0] += sample.value();
      acc[1] += 1;
    }
    List<AnnualMean> means = new ArrayList<>(sums.size());
    for (Map.Entry<Integer, double[]> entry : sums.entrySet()) {
      double[] acc = entry.getValue();
      means.add(new AnnualMean(entry.getKey(), acc[0] / acc[1], (int) acc[1]));
    }
    return means;
  }
}
