package ca.gc.dfo.tides.domain.tide;

import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Linear trend fitted to annual mean sea level.
 * <p><strong>Role:</strong> Output of the trend estimator; only {@link #rateMillimetresPerYear()} is part of the
 * contract, the remaining fields are fit diagnostics.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param rateMillimetresPerYear slope converted to millimetres per year
 * @param slopeMetresPerYear raw fitted slope in metres per year
 * @param intercept fitted intercept in metres (at year zero)
 * @param correlation Pearson correlation coefficient r
 * @param slopeStandardError standard error of the slope in metres per year
 * @param significance two-sided p-value of the slope; {@code NaN} with only two points
 * @param annualMeans annual means the line was fitted through, ascending by year
 * @since 0.1.0
 */
public record TrendResult(
    double rateMillimetresPerYear,
    double slopeMetresPerYear,
    double intercept,
    double correlation,
    double slopeStandardError,
    double significance,
    List<AnnualMean> annualMeans) {

  public TrendResult {
    annualMeans = List.copyOf(Objects.requireNonNull(annualMeans, "annualMeans"));
  }
}
