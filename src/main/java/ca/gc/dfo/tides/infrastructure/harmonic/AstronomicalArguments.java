package ca.gc.dfo.tides.infrastructure.harmonic;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;

/**
 * Mean astronomical longitudes, in degrees normalized to [0, 360), at an instant.
 *
 * @param tau mean lunar time
 * @param s mean longitude of the moon
 * @param h mean longitude of the sun
 * @param p longitude of lunar perigee
 * @param n longitude of the moon's ascending node
 * @param p1 longitude of solar perigee
 * @since 0.1.0
 */
record AstronomicalArguments(double tau, double s, double h, double p, double n, double p1) {
  private static final long J2000_EPOCH_SECOND = 946_728_000L;
  private static final double SECONDS_PER_DAY = 86_400.0;
  private static final double DAYS_PER_CENTURY = 36_525.0;

  /**
   * Evaluates the longitudes at {@code instant} using linear expressions in Julian centuries from J2000.
   *
   * @param instant evaluation time; its offset is honoured
   * @return longitudes at {@code instant}
   */
  static AstronomicalArguments at(ZonedDateTime instant) {
    Objects.requireNonNull(instant, "instant");
    double centuries = (instant.toEpochSecond() - J2000_EPOCH_SECOND) / SECONDS_PER_DAY / DAYS_PER_CENTURY;
    ZonedDateTime utc = instant.withZoneSameInstant(ZoneOffset.UTC);
    double utHours = utc.getHour() + utc.getMinute() / 60.0 + utc.getSecond() / 3600.0;

    double s = 218.3164477 + 481_267.88123421 * centuries;
    double h = 280.46646 + 36_000.76983 * centuries;
    double p = 83.3532465 + 4_069.0137287 * centuries;
    double n = 125.04452 - 1_934.136261 * centuries;
    double p1 = 282.94 + 1.7192 * centuries;
    double tau = 180.0 + 15.0 * utHours + h - s;
    return new AstronomicalArguments(
        normalize(tau), normalize(s), normalize(h), normalize(p), normalize(n), normalize(p1));
  }

  /** Doodson's N' = -N. */
  double nPrime() {
    return normalize(-n);
  }

  static double normalize(double degrees) {
    double value = degrees % 360.0;
    return value < 0 ? value + 360.0 : value;
  }
}
