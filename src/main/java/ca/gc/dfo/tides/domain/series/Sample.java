package ca.gc.dfo.tides.domain.series;

import java.time.LocalDateTime;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * <strong>What:</strong> One tide-gauge observation: a timestamp paired with a level or an explicit missing marker.
 * <p><strong>Why:</strong> Keeps missingness out of the numeric domain so aggregations never compare against
 * sentinel literals.</p>
 * <p><strong>Role:</strong> Domain value carried by {@link TimeSeries}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for sharing.</p>
 *
 * @param timestamp observation time (second resolution, naive); never {@code null}
 * @param level observed level in metres; empty when the observation is missing
 * @since 0.1.0
 */
public record Sample(LocalDateTime timestamp, OptionalDouble level) {

  /**
   * Normalizes the level so that non-finite values are stored as missing.
   *
   * @param timestamp observation time; must not be {@code null}
   * @param level observed level; {@code null} is treated as missing
   */
  public Sample {
    Objects.requireNonNull(timestamp, "timestamp");
    if (level == null || (level.isPresent() && !Double.isFinite(level.getAsDouble()))) {
      level = OptionalDouble.empty();
    }
  }

  /**
   * Creates a sample from a raw double, coercing {@code NaN} and infinities to missing.
   *
   * @param timestamp observation time; must not be {@code null}
   * @param level raw level in metres
   * @return new sample
   */
  public static Sample of(LocalDateTime timestamp, double level) {
    return new Sample(timestamp, OptionalDouble.of(level));
  }

  /**
   * Creates a sample with no observed level.
   *
   * @param timestamp observation time; must not be {@code null}
   * @return missing sample
   */
  public static Sample missing(LocalDateTime timestamp) {
    return new Sample(timestamp, OptionalDouble.empty());
  }

  /**
   * Indicates whether this sample carries a level.
   *
   * @return {@code true} when the level is present
   */
  public boolean isPresent() {
    return level.isPresent();
  }

  /**
   * Returns the level.
   *
   * @return level in metres
   * @throws NoSuchElementException if the sample is missing
   */
  public double value() {
    return level.orElseThrow();
  }

  /**
   * Returns a copy with {@code offset} subtracted from the level; missing samples stay missing.
   *
   * @param offset amount to subtract
   * @return shifted sample
   */
  public Sample minus(double offset) {
    if (!isPresent()) {
      return this;
    }
    return Sample.of(timestamp, value() - offset);
  }
}
