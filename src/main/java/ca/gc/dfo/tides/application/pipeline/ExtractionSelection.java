package ca.gc.dfo.tides.application.pipeline;

import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Either a calendar year or an inclusive time range to extract.
 *
 * @param year calendar year when selecting by year
 * @param start range start when selecting by range
 * @param end range end when selecting by range
 * @since 0.1.0
 */
public record ExtractionSelection(OptionalInt year, Optional<LocalDateTime> start, Optional<LocalDateTime> end) {

  public ExtractionSelection {
    year = Objects.requireNonNullElse(year, OptionalInt.empty());
    start = Objects.requireNonNullElse(start, Optional.empty());
    end = Objects.requireNonNullElse(end, Optional.empty());
    boolean range = start.isPresent() && end.isPresent();
    if (year.isPresent() == range || start.isPresent() != end.isPresent()) {
      throw new IllegalArgumentException("select either a year or both start and end");
    }
  }

  public static ExtractionSelection ofYear(int year) {
    return new ExtractionSelection(OptionalInt.of(year), Optional.empty(), Optional.empty());
  }

  public static ExtractionSelection ofRange(LocalDateTime start, LocalDateTime end) {
    return new ExtractionSelection(
        OptionalInt.empty(),
        Optional.of(Objects.requireNonNull(start, "start")),
        Optional.of(Objects.requireNonNull(end, "end")));
  }

  public boolean isYear() {
    return year.isPresent();
  }

  /**
   * Returns a short label such as {@code "year 2020"}.
   *
   * @return label used in reports and logs
   */
  public String describe() {
    if (isYear()) {
      return "year " + year.getAsInt();
    }
    return "range " + start.get() + " to " + end.get();
  }
}
