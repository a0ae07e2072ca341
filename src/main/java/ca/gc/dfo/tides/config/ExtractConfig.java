package ca.gc.dfo.tides.config;

import ca.gc.dfo.tides.application.pipeline.ExtractionSelection;
import ca.gc.dfo.tides.validation.Numbers;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for {@code tides extract}.
 *
 * @param source station directory or single data file
 * @param selection year or inclusive range
 * @param format report rendering
 * @param output report file; empty writes to standard output
 * @param metricsExporter {@code none} or {@code otlp}
 * @param dryRun validate and print the plan without reading data
 * @since 0.1.0
 */
public record ExtractConfig(
    Path source,
    ExtractionSelection selection,
    ReportFormat format,
    Optional<Path> output,
    String metricsExporter,
    boolean dryRun) {

  public ExtractConfig {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(selection, "selection");
    format = Objects.requireNonNullElse(format, ReportFormat.TEXT);
    output = Objects.requireNonNullElse(output, Optional.empty());
    metricsExporter = Objects.requireNonNullElse(metricsExporter, "none");
  }

  /**
   * Builds a configuration from a merged key/value map.
   *
   * @param options merged options
   * @return validated configuration
   * @throws IllegalArgumentException if the selection is missing, contradictory or malformed
   */
  public static ExtractConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path source = ConfigValues.requirePath(options, "dir");
    Optional<String> year = ConfigValues.optional(options, "year");
    Optional<String> start = ConfigValues.optional(options, "start");
    Optional<String> end = ConfigValues.optional(options, "end");

    ExtractionSelection selection;
    if (year.isPresent()) {
      if (start.isPresent() || end.isPresent()) {
        throw new IllegalArgumentException("year cannot be combined with start/end");
      }
      selection = ExtractionSelection.ofYear((int) Numbers.parseRange("year", year.get(), 1, 9999));
    } else if (start.isPresent() && end.isPresent()) {
      LocalDateTime from = TemporalValues.parseLocal("start", start.get(), false);
      LocalDateTime to = TemporalValues.parseLocal("end", end.get(), true);
      if (from.isAfter(to)) {
        throw new IllegalArgumentException("start " + from + " is after end " + to);
      }
      selection = ExtractionSelection.ofRange(from, to);
    } else {
      throw new IllegalArgumentException("extract requires year=YYYY or both start= and end=");
    }
    return new ExtractConfig(
        source,
        selection,
        ReportFormat.parse(options.get("format")),
        ConfigValues.optionalPath(options, "out"),
        ConfigValues.valueOr(options, "metricsExporter", "none"),
        ConfigValues.parseBoolean(options.get("dryRun"), false));
  }
}
