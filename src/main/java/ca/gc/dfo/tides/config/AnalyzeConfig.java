package ca.gc.dfo.tides.config;

import ca.gc.dfo.tides.application.analysis.MissingValuePolicy;
import ca.gc.dfo.tides.validation.Numbers;
import ca.gc.dfo.tides.validation.Strings;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Settings for {@code tides analyze}.
 * <p><strong>Why:</strong> Turns the merged key/value map into typed, validated values once, before any file is
 * read.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param source station directory or single data file
 * @param constituents constituents to fit, in report order
 * @param epoch phase origin; empty uses the start of the longest contiguous run
 * @param format report rendering
 * @param output report file; empty writes to standard output
 * @param astronomicalArguments whether phases are referenced to the equilibrium argument
 * @param missingPolicy missing-sample treatment for the harmonic fit
 * @param contiguityInterval nominal sampling interval
 * @param contiguityTolerance allowed deviation from the interval
 * @param metricsExporter {@code none} or {@code otlp}
 * @param dryRun validate and print the plan without reading data
 * @since 0.1.0
 * @see ca.gc.dfo.tides.application.pipeline.StationAnalysisUseCase
 */
public record AnalyzeConfig(
    Path source,
    List<String> constituents,
    Optional<ZonedDateTime> epoch,
    ReportFormat format,
    Optional<Path> output,
    boolean astronomicalArguments,
    MissingValuePolicy missingPolicy,
    Duration contiguityInterval,
    Duration contiguityTolerance,
    String metricsExporter,
    boolean dryRun) {

  public AnalyzeConfig {
    Objects.requireNonNull(source, "source");
    constituents = List.copyOf(Objects.requireNonNull(constituents, "constituents"));
    epoch = Objects.requireNonNullElse(epoch, Optional.empty());
    format = Objects.requireNonNullElse(format, ReportFormat.TEXT);
    output = Objects.requireNonNullElse(output, Optional.empty());
    missingPolicy = Objects.requireNonNullElse(missingPolicy, MissingValuePolicy.EXCLUDE);
    Objects.requireNonNull(contiguityInterval, "contiguityInterval");
    Objects.requireNonNull(contiguityTolerance, "contiguityTolerance");
    metricsExporter = Objects.requireNonNullElse(metricsExporter, "none");
  }

  /**
   * Builds a configuration from a merged key/value map.
   *
   * @param options merged options (defaults, YAML and CLI)
   * @return validated configuration
   * @throws IllegalArgumentException if a value is missing or malformed
   */
  public static AnalyzeConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    Path source = ConfigValues.requirePath(options, "dir");
    List<String> constituents = Strings.requireIdentifierList(
        "constituents", ConfigValues.valueOr(options, "constituents", DefaultsForMode.DEFAULT_CONSTITUENTS));
    if (constituents.stream().map(name -> name.toUpperCase(Locale.ROOT)).distinct().count() != constituents.size()) {
      throw new IllegalArgumentException("constituents must not repeat a name");
    }
    Optional<ZonedDateTime> epoch = ConfigValues.optional(options, "epoch")
        .map(value -> TemporalValues.parseEpoch("epoch", value));
    long intervalMinutes = Numbers.parseRange(
        "contiguity.intervalMinutes", ConfigValues.valueOr(options, "contiguity.intervalMinutes", "60"), 1, 1440);
    long toleranceSeconds = Numbers.parseRange(
        "contiguity.toleranceSeconds", ConfigValues.valueOr(options, "contiguity.toleranceSeconds", "60"),
        0, intervalMinutes * 60 - 1);
    return new AnalyzeConfig(
        source,
        constituents,
        epoch,
        ReportFormat.parse(options.get("format")),
        ConfigValues.optionalPath(options, "out"),
        ConfigValues.parseBoolean(options.get("astronomicalArguments"), true),
        MissingValuePolicy.parse(ConfigValues.valueOr(options, "harmonic.missingPolicy", "EXCLUDE")),
        Duration.ofMinutes(intervalMinutes),
        Duration.ofSeconds(toleranceSeconds),
        ConfigValues.valueOr(options, "metricsExporter", "none"),
        ConfigValues.parseBoolean(options.get("dryRun"), false));
  }
}
