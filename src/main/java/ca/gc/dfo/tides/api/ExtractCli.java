package ca.gc.dfo.tides.api;

import ca.gc.dfo.tides.application.port.ReportWriter;
import ca.gc.dfo.tides.config.CompositionRoot;
import ca.gc.dfo.tides.config.ConfigMerger;
import ca.gc.dfo.tides.config.DefaultsForMode;
import ca.gc.dfo.tides.config.ExtractConfig;
import ca.gc.dfo.tides.config.YamlConfigLoader;
import ca.gc.dfo.tides.domain.error.TidalAnalysisException;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.logging.LoggingConfigurator;
import ca.gc.dfo.tides.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code tides extract}: writes a year or an inclusive range of a station with its mean removed.
 *
 * @since 0.1.0
 */
public final class ExtractCli {
  private static final Logger log = LoggerFactory.getLogger(ExtractCli.class);
  private static final String SUMMARY_USAGE =
      "usage: extract dir=PATH (year=YYYY | start=DATE[THH:mm:ss] end=DATE[THH:mm:ss]) [format=text|json] "
          + "[out=FILE] [config=FILE] [--dry-run] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      tides extract

      Usage:
        extract dir=./station year=2020 [options]
        extract ./station start=2020-01-01 end=2020-03-31T23:00:00 [options]

      Required:
        dir=PATH                  Station directory of *.txt files, or a single data file
        year=YYYY                 Calendar year to extract, or
        start=DATE end=DATE       Inclusive range; a date-only end covers the whole day

      Optional (validated):
        format=text|json          Output rendering (default text)
        out=FILE                  Write the series to FILE instead of standard output
        config=FILE               YAML configuration (common + extract sections)
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        --dry-run                 Validate inputs and print the plan without reading data
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ExtractCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Executes the extract command.
   *
   * @param args arguments following the command name
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for extract CLI");
    }

    Map<String, String> kv;
    Optional<Path> configPath;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgsWithDirectory()));
      configPath = YamlConfigLoader.takeConfigPath(kv);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yamlConfig = Optional.empty();
    if (configPath.isPresent()) {
      Path yamlPath = configPath.get();
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        return ExitCode.CONFIG_ERROR;
      }
      try {
        yamlConfig = YamlConfigLoader.load(yamlPath, "extract");
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    ExtractConfig config;
    boolean dryRun;
    try {
      Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          "extract", yamlConfig, kv, DefaultsForMode.asFlatMap("extract"), log::warn));
      TelemetryConfigurator.configureMetrics(effective);
      config = ExtractConfig.fromMap(effective);
      dryRun = input.hasFlag("--dry-run") || config.dryRun();
      Paths.validateReadableSource(config.source());
      config.output().ifPresent(Paths::validateWritableFile);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid extract arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      CliPrinter.printLines(
          "Extract dry-run: no data will be read.",
          " Source          : " + config.source(),
          " Selection       : " + config.selection().describe(),
          " Format          : " + config.format(),
          " Output          : " + config.output().map(Path::toString).orElse("<stdout>"),
          " Metrics exporter: " + config.metricsExporter(),
          " Re-run without --dry-run to extract the series.");
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(config.metricsExporter());
         ReportWriter writer =
             CompositionRoot.openReportWriter(config.format(), config.output(), CliPrinter::reportWriter)) {
      TimeSeries extracted = root.extractionUseCase().run(config.source(), config.selection(), writer);
      log.info("Extract completed: {} samples for {}", extracted.size(), config.selection().describe());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Extract I/O failure for {}", config.source(), ex);
      return ExitCode.IO_ERROR;
    } catch (TidalAnalysisException ex) {
      log.error("Extraction from {} failed ({}): {}", config.source(), ex.kind(), ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("Extract configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in extract", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }
}
