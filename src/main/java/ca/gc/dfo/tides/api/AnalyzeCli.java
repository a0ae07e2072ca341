package ca.gc.dfo.tides.api;

import ca.gc.dfo.tides.application.pipeline.StationAnalysisUseCase;
import ca.gc.dfo.tides.application.port.ReportWriter;
import ca.gc.dfo.tides.config.AnalyzeConfig;
import ca.gc.dfo.tides.config.CompositionRoot;
import ca.gc.dfo.tides.config.ConfigMerger;
import ca.gc.dfo.tides.config.DefaultsForMode;
import ca.gc.dfo.tides.config.YamlConfigLoader;
import ca.gc.dfo.tides.domain.error.TidalAnalysisException;
import ca.gc.dfo.tides.domain.tide.StationReport;
import ca.gc.dfo.tides.infrastructure.harmonic.LeastSquaresHarmonicSolver;
import ca.gc.dfo.tides.logging.LoggingConfigurator;
import ca.gc.dfo.tides.validation.Paths;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for {@code tides analyze}: trend, longest contiguous period and harmonic constituents of one station.
 *
 * @since 0.1.0
 */
public final class AnalyzeCli {
  private static final Logger log = LoggerFactory.getLogger(AnalyzeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: analyze dir=PATH [constituents=M2,S2,...] [epoch=ISO-8601] [format=text|json] [out=FILE] "
          + "[astronomicalArguments=true|false] [harmonic.missingPolicy=EXCLUDE|REJECT|INTERPOLATE] "
          + "[contiguity.intervalMinutes=N] [contiguity.toleranceSeconds=N] [config=FILE] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL] [otelResourceAttributes=K=V,...]";
  private static final String HELP_TEXT = """
      tides analyze

      Usage:
        analyze dir=./station [options]
        analyze ./station [options]

      Required:
        dir=PATH                         Station directory of *.txt files, or a single data file

      Optional (validated):
        constituents=LIST                Comma-separated constituents (default M2,S2,N2,K1,O1)
        epoch=ISO-8601                   Phase origin; default is the start of the longest contiguous period
        astronomicalArguments=true|false Reference phases to Greenwich equilibrium (default true)
        harmonic.missingPolicy=POLICY    EXCLUDE, REJECT or INTERPOLATE missing samples (default EXCLUDE)
        contiguity.intervalMinutes=N     Nominal sampling interval (default 60)
        contiguity.toleranceSeconds=N    Allowed deviation from the interval (default 60)
        format=text|json                 Report rendering (default text)
        out=FILE                         Write the report to FILE instead of standard output
        config=FILE                      YAML configuration (common + analyze sections)
        metricsExporter=otlp|none        Metrics exporter (default none)
        otelEndpoint=URL                 OTLP metrics endpoint when exporter=otlp
        otelResourceAttributes=K=V       Comma-separated OTel resource attributes
        --dry-run                        Validate inputs and print the plan without reading data
        --verbose                        Enable DEBUG logging
        --help                           Show this message
      """;

  private AnalyzeCli() {}

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
   * Executes the analyze command.
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
      log.debug("Verbose logging enabled for analyze CLI");
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
        yamlConfig = YamlConfigLoader.load(yamlPath, "analyze");
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    AnalyzeConfig config;
    boolean dryRun;
    try {
      Map<String, String> effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          "analyze", yamlConfig, kv, DefaultsForMode.asFlatMap("analyze"), log::warn));
      TelemetryConfigurator.configureMetrics(effective);
      config = AnalyzeConfig.fromMap(effective);
      dryRun = input.hasFlag("--dry-run") || config.dryRun();
      requireKnownConstituents(config.constituents());
      Paths.validateReadableSource(config.source());
      config.output().ifPresent(Paths::validateWritableFile);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid analyze arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }

    log.info("Configured analyze: source={}, constituents={}, format={}, metricsExporter={}",
        config.source(), config.constituents(), config.format(), config.metricsExporter());
    try (CompositionRoot root = new CompositionRoot(config.metricsExporter());
         ReportWriter writer =
             CompositionRoot.openReportWriter(config.format(), config.output(), CliPrinter::reportWriter)) {
      StationAnalysisUseCase useCase = root.analysisUseCase(config);
      StationReport report = useCase.run(config.source(), config.constituents(), config.epoch(), writer);
      log.info("Analysis completed for station {} ({} samples)", report.station().site(), report.sampleCount());
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Analyze I/O failure for {}", config.source(), ex);
      return ExitCode.IO_ERROR;
    } catch (TidalAnalysisException ex) {
      log.error("Analysis of {} failed ({}): {}", config.source(), ex.kind(), ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (IllegalArgumentException ex) {
      log.error("Analyze configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in analyze", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void requireKnownConstituents(List<String> constituents) {
    for (String name : constituents) {
      if (!LeastSquaresHarmonicSolver.isKnown(name)) {
        throw new IllegalArgumentException("unknown tidal constituent '" + name + "'; known: "
            + String.join(",", LeastSquaresHarmonicSolver.knownConstituents()));
      }
    }
  }

  private static void printDryRunPlan(AnalyzeConfig config) {
    CliPrinter.printLines(
        "Analyze dry-run: no data will be read.",
        " Source                : " + config.source(),
        " Constituents          : " + String.join(",", config.constituents()),
        " Epoch                 : " + config.epoch().map(Object::toString).orElse("<start of longest period>"),
        " Astronomical arguments: " + config.astronomicalArguments(),
        " Missing policy        : " + config.missingPolicy(),
        " Contiguity interval   : " + config.contiguityInterval(),
        " Contiguity tolerance  : " + config.contiguityTolerance(),
        " Format                : " + config.format(),
        " Output                : " + config.output().map(Path::toString).orElse("<stdout>"),
        " Metrics exporter      : " + config.metricsExporter(),
        " Re-run without --dry-run to analyze the station.");
  }
}
