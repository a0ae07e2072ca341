package ca.gc.dfo.tides.config;

import ca.gc.dfo.tides.application.analysis.ContiguityScanner;
import ca.gc.dfo.tides.application.analysis.HarmonicAnalyzer;
import ca.gc.dfo.tides.application.analysis.MeanRemover;
import ca.gc.dfo.tides.application.analysis.SeriesMerger;
import ca.gc.dfo.tides.application.analysis.TrendEstimator;
import ca.gc.dfo.tides.application.pipeline.SeriesExtractionUseCase;
import ca.gc.dfo.tides.application.pipeline.StationAnalysisUseCase;
import ca.gc.dfo.tides.application.pipeline.StationLoader;
import ca.gc.dfo.tides.application.port.MetricsPort;
import ca.gc.dfo.tides.application.port.ReportWriter;
import ca.gc.dfo.tides.application.port.TideGaugeReader;
import ca.gc.dfo.tides.infrastructure.harmonic.LeastSquaresHarmonicSolver;
import ca.gc.dfo.tides.infrastructure.ingest.TideGaugeFileReader;
import ca.gc.dfo.tides.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.dfo.tides.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.dfo.tides.infrastructure.report.JsonReportWriter;
import ca.gc.dfo.tides.infrastructure.report.TextReportWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * <strong>What:</strong> Wires use cases to concrete adapters from a typed configuration.
 * <p><strong>Role:</strong> Composition root shared by the {@code analyze} and {@code extract} commands.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Select the metrics adapter from {@code metricsExporter}.</li>
 *   <li>Build the analysis and extraction use cases.</li>
 *   <li>Open the report writer for the configured format and destination.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Factory methods create fresh graphs; not synchronized.</p>
 * <p><strong>Lifecycle:</strong> {@link #close()} flushes and shuts down the metrics adapter when it holds one.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private final MetricsPort metrics;
  private final TideGaugeReader reader;

  /**
   * Creates a root whose metrics adapter follows {@code metricsExporter}.
   *
   * @param metricsExporter {@code otlp} for OpenTelemetry, anything else disables metrics
   */
  public CompositionRoot(String metricsExporter) {
    this(selectMetrics(metricsExporter), new TideGaugeFileReader());
  }

  /**
   * Creates a root with explicit collaborators.
   *
   * @param metrics metrics sink
   * @param reader tide-gauge reader
   */
  public CompositionRoot(MetricsPort metrics, TideGaugeReader reader) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.reader = Objects.requireNonNull(reader, "reader");
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public StationLoader stationLoader() {
    return new StationLoader(reader, new SeriesMerger(), metrics);
  }

  /**
   * Builds the analysis use case.
   *
   * @param config analyze settings
   * @return wired use case
   */
  public StationAnalysisUseCase analysisUseCase(AnalyzeConfig config) {
    Objects.requireNonNull(config, "config");
    return new StationAnalysisUseCase(
        stationLoader(),
        new TrendEstimator(),
        new ContiguityScanner(config.contiguityInterval(), config.contiguityTolerance()),
        new HarmonicAnalyzer(
            new LeastSquaresHarmonicSolver(config.astronomicalArguments()), config.missingPolicy()),
        metrics);
  }

  public SeriesExtractionUseCase extractionUseCase() {
    return new SeriesExtractionUseCase(stationLoader(), new MeanRemover(), metrics);
  }

  /**
   * Opens the report writer.
   *
   * @param format rendering
   * @param output destination file; empty writes to {@code stdout}
   * @param stdout supplies the console writer; the returned writer flushes but never closes it
   * @return report writer; the caller closes it
   * @throws IOException if the destination cannot be opened
   */
  public static ReportWriter openReportWriter(ReportFormat format, Optional<Path> output, Supplier<Writer> stdout)
      throws IOException {
    Writer target;
    boolean owned;
    if (output.isPresent()) {
      target = Files.newBufferedWriter(output.get(), StandardCharsets.UTF_8);
      owned = true;
    } else {
      target = stdout.get();
      owned = false;
    }
    return switch (format) {
      case JSON -> new JsonReportWriter(target, owned);
      case TEXT -> new TextReportWriter(target, owned);
    };
  }

  /** Flushes and releases the metrics adapter. */
  @Override
  public void close() {
    if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
      otel.close();
    }
  }

  private static MetricsPort selectMetrics(String exporter) {
    String normalized = exporter == null ? "" : exporter.trim().toLowerCase(Locale.ROOT);
    if ("otlp".equals(normalized)) {
      return new OpenTelemetryMetricsAdapter();
    }
    return new NoOpMetricsAdapter();
  }
}
