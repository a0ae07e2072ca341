package ca.gc.dfo.tides.application.pipeline;

import ca.gc.dfo.tides.application.analysis.ContiguityScanner;
import ca.gc.dfo.tides.application.analysis.HarmonicAnalyzer;
import ca.gc.dfo.tides.application.analysis.TrendEstimator;
import ca.gc.dfo.tides.application.port.MetricsPort;
import ca.gc.dfo.tides.application.port.ReportWriter;
import ca.gc.dfo.tides.domain.error.HarmonicAnalysisException;
import ca.gc.dfo.tides.domain.error.InsufficientDataException;
import ca.gc.dfo.tides.domain.series.ContiguousBlock;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.domain.station.StationRecord;
import ca.gc.dfo.tides.domain.tide.HarmonicResult;
import ca.gc.dfo.tides.domain.tide.StationReport;
import ca.gc.dfo.tides.domain.tide.TrendResult;
import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Runs the full analysis of one station directory and writes a {@link StationReport}.
 * <p><strong>Why:</strong> Gives operators the rise rate, the cleanest record period and the tidal constituents in a
 * single pass.</p>
 * <p><strong>Role:</strong> Application-layer use case behind {@code tides analyze}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load and merge the station files.</li>
 *   <li>Fit the sea-level trend; too few annual means is reported, not fatal.</li>
 *   <li>Find the longest contiguous run and decompose it into constituents.</li>
 *   <li>Hand the report to the {@link ReportWriter}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; one run per call.</p>
 * <p><strong>Performance:</strong> Dominated by the harmonic solve over the longest run.</p>
 * <p><strong>Observability:</strong> Sets MDC key {@code tides.station}; emits {@code tides.trend.insufficient},
 * {@code tides.harmonic.latencyNanos} and {@code tides.analysis.completed}.</p>
 *
 * @since 0.1.0
 */
public final class StationAnalysisUseCase {
  private static final Logger log = LoggerFactory.getLogger(StationAnalysisUseCase.class);

  private final StationLoader loader;
  private final TrendEstimator trendEstimator;
  private final ContiguityScanner contiguityScanner;
  private final HarmonicAnalyzer harmonicAnalyzer;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param loader station loader
   * @param trendEstimator trend component
   * @param contiguityScanner contiguity component
   * @param harmonicAnalyzer harmonic component
   * @param metrics metrics sink
   */
  public StationAnalysisUseCase(
      StationLoader loader,
      TrendEstimator trendEstimator,
      ContiguityScanner contiguityScanner,
      HarmonicAnalyzer harmonicAnalyzer,
      MetricsPort metrics) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.trendEstimator = Objects.requireNonNull(trendEstimator, "trendEstimator");
    this.contiguityScanner = Objects.requireNonNull(contiguityScanner, "contiguityScanner");
    this.harmonicAnalyzer = Objects.requireNonNull(harmonicAnalyzer, "harmonicAnalyzer");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Analyzes a station.
   *
   * @param source station directory or single data file
   * @param constituents constituents to fit; empty skips harmonic analysis
   * @param referenceEpoch phase origin; empty uses the first sample of the longest run at UTC
   * @param writer destination of the report
   * @return the report written
   * @throws IOException if loading or writing fails
   */
  public StationReport run(
      Path source, List<String> constituents, Optional<ZonedDateTime> referenceEpoch, ReportWriter writer)
      throws IOException {
    Objects.requireNonNull(constituents, "constituents");
    Objects.requireNonNull(referenceEpoch, "referenceEpoch");
    Objects.requireNonNull(writer, "writer");
    StationRecord record = loader.load(source);
    MDC.put("tides.station", record.station().site());
    try {
      TimeSeries series = record.series();
      Optional<TrendResult> trend = estimateTrend(series);
      Optional<ContiguousBlock> block = contiguityScanner.longestBlock(series);
      block.ifPresent(b -> log.info("Longest contiguous period {} to {} ({} samples)", b.start(), b.end(), b.size()));
      Optional<HarmonicResult> harmonics = Optional.empty();
      if (block.isPresent() && !constituents.isEmpty()) {
        ZonedDateTime epoch = referenceEpoch.orElseGet(() -> block.get().start().atZone(ZoneOffset.UTC));
        harmonics = analyzeHarmonics(series.withSamples(block.get().samples()), constituents, epoch);
      }

      StationReport report = new StationReport(
          record.station(),
          record.fileCount(),
          series.size(),
          series.presentCount(),
          series.firstTimestamp(),
          series.lastTimestamp(),
          trend,
          block,
          harmonics);
      writer.writeStationReport(report);
      metrics.increment("tides.analysis.completed");
      return report;
    } finally {
      MDC.remove("tides.station");
    }
  }

  private Optional<TrendResult> estimateTrend(TimeSeries series) {
    try {
      TrendResult trend = trendEstimator.seaLevelRiseRate(series);
      log.info("Sea-level rise {} mm/yr over {} annual means",
          trend.rateMillimetresPerYear(), trend.annualMeans().size());
      return Optional.of(trend);
    } catch (InsufficientDataException ex) {
      metrics.increment("tides.trend.insufficient");
      log.warn("Skipping sea-level trend: {}", ex.getMessage());
      return Optional.empty();
    }
  }

  private Optional<HarmonicResult> analyzeHarmonics(
      TimeSeries run, List<String> constituents, ZonedDateTime epoch) {
    long startNanos = System.nanoTime();
    try {
      return Optional.of(harmonicAnalyzer.analyzeConstituents(run, constituents, epoch));
    } catch (HarmonicAnalysisException ex) {
      metrics.increment("tides.harmonic.failed");
      log.warn("Skipping harmonic analysis: {}", ex.getMessage());
      return Optional.empty();
    } finally {
      metrics.observe("tides.harmonic.latencyNanos", System.nanoTime() - startNanos);
    }
  }
}
