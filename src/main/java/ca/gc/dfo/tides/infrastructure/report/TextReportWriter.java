package ca.gc.dfo.tides.infrastructure.report;

import ca.gc.dfo.tides.application.port.ReportWriter;
import ca.gc.dfo.tides.domain.series.ContiguousBlock;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.domain.station.StationMetadata;
import ca.gc.dfo.tides.domain.tide.ConstituentEstimate;
import ca.gc.dfo.tides.domain.tide.HarmonicResult;
import ca.gc.dfo.tides.domain.tide.StationReport;
import ca.gc.dfo.tides.domain.tide.TrendResult;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.Locale;
import java.util.Objects;

/**
 * Human-readable report writer; the default {@code format=text} output.
 *
 * @since 0.1.0
 */
public final class TextReportWriter implements ReportWriter {
  private static final String MISSING = "NaN";

  private final PrintWriter out;
  private final boolean closeTarget;

  /**
   * Creates a writer.
   *
   * @param out destination
   * @param closeTarget whether {@link #close()} closes {@code out}
   */
  public TextReportWriter(Writer out, boolean closeTarget) {
    Objects.requireNonNull(out, "out");
    this.out = out instanceof PrintWriter printWriter ? printWriter : new PrintWriter(out);
    this.closeTarget = closeTarget;
  }

  @Override
  public void writeStationReport(StationReport report) throws IOException {
    Objects.requireNonNull(report, "report");
    StationMetadata station = report.station();
    out.println("Station: " + describe(station));
    out.println("Files merged: " + report.fileCount());
    out.println("Samples: " + report.sampleCount() + " (" + report.presentCount() + " valid)");
    if (report.firstTimestamp().isPresent() && report.lastTimestamp().isPresent()) {
      out.println("Period: " + report.firstTimestamp().get() + " to " + report.lastTimestamp().get());
    }

    if (report.trend().isPresent()) {
      TrendResult trend = report.trend().get();
      out.println(format("Sea-level rise: %.3f mm/yr (r=%.3f, p=%s, %d annual means)",
          trend.rateMillimetresPerYear(),
          trend.correlation(),
          Double.isNaN(trend.significance()) ? "n/a" : format("%.4g", trend.significance()),
          trend.annualMeans().size()));
    } else {
      out.println("Sea-level rise: not enough annual means");
    }

    if (report.longestBlock().isPresent()) {
      ContiguousBlock block = report.longestBlock().get();
      out.println("Longest contiguous period: " + block.start() + " to " + block.end()
          + " (" + block.size() + " samples)");
    } else {
      out.println("Longest contiguous period: none");
    }

    if (report.harmonics().isPresent()) {
      HarmonicResult harmonics = report.harmonics().get();
      out.println("Harmonic analysis (epoch " + harmonics.referenceEpoch() + ", "
          + harmonics.samplesUsed() + " samples, Z0=" + format("%.4f", harmonics.meanLevel()) + "):");
      out.println(format("  %-6s %12s %12s", "Name", "Amplitude", "Phase(deg)"));
      for (ConstituentEstimate estimate : harmonics.estimates().values()) {
        out.println(format("  %-6s %12.4f %12.2f", estimate.name(), estimate.amplitude(), estimate.phaseDegrees()));
      }
    }
    flush();
  }

  @Override
  public void writeSeries(StationMetadata station, String description, TimeSeries series) throws IOException {
    Objects.requireNonNull(series, "series");
    out.println("# Station: " + describe(station));
    out.println("# Selection: " + description + " (" + series.size() + " samples, mean removed)");
    out.println("# time," + series.quantity());
    for (Sample sample : series.samples()) {
      out.println(sample.timestamp() + "," + (sample.isPresent() ? format("%.4f", sample.value()) : MISSING));
    }
    flush();
  }

  @Override
  public void close() throws IOException {
    if (closeTarget) {
      out.close();
      if (out.checkError()) {
        throw new IOException("Failed to write text report");
      }
    } else {
      flush();
    }
  }

  private void flush() throws IOException {
    out.flush();
    if (out.checkError()) {
      throw new IOException("Failed to write text report");
    }
  }

  private static String describe(StationMetadata station) {
    if (station == null) {
      return "unknown";
    }
    StringBuilder sb = new StringBuilder(station.site());
    station.port().ifPresent(port -> sb.append(" [").append(port).append(']'));
    if (station.latitude().isPresent() && station.longitude().isPresent()) {
      sb.append(format(" (%.5f, %.5f)", station.latitude().getAsDouble(), station.longitude().getAsDouble()));
    }
    return sb.toString();
  }

  private static String format(String pattern, Object... args) {
    return String.format(Locale.ROOT, pattern, args);
  }
}
