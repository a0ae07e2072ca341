package ca.gc.dfo.tides.infrastructure.report;

import ca.gc.dfo.tides.application.port.ReportWriter;
import ca.gc.dfo.tides.domain.series.ContiguousBlock;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.domain.station.StationMetadata;
import ca.gc.dfo.tides.domain.tide.AnnualMean;
import ca.gc.dfo.tides.domain.tide.ConstituentEstimate;
import ca.gc.dfo.tides.domain.tide.HarmonicResult;
import ca.gc.dfo.tides.domain.tide.StationReport;
import ca.gc.dfo.tides.domain.tide.TrendResult;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Writes reports as JSON documents, one per line.
 * <p><strong>Role:</strong> Infrastructure adapter for {@link ReportWriter}; used with {@code format=json}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 * <p><strong>Performance:</strong> Streams through a Jackson {@link JsonGenerator}; no object tree is built.</p>
 *
 * @since 0.1.0
 */
public final class JsonReportWriter implements ReportWriter {
  private static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();
  private final Writer out;
  private final boolean closeTarget;

  /**
   * Creates a writer.
   *
   * @param out destination
   * @param closeTarget whether {@link #close()} closes {@code out}; pass {@code false} for standard output
   */
  public JsonReportWriter(Writer out, boolean closeTarget) {
    this.out = Objects.requireNonNull(out, "out");
    this.closeTarget = closeTarget;
  }

  @Override
  public void writeStationReport(StationReport report) throws IOException {
    Objects.requireNonNull(report, "report");
    try (JsonGenerator gen = newGenerator()) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("type", "station-report");
      writeStation(gen, report.station());
      gen.writeNumberField("fileCount", report.fileCount());
      gen.writeNumberField("sampleCount", report.sampleCount());
      gen.writeNumberField("presentCount", report.presentCount());
      writeTimestamp(gen, "first", report.firstTimestamp());
      writeTimestamp(gen, "last", report.lastTimestamp());
      if (report.trend().isPresent()) {
        writeTrend(gen, report.trend().get());
      }
      if (report.longestBlock().isPresent()) {
        writeBlock(gen, report.longestBlock().get());
      }
      if (report.harmonics().isPresent()) {
        writeHarmonics(gen, report.harmonics().get());
      }
      gen.writeEndObject();
    }
    endDocument();
  }

  @Override
  public void writeSeries(StationMetadata station, String description, TimeSeries series) throws IOException {
    Objects.requireNonNull(series, "series");
    try (JsonGenerator gen = newGenerator()) {
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeStringField("type", "series");
      writeStation(gen, station);
      gen.writeStringField("selection", description);
      gen.writeStringField("quantity", series.quantity());
      gen.writeNumberField("sampleCount", series.size());
      gen.writeArrayFieldStart("samples");
      for (Sample sample : series.samples()) {
        gen.writeStartObject();
        gen.writeStringField("time", sample.timestamp().toString());
        if (sample.isPresent()) {
          gen.writeNumberField("level", sample.value());
        } else {
          gen.writeNullField("level");
        }
        gen.writeEndObject();
      }
      gen.writeEndArray();
      gen.writeEndObject();
    }
    endDocument();
  }

  @Override
  public void close() throws IOException {
    if (closeTarget) {
      out.close();
    } else {
      out.flush();
    }
  }

  private JsonGenerator newGenerator() throws IOException {
    JsonGenerator gen = jsonFactory.createGenerator(out);
    gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    return gen;
  }

  private void endDocument() throws IOException {
    out.write(System.lineSeparator());
    out.flush();
  }

  private static void writeStation(JsonGenerator gen, StationMetadata station) throws IOException {
    if (station == null) {
      return;
    }
    gen.writeObjectFieldStart("station");
    gen.writeStringField("site", station.site());
    if (station.port().isPresent()) {
      gen.writeStringField("port", station.port().get());
    }
    if (station.latitude().isPresent()) {
      gen.writeNumberField("latitude", station.latitude().getAsDouble());
    }
    if (station.longitude().isPresent()) {
      gen.writeNumberField("longitude", station.longitude().getAsDouble());
    }
    gen.writeEndObject();
  }

  private static void writeTrend(JsonGenerator gen, TrendResult trend) throws IOException {
    gen.writeObjectFieldStart("trend");
    writeDouble(gen, "rateMillimetresPerYear", trend.rateMillimetresPerYear());
    writeDouble(gen, "slopeMetresPerYear", trend.slopeMetresPerYear());
    writeDouble(gen, "intercept", trend.intercept());
    writeDouble(gen, "correlation", trend.correlation());
    writeDouble(gen, "slopeStandardError", trend.slopeStandardError());
    writeDouble(gen, "significance", trend.significance());
    gen.writeArrayFieldStart("annualMeans");
    for (AnnualMean mean : trend.annualMeans()) {
      gen.writeStartObject();
      gen.writeNumberField("year", mean.year());
      writeDouble(gen, "meanLevel", mean.meanLevel());
      gen.writeNumberField("sampleCount", mean.sampleCount());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeBlock(JsonGenerator gen, ContiguousBlock block) throws IOException {
    gen.writeObjectFieldStart("longestContiguous");
    gen.writeStringField("start", block.start().toString());
    gen.writeStringField("end", block.end().toString());
    gen.writeNumberField("samples", block.size());
    gen.writeEndObject();
  }

  private static void writeHarmonics(JsonGenerator gen, HarmonicResult result) throws IOException {
    gen.writeObjectFieldStart("harmonics");
    gen.writeStringField("referenceEpoch", result.referenceEpoch().toString());
    gen.writeNumberField("samplesUsed", result.samplesUsed());
    writeDouble(gen, "meanLevel", result.meanLevel());
    gen.writeArrayFieldStart("constituents");
    for (ConstituentEstimate estimate : result.estimates().values()) {
      gen.writeStartObject();
      gen.writeStringField("name", estimate.name());
      writeDouble(gen, "amplitude", estimate.amplitude());
      writeDouble(gen, "phaseDegrees", estimate.phaseDegrees());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  private static void writeTimestamp(JsonGenerator gen, String field, Optional<LocalDateTime> value)
      throws IOException {
    if (value.isPresent()) {
      gen.writeStringField(field, value.get().toString());
    } else {
      gen.writeNullField(field);
    }
  }

  private static void writeDouble(JsonGenerator gen, String field, double value) throws IOException {
    if (Double.isFinite(value)) {
      gen.writeNumberField(field, value);
    } else {
      gen.writeNullField(field);
    }
  }
}
