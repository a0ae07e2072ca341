package ca.gc.dfo.tides.infrastructure.report;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import java.io.IOException;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.Test;

class TextReportWriterTest {

  @Test
  void stationReportListsTrendRunAndConstituents() throws IOException {
    StringWriter buffer = new StringWriter();
    try (TextReportWriter writer = new TextReportWriter(buffer, false)) {
      writer.writeStationReport(ReportFixtures.fullReport());
    }

    String text = buffer.toString();
    assertTrue(text.contains("Station: Aberdeen [P035] (57.14405, -2.08075)"));
    assertTrue(text.contains("Samples: 22 (21 valid)"));
    assertTrue(text.contains("Sea-level rise: 5.000 mm/yr (r=0.990, p=n/a, 2 annual means)"));
    assertTrue(text.contains("Longest contiguous period: 2020-01-01T00:00 to 2020-01-01T01:00 (2 samples)"));
    assertTrue(text.contains("  M2           1.2345        30.50"));
    assertTrue(text.contains("  S2           0.4000      -100.25"));
  }

  @Test
  void bareReportSaysWhatIsMissing() throws IOException {
    StringWriter buffer = new StringWriter();
    try (TextReportWriter writer = new TextReportWriter(buffer, false)) {
      writer.writeStationReport(ReportFixtures.bareReport());
    }

    String text = buffer.toString();
    assertTrue(text.contains("Sea-level rise: not enough annual means"));
    assertTrue(text.contains("Longest contiguous period: none"));
  }

  @Test
  void seriesIsCsvWithNaNForMissing() throws IOException {
    StringWriter buffer = new StringWriter();
    TimeSeries series = TimeSeries.seaLevel(List.of(
        Sample.of(ReportFixtures.T0, -0.5), Sample.missing(ReportFixtures.T0.plusHours(1))));
    try (TextReportWriter writer = new TextReportWriter(buffer, false)) {
      writer.writeSeries(ReportFixtures.STATION, "year 2020", series);
    }

    List<String> lines = buffer.toString().lines().toList();
    assertEquals("# Selection: year 2020 (2 samples, mean removed)", lines.get(1));
    assertEquals("# time,Sea Level", lines.get(2));
    assertEquals("2020-01-01T00:00,-0.5000", lines.get(3));
    assertEquals("2020-01-01T01:00,NaN", lines.get(4));
  }
}
