package ca.gc.dfo.tides.application.pipeline;

import static ca.gc.dfo.tides.testutil.SeriesFixtures.writeGaugeFile;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.dfo.tides.application.analysis.MeanRemover;
import ca.gc.dfo.tides.application.analysis.SeriesMerger;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.infrastructure.ingest.TideGaugeFileReader;
import ca.gc.dfo.tides.infrastructure.report.TextReportWriter;
import ca.gc.dfo.tides.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SeriesExtractionUseCaseTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2020, 12, 31, 22, 0);

  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final SeriesExtractionUseCase useCase = new SeriesExtractionUseCase(
      new StationLoader(new TideGaugeFileReader(), new SeriesMerger(), metrics), new MeanRemover(), metrics);

  @Test
  void extractsYearWithMeanRemovedAndWritesIt() throws IOException {
    writeGaugeFile(tempDir.resolve("s.txt"), "Testport", List.of(
        Sample.of(T0, 1.0), Sample.of(T0.plusHours(1), 3.0), Sample.of(T0.plusHours(2), 50.0)));
    StringWriter buffer = new StringWriter();

    TimeSeries extracted;
    try (TextReportWriter writer = new TextReportWriter(buffer, false)) {
      extracted = useCase.run(tempDir, ExtractionSelection.ofYear(2020), writer);
    }

    assertEquals(2, extracted.size());
    assertEquals(-1.0, extracted.samples().get(0).value(), 1e-12);
    assertTrue(buffer.toString().contains("# Selection: year 2020 (2 samples, mean removed)"));
    assertTrue(buffer.toString().contains("2020-12-31T23:00,1.0000"));
  }

  @Test
  void emptyRangeIsCountedAndWritten() throws IOException {
    writeGaugeFile(tempDir.resolve("s.txt"), "Testport", List.of(Sample.of(T0, 1.0)));
    StringWriter buffer = new StringWriter();

    TimeSeries extracted;
    try (TextReportWriter writer = new TextReportWriter(buffer, false)) {
      extracted = useCase.run(tempDir, ExtractionSelection.ofRange(
          LocalDateTime.of(1990, 1, 1, 0, 0), LocalDateTime.of(1990, 2, 1, 0, 0)), writer);
    }

    assertTrue(extracted.isEmpty());
    assertEquals(1, metrics.count("tides.extract.empty"));
    assertTrue(buffer.toString().contains("(0 samples, mean removed)"));
  }

  @Test
  void selectionMustBeYearOrRange() {
    assertThrows(IllegalArgumentException.class, () -> new ExtractionSelection(null, null, null));
    assertEquals("year 2020", ExtractionSelection.ofYear(2020).describe());
  }
}
