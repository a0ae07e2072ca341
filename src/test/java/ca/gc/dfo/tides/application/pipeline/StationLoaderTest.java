package ca.gc.dfo.tides.application.pipeline;

import static ca.gc.dfo.tides.testutil.SeriesFixtures.writeGaugeFile;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.dfo.tides.application.analysis.SeriesMerger;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.station.StationRecord;
import ca.gc.dfo.tides.infrastructure.ingest.TideGaugeFileReader;
import ca.gc.dfo.tides.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StationLoaderTest {
  private static final LocalDateTime T0 = LocalDateTime.of(2020, 1, 1, 0, 0);

  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final StationLoader loader = new StationLoader(new TideGaugeFileReader(), new SeriesMerger(), metrics);

  @Test
  void mergesEveryTextFileInNameOrder() throws IOException {
    writeGaugeFile(tempDir.resolve("b.txt"), "Second", List.of(Sample.of(T0, 1.0), Sample.of(T0.plusHours(2), 3.0)));
    writeGaugeFile(tempDir.resolve("a.TXT"), "First", List.of(Sample.of(T0.plusHours(1), 2.0)));
    Files.writeString(tempDir.resolve("notes.md"), "ignored");

    StationRecord record = loader.load(tempDir);

    assertEquals("First", record.station().site());
    assertEquals(2, record.fileCount());
    assertEquals(3, record.series().size());
    assertTrue(record.series().isChronological());
    assertEquals(2, metrics.count("tides.files.loaded"));
    assertEquals(List.of(3L), metrics.observed("tides.samples.loaded"));
  }

  @Test
  void singleFileIsAccepted() throws IOException {
    Path file = writeGaugeFile(tempDir.resolve("only.dat"), "Solo", List.of(Sample.of(T0, 1.0)));

    StationRecord record = loader.load(file);

    assertEquals(1, record.fileCount());
    assertEquals("Solo", record.station().site());
  }

  @Test
  void missingDirectoryOrNoDataFilesIsNoSuchFile() throws IOException {
    assertThrows(NoSuchFileException.class, () -> loader.load(tempDir.resolve("absent")));

    Path empty = Files.createDirectory(tempDir.resolve("empty"));
    assertThrows(NoSuchFileException.class, () -> loader.load(empty));
  }
}
