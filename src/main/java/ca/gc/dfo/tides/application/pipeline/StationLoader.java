package ca.gc.dfo.tides.application.pipeline;

import ca.gc.dfo.tides.application.analysis.SeriesMerger;
import ca.gc.dfo.tides.application.port.MetricsPort;
import ca.gc.dfo.tides.application.port.TideGaugeReader;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.domain.station.StationRecord;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Loads every tide-gauge file of a station directory into one merged series.
 * <p><strong>Role:</strong> Shared first stage of the analysis and extraction use cases.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>List {@code *.txt} files in name order; a plain file path loads that file alone.</li>
 *   <li>Read each through the {@link TideGaugeReader} port and merge with {@link SeriesMerger#joinAll}.</li>
 *   <li>Take station metadata from the first file.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Thread-safe when the reader is.</p>
 * <p><strong>Observability:</strong> Increments {@code tides.files.loaded}; observes {@code tides.samples.loaded}.</p>
 *
 * @since 0.1.0
 */
public final class StationLoader {
  private static final Logger log = LoggerFactory.getLogger(StationLoader.class);
  private static final String EXTENSION = ".txt";

  private final TideGaugeReader reader;
  private final SeriesMerger merger;
  private final MetricsPort metrics;

  /**
   * Creates a loader.
   *
   * @param reader per-file reader
   * @param merger merger combining the yearly files
   * @param metrics metrics sink
   */
  public StationLoader(TideGaugeReader reader, SeriesMerger merger, MetricsPort metrics) {
    this.reader = Objects.requireNonNull(reader, "reader");
    this.merger = Objects.requireNonNull(merger, "merger");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Reads and merges a station directory.
   *
   * @param source station directory, or a single data file
   * @return merged record; metadata from the first file in name order
   * @throws NoSuchFileException if {@code source} does not exist or holds no {@code *.txt} files
   * @throws IOException if a file cannot be read or parsed
   */
  public StationRecord load(Path source) throws IOException {
    Objects.requireNonNull(source, "source");
    List<Path> files = listDataFiles(source);
    List<StationRecord> records = new ArrayList<>(files.size());
    for (Path file : files) {
      StationRecord record = reader.read(file);
      metrics.increment("tides.files.loaded");
      log.debug("Loaded {} samples from {}", record.series().size(), file);
      records.add(record);
    }
    List<TimeSeries> parts = new ArrayList<>(records.size());
    for (StationRecord record : records) {
      parts.add(record.series());
    }
    TimeSeries merged = merger.joinAll(parts);
    metrics.observe("tides.samples.loaded", merged.size());
    log.info("Loaded {} files with {} samples for station {}",
        files.size(), merged.size(), records.get(0).station().site());
    return new StationRecord(records.get(0).station(), merged, files.size());
  }

  /**
   * Lists the data files a load would read.
   *
   * @param source station directory or single file
   * @return files in name order
   * @throws NoSuchFileException if {@code source} does not exist or holds no data files
   * @throws IOException if the directory cannot be listed
   */
  public List<Path> listDataFiles(Path source) throws IOException {
    if (!Files.exists(source)) {
      throw new NoSuchFileException(source.toString(), null, "station directory not found");
    }
    if (!Files.isDirectory(source)) {
      return List.of(source);
    }
    List<Path> files;
    try (Stream<Path> stream = Files.list(source)) {
      files = stream
          .filter(Files::isRegularFile)
          .filter(path -> fileName(path).toLowerCase(Locale.ROOT).endsWith(EXTENSION))
          .sorted(Comparator.comparing(StationLoader::fileName))
          .collect(Collectors.toList());
    }
    if (files.isEmpty()) {
      throw new NoSuchFileException(source.toString(), null, "no *" + EXTENSION + " tide-gauge files");
    }
    return files;
  }

  private static String fileName(Path path) {
    Path name = path.getFileName();
    return name == null ? path.toString() : name.toString();
  }
}
