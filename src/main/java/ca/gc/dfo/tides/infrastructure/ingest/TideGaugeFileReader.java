package ca.gc.dfo.tides.infrastructure.ingest;

import ca.gc.dfo.tides.application.port.TideGaugeReader;
import ca.gc.dfo.tides.domain.series.Sample;
import ca.gc.dfo.tides.domain.series.TimeSeries;
import ca.gc.dfo.tides.domain.station.StationMetadata;
import ca.gc.dfo.tides.domain.station.StationRecord;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reads the whitespace-delimited tide-gauge record format into a sea-level series.
 * <p><strong>Why:</strong> Converts raw sentinels and quality flags into explicit missing samples at the boundary
 * so the analysis layer never sees them.</p>
 * <p><strong>Role:</strong> Infrastructure adapter for {@link TideGaugeReader}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Skip the fixed header block, harvesting {@code Key: value} metadata on the way.</li>
 *   <li>Parse {@code cycle date time level residual} rows; the level keeps only its first numeric substring.</li>
 *   <li>Map the {@code -99.0} sentinel and unparseable levels to missing samples.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Streams the file line by line.</p>
 * <p><strong>Observability:</strong> Logs per-file sample counts at DEBUG.</p>
 *
 * @since 0.1.0
 */
public final class TideGaugeFileReader implements TideGaugeReader {
  /** Number of header lines preceding the first data row. */
  public static final int HEADER_LINES = 12;
  /** Raw value marking an absent observation. */
  public static final double MISSING_SENTINEL = -99.0;

  private static final Logger log = LoggerFactory.getLogger(TideGaugeFileReader.class);
  private static final Pattern NUMBER = Pattern.compile("[-+]?[0-9]*\\.?[0-9]+");
  private static final Pattern HEADER_ENTRY = Pattern.compile("^\\s*([A-Za-z][A-Za-z ]*?)\\s*:\\s*(.*?)\\s*$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuu/MM/dd", Locale.ROOT);
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss", Locale.ROOT);

  @Override
  public StationRecord read(Path file) throws IOException {
    if (file == null || !Files.exists(file)) {
      throw new NoSuchFileException(String.valueOf(file), null, "The file was not found");
    }
    Map<String, String> header = new LinkedHashMap<>();
    List<Sample> samples = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
      String line;
      int lineNumber = 0;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (lineNumber <= HEADER_LINES) {
          collectHeader(line, header);
          continue;
        }
        if (line.isBlank()) {
          continue;
        }
        samples.add(parseRow(file, lineNumber, line));
      }
    }
    TimeSeries series = TimeSeries.seaLevel(samples);
    log.debug("Read {} samples ({} present) from {}", series.size(), series.presentCount(), file);
    return new StationRecord(metadata(file, header), series, 1);
  }

  /**
   * Reduces a raw level token to a value.
   *
   * @param raw raw token such as {@code "4.1230M"} or {@code "-99.0000N"}
   * @return parsed level, or empty for the sentinel and tokens without digits
   */
  static OptionalDouble parseLevel(String raw) {
    if (raw == null) {
      return OptionalDouble.empty();
    }
    Matcher matcher = NUMBER.matcher(raw);
    if (!matcher.find()) {
      return OptionalDouble.empty();
    }
    double value = Double.parseDouble(matcher.group());
    if (value == MISSING_SENTINEL) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(value);
  }

  private static Sample parseRow(Path file, int lineNumber, String line) throws TideGaugeFormatException {
    String[] fields = WHITESPACE.split(line.trim());
    if (fields.length < 4) {
      throw new TideGaugeFormatException(
          file, lineNumber, "expected cycle, date, time and level but found " + fields.length + " fields", null);
    }
    LocalDateTime timestamp;
    try {
      timestamp = LocalDateTime.of(LocalDate.parse(fields[1], DATE), LocalTime.parse(fields[2], TIME));
    } catch (DateTimeParseException ex) {
      throw new TideGaugeFormatException(
          file, lineNumber, "invalid timestamp '" + fields[1] + " " + fields[2] + "'", ex);
    }
    return new Sample(timestamp, parseLevel(fields[3]));
  }

  private static void collectHeader(String line, Map<String, String> header) {
    Matcher matcher = HEADER_ENTRY.matcher(line);
    if (matcher.matches() && !matcher.group(2).isEmpty()) {
      header.putIfAbsent(matcher.group(1).toLowerCase(Locale.ROOT), matcher.group(2));
    }
  }

  private static StationMetadata metadata(Path file, Map<String, String> header) {
    String site = Optional.ofNullable(header.get("site"))
        .filter(value -> !value.isBlank())
        .orElseGet(() -> stem(file));
    return new StationMetadata(
        site,
        Optional.ofNullable(header.get("port")),
        coordinate(header.get("latitude")),
        coordinate(header.get("longitude")));
  }

  private static OptionalDouble coordinate(String raw) {
    if (raw == null) {
      return OptionalDouble.empty();
    }
    try {
      return OptionalDouble.of(Double.parseDouble(raw.trim()));
    } catch (NumberFormatException ex) {
      log.debug("Ignoring non-numeric coordinate '{}'", raw);
      return OptionalDouble.empty();
    }
  }

  private static String stem(Path file) {
    Path name = file.getFileName();
    String value = name == null ? file.toString() : name.toString();
    int dot = value.lastIndexOf('.');
    return dot > 0 ? value.substring(0, dot) : value;
  }
}
