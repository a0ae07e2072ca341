package ca.gc.dfo.tides.config;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses the ISO-8601 date and time values accepted by {@code epoch=}, {@code start=} and {@code end=}.
 */
final class TemporalValues {

  private TemporalValues() {}

  /**
   * Parses a reference epoch. Zone-less values are read as UTC.
   *
   * @param name key name for diagnostics
   * @param raw {@code 2020-01-01}, {@code 2020-01-01T00:00}, {@code 2020-01-01T00:00Z} or a zoned form such as
   *     {@code 2020-01-01T00:00+01:00[Europe/London]}
   * @return parsed instant with its zone
   */
  static ZonedDateTime parseEpoch(String name, String raw) {
    String text = raw.trim();
    if (text.indexOf('T') < 0) {
      return parseDate(name, raw, text).atStartOfDay(ZoneOffset.UTC);
    }
    try {
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
      if (parsed instanceof ZonedDateTime zoned) {
        return zoned;
      }
      return ((LocalDateTime) parsed).atZone(ZoneOffset.UTC);
    } catch (DateTimeParseException ex) {
      throw invalid(name, raw, ex);
    }
  }

  /**
   * Parses a range bound; a date alone means the start of that day, or its end when {@code endOfDay} is set.
   *
   * @param name key name for diagnostics
   * @param raw {@code 2020-01-01} or {@code 2020-01-01T06:00[:00]}
   * @param endOfDay whether a bare date extends to the last instant of the day
   * @return parsed local timestamp
   */
  static LocalDateTime parseLocal(String name, String raw, boolean endOfDay) {
    String text = raw.trim();
    if (text.indexOf('T') < 0) {
      LocalDate date = parseDate(name, raw, text);
      return endOfDay ? date.atTime(LocalTime.MAX) : date.atStartOfDay();
    }
    try {
      return LocalDateTime.parse(text);
    } catch (DateTimeParseException ex) {
      throw invalid(name, raw, ex);
    }
  }

  private static LocalDate parseDate(String name, String raw, String text) {
    try {
      return LocalDate.parse(text);
    } catch (DateTimeParseException ex) {
      throw invalid(name, raw, ex);
    }
  }

  private static IllegalArgumentException invalid(String name, String raw, DateTimeParseException cause) {
    return new IllegalArgumentException(name + " must be an ISO-8601 date or date-time (was '" + raw + "')", cause);
  }
}
