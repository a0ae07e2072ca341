package ca.gc.dfo.tides.config;

import java.util.Locale;

/**
 * Output rendering selected with {@code format=}.
 *
 * @since 0.1.0
 */
public enum ReportFormat {
  TEXT,
  JSON;

  /**
   * Parses a format name, ignoring case; blank selects {@link #TEXT}.
   *
   * @param raw format name
   * @return parsed format
   * @throws IllegalArgumentException if the name is unknown
   */
  public static ReportFormat parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return TEXT;
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "text" -> TEXT;
      case "json" -> JSON;
      default -> throw new IllegalArgumentException("format must be text or json (was '" + raw + "')");
    };
  }
}
