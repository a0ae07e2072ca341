package ca.gc.dfo.tides.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup helpers shared by the typed configuration records.
 */
final class ConfigValues {

  private ConfigValues() {}

  static Optional<String> optional(Map<String, String> options, String key) {
    String value = options.get(key);
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  static String valueOr(Map<String, String> options, String key, String fallback) {
    return optional(options, key).orElse(fallback);
  }

  static Path requirePath(Map<String, String> options, String key) {
    return optionalPath(options, key)
        .orElseThrow(() -> new IllegalArgumentException(key + " is required"));
  }

  static Optional<Path> optionalPath(Map<String, String> options, String key) {
    Optional<String> raw = optional(options, key);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(Path.of(raw.get()));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + raw.get(), ex);
    }
  }

  static boolean parseBoolean(String value, boolean defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "true", "yes", "1", "on" -> true;
      case "false", "no", "0", "off" -> false;
      default -> throw new IllegalArgumentException("expected a boolean but got '" + value + "'");
    };
  }
}
