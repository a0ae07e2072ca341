package ca.gc.dfo.tides.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI mode.
 *
 * <p>The defaults are the single source of truth for optional YAML keys and CLI overrides.
 */
public final class DefaultsForMode {
  /** Constituents fitted when none are requested. */
  public static final String DEFAULT_CONSTITUENTS = "M2,S2,N2,K1,O1";

  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested mode merged with common defaults.
   *
   * @param mode CLI mode ({@code analyze} or {@code extract})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the mode is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "analyze" -> buildAnalyzeDefaults();
      case "extract" -> buildExtractDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dir", "");
    map.put("format", ReportFormat.TEXT.name().toLowerCase(Locale.ROOT));
    map.put("out", "");
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    map.put("dryRun", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildAnalyzeDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("constituents", DEFAULT_CONSTITUENTS);
    map.put("epoch", "");
    map.put("astronomicalArguments", "true");
    map.put("harmonic.missingPolicy", "EXCLUDE");
    map.put("contiguity.intervalMinutes", "60");
    map.put("contiguity.toleranceSeconds", "60");
    return map;
  }

  private static Map<String, String> buildExtractDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("year", "");
    map.put("start", "");
    map.put("end", "");
    return map;
  }
}
