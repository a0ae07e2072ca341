package ca.gc.dfo.tides.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings with precedence CLI &gt; YAML &gt; defaults.
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration map.
   *
   * @param mode active CLI mode
   * @param yaml optional YAML-derived settings for the mode
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the mode
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged selection is contradictory
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);

    // A CLI year replaces a YAML range and vice versa.
    if (cliCopy.containsKey("year") && !cliCopy.containsKey("start") && !cliCopy.containsKey("end")) {
      merged.put("start", "");
      merged.put("end", "");
    }
    if ((cliCopy.containsKey("start") || cliCopy.containsKey("end")) && !cliCopy.containsKey("year")) {
      merged.put("year", "");
    }

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (!"extract".equalsIgnoreCase(mode.trim())) {
      return;
    }
    boolean year = !trim(effective.get("year")).isEmpty();
    boolean start = !trim(effective.get("start")).isEmpty();
    boolean end = !trim(effective.get("end")).isEmpty();
    if (year && (start || end)) {
      throw new IllegalArgumentException("year cannot be combined with start/end");
    }
    if (start != end) {
      throw new IllegalArgumentException("start and end must be given together");
    }
    if (!year && !start) {
      throw new IllegalArgumentException("extract requires year=YYYY or start=... end=...");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
