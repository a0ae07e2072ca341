package ca.gc.dfo.tides.api;

import ca.gc.dfo.tides.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Copies telemetry settings into the system properties read by the OpenTelemetry bootstrap.
 */
final class TelemetryConfigurator {
  private static final Logger log = LoggerFactory.getLogger(TelemetryConfigurator.class);
  private static final int MAX_RESOURCE_ATTRIBUTES_LENGTH = 4_096;

  private TelemetryConfigurator() {}

  /**
   * Applies {@code metricsExporter}, {@code otelEndpoint} and {@code otelResourceAttributes}. The exporter is
   * written back normalized; the two OTLP keys are removed from {@code args}.
   *
   * @param args mutable effective configuration
   * @return normalized exporter name, {@code none} when unset
   * @throws IllegalArgumentException if a value is malformed
   */
  static String configureMetrics(Map<String, String> args) {
    String exporter = normalizeExporter(args.get("metricsExporter"));
    if (!exporter.equals("otlp") && !exporter.equals("none")) {
      throw new IllegalArgumentException("metricsExporter must be 'otlp' or 'none'");
    }
    log.debug("Configuring OpenTelemetry metrics exporter: {}", exporter);
    System.setProperty("otel.metrics.exporter", exporter);
    args.put("metricsExporter", exporter);

    String endpoint = trimmed(args.remove("otelEndpoint"));
    if (!endpoint.isEmpty()) {
      validateEndpoint(endpoint);
      log.debug("Configuring OTLP endpoint: {}", endpoint);
      System.setProperty("otel.exporter.otlp.endpoint", endpoint);
    }

    String resourceAttributes = trimmed(args.remove("otelResourceAttributes"));
    if (!resourceAttributes.isEmpty()) {
      Strings.requireNonBlank("otelResourceAttributes", resourceAttributes);
      if (resourceAttributes.length() > MAX_RESOURCE_ATTRIBUTES_LENGTH) {
        throw new IllegalArgumentException(
            "otelResourceAttributes exceeds " + MAX_RESOURCE_ATTRIBUTES_LENGTH + " characters");
      }
      log.debug("Configuring OTEL resource attributes override");
      System.setProperty("otel.resource.attributes", resourceAttributes);
    }
    return exporter;
  }

  private static String normalizeExporter(String raw) {
    String value = trimmed(raw).toLowerCase(Locale.ROOT);
    return value.isEmpty() ? "none" : value;
  }

  private static String trimmed(String raw) {
    return raw == null ? "" : raw.trim();
  }

  private static void validateEndpoint(String raw) {
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme();
      if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
        throw new IllegalArgumentException("otelEndpoint must use http or https scheme");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException("otelEndpoint must include a host");
      }
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("otelEndpoint must be a valid URI", ex);
    }
  }
}
