package ca.gc.dfo.tides.domain.station;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Station identification read from a tide-gauge file header.
 *
 * @param site human-readable site name; never blank
 * @param port gauge/port code when the header supplies one
 * @param latitude decimal degrees north when supplied
 * @param longitude decimal degrees east when supplied
 * @since 0.1.0
 */
public record StationMetadata(
    String site, Optional<String> port, OptionalDouble latitude, OptionalDouble longitude) {

  public StationMetadata {
    Objects.requireNonNull(site, "site");
    if (site.isBlank()) {
      throw new IllegalArgumentException("site must not be blank");
    }
    port = Objects.requireNonNullElse(port, Optional.empty());
    latitude = Objects.requireNonNullElse(latitude, OptionalDouble.empty());
    longitude = Objects.requireNonNullElse(longitude, OptionalDouble.empty());
  }

  /**
   * Creates metadata carrying only a site name.
   *
   * @param site site name
   * @return metadata without port or coordinates
   */
  public static StationMetadata named(String site) {
    return new StationMetadata(site, Optional.empty(), OptionalDouble.empty(), OptionalDouble.empty());
  }
}
