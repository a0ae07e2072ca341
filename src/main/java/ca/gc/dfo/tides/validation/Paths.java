package ca.gc.dfo.tides.validation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for station inputs and report outputs.
 * <p><strong>Why:</strong> Fails fast with a clear message before a long analysis starts.</p>
 * <p><strong>Thread-safety:</strong> Stateless; filesystem state may change between checks.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a readable station directory or data file.
   *
   * @param path candidate input
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the path is malformed, missing or unreadable
   */
  public static Path validateReadableSource(Path path) {
    Path normalized = normalize(path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException("input does not exist: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException("input is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates a report destination: its parent must be an existing writable directory and the file itself, if
   * present, must be a writable regular file.
   *
   * @param path candidate output file
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the file cannot be written
   */
  public static Path validateWritableFile(Path path) {
    Path normalized = normalize(path);
    if (Files.isDirectory(normalized)) {
      throw new IllegalArgumentException("output is a directory: " + normalized);
    }
    if (Files.exists(normalized) && !Files.isWritable(normalized)) {
      throw new IllegalArgumentException("output is not writable: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException("output directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException("output directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(Path path) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    for (int i = 0; i < raw.length(); i++) {
      if (Character.isISOControl(raw.charAt(i))) {
        throw new IllegalArgumentException("path must not contain control characters");
      }
    }
    return path.toAbsolutePath().normalize();
  }
}
