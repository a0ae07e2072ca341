package ca.gc.dfo.tides.validation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> String validation utilities for configuration and CLI values.
 * <p><strong>Role:</strong> Support utilities invoked before values reach the analysis layer.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character input.</li>
 *   <li>Split comma-separated constituent lists into validated identifiers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9]+$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a value is non-null, non-blank and free of control characters.
   *
   * @param name parameter name for diagnostics
   * @param value candidate text
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the value is blank or holds ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Splits a comma-separated list of alphanumeric identifiers, keeping order.
   *
   * @param name parameter name for diagnostics
   * @param value list such as {@code "M2,S2,K1"}
   * @return identifiers, trimmed, in input order
   * @throws IllegalArgumentException if the list is blank, holds an empty entry or a non-alphanumeric identifier
   */
  public static List<String> requireIdentifierList(String name, String value) {
    String list = requireNonBlank(name, value);
    List<String> result = new ArrayList<>();
    for (String token : list.split(",", -1)) {
      String trimmed = token.trim();
      if (trimmed.isEmpty()) {
        throw new IllegalArgumentException(message(name, "must not contain empty entries"));
      }
      if (!IDENTIFIER.matcher(trimmed).matches()) {
        throw new IllegalArgumentException(message(name, "entry '" + trimmed + "' must be alphanumeric"));
      }
      result.add(trimmed);
    }
    return List.copyOf(result);
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
