package ca.gc.cra.netsim.validation;

/**
 * <strong>What:</strong> Numeric validation helpers for configuration and protocol field bounds.
 * <p><strong>Why:</strong> Keeps range checks for TTLs, ports, VLAN IDs and timers consistent across the simulator.</p>
 * <p><strong>Role:</strong> Cross-cutting validation utility used by domain constructors and config parsing.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name label used in the exception message
   * @param value value to validate
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value} when valid
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Integer overload of {@link #requireRange(String, long, long, long)}.
   *
   * @param name label used in the exception message
   * @param value value to validate
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value} when valid
   * @throws IllegalArgumentException when out of range
   */
  public static int requireRange(String name, int value, int min, int max) {
    return (int) requireRange(name, (long) value, (long) min, (long) max);
  }

  /**
   * Ensures {@code value} is strictly positive.
   *
   * @param name label used in the exception message
   * @param value value to validate
   * @return {@code value} when positive
   * @throws IllegalArgumentException when zero or negative
   */
  public static long requirePositive(String name, long value) {
    if (value <= 0) {
      throw new IllegalArgumentException(label(name) + " must be positive (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer, reporting the field name on failure.
   *
   * @param name label used in the exception message
   * @param text text to parse
   * @return parsed value
   * @throws IllegalArgumentException when {@code text} is not a decimal integer
   */
  public static long parseLong(String name, String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    try {
      return Long.parseLong(text.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was '" + text + "')", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
