package ca.gc.cra.netsim.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * String validation helpers for device, interface and ACL names.
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern NAME_PATTERN = Pattern.compile("^[A-Za-z0-9._/:-]+$");

  private Strings() {
    // Utility
  }

  /**
   * Trims and validates that the value is non-blank and free of control characters.
   *
   * @param name label used in exception messages
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException when {@code value} is {@code null}
   * @throws IllegalArgumentException when blank or containing control characters
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
   * Validates an identifier such as {@code GigabitEthernet0/1} or {@code BLOCK_WEB}.
   *
   * @param name label used in exception messages
   * @param value raw identifier
   * @return trimmed identifier
   * @throws IllegalArgumentException when the identifier contains unsupported characters
   */
  public static String requireIdentifier(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!NAME_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, slash, colon, or hyphen"));
    }
    return sanitized;
  }

  /**
   * Validates a bounded printable-ASCII value such as OpenTelemetry resource attributes.
   *
   * @param name label used in exception messages
   * @param value raw value
   * @param maxLength maximum length after trimming
   * @return trimmed value
   * @throws IllegalArgumentException when too long or containing non-printable characters
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String sanitized = requireNonBlank(name, value);
    if (sanitized.length() > maxLength) {
      throw new IllegalArgumentException(message(name, "length must be <= " + maxLength));
    }
    for (int i = 0; i < sanitized.length(); i++) {
      char c = sanitized.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(message(name, "must contain printable ASCII characters"));
      }
    }
    return sanitized;
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
