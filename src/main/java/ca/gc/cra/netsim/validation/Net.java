package ca.gc.cra.netsim.validation;

import java.util.regex.Pattern;

/**
 * Parsers for dotted-quad IPv4 and 48-bit MAC address literals.
 *
 * <p>Used by the address value types so that every entry point rejects malformed literals the
 * same way. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class Net {

  // IPv4 dotted-quad shape (fast pre-check); octets are still range-checked.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");
  private static final Pattern MAC_COLON_PATTERN =
      Pattern.compile("\\A[0-9A-Fa-f]{2}(?:[:-][0-9A-Fa-f]{2}){5}\\z");
  private static final Pattern MAC_DOTTED_PATTERN =
      Pattern.compile("\\A[0-9A-Fa-f]{4}\\.[0-9A-Fa-f]{4}\\.[0-9A-Fa-f]{4}\\z");

  private Net() {
    // Utility
  }

  /**
   * Parses a dotted-quad IPv4 literal into its 32-bit value.
   *
   * @param value literal such as {@code 192.168.1.1}
   * @return address bits in network order packed into an {@code int}
   * @throws IllegalArgumentException when the literal is not a valid dotted quad
   */
  public static int parseIpv4(String value) {
    String sanitized = Strings.requireNonBlank("IPv4 address", value);
    if (!IPV4_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException("invalid IPv4 address: " + sanitized);
    }
    int bits = 0;
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      final int endIndex = (i < 3) ? sanitized.indexOf('.', startIndex) : sanitized.length();
      final int octet = Integer.parseInt(sanitized.substring(startIndex, endIndex));
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      bits = (bits << 8) | octet;
      startIndex = endIndex + 1;
    }
    return bits;
  }

  /**
   * Parses a MAC literal in {@code aa:bb:cc:dd:ee:ff}, {@code aa-bb-..} or Cisco {@code aabb.ccdd.eeff} form.
   *
   * @param value MAC literal
   * @return 48-bit address in the low bits of a {@code long}
   * @throws IllegalArgumentException when the literal is malformed
   */
  public static long parseMac(String value) {
    String sanitized = Strings.requireNonBlank("MAC address", value);
    String hex;
    if (MAC_COLON_PATTERN.matcher(sanitized).matches()) {
      hex = sanitized.replace(":", "").replace("-", "");
    } else if (MAC_DOTTED_PATTERN.matcher(sanitized).matches()) {
      hex = sanitized.replace(".", "");
    } else {
      throw new IllegalArgumentException("invalid MAC address: " + sanitized);
    }
    return Long.parseLong(hex, 16);
  }
}
