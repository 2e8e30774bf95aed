package ca.gc.cra.netsim.domain.net;

import ca.gc.cra.netsim.validation.Net;
import java.util.Locale;

/**
 * <strong>What:</strong> Immutable 48-bit Ethernet MAC address.
 * <p><strong>Role:</strong> Domain value object used for frame addressing and MAC table keys.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param bits address in the low 48 bits
 * @since 0.1.0
 */
public record MacAddress(long bits) {
  private static final long MASK = 0xFFFF_FFFF_FFFFL;

  /** {@code FF:FF:FF:FF:FF:FF}. */
  public static final MacAddress BROADCAST = new MacAddress(MASK);
  /** Placeholder used in ARP requests for the unknown target. */
  public static final MacAddress ZERO = new MacAddress(0);

  /**
   * Normalizes to 48 bits.
   */
  public MacAddress {
    bits = bits & MASK;
  }

  /**
   * Parses a MAC literal.
   *
   * @param text colon, hyphen or Cisco-dotted form
   * @return address
   * @throws IllegalArgumentException when malformed
   */
  public static MacAddress parse(String text) {
    return new MacAddress(Net.parseMac(text));
  }

  /**
   * Maps an IPv4 multicast group to its Ethernet group address (01:00:5E + low 23 bits).
   *
   * @param group multicast IPv4 address
   * @return Ethernet multicast address
   * @throws IllegalArgumentException when {@code group} is not multicast
   */
  public static MacAddress ipv4Multicast(Ipv4Address group) {
    if (!group.isMulticast()) {
      throw new IllegalArgumentException("not a multicast group: " + group);
    }
    return new MacAddress(0x01005E000000L | (group.bits() & 0x7FFFFF));
  }

  /** @return {@code true} for {@code FF:FF:FF:FF:FF:FF} */
  public boolean isBroadcast() {
    return bits == MASK;
  }

  /** @return {@code true} when the I/G bit is set (includes broadcast) */
  public boolean isMulticast() {
    return (bits & 0x0100_0000_0000L) != 0;
  }

  /** @return {@code true} for individual addresses */
  public boolean isUnicast() {
    return !isMulticast();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(17);
    for (int shift = 40; shift >= 0; shift -= 8) {
      if (sb.length() > 0) {
        sb.append(':');
      }
      sb.append(String.format(Locale.ROOT, "%02X", (bits >>> shift) & 0xFF));
    }
    return sb.toString();
  }
}
