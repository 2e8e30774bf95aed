package ca.gc.cra.netsim.domain.net;

import ca.gc.cra.netsim.validation.Net;
import ca.gc.cra.netsim.validation.Numbers;

/**
 * <strong>What:</strong> Contiguous 32-bit IPv4 subnet mask.
 * <p><strong>Why:</strong> Routing lookups need the prefix length; ACLs need its complement (the wildcard).</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param bits mask bits in network order; must be contiguous ones followed by zeros
 * @since 0.1.0
 */
public record SubnetMask(int bits) {
  /** {@code /32} host mask. */
  public static final SubnetMask HOST = new SubnetMask(0xFFFFFFFF);
  /** {@code /0}, used by default routes. */
  public static final SubnetMask ZERO = new SubnetMask(0);

  /**
   * Validates contiguity.
   *
   * @throws IllegalArgumentException when the mask has holes
   */
  public SubnetMask {
    int inverted = ~bits;
    if ((inverted & (inverted + 1)) != 0) {
      throw new IllegalArgumentException("subnet mask must be contiguous (was " + new Ipv4Address(bits) + ")");
    }
  }

  /**
   * Parses a dotted-quad mask such as {@code 255.255.255.0}.
   *
   * @param text mask literal
   * @return mask
   * @throws IllegalArgumentException when malformed or non-contiguous
   */
  public static SubnetMask parse(String text) {
    return new SubnetMask(Net.parseIpv4(text));
  }

  /**
   * Builds a mask from a prefix length.
   *
   * @param prefixLength number of leading ones, 0-32
   * @return mask
   */
  public static SubnetMask ofPrefix(int prefixLength) {
    Numbers.requireRange("prefixLength", prefixLength, 0, 32);
    return new SubnetMask(prefixLength == 0 ? 0 : -1 << (32 - prefixLength));
  }

  /**
   * Builds the subnet mask whose complement is {@code wildcard}.
   *
   * @param wildcard wildcard bits
   * @return mask
   */
  public static SubnetMask fromWildcard(Ipv4Address wildcard) {
    return new SubnetMask(~wildcard.bits());
  }

  /** @return number of leading one bits */
  public int prefixLength() {
    return Integer.bitCount(bits);
  }

  /**
   * Returns the ACL wildcard, the bitwise complement of this mask.
   *
   * @return wildcard as an address value
   */
  public Ipv4Address wildcard() {
    return new Ipv4Address(~bits);
  }

  /** @return the mask as an address value, for header fields */
  public Ipv4Address asAddress() {
    return new Ipv4Address(bits);
  }

  @Override
  public String toString() {
    return new Ipv4Address(bits).toString();
  }
}
