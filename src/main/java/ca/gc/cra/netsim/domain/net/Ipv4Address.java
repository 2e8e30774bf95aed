package ca.gc.cra.netsim.domain.net;

import ca.gc.cra.netsim.validation.Net;

/**
 * <strong>What:</strong> Immutable 32-bit IPv4 address.
 * <p><strong>Why:</strong> Gives forwarding, ACL, NAT and OSPF code one value type with bitwise helpers instead of strings.</p>
 * <p><strong>Role:</strong> Domain value object; also used for OSPF router and area identifiers.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 * <p><strong>Performance:</strong> Single {@code int} field; comparisons are unsigned.</p>
 *
 * @param bits address bits in network order
 * @since 0.1.0
 */
public record Ipv4Address(int bits) implements Comparable<Ipv4Address> {
  /** The unspecified address {@code 0.0.0.0}; OSPF uses it for "no DR/BDR". */
  public static final Ipv4Address ANY = new Ipv4Address(0);
  /** Limited broadcast {@code 255.255.255.255}. */
  public static final Ipv4Address BROADCAST = new Ipv4Address(0xFFFFFFFF);

  /**
   * Parses a dotted-quad literal.
   *
   * @param text literal such as {@code 10.0.0.1}
   * @return parsed address
   * @throws IllegalArgumentException when the literal is malformed
   */
  public static Ipv4Address parse(String text) {
    return new Ipv4Address(Net.parseIpv4(text));
  }

  /**
   * Builds an address from four octets.
   *
   * @param a first octet
   * @param b second octet
   * @param c third octet
   * @param d fourth octet
   * @return address
   */
  public static Ipv4Address of(int a, int b, int c, int d) {
    return new Ipv4Address(((a & 0xFF) << 24) | ((b & 0xFF) << 16) | ((c & 0xFF) << 8) | (d & 0xFF));
  }

  /**
   * Applies a subnet mask.
   *
   * @param mask subnet mask
   * @return network address
   */
  public Ipv4Address network(SubnetMask mask) {
    return new Ipv4Address(bits & mask.bits());
  }

  /**
   * Returns whether this address and {@code other} share the subnet defined by {@code mask}.
   *
   * @param other other address
   * @param mask subnet mask
   * @return {@code true} when both addresses fall in the same subnet
   */
  public boolean sameSubnet(Ipv4Address other, SubnetMask mask) {
    return ((bits ^ other.bits) & mask.bits()) == 0;
  }

  /**
   * Returns the address as an unsigned value.
   *
   * @return address in {@code [0, 2^32)}
   */
  public long toUnsigned() {
    return Integer.toUnsignedLong(bits);
  }

  /**
   * Returns the address offset by {@code delta}.
   *
   * @param delta signed offset
   * @return shifted address (wraps modulo 2^32)
   */
  public Ipv4Address plus(long delta) {
    return new Ipv4Address((int) (toUnsigned() + delta));
  }

  /** @return {@code true} for 224.0.0.0/4 */
  public boolean isMulticast() {
    return (bits & 0xF0000000) == 0xE0000000;
  }

  /** @return {@code true} for {@code 0.0.0.0} */
  public boolean isUnspecified() {
    return bits == 0;
  }

  /**
   * Renders the address as network-order bytes.
   *
   * @return four bytes
   */
  public byte[] toBytes() {
    return new byte[] {(byte) (bits >>> 24), (byte) (bits >>> 16), (byte) (bits >>> 8), (byte) bits};
  }

  @Override
  public int compareTo(Ipv4Address other) {
    return Integer.compareUnsigned(bits, other.bits);
  }

  @Override
  public String toString() {
    return ((bits >>> 24) & 0xFF) + "." + ((bits >>> 16) & 0xFF) + "." + ((bits >>> 8) & 0xFF) + "." + (bits & 0xFF);
  }
}
