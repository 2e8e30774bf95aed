package ca.gc.cra.netsim.domain.net;

/**
 * IPv4 protocol numbers used by the forwarding, ACL and NAT paths.
 *
 * @since 0.1.0
 */
public final class IpProtocol {
  /** Internet Control Message Protocol. */
  public static final int ICMP = 1;
  /** Transmission Control Protocol. */
  public static final int TCP = 6;
  /** User Datagram Protocol. */
  public static final int UDP = 17;
  /** Open Shortest Path First. */
  public static final int OSPF = 89;

  private IpProtocol() {
    // Utility
  }

  /**
   * Returns whether the protocol carries 16-bit source and destination ports.
   *
   * @param protocol protocol number
   * @return {@code true} for TCP and UDP
   */
  public static boolean hasPorts(int protocol) {
    return protocol == TCP || protocol == UDP;
  }
}
