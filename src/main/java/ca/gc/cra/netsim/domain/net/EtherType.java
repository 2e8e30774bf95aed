package ca.gc.cra.netsim.domain.net;

/**
 * Ethernet type codes understood by the simulator.
 *
 * @since 0.1.0
 */
public final class EtherType {
  /** Internet Protocol version 4. */
  public static final int IPV4 = 0x0800;
  /** Address Resolution Protocol. */
  public static final int ARP = 0x0806;
  /** Internet Protocol version 6 (carried as raw payload only). */
  public static final int IPV6 = 0x86DD;
  /** IEEE 802.1Q tag protocol identifier. */
  public static final int VLAN = 0x8100;

  private EtherType() {
    // Utility
  }
}
