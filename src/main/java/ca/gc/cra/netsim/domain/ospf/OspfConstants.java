package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;

/**
 * Protocol constants from RFC 2328 Appendix B and C.
 *
 * @since 0.1.0
 */
public final class OspfConstants {
  /** IP protocol number carried in the IPv4 header. */
  public static final int PROTOCOL = 89;
  public static final int VERSION = 2;

  public static final int DEFAULT_HELLO_INTERVAL_SECONDS = 10;
  public static final int DEFAULT_DEAD_INTERVAL_SECONDS = 40;
  public static final int DEFAULT_RETRANSMIT_INTERVAL_SECONDS = 5;
  public static final int DEFAULT_TRANSMIT_DELAY_SECONDS = 1;
  public static final int DEFAULT_PRIORITY = 1;
  public static final int DEFAULT_REFERENCE_BANDWIDTH_MBPS = 100;
  public static final int DEFAULT_INTERFACE_BANDWIDTH_MBPS = 1000;
  public static final int DEFAULT_MTU = 1500;

  public static final int MAX_AGE_SECONDS = 3600;
  public static final int MAX_AGE_DIFF_SECONDS = 900;
  public static final int LS_REFRESH_SECONDS = 1800;
  public static final int INITIAL_SEQUENCE_NUMBER = 0x80000001;
  public static final int MAX_SEQUENCE_NUMBER = 0x7FFFFFFF;

  /** Options byte with only the E bit set. */
  public static final int OPTIONS_E = 0x02;

  public static final int DD_FLAG_INIT = 0x04;
  public static final int DD_FLAG_MORE = 0x02;
  public static final int DD_FLAG_MASTER = 0x01;

  /** Header count per Database Description packet. */
  public static final int MAX_DD_HEADERS = 10;
  /** Key count per Link State Request packet. */
  public static final int MAX_LSR_KEYS = 10;
  /** Delay between a topology change and the SPF run it triggers. */
  public static final long SPF_DELAY_MILLIS = 200;

  /** Router-LSA flag set by area border routers. */
  public static final int ROUTER_FLAG_B = 0x01;

  public static final Ipv4Address ALL_SPF_ROUTERS = Ipv4Address.of(224, 0, 0, 5);
  public static final Ipv4Address ALL_D_ROUTERS = Ipv4Address.of(224, 0, 0, 6);
  public static final Ipv4Address BACKBONE_AREA = Ipv4Address.ANY;

  private OspfConstants() {
    // Utility
  }
}
