package ca.gc.cra.netsim.domain.ospf;

/**
 * OSPF packet types (RFC 2328 A.3.1).
 *
 * @since 0.1.0
 */
public enum OspfPacketType {
  HELLO(1),
  DATABASE_DESCRIPTION(2),
  LINK_STATE_REQUEST(3),
  LINK_STATE_UPDATE(4),
  LINK_STATE_ACK(5);

  private final int code;

  OspfPacketType(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
