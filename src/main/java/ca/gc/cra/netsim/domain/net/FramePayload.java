package ca.gc.cra.netsim.domain.net;

/**
 * Payload carried directly inside an {@link EthernetFrame}.
 *
 * <p>Implemented by {@link Ipv4Packet}, {@link ArpPacket} and {@link RawPayload}.</p>
 *
 * @since 0.1.0
 */
public interface FramePayload {
  /**
   * Returns the encoded size of this payload in bytes.
   *
   * @return payload length on the wire
   */
  int length();
}
