package ca.gc.cra.netsim.domain.net;

/**
 * Upper-layer payload carried by an {@link Ipv4Packet}.
 *
 * <p>Payloads carry no addressing or TTL of their own; those live on the enclosing IPv4
 * header.</p>
 *
 * @since 0.1.0
 */
public interface Ipv4Payload {
  /**
   * Returns the encoded size of this payload in bytes.
   *
   * @return payload length on the wire
   */
  int length();

  /**
   * Returns the first eight bytes of the encoded payload, quoted by ICMP error messages.
   *
   * @return up to eight bytes; empty when the payload has no fixed leading header
   */
  default byte[] leadingBytes() {
    return new byte[0];
  }
}
