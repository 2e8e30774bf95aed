package ca.gc.cra.netsim.domain.net;

/**
 * Payload that declares its own IP protocol number, for protocols defined outside this package.
 *
 * @since 0.1.0
 */
public interface ProtocolPayload extends Ipv4Payload {
  /** @return IP protocol number carried in the enclosing header */
  int protocol();
}
