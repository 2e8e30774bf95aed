package ca.gc.cra.netsim.domain.net;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * <strong>What:</strong> Immutable match key extracted from an IPv4 packet: addresses, protocol, optional ports and
 * the TCP established bits.
 * <p><strong>Why:</strong> ACL evaluation and NAT lookups both key on these fields; extracting them once keeps both
 * engines independent of payload types.</p>
 * <p><strong>Role:</strong> Domain value object used as an evaluation input and in log lines.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 *
 * @since 0.1.0
 */
public final class FiveTuple {
  private final Ipv4Address source;
  private final Ipv4Address destination;
  private final int protocol;
  private final Integer sourcePort;
  private final Integer destinationPort;
  private final boolean established;

  /**
   * Creates a match key.
   *
   * @param source source address; must not be {@code null}
   * @param destination destination address; {@code null} when unknown
   * @param protocol IP protocol number; 0 when unknown
   * @param sourcePort source port or {@code null}
   * @param destinationPort destination port or {@code null}
   * @param established whether a TCP segment carries ACK or RST
   */
  public FiveTuple(
      Ipv4Address source,
      Ipv4Address destination,
      int protocol,
      Integer sourcePort,
      Integer destinationPort,
      boolean established) {
    this.source = Objects.requireNonNull(source, "source");
    this.destination = destination;
    this.protocol = protocol;
    this.sourcePort = sourcePort;
    this.destinationPort = destinationPort;
    this.established = established;
  }

  /**
   * Creates a key holding only a source address, as a standard ACL sees a packet.
   *
   * @param source source address
   * @return key without destination, protocol or ports
   */
  public static FiveTuple sourceOnly(Ipv4Address source) {
    return new FiveTuple(source, null, 0, null, null, false);
  }

  /**
   * Extracts the key from a packet. Only TCP and UDP supply ports.
   *
   * @param packet packet to inspect
   * @return match key
   */
  public static FiveTuple of(Ipv4Packet packet) {
    Ipv4Payload payload = packet.payload();
    if (payload instanceof TcpSegment tcp) {
      return new FiveTuple(packet.source(), packet.destination(), packet.protocol(),
          tcp.sourcePort(), tcp.destinationPort(), tcp.flags().established());
    }
    if (payload instanceof UdpDatagram udp) {
      return new FiveTuple(packet.source(), packet.destination(), packet.protocol(),
          udp.sourcePort(), udp.destinationPort(), false);
    }
    return new FiveTuple(packet.source(), packet.destination(), packet.protocol(), null, null, false);
  }

  /** @return source address */
  public Ipv4Address source() {
    return source;
  }

  /** @return destination address, or {@code null} when unknown */
  public Ipv4Address destination() {
    return destination;
  }

  /** @return IP protocol number (0 when unknown) */
  public int protocol() {
    return protocol;
  }

  /** @return source port when the protocol carries one */
  public OptionalInt sourcePort() {
    return sourcePort == null ? OptionalInt.empty() : OptionalInt.of(sourcePort);
  }

  /** @return destination port when the protocol carries one */
  public OptionalInt destinationPort() {
    return destinationPort == null ? OptionalInt.empty() : OptionalInt.of(destinationPort);
  }

  /** @return whether the TCP ACK or RST bit is set */
  public boolean established() {
    return established;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FiveTuple that)) {
      return false;
    }
    return protocol == that.protocol
        && established == that.established
        && source.equals(that.source)
        && Objects.equals(destination, that.destination)
        && Objects.equals(sourcePort, that.sourcePort)
        && Objects.equals(destinationPort, that.destinationPort);
  }

  @Override
  public int hashCode() {
    return Objects.hash(source, destination, protocol, sourcePort, destinationPort, established);
  }

  @Override
  public String toString() {
    return source + (sourcePort == null ? "" : ":" + sourcePort)
        + " -> " + (destination == null ? "?" : destination.toString())
        + (destinationPort == null ? "" : ":" + destinationPort)
        + " proto=" + protocol;
  }
}
