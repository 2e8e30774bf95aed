package ca.gc.cra.netsim.domain.net;

import ca.gc.cra.netsim.validation.Numbers;
import java.util.Objects;

/**
 * <strong>What:</strong> Builders for well-formed packets and frames.
 * <p><strong>Why:</strong> Centralizes the rules that keep a freshly built packet valid: total length follows the
 * payload and the header checksum is computed last.</p>
 * <p><strong>Role:</strong> Domain factory used by devices, the OSPF engine and tests.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class PacketFactory {
  private PacketFactory() {
    // Utility
  }

  /**
   * Builds an IPv4 packet with a computed total length and header checksum.
   *
   * @param source source address
   * @param destination destination address
   * @param protocol upper-layer protocol number
   * @param ttl time to live
   * @param payload carried payload; {@code null} for an empty payload
   * @param payloadSize payload size in bytes used for the total length field
   * @return valid packet
   * @throws IllegalArgumentException when a field is out of range
   */
  public static Ipv4Packet createIpv4Packet(
      Ipv4Address source,
      Ipv4Address destination,
      int protocol,
      int ttl,
      Ipv4Payload payload,
      int payloadSize) {
    Numbers.requireRange("payloadSize", payloadSize, 0, 0xFFFF - Ipv4Packet.HEADER_BYTES);
    Ipv4Packet unchecked = new Ipv4Packet(
        4, 5, 0, Ipv4Packet.HEADER_BYTES + payloadSize, 0, 0, 0, ttl, protocol, 0, source, destination, payload);
    return unchecked.withComputedChecksum();
  }

  /**
   * Builds an IPv4 packet whose size and protocol are derived from {@code payload}.
   *
   * @param source source address
   * @param destination destination address
   * @param ttl time to live
   * @param payload typed payload
   * @return valid packet
   */
  public static Ipv4Packet createIpv4Packet(
      Ipv4Address source, Ipv4Address destination, int ttl, Ipv4Payload payload) {
    Objects.requireNonNull(payload, "payload");
    return createIpv4Packet(source, destination, protocolOf(payload), ttl, payload, payload.length());
  }

  /**
   * Computes the checksum for the packet's current header.
   *
   * @param packet packet
   * @return checksum value
   */
  public static int computeChecksum(Ipv4Packet packet) {
    return Ipv4Checksum.compute(packet);
  }

  /**
   * Verifies the packet's carried checksum.
   *
   * @param packet packet
   * @return {@code true} only on an exact match
   */
  public static boolean verifyChecksum(Ipv4Packet packet) {
    return Ipv4Checksum.verify(packet);
  }

  /**
   * Builds an ICMP echo request packet.
   *
   * @param source source address
   * @param destination destination address
   * @param ttl time to live
   * @param identifier echo identifier
   * @param sequence echo sequence
   * @return echo request with the default 32-byte payload
   */
  public static Ipv4Packet echoRequest(
      Ipv4Address source, Ipv4Address destination, int ttl, int identifier, int sequence) {
    IcmpMessage icmp = IcmpMessage.echoRequest(identifier, sequence, IcmpMessage.DEFAULT_ECHO_DATA_SIZE);
    return createIpv4Packet(source, destination, ttl, icmp);
  }

  /**
   * Builds the echo reply to {@code request}.
   *
   * @param request received echo request packet
   * @param replySource address the reply is sent from
   * @param ttl time to live of the reply
   * @return echo reply addressed to the requester
   * @throws IllegalArgumentException when {@code request} does not carry an echo request
   */
  public static Ipv4Packet echoReply(Ipv4Packet request, Ipv4Address replySource, int ttl) {
    if (!(request.payload() instanceof IcmpMessage icmp) || icmp.type() != IcmpType.ECHO_REQUEST) {
      throw new IllegalArgumentException("packet does not carry an ICMP echo request");
    }
    return createIpv4Packet(replySource, request.source(), ttl, icmp.toEchoReply());
  }

  /**
   * Builds an ICMP error packet about {@code offending}.
   *
   * @param type error type
   * @param code error code
   * @param offending packet that triggered the error
   * @param reporter address of the reporting interface
   * @param ttl time to live of the error packet
   * @return error packet addressed to the offending packet's source
   */
  public static Ipv4Packet icmpError(
      IcmpType type, int code, Ipv4Packet offending, Ipv4Address reporter, int ttl) {
    IcmpMessage icmp = IcmpMessage.error(type, code, offending);
    return createIpv4Packet(reporter, offending.source(), ttl, icmp);
  }

  /**
   * Builds a broadcast ARP request frame.
   *
   * @param senderMac requester MAC
   * @param senderIp requester address
   * @param targetIp address being resolved
   * @return frame addressed to {@link MacAddress#BROADCAST}
   */
  public static EthernetFrame arpRequest(MacAddress senderMac, Ipv4Address senderIp, Ipv4Address targetIp) {
    return EthernetFrame.arp(senderMac, MacAddress.BROADCAST, ArpPacket.request(senderMac, senderIp, targetIp));
  }

  /**
   * Builds the unicast ARP reply frame for {@code request}.
   *
   * @param request request being answered
   * @param ownerMac MAC of the answering interface
   * @return frame addressed to the requester
   */
  public static EthernetFrame arpReply(ArpPacket request, MacAddress ownerMac) {
    return EthernetFrame.arp(ownerMac, request.senderMac(), ArpPacket.replyTo(request, ownerMac));
  }

  /**
   * Returns the IP protocol number matching a typed payload.
   *
   * @param payload payload
   * @return protocol number, or 0 for raw payloads
   */
  public static int protocolOf(Ipv4Payload payload) {
    if (payload instanceof IcmpMessage) {
      return IpProtocol.ICMP;
    }
    if (payload instanceof TcpSegment) {
      return IpProtocol.TCP;
    }
    if (payload instanceof UdpDatagram) {
      return IpProtocol.UDP;
    }
    if (payload instanceof ProtocolPayload typed) {
      return typed.protocol();
    }
    return 0;
  }
}
