package ca.gc.cra.netsim.domain.net;

import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable Ethernet II frame exchanged between device interfaces.
 * <p><strong>Why:</strong> Frames are created at the transmitting interface and consumed at the receiving one; rewriting
 * a header (VLAN tagging, next-hop MAC) yields a new frame so that observers of the original never see it change.</p>
 * <p><strong>Role:</strong> Domain value object crossing every {@code Cable}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; payloads are immutable values.</p>
 *
 * @param source source MAC address
 * @param destination destination MAC address
 * @param etherType payload type, see {@link EtherType}
 * @param vlanTag optional 802.1Q tag; {@code null} for untagged frames
 * @param payload carried payload
 * @since 0.1.0
 */
public record EthernetFrame(
    MacAddress source,
    MacAddress destination,
    int etherType,
    VlanTag vlanTag,
    FramePayload payload) {

  /**
   * Validates required components.
   */
  public EthernetFrame {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(payload, "payload");
  }

  /**
   * Creates an untagged IPv4 frame.
   *
   * @param source source MAC
   * @param destination destination MAC
   * @param packet carried packet
   * @return frame with ether-type {@link EtherType#IPV4}
   */
  public static EthernetFrame ipv4(MacAddress source, MacAddress destination, Ipv4Packet packet) {
    return new EthernetFrame(source, destination, EtherType.IPV4, null, packet);
  }

  /**
   * Creates an untagged ARP frame.
   *
   * @param source source MAC
   * @param destination destination MAC, broadcast for requests
   * @param arp carried ARP message
   * @return frame with ether-type {@link EtherType#ARP}
   */
  public static EthernetFrame arp(MacAddress source, MacAddress destination, ArpPacket arp) {
    return new EthernetFrame(source, destination, EtherType.ARP, null, arp);
  }

  /** @return the 802.1Q tag when present */
  public Optional<VlanTag> vlan() {
    return Optional.ofNullable(vlanTag);
  }

  /**
   * Returns the IPv4 packet carried by this frame.
   *
   * @return packet when the ether-type is IPv4 and the payload is a parsed packet
   */
  public Optional<Ipv4Packet> ipv4Packet() {
    if (etherType == EtherType.IPV4 && payload instanceof Ipv4Packet packet) {
      return Optional.of(packet);
    }
    return Optional.empty();
  }

  /**
   * Returns the ARP message carried by this frame.
   *
   * @return ARP message when the ether-type is ARP
   */
  public Optional<ArpPacket> arpPacket() {
    if (etherType == EtherType.ARP && payload instanceof ArpPacket arp) {
      return Optional.of(arp);
    }
    return Optional.empty();
  }

  /**
   * Returns a copy carrying {@code tag}.
   *
   * @param tag 802.1Q tag
   * @return tagged frame
   */
  public EthernetFrame withVlanTag(VlanTag tag) {
    return new EthernetFrame(source, destination, etherType, Objects.requireNonNull(tag, "tag"), payload);
  }

  /**
   * Returns a copy addressed to {@code newDestination}.
   *
   * @param newDestination destination MAC
   * @return re-addressed frame
   */
  public EthernetFrame withDestination(MacAddress newDestination) {
    return new EthernetFrame(source, newDestination, etherType, vlanTag, payload);
  }

  /**
   * Returns a copy sent from {@code newSource}.
   *
   * @param newSource source MAC
   * @return re-addressed frame
   */
  public EthernetFrame withSource(MacAddress newSource) {
    return new EthernetFrame(newSource, destination, etherType, vlanTag, payload);
  }

  /** @return an untagged copy, or {@code this} when already untagged */
  public EthernetFrame withoutVlanTag() {
    return vlanTag == null ? this : new EthernetFrame(source, destination, etherType, null, payload);
  }

  /** @return the encoded size: 14-byte header, 4 more when tagged, plus payload */
  public int length() {
    return 14 + (vlanTag == null ? 0 : 4) + payload.length();
  }
}
