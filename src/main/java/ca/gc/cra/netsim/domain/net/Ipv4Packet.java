package ca.gc.cra.netsim.domain.net;

import ca.gc.cra.netsim.domain.util.Bytes;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable IPv4 datagram with a 20-byte option-less header.
 * <p><strong>Why:</strong> Routers rewrite TTL and NAT rewrites addresses; each rewrite returns a new packet so that an
 * ACL inspecting the untranslated packet, or a test holding the original, stays consistent.</p>
 * <p><strong>Role:</strong> Domain value object carried by {@link EthernetFrame}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 * <p><strong>Checksum contract:</strong> {@code headerChecksum} is whatever the creator supplied. The {@code withX}
 * transforms keep it unchanged, so a transform without {@link #withComputedChecksum()} leaves a checksum that
 * {@link Ipv4Checksum#verify(Ipv4Packet)} rejects.</p>
 *
 * @param version IP version, always 4
 * @param headerLength header length in 32-bit words, always 5
 * @param dscp differentiated services code point, 0-63
 * @param totalLength header plus payload length in bytes
 * @param identification fragment identification
 * @param flags 3-bit flags field (DF = 0b010)
 * @param fragmentOffset fragment offset in 8-byte units
 * @param ttl time to live, 0-255
 * @param protocol upper-layer protocol number
 * @param headerChecksum one's-complement header checksum as carried
 * @param source source address
 * @param destination destination address
 * @param payload upper-layer payload
 * @since 0.1.0
 */
public record Ipv4Packet(
    int version,
    int headerLength,
    int dscp,
    int totalLength,
    int identification,
    int flags,
    int fragmentOffset,
    int ttl,
    int protocol,
    int headerChecksum,
    Ipv4Address source,
    Ipv4Address destination,
    Ipv4Payload payload) implements FramePayload {

  /** Size of the option-less header in bytes. */
  public static final int HEADER_BYTES = 20;

  /**
   * Validates field ranges.
   *
   * @throws IllegalArgumentException when a field does not fit its header width
   */
  public Ipv4Packet {
    Numbers.requireRange("version", version, 0, 15);
    Numbers.requireRange("headerLength", headerLength, 0, 15);
    Numbers.requireRange("dscp", dscp, 0, 63);
    Numbers.requireRange("totalLength", totalLength, 0, 0xFFFF);
    Numbers.requireRange("identification", identification, 0, 0xFFFF);
    Numbers.requireRange("flags", flags, 0, 7);
    Numbers.requireRange("fragmentOffset", fragmentOffset, 0, 0x1FFF);
    Numbers.requireRange("ttl", ttl, 0, 255);
    Numbers.requireRange("protocol", protocol, 0, 255);
    Numbers.requireRange("headerChecksum", headerChecksum, 0, 0xFFFF);
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(destination, "destination");
    payload = payload != null ? payload : RawPayload.EMPTY;
  }

  /**
   * Renders the 20-byte header exactly as carried, including the current checksum field.
   *
   * @return header bytes in network order
   */
  public byte[] headerBytes() {
    byte[] header = new byte[HEADER_BYTES];
    header[0] = (byte) ((version << 4) | headerLength);
    header[1] = (byte) (dscp << 2);
    Bytes.putU16be(header, 2, totalLength);
    Bytes.putU16be(header, 4, identification);
    Bytes.putU16be(header, 6, (flags << 13) | fragmentOffset);
    header[8] = (byte) ttl;
    header[9] = (byte) protocol;
    Bytes.putU16be(header, 10, headerChecksum);
    Bytes.putU32be(header, 12, source.bits());
    Bytes.putU32be(header, 16, destination.bits());
    return header;
  }

  /**
   * Returns a copy with a different TTL; the checksum is left untouched.
   *
   * @param newTtl TTL value
   * @return rewritten packet
   */
  public Ipv4Packet withTtl(int newTtl) {
    return new Ipv4Packet(version, headerLength, dscp, totalLength, identification, flags, fragmentOffset,
        newTtl, protocol, headerChecksum, source, destination, payload);
  }

  /**
   * Returns a copy with a different source address; the checksum is left untouched.
   *
   * @param newSource source address
   * @return rewritten packet
   */
  public Ipv4Packet withSource(Ipv4Address newSource) {
    return new Ipv4Packet(version, headerLength, dscp, totalLength, identification, flags, fragmentOffset,
        ttl, protocol, headerChecksum, newSource, destination, payload);
  }

  /**
   * Returns a copy with a different destination address; the checksum is left untouched.
   *
   * @param newDestination destination address
   * @return rewritten packet
   */
  public Ipv4Packet withDestination(Ipv4Address newDestination) {
    return new Ipv4Packet(version, headerLength, dscp, totalLength, identification, flags, fragmentOffset,
        ttl, protocol, headerChecksum, source, newDestination, payload);
  }

  /**
   * Returns a copy carrying a different payload of the same protocol; total length follows the payload.
   *
   * @param newPayload payload
   * @return rewritten packet
   */
  public Ipv4Packet withPayload(Ipv4Payload newPayload) {
    Ipv4Payload effective = newPayload != null ? newPayload : RawPayload.EMPTY;
    return new Ipv4Packet(version, headerLength, dscp, HEADER_BYTES + effective.length(), identification, flags,
        fragmentOffset, ttl, protocol, headerChecksum, source, destination, effective);
  }

  /**
   * Returns a copy whose transport header fields were rewritten in place, such as a NAT port change. Total length
   * is kept, so the application bytes the segment stands for still count.
   *
   * @param rewritten payload of the same protocol
   * @return rewritten packet; the checksum is left as is
   */
  public Ipv4Packet withTransportPayload(Ipv4Payload rewritten) {
    Objects.requireNonNull(rewritten, "rewritten");
    return new Ipv4Packet(version, headerLength, dscp, totalLength, identification, flags, fragmentOffset,
        ttl, protocol, headerChecksum, source, destination, rewritten);
  }

  /**
   * Returns a copy carrying {@code checksum} verbatim.
   *
   * @param checksum checksum value
   * @return rewritten packet
   */
  public Ipv4Packet withChecksum(int checksum) {
    return new Ipv4Packet(version, headerLength, dscp, totalLength, identification, flags, fragmentOffset,
        ttl, protocol, checksum, source, destination, payload);
  }

  /** @return a copy whose checksum is recomputed over the current header */
  public Ipv4Packet withComputedChecksum() {
    return withChecksum(Ipv4Checksum.compute(this));
  }

  @Override
  public int length() {
    return totalLength;
  }

  @Override
  public String toString() {
    return "Ipv4Packet{" + source + " -> " + destination
        + ", ttl=" + ttl
        + ", protocol=" + protocol
        + ", totalLength=" + totalLength
        + ", checksum=0x" + Integer.toHexString(headerChecksum)
        + ", payload=" + payload
        + '}';
  }
}
