package ca.gc.cra.netsim.domain.net;

import ca.gc.cra.netsim.domain.util.Bytes;

/**
 * IPv4 header checksum (RFC 791, RFC 1071).
 *
 * <p>The checksum is the 16-bit one's complement of the one's-complement sum of the ten header
 * words, computed with the checksum field treated as zero.</p>
 *
 * @since 0.1.0
 */
public final class Ipv4Checksum {
  private Ipv4Checksum() {
    // Utility
  }

  /**
   * Computes the checksum for the packet's current header fields.
   *
   * @param packet packet to checksum; its carried checksum is ignored
   * @return checksum value
   */
  public static int compute(Ipv4Packet packet) {
    byte[] header = packet.headerBytes();
    header[10] = 0;
    header[11] = 0;
    return Bytes.internetChecksum(header, 0, header.length);
  }

  /**
   * Verifies the carried checksum against the current header fields.
   *
   * @param packet packet to verify
   * @return {@code true} only when the carried checksum matches a fresh computation
   */
  public static boolean verify(Ipv4Packet packet) {
    return compute(packet) == packet.headerChecksum();
  }
}
