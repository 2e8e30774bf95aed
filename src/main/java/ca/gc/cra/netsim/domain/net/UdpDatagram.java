package ca.gc.cra.netsim.domain.net;

import ca.gc.cra.netsim.domain.util.Bytes;
import ca.gc.cra.netsim.validation.Numbers;

/**
 * UDP datagram header; the payload is represented by its length only.
 *
 * @param sourcePort source port
 * @param destinationPort destination port
 * @param checksum datagram checksum as carried (0 = none)
 * @param payloadLength number of data bytes following the 8-byte header
 * @since 0.1.0
 */
public record UdpDatagram(int sourcePort, int destinationPort, int checksum, int payloadLength)
    implements Ipv4Payload {

  /**
   * Validates field ranges.
   */
  public UdpDatagram {
    Numbers.requireRange("sourcePort", sourcePort, 0, 0xFFFF);
    Numbers.requireRange("destinationPort", destinationPort, 0, 0xFFFF);
    Numbers.requireRange("checksum", checksum, 0, 0xFFFF);
    Numbers.requireRange("payloadLength", payloadLength, 0, 0xFFFF - 8);
  }

  /**
   * Returns a copy with a different source port.
   *
   * @param port new source port
   * @return rewritten datagram
   */
  public UdpDatagram withSourcePort(int port) {
    return new UdpDatagram(port, destinationPort, checksum, payloadLength);
  }

  /**
   * Returns a copy with a different destination port.
   *
   * @param port new destination port
   * @return rewritten datagram
   */
  public UdpDatagram withDestinationPort(int port) {
    return new UdpDatagram(sourcePort, port, checksum, payloadLength);
  }

  @Override
  public int length() {
    return 8 + payloadLength;
  }

  @Override
  public byte[] leadingBytes() {
    byte[] out = new byte[8];
    Bytes.putU16be(out, 0, sourcePort);
    Bytes.putU16be(out, 2, destinationPort);
    Bytes.putU16be(out, 4, length());
    Bytes.putU16be(out, 6, checksum);
    return out;
  }
}
