package ca.gc.cra.netsim.domain.net;

import ca.gc.cra.netsim.domain.util.Bytes;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.Objects;

/**
 * <strong>What:</strong> TCP segment header carried by an IPv4 packet; the payload is represented by its length only.
 * <p><strong>Why:</strong> ACLs match on ports and the established bits; PAT rewrites ports.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param sourcePort source port
 * @param destinationPort destination port
 * @param sequenceNumber sequence number (unsigned 32-bit)
 * @param acknowledgmentNumber acknowledgment number (unsigned 32-bit)
 * @param dataOffset header length in 32-bit words, at least 5
 * @param flags control bits
 * @param window receive window
 * @param checksum segment checksum as carried
 * @param urgentPointer urgent pointer
 * @param payloadLength number of data bytes following the header
 * @since 0.1.0
 */
public record TcpSegment(
    int sourcePort,
    int destinationPort,
    long sequenceNumber,
    long acknowledgmentNumber,
    int dataOffset,
    TcpFlags flags,
    int window,
    int checksum,
    int urgentPointer,
    int payloadLength) implements Ipv4Payload {

  /**
   * Validates field ranges.
   */
  public TcpSegment {
    Numbers.requireRange("sourcePort", sourcePort, 0, 0xFFFF);
    Numbers.requireRange("destinationPort", destinationPort, 0, 0xFFFF);
    Numbers.requireRange("sequenceNumber", sequenceNumber, 0, 0xFFFF_FFFFL);
    Numbers.requireRange("acknowledgmentNumber", acknowledgmentNumber, 0, 0xFFFF_FFFFL);
    Numbers.requireRange("dataOffset", dataOffset, 5, 15);
    Objects.requireNonNull(flags, "flags");
    Numbers.requireRange("window", window, 0, 0xFFFF);
    Numbers.requireRange("checksum", checksum, 0, 0xFFFF);
    Numbers.requireRange("urgentPointer", urgentPointer, 0, 0xFFFF);
    Numbers.requireRange("payloadLength", payloadLength, 0, 0xFFFF);
  }

  /**
   * Creates a minimal segment with default header fields.
   *
   * @param sourcePort source port
   * @param destinationPort destination port
   * @param flags control bits
   * @param payloadLength data bytes
   * @return segment
   */
  public static TcpSegment of(int sourcePort, int destinationPort, TcpFlags flags, int payloadLength) {
    return new TcpSegment(sourcePort, destinationPort, 0, 0, 5, flags, 65535, 0, 0, payloadLength);
  }

  /**
   * Returns a copy with a different source port.
   *
   * @param port new source port
   * @return rewritten segment
   */
  public TcpSegment withSourcePort(int port) {
    return new TcpSegment(port, destinationPort, sequenceNumber, acknowledgmentNumber, dataOffset, flags, window,
        checksum, urgentPointer, payloadLength);
  }

  /**
   * Returns a copy with a different destination port.
   *
   * @param port new destination port
   * @return rewritten segment
   */
  public TcpSegment withDestinationPort(int port) {
    return new TcpSegment(sourcePort, port, sequenceNumber, acknowledgmentNumber, dataOffset, flags, window,
        checksum, urgentPointer, payloadLength);
  }

  @Override
  public int length() {
    return dataOffset * 4 + payloadLength;
  }

  @Override
  public byte[] leadingBytes() {
    byte[] out = new byte[8];
    Bytes.putU16be(out, 0, sourcePort);
    Bytes.putU16be(out, 2, destinationPort);
    Bytes.putU32be(out, 4, (int) sequenceNumber);
    return out;
  }
}
