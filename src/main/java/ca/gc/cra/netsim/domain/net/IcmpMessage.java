package ca.gc.cra.netsim.domain.net;

import ca.gc.cra.netsim.domain.util.Bytes;
import ca.gc.cra.netsim.validation.Numbers;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> ICMP message carried inside an IPv4 packet.
 * <p><strong>Why:</strong> Echo request/reply drive pings; unreachable and time-exceeded report forwarding failures.</p>
 * <p><strong>Role:</strong> Domain value object; holds no addresses or TTL, which belong to the enclosing IPv4 header.</p>
 * <p><strong>Thread-safety:</strong> Immutable; data is copied on construction.</p>
 *
 * @param type message type
 * @param code type-specific code (e.g. 0 = net unreachable)
 * @param identifier echo identifier; 0 for errors
 * @param sequence echo sequence number; 0 for errors
 * @param data echo data, or the quoted header and leading payload bytes for errors
 * @since 0.1.0
 */
public record IcmpMessage(IcmpType type, int code, int identifier, int sequence, byte[] data)
    implements Ipv4Payload {

  /** Default echo payload size used by pings. */
  public static final int DEFAULT_ECHO_DATA_SIZE = 32;
  private static final byte ECHO_FILL = 0x61;

  /**
   * Validates fields and copies data.
   */
  public IcmpMessage {
    Objects.requireNonNull(type, "type");
    Numbers.requireRange("code", code, 0, 255);
    Numbers.requireRange("identifier", identifier, 0, 0xFFFF);
    Numbers.requireRange("sequence", sequence, 0, 0xFFFF);
    data = data != null ? data.clone() : new byte[0];
  }

  /**
   * Creates an echo request with {@code dataSize} bytes of {@code 0x61} ('a').
   *
   * @param identifier echo identifier
   * @param sequence echo sequence
   * @param dataSize payload size in bytes
   * @return echo request
   */
  public static IcmpMessage echoRequest(int identifier, int sequence, int dataSize) {
    byte[] fill = new byte[Math.max(0, dataSize)];
    Arrays.fill(fill, ECHO_FILL);
    return new IcmpMessage(IcmpType.ECHO_REQUEST, 0, identifier, sequence, fill);
  }

  /**
   * Creates the reply matching this echo request.
   *
   * @return echo reply carrying the same identifier, sequence and data
   * @throws IllegalStateException when this message is not an echo request
   */
  public IcmpMessage toEchoReply() {
    if (type != IcmpType.ECHO_REQUEST) {
      throw new IllegalStateException("only echo requests can be answered (was " + type + ")");
    }
    return new IcmpMessage(IcmpType.ECHO_REPLY, 0, identifier, sequence, data);
  }

  /**
   * Creates an error message quoting the offending packet's header and first eight payload bytes (RFC 792).
   *
   * @param type error type
   * @param code error code
   * @param offending packet that triggered the error
   * @return error message
   */
  public static IcmpMessage error(IcmpType type, int code, Ipv4Packet offending) {
    if (!type.isError()) {
      throw new IllegalArgumentException("not an ICMP error type: " + type);
    }
    byte[] header = offending.headerBytes();
    byte[] leading = offending.payload().leadingBytes();
    byte[] quoted = Arrays.copyOf(header, header.length + leading.length);
    System.arraycopy(leading, 0, quoted, header.length, leading.length);
    return new IcmpMessage(type, code, 0, 0, quoted);
  }

  /**
   * Provides the data bytes without copying.
   *
   * @return internal data array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Data is copied on construction; ICMP messages are re-read on every hop.")
  public byte[] data() {
    return data;
  }

  /**
   * Renders the message, including a freshly computed checksum.
   *
   * @return encoded ICMP message
   */
  public byte[] toBytes() {
    byte[] out = new byte[8 + data.length];
    out[0] = (byte) type.code();
    out[1] = (byte) code;
    Bytes.putU16be(out, 4, identifier);
    Bytes.putU16be(out, 6, sequence);
    System.arraycopy(data, 0, out, 8, data.length);
    Bytes.putU16be(out, 2, Bytes.internetChecksum(out, 0, out.length));
    return out;
  }

  /** @return ICMP checksum over the encoded message */
  public int checksum() {
    return Bytes.u16be(toBytes(), 2);
  }

  /** @return {@code true} when this is an error rather than a query */
  public boolean isError() {
    return type.isError();
  }

  /**
   * Returns a copy with a different identifier; PAT uses the echo identifier as the translated port.
   *
   * @param newIdentifier identifier
   * @return rewritten message
   */
  public IcmpMessage withIdentifier(int newIdentifier) {
    return new IcmpMessage(type, code, newIdentifier, sequence, data);
  }

  @Override
  public int length() {
    return 8 + data.length;
  }

  @Override
  public byte[] leadingBytes() {
    return Arrays.copyOf(toBytes(), 8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof IcmpMessage that)) {
      return false;
    }
    return type == that.type
        && code == that.code
        && identifier == that.identifier
        && sequence == that.sequence
        && Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(type, code, identifier, sequence);
    result = 31 * result + Arrays.hashCode(data);
    return result;
  }

  @Override
  public String toString() {
    return "IcmpMessage{" + type + ", code=" + code + ", id=" + identifier + ", seq=" + sequence
        + ", dataLength=" + data.length + '}';
  }
}
