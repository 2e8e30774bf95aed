package ca.gc.cra.netsim.domain.net;

/**
 * TCP control bits.
 *
 * @param urg urgent pointer significant
 * @param ack acknowledgment field significant
 * @param psh push function
 * @param rst reset the connection
 * @param syn synchronize sequence numbers
 * @param fin no more data from sender
 * @since 0.1.0
 */
public record TcpFlags(boolean urg, boolean ack, boolean psh, boolean rst, boolean syn, boolean fin) {
  /** No bits set. */
  public static final TcpFlags NONE = new TcpFlags(false, false, false, false, false, false);
  /** Connection-opening SYN. */
  public static final TcpFlags SYN = new TcpFlags(false, false, false, false, true, false);
  /** Bare ACK. */
  public static final TcpFlags ACK = new TcpFlags(false, true, false, false, false, false);

  /**
   * Decodes the low six control bits.
   *
   * @param bits flag byte
   * @return decoded flags
   */
  public static TcpFlags fromBits(int bits) {
    return new TcpFlags(
        (bits & 0x20) != 0,
        (bits & 0x10) != 0,
        (bits & 0x08) != 0,
        (bits & 0x04) != 0,
        (bits & 0x02) != 0,
        (bits & 0x01) != 0);
  }

  /** @return encoded control bits */
  public int bits() {
    return (urg ? 0x20 : 0) | (ack ? 0x10 : 0) | (psh ? 0x08 : 0) | (rst ? 0x04 : 0) | (syn ? 0x02 : 0)
        | (fin ? 0x01 : 0);
  }

  /** @return {@code true} when ACK or RST is set, i.e. the segment belongs to an established connection */
  public boolean established() {
    return ack || rst;
  }
}
