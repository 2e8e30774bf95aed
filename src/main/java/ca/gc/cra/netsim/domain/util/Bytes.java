package ca.gc.cra.netsim.domain.util;

/**
 * <strong>What:</strong> Utility methods for reading and writing unsigned big-endian integers in byte arrays.
 * <p><strong>Why:</strong> Header renderers (IPv4, ICMP, LSA) and checksum routines operate on raw network-order buffers.</p>
 * <p><strong>Role:</strong> Domain support functions reused across packet and OSPF value objects.</p>
 * <p><strong>Thread-safety:</strong> Stateless static helpers; safe for concurrent use.</p>
 * <p><strong>Performance:</strong> Constant-time bit manipulations; readers return 0 on invalid offsets instead of throwing.</p>
 *
 * @since 0.1.0
 */
public final class Bytes {
  private Bytes() {}

  /**
   * Reads an unsigned 8-bit value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset in the array
   * @return unsigned value in the range {@code [0,255]} or {@code 0} if out of bounds
   */
  public static int u8(byte[] a, int off) {
    if (a == null || off < 0 || off >= a.length) {
      return 0;
    }
    return a[off] & 0xFF;
  }

  /**
   * Reads an unsigned 16-bit big-endian value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset of the first byte
   * @return unsigned value or {@code 0} when insufficient bytes remain
   */
  public static int u16be(byte[] a, int off) {
    if (a == null || off < 0 || off + 1 >= a.length) {
      return 0;
    }
    return ((a[off] & 0xFF) << 8) | (a[off + 1] & 0xFF);
  }

  /**
   * Reads a 32-bit big-endian value.
   *
   * @param a byte array source; may be {@code null}
   * @param off offset of the most significant byte
   * @return value as an {@code int} or {@code 0} if out of bounds
   */
  public static int u32be(byte[] a, int off) {
    if (a == null || off < 0 || off + 3 >= a.length) {
      return 0;
    }
    return ((a[off] & 0xFF) << 24)
        | ((a[off + 1] & 0xFF) << 16)
        | ((a[off + 2] & 0xFF) << 8)
        | (a[off + 3] & 0xFF);
  }

  /**
   * Writes the low 16 bits of {@code value} in network order.
   *
   * @param a destination buffer
   * @param off offset of the first byte
   * @param value value to write; higher bits are ignored
   */
  public static void putU16be(byte[] a, int off, int value) {
    a[off] = (byte) (value >>> 8);
    a[off + 1] = (byte) value;
  }

  /**
   * Writes a 32-bit value in network order.
   *
   * @param a destination buffer
   * @param off offset of the most significant byte
   * @param value value to write
   */
  public static void putU32be(byte[] a, int off, int value) {
    a[off] = (byte) (value >>> 24);
    a[off + 1] = (byte) (value >>> 16);
    a[off + 2] = (byte) (value >>> 8);
    a[off + 3] = (byte) value;
  }

  /**
   * Computes the 16-bit one's-complement of the one's-complement sum of {@code len} bytes.
   *
   * <p>An odd trailing byte is padded with zero on the right, as for the Internet checksum
   * (RFC 1071).</p>
   *
   * @param a source buffer
   * @param off first byte to include
   * @param len number of bytes to include
   * @return checksum in the range {@code [0, 0xFFFF]}
   */
  public static int internetChecksum(byte[] a, int off, int len) {
    long sum = 0;
    int end = off + len;
    int i = off;
    for (; i + 1 < end; i += 2) {
      sum += ((a[i] & 0xFF) << 8) | (a[i + 1] & 0xFF);
    }
    if (i < end) {
      sum += (a[i] & 0xFF) << 8;
    }
    while ((sum >>> 16) != 0) {
      sum = (sum & 0xFFFF) + (sum >>> 16);
    }
    return (int) (~sum & 0xFFFF);
  }
}
