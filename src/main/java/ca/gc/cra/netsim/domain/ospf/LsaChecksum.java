package ca.gc.cra.netsim.domain.ospf;

/**
 * Fletcher checksum used by LSAs (RFC 2328 §12.1.7, ISO 8473 Annex C).
 *
 * <p>Computed over the whole LSA except the LS age field, with the checksum bytes treated as zero. The checksum
 * field sits at offset 16 of the LSA, offset 14 of the checksummed range.</p>
 *
 * @since 0.1.0
 */
public final class LsaChecksum {
  private static final int AGE_BYTES = 2;
  private static final int CHECKSUM_OFFSET = 14;
  private static final int MODULUS = 255;

  private LsaChecksum() {
    // Utility
  }

  /**
   * Computes the checksum of an encoded LSA.
   *
   * @param lsa encoded LSA starting with the 20-byte header; not modified
   * @return checksum value to store in the header
   * @throws IllegalArgumentException when the buffer is shorter than an LSA header
   */
  public static int compute(byte[] lsa) {
    if (lsa == null || lsa.length < LsaHeader.BYTES) {
      throw new IllegalArgumentException("LSA must be at least " + LsaHeader.BYTES + " bytes");
    }
    byte[] buf = lsa.clone();
    int len = buf.length - AGE_BYTES;
    buf[AGE_BYTES + CHECKSUM_OFFSET] = 0;
    buf[AGE_BYTES + CHECKSUM_OFFSET + 1] = 0;

    int c0 = 0;
    int c1 = 0;
    for (int i = AGE_BYTES; i < buf.length; i++) {
      c0 = (c0 + (buf[i] & 0xFF)) % MODULUS;
      c1 = (c1 + c0) % MODULUS;
    }

    int x = ((len - CHECKSUM_OFFSET - 1) * c0 - c1) % MODULUS;
    if (x <= 0) {
      x += MODULUS;
    }
    int y = 510 - c0 - x;
    if (y > MODULUS) {
      y -= MODULUS;
    }
    return (x << 8) | y;
  }

  /**
   * Verifies an LSA's carried checksum.
   *
   * @param lsa LSA
   * @return {@code true} when the carried checksum matches its content
   */
  public static boolean verify(Lsa lsa) {
    return compute(lsa.toBytes()) == lsa.header().checksum();
  }
}
