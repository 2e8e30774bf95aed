package ca.gc.cra.netsim.domain.ospf;

/**
 * A link state advertisement: header plus type-specific body.
 *
 * @since 0.1.0
 */
public interface Lsa {
  LsaHeader header();

  /**
   * Encodes the type-specific body.
   *
   * @return body bytes following the header
   */
  byte[] bodyBytes();

  /**
   * Returns a copy with a different age; the checksum does not cover the age and stays valid.
   *
   * @param age age in seconds
   * @return aged copy
   */
  Lsa withAge(int age);

  default LsaKey key() {
    return header().key();
  }

  /**
   * Encodes the whole LSA.
   *
   * @return header followed by body
   */
  default byte[] toBytes() {
    byte[] body = bodyBytes();
    byte[] out = new byte[LsaHeader.BYTES + body.length];
    header().writeTo(out, 0);
    System.arraycopy(body, 0, out, LsaHeader.BYTES, body.length);
    return out;
  }
}
