package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.util.Bytes;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.Objects;

/**
 * <strong>What:</strong> The 20-byte header shared by every LSA.
 * <p><strong>Why:</strong> Database Description and Link State Acknowledgment packets carry headers only; comparing two
 * headers is enough to decide which instance is more recent.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param age LS age in seconds, capped at MaxAge
 * @param options options byte
 * @param type LS type code
 * @param linkStateId link state ID
 * @param advertisingRouter originating router ID
 * @param sequence signed LS sequence number
 * @param checksum Fletcher checksum over the LSA without the age field
 * @param length LSA length in bytes including this header
 * @since 0.1.0
 */
public record LsaHeader(
    int age,
    int options,
    int type,
    Ipv4Address linkStateId,
    Ipv4Address advertisingRouter,
    int sequence,
    int checksum,
    int length) {

  /** Encoded header size in bytes. */
  public static final int BYTES = 20;

  /**
   * Validates field widths.
   */
  public LsaHeader {
    Numbers.requireRange("age", age, 0, OspfConstants.MAX_AGE_SECONDS);
    Numbers.requireRange("options", options, 0, 255);
    Numbers.requireRange("type", type, 0, 255);
    Objects.requireNonNull(linkStateId, "linkStateId");
    Objects.requireNonNull(advertisingRouter, "advertisingRouter");
    Numbers.requireRange("checksum", checksum, 0, 0xFFFF);
    Numbers.requireRange("length", length, BYTES, 0xFFFF);
  }

  public LsaKey key() {
    return new LsaKey(type, linkStateId, advertisingRouter);
  }

  /** @return {@code true} once the LSA has aged out and is being flushed */
  public boolean isMaxAge() {
    return age >= OspfConstants.MAX_AGE_SECONDS;
  }

  /**
   * Returns a copy with a different age.
   *
   * @param newAge age in seconds
   * @return header
   */
  public LsaHeader withAge(int newAge) {
    return new LsaHeader(Math.min(newAge, OspfConstants.MAX_AGE_SECONDS), options, type, linkStateId,
        advertisingRouter, sequence, checksum, length);
  }

  /**
   * Returns a copy with a different checksum.
   *
   * @param newChecksum checksum
   * @return header
   */
  public LsaHeader withChecksum(int newChecksum) {
    return new LsaHeader(age, options, type, linkStateId, advertisingRouter, sequence, newChecksum, length);
  }

  /**
   * Decides which of two instances of the same LSA is more recent (RFC 2328 §13.1).
   *
   * <p>Higher sequence wins (signed comparison). On a tie the higher checksum wins, then an instance at MaxAge,
   * then the younger instance when the ages differ by more than MaxAgeDiff.</p>
   *
   * @param other another instance of the same LSA
   * @return positive when this instance is newer, negative when older, zero when they are the same instance
   */
  public int compareInstance(LsaHeader other) {
    if (sequence != other.sequence) {
      return Integer.compare(sequence, other.sequence);
    }
    if (checksum != other.checksum) {
      return Integer.compare(checksum, other.checksum);
    }
    if (isMaxAge() != other.isMaxAge()) {
      return isMaxAge() ? 1 : -1;
    }
    if (Math.abs(age - other.age) > OspfConstants.MAX_AGE_DIFF_SECONDS) {
      return age < other.age ? 1 : -1;
    }
    return 0;
  }

  /**
   * Encodes the header in network order.
   *
   * @return 20 bytes
   */
  public byte[] toBytes() {
    byte[] out = new byte[BYTES];
    writeTo(out, 0);
    return out;
  }

  void writeTo(byte[] out, int off) {
    Bytes.putU16be(out, off, age);
    out[off + 2] = (byte) options;
    out[off + 3] = (byte) type;
    Bytes.putU32be(out, off + 4, linkStateId.bits());
    Bytes.putU32be(out, off + 8, advertisingRouter.bits());
    Bytes.putU32be(out, off + 12, sequence);
    Bytes.putU16be(out, off + 16, checksum);
    Bytes.putU16be(out, off + 18, length);
  }

  @Override
  public String toString() {
    return "LSA{" + key() + ", seq=0x" + Integer.toHexString(sequence) + ", age=" + age + "}";
  }
}
