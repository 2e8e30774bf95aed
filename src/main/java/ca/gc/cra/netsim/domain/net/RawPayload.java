package ca.gc.cra.netsim.domain.net;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Arrays;

/**
 * <strong>What:</strong> Opaque payload bytes at either layer 2 or layer 3.
 * <p><strong>Why:</strong> Lets frames and packets carry content the simulator does not interpret.</p>
 * <p><strong>Thread-safety:</strong> Immutable; bytes are copied on construction.</p>
 *
 * @param data payload bytes; defensively copied
 * @since 0.1.0
 */
public record RawPayload(byte[] data) implements FramePayload, Ipv4Payload {
  /** Zero-length payload. */
  public static final RawPayload EMPTY = new RawPayload(new byte[0]);

  /**
   * Copies {@code data}, substituting an empty array for {@code null}.
   */
  public RawPayload {
    data = data != null ? data.clone() : new byte[0];
  }

  /**
   * Creates a payload of {@code size} zero bytes.
   *
   * @param size payload size in bytes
   * @return zero-filled payload
   */
  public static RawPayload ofSize(int size) {
    return new RawPayload(new byte[Math.max(0, size)]);
  }

  /**
   * Provides access to the payload without additional copying.
   *
   * @return internal payload array; callers must not mutate it
   */
  @SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Payload is copied on construction; exposing the canonical buffer avoids a copy per hop.")
  public byte[] data() {
    return data;
  }

  @Override
  public int length() {
    return data.length;
  }

  @Override
  public byte[] leadingBytes() {
    return Arrays.copyOf(data, Math.min(8, data.length));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawPayload that)) {
      return false;
    }
    return Arrays.equals(data, that.data);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "RawPayload{length=" + data.length + '}';
  }
}
