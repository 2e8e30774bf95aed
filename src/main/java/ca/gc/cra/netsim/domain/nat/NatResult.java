package ca.gc.cra.netsim.domain.nat;

import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import java.util.Objects;
import java.util.Optional;

/**
 * Translation outcome with the packet to continue with.
 *
 * @param status outcome
 * @param packet rewritten packet when translated, otherwise the input packet
 * @param translation translation used, or {@code null} when none applied
 * @since 0.1.0
 */
public record NatResult(NatStatus status, Ipv4Packet packet, NatTranslation translation) {
  /**
   * Validates fields.
   */
  public NatResult {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(packet, "packet");
  }

  /**
   * Result for a packet no rule applied to.
   *
   * @param packet unchanged packet
   * @return result
   */
  public static NatResult notMatched(Ipv4Packet packet) {
    return new NatResult(NatStatus.NOT_MATCHED, packet, null);
  }

  /**
   * Result for a packet whose rule had no free address or port.
   *
   * @param packet unchanged packet
   * @return result
   */
  public static NatResult exhausted(Ipv4Packet packet) {
    return new NatResult(NatStatus.EXHAUSTED, packet, null);
  }

  /**
   * Result for a rewritten packet.
   *
   * @param packet rewritten packet
   * @param translation translation used
   * @return result
   */
  public static NatResult of(Ipv4Packet packet, NatTranslation translation) {
    return new NatResult(NatStatus.TRANSLATED, packet, Objects.requireNonNull(translation, "translation"));
  }

  /** @return {@code true} when the packet was rewritten */
  public boolean isTranslated() {
    return status == NatStatus.TRANSLATED;
  }

  public Optional<NatTranslation> usedTranslation() {
    return Optional.ofNullable(translation);
  }
}
