package ca.gc.cra.netsim.domain.acl;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.Objects;

/**
 * Address and wildcard pair. Wildcard bits set to 1 are "don't care".
 *
 * @param network address operand
 * @param wildcard wildcard mask; need not be contiguous
 * @since 0.1.0
 */
public record AddressMatch(Ipv4Address network, Ipv4Address wildcard) {
  /** Matches every address ({@code any}). */
  public static final AddressMatch ANY = new AddressMatch(Ipv4Address.ANY, Ipv4Address.BROADCAST);

  /**
   * Validates fields.
   */
  public AddressMatch {
    Objects.requireNonNull(network, "network");
    Objects.requireNonNull(wildcard, "wildcard");
  }

  /**
   * Matches exactly one address ({@code host a.b.c.d}).
   *
   * @param address host address
   * @return match
   */
  public static AddressMatch host(Ipv4Address address) {
    return new AddressMatch(address, Ipv4Address.ANY);
  }

  /**
   * Tests an address: {@code (address XOR network) AND NOT wildcard == 0}.
   *
   * @param address address to test
   * @return {@code true} when every cared-for bit matches
   */
  public boolean matches(Ipv4Address address) {
    return ((address.bits() ^ network.bits()) & ~wildcard.bits()) == 0;
  }

  /** @return {@code true} for {@code any} */
  public boolean isAny() {
    return wildcard.bits() == -1;
  }

  /** @return {@code true} for a single host */
  public boolean isHost() {
    return wildcard.bits() == 0;
  }
}
