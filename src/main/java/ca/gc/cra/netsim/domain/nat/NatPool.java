package ca.gc.cra.netsim.domain.nat;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import ca.gc.cra.netsim.validation.Strings;
import java.util.Objects;

/**
 * Range of global addresses for dynamic NAT.
 *
 * @param name pool name
 * @param start first address
 * @param end last address, not before {@code start}
 * @param netmask pool netmask
 * @param type plain pool or overload
 * @since 0.1.0
 */
public record NatPool(String name, Ipv4Address start, Ipv4Address end, SubnetMask netmask, Type type) {

  /** Allocation mode of a pool. */
  public enum Type {
    /** One global address per inside host. */
    POOL,
    /** Addresses shared through port translation. */
    OVERLOAD
  }

  /**
   * Validates fields.
   */
  public NatPool {
    name = Strings.requireIdentifier("pool name", name);
    Objects.requireNonNull(start, "start");
    Objects.requireNonNull(end, "end");
    Objects.requireNonNull(netmask, "netmask");
    Objects.requireNonNull(type, "type");
    if (start.compareTo(end) > 0) {
      throw new IllegalArgumentException("pool start " + start + " must not follow end " + end);
    }
  }

  /** @return number of addresses in the pool */
  public long size() {
    return end.toUnsigned() - start.toUnsigned() + 1;
  }

  /**
   * Returns whether {@code address} lies in the pool.
   *
   * @param address address
   * @return {@code true} when within [start, end]
   */
  public boolean contains(Ipv4Address address) {
    return address.compareTo(start) >= 0 && address.compareTo(end) <= 0;
  }
}
