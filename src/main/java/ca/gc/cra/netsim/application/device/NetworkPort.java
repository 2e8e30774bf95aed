package ca.gc.cra.netsim.application.device;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.MacAddress;
import ca.gc.cra.netsim.domain.net.SubnetMask;
import java.util.Objects;
import java.util.Optional;

/**
 * Physical port of a device: name, burned-in MAC, administrative state and, on layer 3 devices, an IPv4 address.
 *
 * <p>Mutated only by the owning device.</p>
 *
 * @since 0.1.0
 */
public final class NetworkPort {
  private final String name;
  private final MacAddress mac;
  private boolean enabled = true;
  private Ipv4Address address;
  private SubnetMask mask;

  NetworkPort(String name, MacAddress mac) {
    this.name = Objects.requireNonNull(name, "name");
    this.mac = Objects.requireNonNull(mac, "mac");
  }

  public String name() {
    return name;
  }

  public MacAddress mac() {
    return mac;
  }

  /** @return {@code false} after {@code shutdown} */
  public boolean isEnabled() {
    return enabled;
  }

  public Optional<Ipv4Address> address() {
    return Optional.ofNullable(address);
  }

  public Optional<SubnetMask> mask() {
    return Optional.ofNullable(mask);
  }

  /** @return {@code true} when an address is configured */
  public boolean hasAddress() {
    return address != null;
  }

  /**
   * Returns whether {@code destination} lies in this port's subnet.
   *
   * @param destination address
   * @return {@code false} when unaddressed
   */
  public boolean isOnLink(Ipv4Address destination) {
    return address != null && address.sameSubnet(destination, mask);
  }

  void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  void setAddress(Ipv4Address address, SubnetMask mask) {
    this.address = address;
    this.mask = mask;
  }

  @Override
  public String toString() {
    return name + (address == null ? "" : " " + address + "/" + mask.prefixLength()) + (enabled ? "" : " (shutdown)");
  }
}
