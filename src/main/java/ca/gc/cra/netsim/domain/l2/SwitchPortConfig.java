package ca.gc.cra.netsim.domain.l2;

import ca.gc.cra.netsim.validation.Numbers;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * VLAN settings of one switch port. Immutable; the switch swaps whole values on reconfiguration.
 *
 * @param mode access or trunk
 * @param accessVlan VLAN carried by an access port
 * @param nativeVlan VLAN carried untagged on a trunk
 * @param allowedVlans VLANs a trunk carries; empty means all
 * @since 0.1.0
 */
public record SwitchPortConfig(SwitchPortMode mode, int accessVlan, int nativeVlan, Set<Integer> allowedVlans) {
  /** Default port: access in VLAN 1. */
  public static final SwitchPortConfig DEFAULT = access(Vlan.DEFAULT_ID);

  /**
   * Validates fields and copies the allowed set.
   */
  public SwitchPortConfig {
    Objects.requireNonNull(mode, "mode");
    Numbers.requireRange("accessVlan", accessVlan, 1, 4094);
    Numbers.requireRange("nativeVlan", nativeVlan, 1, 4094);
    allowedVlans = Set.copyOf(allowedVlans == null ? Set.of() : allowedVlans);
    for (int vid : allowedVlans) {
      Numbers.requireRange("allowedVlan", vid, 1, 4094);
    }
  }

  /**
   * Access port in {@code vlan}.
   *
   * @param vlan VLAN ID
   * @return config
   */
  public static SwitchPortConfig access(int vlan) {
    return new SwitchPortConfig(SwitchPortMode.ACCESS, vlan, Vlan.DEFAULT_ID, Set.of());
  }

  /**
   * Trunk port.
   *
   * @param nativeVlan untagged VLAN
   * @param allowed allowed VLANs; empty means all
   * @return config
   */
  public static SwitchPortConfig trunk(int nativeVlan, Set<Integer> allowed) {
    return new SwitchPortConfig(SwitchPortMode.TRUNK, Vlan.DEFAULT_ID, nativeVlan, allowed);
  }

  /**
   * Returns whether frames of {@code vlan} may cross this port.
   *
   * @param vlan VLAN ID
   * @return {@code true} when carried
   */
  public boolean carries(int vlan) {
    if (mode == SwitchPortMode.ACCESS) {
      return accessVlan == vlan;
    }
    return allowedVlans.isEmpty() || allowedVlans.contains(vlan);
  }

  /**
   * Returns a copy with {@code vlan} as access VLAN.
   *
   * @param vlan VLAN ID
   * @return config
   */
  public SwitchPortConfig withAccessVlan(int vlan) {
    return new SwitchPortConfig(mode, vlan, nativeVlan, allowedVlans);
  }

  @Override
  public String toString() {
    return mode == SwitchPortMode.ACCESS
        ? "access vlan " + accessVlan
        : "trunk native " + nativeVlan + " allowed " + (allowedVlans.isEmpty() ? "all" : new TreeSet<>(allowedVlans));
  }
}
