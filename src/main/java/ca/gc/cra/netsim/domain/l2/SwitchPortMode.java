package ca.gc.cra.netsim.domain.l2;

/**
 * 802.1Q role of a switch port.
 *
 * @since 0.1.0
 */
public enum SwitchPortMode {
  /** Carries one VLAN, untagged. */
  ACCESS,
  /** Carries the allowed VLANs tagged and the native VLAN untagged. */
  TRUNK
}
