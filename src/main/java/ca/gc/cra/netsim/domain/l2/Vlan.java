package ca.gc.cra.netsim.domain.l2;

import ca.gc.cra.netsim.validation.Numbers;
import ca.gc.cra.netsim.validation.Strings;

/**
 * VLAN database row.
 *
 * @param id VLAN ID, 1-4094
 * @param name display name
 * @since 0.1.0
 */
public record Vlan(int id, String name) {
  /** ID of the default VLAN, which cannot be deleted. */
  public static final int DEFAULT_ID = 1;

  /**
   * Validates fields.
   */
  public Vlan {
    Numbers.requireRange("vlan", id, 1, 4094);
    name = Strings.requireNonBlank("name", name);
  }

  /**
   * Builds a VLAN with the conventional {@code VLAN0010} style name.
   *
   * @param id VLAN ID
   * @return VLAN
   */
  public static Vlan withDefaultName(int id) {
    return new Vlan(id, id == DEFAULT_ID ? "default" : String.format(java.util.Locale.ROOT, "VLAN%04d", id));
  }
}
