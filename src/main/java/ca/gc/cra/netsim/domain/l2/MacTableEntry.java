package ca.gc.cra.netsim.domain.l2;

import ca.gc.cra.netsim.domain.net.MacAddress;
import java.util.Objects;

/**
 * One row of a switch MAC address table.
 *
 * @param vlan VLAN the address was seen in
 * @param mac station address
 * @param port switch port the station is reachable through
 * @param type dynamic or static
 * @param lastSeenMillis simulation time of the last learn/refresh
 * @since 0.1.0
 */
public record MacTableEntry(int vlan, MacAddress mac, String port, MacEntryType type, long lastSeenMillis) {
  /**
   * Validates fields.
   */
  public MacTableEntry {
    Objects.requireNonNull(mac, "mac");
    Objects.requireNonNull(port, "port");
    Objects.requireNonNull(type, "type");
  }
}
