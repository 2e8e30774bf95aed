package ca.gc.cra.netsim.domain.ospf;

/**
 * Inputs to the interface state machine (RFC 2328 §9.2).
 *
 * @since 0.1.0
 */
public enum InterfaceEvent {
  INTERFACE_UP("InterfaceUp"),
  WAIT_TIMER("WaitTimer"),
  BACKUP_SEEN("BackupSeen"),
  NEIGHBOR_CHANGE("NeighborChange"),
  INTERFACE_DOWN("InterfaceDown");

  private final String displayName;

  InterfaceEvent(String displayName) {
    this.displayName = displayName;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
