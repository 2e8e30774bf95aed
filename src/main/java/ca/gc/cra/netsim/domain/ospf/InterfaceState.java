package ca.gc.cra.netsim.domain.ospf;

/**
 * OSPF interface states (RFC 2328 §9.1).
 *
 * @since 0.1.0
 */
public enum InterfaceState {
  DOWN("Down"),
  WAITING("Waiting"),
  POINT_TO_POINT("PointToPoint"),
  DR_OTHER("DROther"),
  BACKUP("Backup"),
  DR("DR");

  private final String displayName;

  InterfaceState(String displayName) {
    this.displayName = displayName;
  }

  /** @return {@code true} once the DR election has run on a multi-access network */
  public boolean isElected() {
    return this == DR_OTHER || this == BACKUP || this == DR;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
