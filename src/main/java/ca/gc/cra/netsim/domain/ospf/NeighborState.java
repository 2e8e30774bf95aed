package ca.gc.cra.netsim.domain.ospf;

/**
 * Neighbor conversation states (RFC 2328 §10.1), in ascending order of progress.
 *
 * @since 0.1.0
 */
public enum NeighborState {
  DOWN("Down"),
  ATTEMPT("Attempt"),
  INIT("Init"),
  TWO_WAY("TwoWay"),
  EXSTART("ExStart"),
  EXCHANGE("Exchange"),
  LOADING("Loading"),
  FULL("Full");

  private final String displayName;

  NeighborState(String displayName) {
    this.displayName = displayName;
  }

  /**
   * Returns whether this state is at or beyond {@code other}.
   *
   * @param other reference state
   * @return {@code true} when {@code this >= other}
   */
  public boolean isAtLeast(NeighborState other) {
    return compareTo(other) >= 0;
  }

  /** @return {@code true} for Exchange, Loading and Full, the states that take part in flooding */
  public boolean isSynchronizing() {
    return isAtLeast(EXCHANGE);
  }

  @Override
  public String toString() {
    return displayName;
  }
}
