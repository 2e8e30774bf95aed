package ca.gc.cra.netsim.domain.ospf;

/**
 * Inputs to the neighbor state machine (RFC 2328 §10.2).
 *
 * @since 0.1.0
 */
public enum NeighborEvent {
  HELLO_RECEIVED("HelloReceived"),
  START("Start"),
  TWO_WAY_RECEIVED("TwoWayReceived"),
  NEGOTIATION_DONE("NegotiationDone"),
  EXCHANGE_DONE("ExchangeDone"),
  BAD_LS_REQ("BadLSReq"),
  LOADING_DONE("LoadingDone"),
  ADJ_OK("AdjOK"),
  SEQ_NUMBER_MISMATCH("SeqNumberMismatch"),
  ONE_WAY("OneWay"),
  KILL_NBR("KillNbr"),
  INACTIVITY_TIMER("InactivityTimer"),
  LL_DOWN("LLDown");

  private final String displayName;

  NeighborEvent(String displayName) {
    this.displayName = displayName;
  }

  /** @return {@code true} for the events that tear the neighbor down */
  public boolean isTeardown() {
    return this == KILL_NBR || this == INACTIVITY_TIMER || this == LL_DOWN;
  }

  @Override
  public String toString() {
    return displayName;
  }
}
