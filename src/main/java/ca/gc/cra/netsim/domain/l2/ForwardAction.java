package ca.gc.cra.netsim.domain.l2;

/**
 * Outcome of a switch forwarding decision.
 *
 * @since 0.1.0
 */
public enum ForwardAction {
  /** Sent to the single port the destination was learned on. */
  FORWARD,
  /** Sent to every port of the VLAN except the ingress port. */
  FLOOD,
  /** Destination lives on the ingress port; nothing sent. */
  FILTER,
  /** Discarded by VLAN or port policy. */
  DROP
}
