package ca.gc.cra.netsim.domain.nat;

/**
 * Outcome of a translation attempt.
 *
 * @since 0.1.0
 */
public enum NatStatus {
  /** The packet was rewritten. */
  TRANSLATED,
  /** No rule applied; the packet continues unchanged. */
  NOT_MATCHED,
  /** A rule applied but its pool or port space is used up; the caller drops the packet. */
  EXHAUSTED
}
