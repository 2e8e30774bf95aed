package ca.gc.cra.netsim.domain.l2;

/**
 * Origin of a MAC table entry.
 *
 * @since 0.1.0
 */
public enum MacEntryType {
  /** Learned from a frame's source address; ages out. */
  DYNAMIC,
  /** Configured by an operator; never aged or overwritten by learning. */
  STATIC
}
