package ca.gc.cra.netsim.domain.acl;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Sequenced access-list entry with its hit counter.
 *
 * <p>The rule is immutable; only the counter changes.</p>
 *
 * @since 0.1.0
 */
public final class AclEntry {
  private final int sequence;
  private final AclRule rule;
  private final AtomicLong hits = new AtomicLong();

  /**
   * Creates an entry.
   *
   * @param sequence position within the list; lower sequences are evaluated first
   * @param rule conditions and verdict
   */
  public AclEntry(int sequence, AclRule rule) {
    if (sequence <= 0) {
      throw new IllegalArgumentException("sequence must be positive (was " + sequence + ")");
    }
    this.sequence = sequence;
    this.rule = Objects.requireNonNull(rule, "rule");
  }

  public int sequence() {
    return sequence;
  }

  public AclRule rule() {
    return rule;
  }

  public AclAction action() {
    return rule.action();
  }

  /** @return number of packets this entry decided */
  public long hits() {
    return hits.get();
  }

  void recordHit() {
    hits.incrementAndGet();
  }

  void resetHits() {
    hits.set(0);
  }

  @Override
  public String toString() {
    return "AclEntry{" + sequence + " " + rule.action() + ", hits=" + hits.get() + "}";
  }
}
