package ca.gc.cra.netsim.domain.acl;

import ca.gc.cra.netsim.domain.net.FiveTuple;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Ordered list of entries identified by number or name.
 * <p><strong>Semantics:</strong> Entries are evaluated in ascending sequence order; the first match decides and
 * has its counter incremented. When nothing matches, {@link #evaluate(FiveTuple)} returns empty and the caller
 * applies the implicit deny.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by one {@code AclEngine}.</p>
 *
 * @since 0.1.0
 */
public final class AccessList {
  private final AclId id;
  private final AclType type;
  private final TreeMap<Integer, AclEntry> entries = new TreeMap<>();
  private String remark;

  /**
   * Creates an empty list.
   *
   * @param id identifier
   * @param type list type
   */
  public AccessList(AclId id, AclType type) {
    this.id = Objects.requireNonNull(id, "id");
    this.type = Objects.requireNonNull(type, "type");
  }

  public AclId id() {
    return id;
  }

  public AclType type() {
    return type;
  }

  /** @return entries in evaluation order */
  public List<AclEntry> entries() {
    return List.copyOf(entries.values());
  }

  /** @return highest sequence in use, or 0 when empty */
  public int lastSequence() {
    return entries.isEmpty() ? 0 : entries.lastKey();
  }

  public Optional<String> remark() {
    return Optional.ofNullable(remark);
  }

  public void setRemark(String remark) {
    this.remark = remark;
  }

  /**
   * Adds or replaces the entry at {@code sequence}.
   *
   * @param sequence sequence number
   * @param rule rule
   * @return the new entry
   */
  public AclEntry put(int sequence, AclRule rule) {
    AclEntry entry = new AclEntry(sequence, rule);
    entries.put(sequence, entry);
    return entry;
  }

  /**
   * Removes the entry at {@code sequence}.
   *
   * @param sequence sequence number
   * @return {@code true} when an entry was removed
   */
  public boolean remove(int sequence) {
    return entries.remove(sequence) != null;
  }

  /**
   * Finds the first matching entry and counts the hit.
   *
   * @param tuple packet key
   * @return deciding entry, or empty for the implicit deny
   */
  public Optional<AclEntry> evaluate(FiveTuple tuple) {
    for (AclEntry entry : entries.values()) {
      if (entry.rule().matches(tuple, type)) {
        entry.recordHit();
        return Optional.of(entry);
      }
    }
    return Optional.empty();
  }

  /** Resets every entry's hit counter. */
  public void clearCounters() {
    entries.values().forEach(AclEntry::resetHits);
  }

  /** @return number of entries */
  public int size() {
    return entries.size();
  }
}
