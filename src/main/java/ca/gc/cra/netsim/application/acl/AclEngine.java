package ca.gc.cra.netsim.application.acl;

import ca.gc.cra.netsim.domain.acl.AccessList;
import ca.gc.cra.netsim.domain.acl.AclAction;
import ca.gc.cra.netsim.domain.acl.AclBinding;
import ca.gc.cra.netsim.domain.acl.AclDirection;
import ca.gc.cra.netsim.domain.acl.AclEntry;
import ca.gc.cra.netsim.domain.acl.AclId;
import ca.gc.cra.netsim.domain.acl.AclRule;
import ca.gc.cra.netsim.domain.acl.AclStatistics;
import ca.gc.cra.netsim.domain.acl.AclType;
import ca.gc.cra.netsim.domain.net.FiveTuple;
import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Per-router access-list store, interface bindings and packet evaluation.
 * <p><strong>Semantics:</strong> first matching entry wins; no match is an implicit deny; an unknown list or an
 * unbound interface permits. At most one list is bound per (interface, direction); rebinding replaces it.</p>
 * <p><strong>Role:</strong> Application service owned by a {@code Router}; also usable standalone.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven from the simulation thread.</p>
 *
 * @since 0.1.0
 */
public final class AclEngine {
  private static final Logger log = LoggerFactory.getLogger(AclEngine.class);
  private static final int SEQUENCE_STEP = 10;

  private final String owner;
  private final Map<AclId, AccessList> lists = new LinkedHashMap<>();
  private final Map<AclId, Integer> nextSequence = new LinkedHashMap<>();
  private final List<AclBinding> bindings = new ArrayList<>();

  /**
   * Creates an engine.
   *
   * @param owner device name used in log lines
   */
  public AclEngine(String owner) {
    this.owner = Objects.requireNonNull(owner, "owner");
  }

  /**
   * Appends an entry to a numbered list, creating the list when needed. Sequences advance by 10.
   *
   * @param number list number; determines the list type
   * @param rule rule to append
   * @return created entry
   * @throws IllegalArgumentException when the number is outside the standard and extended ranges
   */
  public AclEntry addNumberedEntry(int number, AclRule rule) {
    AclType type = AclType.forNumber(number)
        .orElseThrow(() -> new IllegalArgumentException("ACL number " + number + " is not a standard or extended list"));
    AclId id = AclId.of(number);
    AccessList list = lists.computeIfAbsent(id, k -> new AccessList(k, type));
    int sequence = nextSequence.getOrDefault(id, SEQUENCE_STEP);
    nextSequence.put(id, sequence + SEQUENCE_STEP);
    AclEntry entry = list.put(sequence, Objects.requireNonNull(rule, "rule"));
    log.info("{}: access-list {} seq {} {}", owner, number, sequence, AclEntryFormatter.format(entry, type));
    return entry;
  }

  /**
   * Adds an entry to a named list, creating the list with {@code type} when needed.
   *
   * @param name list name
   * @param type list type; ignored when the list already exists
   * @param rule rule
   * @param sequence explicit sequence, or {@code null} to take the next multiple of 10
   * @return created entry
   */
  public AclEntry addNamedEntry(String name, AclType type, AclRule rule, Integer sequence) {
    AclId id = AclId.named(name);
    AccessList list = lists.computeIfAbsent(id, k -> new AccessList(k, Objects.requireNonNull(type, "type")));
    int seq;
    if (sequence == null) {
      seq = nextSequence.getOrDefault(id, SEQUENCE_STEP);
      nextSequence.put(id, seq + SEQUENCE_STEP);
    } else {
      seq = sequence;
      int next = ((seq / SEQUENCE_STEP) + 1) * SEQUENCE_STEP;
      nextSequence.merge(id, next, Math::max);
    }
    AclEntry entry = list.put(seq, Objects.requireNonNull(rule, "rule"));
    log.info("{}: ip access-list {} {} seq {} {}", owner, list.type(), name, seq,
        AclEntryFormatter.format(entry, list.type()));
    return entry;
  }

  /**
   * Removes the entry at {@code sequence}.
   *
   * @param id list
   * @param sequence sequence number
   * @return {@code true} when removed
   */
  public boolean removeEntry(AclId id, int sequence) {
    AccessList list = lists.get(id);
    return list != null && list.remove(sequence);
  }

  /**
   * Deletes a whole list. Bindings referring to it stay and then permit, as an unknown list does.
   *
   * @param id list
   * @return {@code true} when a list was deleted
   */
  public boolean deleteAcl(AclId id) {
    nextSequence.remove(id);
    boolean removed = lists.remove(id) != null;
    if (removed) {
      log.info("{}: access-list {} deleted", owner, id);
    }
    return removed;
  }

  public Optional<AccessList> getAcl(AclId id) {
    return Optional.ofNullable(lists.get(id));
  }

  /** @return all lists, numbered and named, in creation order */
  public List<AccessList> getAcls() {
    return List.copyOf(lists.values());
  }

  /**
   * Binds {@code id} to an interface direction, replacing any list bound there.
   *
   * @param interfaceName interface
   * @param id list
   * @param direction direction
   */
  public void bindToInterface(String interfaceName, AclId id, AclDirection direction) {
    bindings.removeIf(b -> b.interfaceName().equals(interfaceName) && b.direction() == direction);
    bindings.add(new AclBinding(interfaceName, id, direction));
    log.info("{}: {} ip access-group {} {}", owner, interfaceName, id, direction);
  }

  /**
   * Removes the binding of an interface direction.
   *
   * @param interfaceName interface
   * @param direction direction
   * @return {@code true} when a binding was removed
   */
  public boolean unbindFromInterface(String interfaceName, AclDirection direction) {
    return bindings.removeIf(b -> b.interfaceName().equals(interfaceName) && b.direction() == direction);
  }

  public List<AclBinding> getBindings() {
    return List.copyOf(bindings);
  }

  /**
   * Returns the list bound to an interface direction.
   *
   * @param interfaceName interface
   * @param direction direction
   * @return bound list id, or empty
   */
  public Optional<AclId> boundAcl(String interfaceName, AclDirection direction) {
    for (AclBinding binding : bindings) {
      if (binding.interfaceName().equals(interfaceName) && binding.direction() == direction) {
        return Optional.of(binding.aclId());
      }
    }
    return Optional.empty();
  }

  /**
   * Evaluates a packet key against a list.
   *
   * @param id list
   * @param tuple packet key
   * @return verdict; {@link AclAction#PERMIT} for an unknown list, {@link AclAction#DENY} when nothing matches
   */
  public AclAction evaluate(AclId id, FiveTuple tuple) {
    Objects.requireNonNull(tuple, "tuple");
    AccessList list = lists.get(id);
    if (list == null) {
      return AclAction.PERMIT;
    }
    Optional<AclEntry> match = list.evaluate(tuple);
    if (match.isEmpty()) {
      log.debug("{}: access-list {} implicit deny {}", owner, id, tuple);
      return AclAction.DENY;
    }
    AclEntry entry = match.get();
    if (entry.rule().log()) {
      log.info("{}: list {} {} {} ({} matches)", owner, id, entry.action(), tuple, entry.hits());
    }
    return entry.action();
  }

  /**
   * Convenience form of {@link #evaluate(AclId, FiveTuple)} for a packet.
   *
   * @param id list
   * @param packet packet
   * @return {@code true} when permitted
   */
  public boolean permits(AclId id, Ipv4Packet packet) {
    return evaluate(id, FiveTuple.of(packet)) == AclAction.PERMIT;
  }

  /**
   * Checks a packet against whatever list is bound to the interface direction.
   *
   * @param interfaceName interface
   * @param direction direction
   * @param packet packet
   * @return {@code true} when permitted (including when nothing is bound)
   */
  public boolean checkPacket(String interfaceName, AclDirection direction, Ipv4Packet packet) {
    Optional<AclId> bound = boundAcl(interfaceName, direction);
    return bound.isEmpty() || permits(bound.get(), packet);
  }

  /**
   * Renders an entry in IOS style, e.g. {@code 10 permit tcp any host 10.0.0.1 eq www established}.
   *
   * @param entry entry
   * @param type owning list type
   * @return rendering
   */
  public String formatEntry(AclEntry entry, AclType type) {
    return AclEntryFormatter.format(entry, type);
  }

  /**
   * Resets hit counters of one list.
   *
   * @param id list
   */
  public void clearCounters(AclId id) {
    getAcl(id).ifPresent(AccessList::clearCounters);
  }

  /** Resets hit counters of every list. */
  public void clearCounters() {
    lists.values().forEach(AccessList::clearCounters);
  }

  /** @return summary counters */
  public AclStatistics getStatistics() {
    int numbered = 0;
    int entries = 0;
    for (AccessList list : lists.values()) {
      if (list.id().isNumbered()) {
        numbered++;
      }
      entries += list.size();
    }
    return new AclStatistics(lists.size(), numbered, lists.size() - numbered, entries, bindings.size());
  }
}
