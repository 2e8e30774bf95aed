package ca.gc.cra.netsim.domain.l2;

import ca.gc.cra.netsim.domain.net.MacAddress;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Switch MAC address table keyed by (VLAN, MAC).
 * <p><strong>Why:</strong> Lets the switch forward known unicast frames to one port instead of flooding.</p>
 * <p><strong>Role:</strong> Domain aggregate owned by one switch. Time is passed in by the caller so the table
 * never reads a clock itself.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to the owning switch.</p>
 *
 * @since 0.1.0
 */
public final class MacTable {
  private final Map<Key, MacTableEntry> entries = new LinkedHashMap<>();
  private final long agingMillis;
  private final int capacity;
  private long learned;
  private long moves;
  private long lookups;
  private long hits;
  private long misses;
  private long evictions;

  /**
   * Creates a table.
   *
   * @param agingSeconds idle time after which dynamic entries expire
   * @param capacity maximum number of entries
   */
  public MacTable(int agingSeconds, int capacity) {
    this.agingMillis = Numbers.requirePositive("agingSeconds", agingSeconds) * 1_000L;
    this.capacity = (int) Numbers.requirePositive("capacity", capacity);
  }

  /**
   * Learns or refreshes {@code mac} on {@code port}. Group addresses are ignored and static entries are never
   * overwritten.
   *
   * @param vlan VLAN ID
   * @param mac source address
   * @param port ingress port
   * @param nowMillis current simulation time
   * @return {@code true} when the table was updated
   */
  public boolean learn(int vlan, MacAddress mac, String port, long nowMillis) {
    Objects.requireNonNull(mac, "mac");
    Objects.requireNonNull(port, "port");
    if (!mac.isUnicast()) {
      return false;
    }
    Key key = new Key(vlan, mac);
    MacTableEntry existing = entries.get(key);
    if (existing != null && existing.type() == MacEntryType.STATIC) {
      return false;
    }
    if (existing != null && !existing.port().equals(port)) {
      moves++;
    }
    if (existing == null && entries.size() >= capacity) {
      evictOldest();
    }
    entries.put(key, new MacTableEntry(vlan, mac, port, MacEntryType.DYNAMIC, nowMillis));
    learned++;
    return true;
  }

  /**
   * Installs a static entry, replacing any dynamic one.
   *
   * @param vlan VLAN ID
   * @param mac station address
   * @param port port
   */
  public void addStatic(int vlan, MacAddress mac, String port) {
    Key key = new Key(vlan, Objects.requireNonNull(mac, "mac"));
    if (!entries.containsKey(key) && entries.size() >= capacity) {
      evictOldest();
    }
    entries.put(key, new MacTableEntry(vlan, mac, Objects.requireNonNull(port, "port"), MacEntryType.STATIC, 0L));
  }

  /**
   * Looks up the port for {@code mac} in {@code vlan}, expiring the entry when it is too old.
   *
   * @param vlan VLAN ID
   * @param mac destination address
   * @param nowMillis current simulation time
   * @return port name, or empty when unknown
   */
  public Optional<String> lookup(int vlan, MacAddress mac, long nowMillis) {
    lookups++;
    Key key = new Key(vlan, mac);
    MacTableEntry entry = entries.get(key);
    if (entry == null) {
      misses++;
      return Optional.empty();
    }
    if (isExpired(entry, nowMillis)) {
      entries.remove(key);
      misses++;
      return Optional.empty();
    }
    hits++;
    return Optional.of(entry.port());
  }

  /**
   * Removes dynamic entries learned on {@code port}.
   *
   * @param port port name
   * @return number of entries removed
   */
  public int removePort(String port) {
    return removeIf(e -> e.type() == MacEntryType.DYNAMIC && e.port().equals(port));
  }

  /**
   * Removes every entry of {@code vlan}, static ones included.
   *
   * @param vlan VLAN ID
   * @return number of entries removed
   */
  public int removeVlan(int vlan) {
    return removeIf(e -> e.vlan() == vlan);
  }

  /**
   * Removes dynamic entries idle longer than the aging time.
   *
   * @param nowMillis current simulation time
   * @return number of entries removed
   */
  public int cleanExpired(long nowMillis) {
    return removeIf(e -> isExpired(e, nowMillis));
  }

  /** Removes all dynamic entries; static entries survive. */
  public void clearDynamic() {
    removeIf(e -> e.type() == MacEntryType.DYNAMIC);
  }

  /** Removes all entries. */
  public void clear() {
    entries.clear();
  }

  /**
   * Returns a snapshot ordered by VLAN then MAC.
   *
   * @return entries
   */
  public List<MacTableEntry> entries() {
    List<MacTableEntry> snapshot = new ArrayList<>(entries.values());
    snapshot.sort(Comparator.comparingInt(MacTableEntry::vlan).thenComparingLong(e -> e.mac().bits()));
    return List.copyOf(snapshot);
  }

  /** @return current number of entries */
  public int size() {
    return entries.size();
  }

  /** @return counters snapshot */
  public MacTableStatistics statistics() {
    return new MacTableStatistics(entries.size(), learned, moves, lookups, hits, misses, evictions);
  }

  private boolean isExpired(MacTableEntry entry, long nowMillis) {
    return entry.type() == MacEntryType.DYNAMIC && nowMillis - entry.lastSeenMillis() >= agingMillis;
  }

  private void evictOldest() {
    MacTableEntry oldest = null;
    for (MacTableEntry entry : entries.values()) {
      if (entry.type() == MacEntryType.DYNAMIC
          && (oldest == null || entry.lastSeenMillis() < oldest.lastSeenMillis())) {
        oldest = entry;
      }
    }
    if (oldest != null) {
      entries.remove(new Key(oldest.vlan(), oldest.mac()));
      evictions++;
    }
  }

  private int removeIf(java.util.function.Predicate<MacTableEntry> condition) {
    int removed = 0;
    Iterator<MacTableEntry> it = entries.values().iterator();
    while (it.hasNext()) {
      if (condition.test(it.next())) {
        it.remove();
        removed++;
      }
    }
    return removed;
  }

  private record Key(int vlan, MacAddress mac) {}
}
