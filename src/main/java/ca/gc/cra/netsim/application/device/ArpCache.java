package ca.gc.cra.netsim.application.device;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import ca.gc.cra.netsim.domain.net.MacAddress;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * IPv4-to-MAC bindings of one device plus the packets waiting for a binding to be resolved.
 *
 * <p>Not thread-safe; owned by a single device.</p>
 *
 * @since 0.1.0
 */
public final class ArpCache {

  /**
   * Packet parked until its next hop resolves.
   *
   * @param packet packet to send
   * @param portName egress port
   * @param queuedAtMillis time it was parked
   */
  public record Pending(Ipv4Packet packet, String portName, long queuedAtMillis) {
    /**
     * Validates fields.
     */
    public Pending {
      Objects.requireNonNull(packet, "packet");
      Objects.requireNonNull(portName, "portName");
    }
  }

  private final Map<Ipv4Address, MacAddress> entries = new LinkedHashMap<>();
  private final Map<Ipv4Address, Deque<Pending>> pending = new LinkedHashMap<>();

  /**
   * Records or refreshes a binding.
   *
   * @param address protocol address
   * @param mac hardware address
   * @return {@code true} when the binding is new or changed
   */
  public boolean learn(Ipv4Address address, MacAddress mac) {
    Objects.requireNonNull(address, "address");
    Objects.requireNonNull(mac, "mac");
    return !mac.equals(entries.put(address, mac));
  }

  public Optional<MacAddress> lookup(Ipv4Address address) {
    return Optional.ofNullable(entries.get(address));
  }

  /** @return bindings in learning order */
  public Map<Ipv4Address, MacAddress> entries() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
  }

  public int size() {
    return entries.size();
  }

  /** Removes every binding; parked packets stay parked. */
  public void clear() {
    entries.clear();
  }

  /**
   * Parks a packet for {@code nextHop}.
   *
   * @param nextHop address being resolved
   * @param item parked packet
   * @return {@code true} when no resolution was already in progress, i.e. the caller should send a request
   */
  public boolean enqueue(Ipv4Address nextHop, Pending item) {
    Deque<Pending> queue = pending.computeIfAbsent(nextHop, k -> new ArrayDeque<>());
    queue.addLast(Objects.requireNonNull(item, "item"));
    return queue.size() == 1;
  }

  /**
   * Removes and returns the packets parked for {@code nextHop}.
   *
   * @param nextHop resolved address
   * @return parked packets, oldest first
   */
  public List<Pending> release(Ipv4Address nextHop) {
    Deque<Pending> queue = pending.remove(nextHop);
    return queue == null ? List.of() : new ArrayList<>(queue);
  }

  /**
   * Discards packets parked for {@code nextHop} at or before {@code cutoffMillis}.
   *
   * @param nextHop address being resolved
   * @param cutoffMillis newest queue time to discard
   * @return number discarded
   */
  public int discardOlderThan(Ipv4Address nextHop, long cutoffMillis) {
    Deque<Pending> queue = pending.get(nextHop);
    if (queue == null) {
      return 0;
    }
    int removed = 0;
    for (Iterator<Pending> it = queue.iterator(); it.hasNext(); ) {
      if (it.next().queuedAtMillis() <= cutoffMillis) {
        it.remove();
        removed++;
      }
    }
    if (queue.isEmpty()) {
      pending.remove(nextHop);
    }
    return removed;
  }

  /** @return number of parked packets across all next hops */
  public int pendingCount() {
    int count = 0;
    for (Deque<Pending> queue : pending.values()) {
      count += queue.size();
    }
    return count;
  }
}
