package ca.gc.cra.netsim.domain.ospf;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Per-area store of the most recent instance of every LSA.
 * <p><strong>Role:</strong> Owned by one OSPF engine; read by the DD exchange, flooding and SPF.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; used from the simulation thread only.</p>
 *
 * @since 0.1.0
 */
public final class LinkStateDatabase {
  private final Map<Ipv4Address, Map<LsaKey, Lsa>> areas = new TreeMap<>();

  /**
   * Ensures an (initially empty) database exists for {@code area}.
   *
   * @param area area ID
   */
  public void addArea(Ipv4Address area) {
    areas.computeIfAbsent(area, a -> new LinkedHashMap<>());
  }

  /**
   * Stores {@code lsa}, replacing any instance with the same key.
   *
   * @param area area ID
   * @param lsa LSA
   * @return the replaced instance, if any
   */
  public Optional<Lsa> install(Ipv4Address area, Lsa lsa) {
    Map<LsaKey, Lsa> db = areas.computeIfAbsent(area, a -> new LinkedHashMap<>());
    return Optional.ofNullable(db.put(lsa.key(), lsa));
  }

  /**
   * Looks up the current instance.
   *
   * @param area area ID
   * @param key LSA key
   * @return stored instance, if any
   */
  public Optional<Lsa> lookup(Ipv4Address area, LsaKey key) {
    Map<LsaKey, Lsa> db = areas.get(area);
    return db == null ? Optional.empty() : Optional.ofNullable(db.get(key));
  }

  /**
   * Returns the Network-LSA whose link state ID is {@code drAddress}, whoever advertises it.
   *
   * @param area area ID
   * @param drAddress DR interface address
   * @return live Network-LSA, if any
   */
  public Optional<NetworkLsa> findNetworkLsa(Ipv4Address area, Ipv4Address drAddress) {
    for (Lsa lsa : lsas(area)) {
      if (lsa instanceof NetworkLsa network
          && network.header().linkStateId().equals(drAddress)
          && !network.header().isMaxAge()) {
        return Optional.of(network);
      }
    }
    return Optional.empty();
  }

  /**
   * Removes an LSA.
   *
   * @param area area ID
   * @param key key
   * @return removed instance, if any
   */
  public Optional<Lsa> remove(Ipv4Address area, LsaKey key) {
    Map<LsaKey, Lsa> db = areas.get(area);
    return db == null ? Optional.empty() : Optional.ofNullable(db.remove(key));
  }

  /**
   * Returns the LSAs of one area in installation order.
   *
   * @param area area ID
   * @return immutable snapshot; empty for unknown areas
   */
  public List<Lsa> lsas(Ipv4Address area) {
    Map<LsaKey, Lsa> db = areas.get(area);
    return db == null ? List.of() : List.copyOf(db.values());
  }

  /**
   * Returns the headers of one area, as listed in a database summary.
   *
   * @param area area ID
   * @return headers
   */
  public List<LsaHeader> headers(Ipv4Address area) {
    List<LsaHeader> out = new ArrayList<>();
    for (Lsa lsa : lsas(area)) {
      out.add(lsa.header());
    }
    return out;
  }

  public Set<Ipv4Address> areas() {
    return Collections.unmodifiableSet(areas.keySet());
  }

  /** @return number of LSAs across all areas */
  public int size() {
    int count = 0;
    for (Map<LsaKey, Lsa> db : areas.values()) {
      count += db.size();
    }
    return count;
  }

  public void clear() {
    areas.clear();
  }
}
