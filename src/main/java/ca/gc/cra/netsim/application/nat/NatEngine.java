package ca.gc.cra.netsim.application.nat;

import ca.gc.cra.netsim.application.acl.AclEngine;
import ca.gc.cra.netsim.application.port.ClockPort;
import ca.gc.cra.netsim.domain.acl.AclAction;
import ca.gc.cra.netsim.domain.acl.AclId;
import ca.gc.cra.netsim.domain.nat.NatBinding;
import ca.gc.cra.netsim.domain.nat.NatPool;
import ca.gc.cra.netsim.domain.nat.NatResult;
import ca.gc.cra.netsim.domain.nat.NatStatistics;
import ca.gc.cra.netsim.domain.nat.NatTranslation;
import ca.gc.cra.netsim.domain.nat.NatType;
import ca.gc.cra.netsim.domain.net.FiveTuple;
import ca.gc.cra.netsim.domain.net.IcmpMessage;
import ca.gc.cra.netsim.domain.net.IcmpType;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import ca.gc.cra.netsim.domain.net.Ipv4Packet;
import ca.gc.cra.netsim.domain.net.Ipv4Payload;
import ca.gc.cra.netsim.domain.net.TcpSegment;
import ca.gc.cra.netsim.domain.net.UdpDatagram;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Static, dynamic and overload (PAT) source translation for one router.
 * <p><strong>Outbound</strong> (inside interface): a static entry for the source wins; otherwise ACL bindings are
 * tried in binding order and the first whose list permits the packet applies. <strong>Inbound</strong> (outside
 * interface): static reverse lookup, then PAT by (global, port, protocol), then dynamic by global address.</p>
 * <p><strong>Ports:</strong> TCP and UDP flows are keyed by source port, ICMP echo flows by identifier. PAT ports
 * come from a wrapping cursor over [1024, 65535] and are unique per global address; when the range is full, expired
 * translations are swept before giving up. Protocols without ports keep port 0 and are overloaded for one inside
 * host per (global, protocol); a second host is refused with {@code EXHAUSTED}.</p>
 * <p><strong>Expiry:</strong> non-static translations idle longer than the timeout are dropped by
 * {@link #cleanupExpired(long)} and are never reused once expired, even before a cleanup runs.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven from the simulation thread.</p>
 *
 * @since 0.1.0
 */
public final class NatEngine {
  private static final Logger log = LoggerFactory.getLogger(NatEngine.class);
  static final int PAT_FIRST_PORT = 1024;
  static final int PAT_LAST_PORT = 65_535;

  private final String owner;
  private final AclEngine acl;
  private final ClockPort clock;
  private final Function<String, Optional<Ipv4Address>> interfaceAddresses;
  private long translationTimeoutSeconds;

  private final Set<String> insideInterfaces = new LinkedHashSet<>();
  private final Set<String> outsideInterfaces = new LinkedHashSet<>();
  private final Map<String, NatPool> pools = new LinkedHashMap<>();
  private final Map<Ipv4Address, Ipv4Address> staticEntries = new LinkedHashMap<>();
  private final List<NatBinding> bindings = new ArrayList<>();
  private final Map<String, NatTranslation> translations = new LinkedHashMap<>();
  private final Map<Ipv4Address, Set<Integer>> portsInUse = new HashMap<>();
  private int nextPatPort = PAT_FIRST_PORT;

  private long hits;
  private long misses;
  private long exhausted;
  private long expired;

  /**
   * Creates an engine.
   *
   * @param owner device name used in log lines
   * @param acl ACL engine evaluating binding lists
   * @param clock time source for usage stamps
   * @param interfaceAddresses resolves an interface name to its configured address
   * @param translationTimeoutSeconds idle timeout of dynamic and PAT translations
   */
  public NatEngine(String owner, AclEngine acl, ClockPort clock,
      Function<String, Optional<Ipv4Address>> interfaceAddresses, long translationTimeoutSeconds) {
    this.owner = Objects.requireNonNull(owner, "owner");
    this.acl = Objects.requireNonNull(acl, "acl");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.interfaceAddresses = Objects.requireNonNull(interfaceAddresses, "interfaceAddresses");
    setTranslationTimeout(translationTimeoutSeconds);
  }

  /**
   * Changes the idle timeout applied to translations created from now on.
   *
   * @param seconds timeout in seconds
   */
  public void setTranslationTimeout(long seconds) {
    this.translationTimeoutSeconds = Numbers.requirePositive("translationTimeoutSeconds", seconds);
  }

  public long translationTimeoutSeconds() {
    return translationTimeoutSeconds;
  }

  /**
   * Marks an interface as NAT inside, clearing an outside role.
   *
   * @param interfaceName interface
   */
  public void setInsideInterface(String interfaceName) {
    outsideInterfaces.remove(interfaceName);
    insideInterfaces.add(Objects.requireNonNull(interfaceName, "interfaceName"));
    log.info("{}: {} ip nat inside", owner, interfaceName);
  }

  /**
   * Marks an interface as NAT outside, clearing an inside role.
   *
   * @param interfaceName interface
   */
  public void setOutsideInterface(String interfaceName) {
    insideInterfaces.remove(interfaceName);
    outsideInterfaces.add(Objects.requireNonNull(interfaceName, "interfaceName"));
    log.info("{}: {} ip nat outside", owner, interfaceName);
  }

  /**
   * Removes any NAT role from an interface.
   *
   * @param interfaceName interface
   */
  public void clearInterfaceRole(String interfaceName) {
    insideInterfaces.remove(interfaceName);
    outsideInterfaces.remove(interfaceName);
  }

  public boolean isInside(String interfaceName) {
    return insideInterfaces.contains(interfaceName);
  }

  public boolean isOutside(String interfaceName) {
    return outsideInterfaces.contains(interfaceName);
  }

  /**
   * Adds or replaces a pool.
   *
   * @param pool pool
   */
  public void addPool(NatPool pool) {
    pools.put(pool.name(), pool);
    log.info("{}: ip nat pool {} {} {} netmask {}", owner, pool.name(), pool.start(), pool.end(), pool.netmask());
  }

  /**
   * Removes a pool. Existing translations from it stay until they expire or are cleared.
   *
   * @param name pool name
   * @return {@code true} when removed
   */
  public boolean removePool(String name) {
    return pools.remove(name) != null;
  }

  public Optional<NatPool> getPool(String name) {
    return Optional.ofNullable(pools.get(name));
  }

  public List<NatPool> getPools() {
    return List.copyOf(pools.values());
  }

  /**
   * Installs a static translation; one global address per inside local.
   *
   * @param insideLocal private address
   * @param insideGlobal public address
   * @throws IllegalArgumentException when {@code insideGlobal} is already mapped to another inside address
   */
  public void addStaticNat(Ipv4Address insideLocal, Ipv4Address insideGlobal) {
    Objects.requireNonNull(insideLocal, "insideLocal");
    Objects.requireNonNull(insideGlobal, "insideGlobal");
    for (Map.Entry<Ipv4Address, Ipv4Address> entry : staticEntries.entrySet()) {
      if (entry.getValue().equals(insideGlobal) && !entry.getKey().equals(insideLocal)) {
        throw new IllegalArgumentException(
            "global address " + insideGlobal + " is already mapped to " + entry.getKey());
      }
    }
    staticEntries.put(insideLocal, insideGlobal);
    putStaticTranslation(insideLocal, insideGlobal);
    log.info("{}: ip nat inside source static {} {}", owner, insideLocal, insideGlobal);
  }

  /**
   * Removes a static translation.
   *
   * @param insideLocal private address
   * @return {@code true} when removed
   */
  public boolean removeStaticNat(Ipv4Address insideLocal) {
    translations.remove(NatTranslation.key(NatType.STATIC, insideLocal, 0, 0));
    return staticEntries.remove(insideLocal) != null;
  }

  public Map<Ipv4Address, Ipv4Address> getStaticEntries() {
    return Map.copyOf(staticEntries);
  }

  /**
   * Adds a binding; an existing binding for the same list is replaced.
   *
   * @param binding binding
   */
  public void bindAccessList(NatBinding binding) {
    Objects.requireNonNull(binding, "binding");
    bindings.removeIf(b -> b.aclId().equals(binding.aclId()));
    bindings.add(binding);
    log.info("{}: ip nat inside source list {} {}{}", owner, binding.aclId(),
        binding.pool().map(p -> "pool " + p).orElseGet(() -> "interface " + binding.interfaceName()),
        binding.overload() ? " overload" : "");
  }

  /**
   * Removes the binding of a list.
   *
   * @param aclId list
   * @return {@code true} when removed
   */
  public boolean unbindAccessList(AclId aclId) {
    return bindings.removeIf(b -> b.aclId().equals(aclId));
  }

  public List<NatBinding> getBindings() {
    return List.copyOf(bindings);
  }

  /**
   * Translates a packet leaving the inside network.
   *
   * @param packet packet as received
   * @param ingressInterface interface the packet arrived on; only inside interfaces translate
   * @param outsideAddress address of the egress interface, used for overload when the binding names neither an
   *     interface nor a pool; may be {@code null}
   * @return result; {@code EXHAUSTED} means the caller must drop the packet
   */
  public NatResult translateOutgoing(Ipv4Packet packet, String ingressInterface, Ipv4Address outsideAddress) {
    Objects.requireNonNull(packet, "packet");
    if (!isInside(ingressInterface)) {
      return NatResult.notMatched(packet);
    }
    long now = clock.nowMillis();
    Ipv4Address source = packet.source();

    Ipv4Address staticGlobal = staticEntries.get(source);
    if (staticGlobal != null) {
      NatTranslation translation = translations.get(NatTranslation.key(NatType.STATIC, source, 0, 0));
      if (translation == null) {
        translation = putStaticTranslation(source, staticGlobal);
      }
      return hit(translation, now, rewriteSource(packet, staticGlobal, -1));
    }

    FiveTuple tuple = FiveTuple.of(packet);
    for (NatBinding binding : bindings) {
      if (acl.getAcl(binding.aclId()).isEmpty() || acl.evaluate(binding.aclId(), tuple) != AclAction.PERMIT) {
        continue;
      }
      if (binding.overload()) {
        Optional<Ipv4Address> global = overloadAddress(binding, outsideAddress);
        if (global.isEmpty()) {
          log.debug("{}: no address for overload binding {}", owner, binding.aclId());
          continue;
        }
        return translatePat(packet, global.get(), now);
      }
      NatPool pool = pools.get(binding.poolName());
      if (pool != null) {
        return translateDynamic(packet, pool, now);
      }
    }
    misses++;
    return NatResult.notMatched(packet);
  }

  /**
   * Translates a packet entering from the outside network.
   *
   * @param packet packet as received
   * @param ingressInterface interface the packet arrived on; only outside interfaces translate
   * @return result
   */
  public NatResult translateIncoming(Ipv4Packet packet, String ingressInterface) {
    Objects.requireNonNull(packet, "packet");
    if (!isOutside(ingressInterface)) {
      return NatResult.notMatched(packet);
    }
    long now = clock.nowMillis();
    Ipv4Address destination = packet.destination();

    for (Map.Entry<Ipv4Address, Ipv4Address> entry : staticEntries.entrySet()) {
      if (entry.getValue().equals(destination)) {
        NatTranslation translation = translations.get(NatTranslation.key(NatType.STATIC, entry.getKey(), 0, 0));
        if (translation == null) {
          translation = putStaticTranslation(entry.getKey(), entry.getValue());
        }
        return hit(translation, now, rewriteDestination(packet, entry.getKey(), -1));
      }
    }

    int port = flowPort(packet.payload(), false);
    NatTranslation dynamicMatch = null;
    Iterator<NatTranslation> it = translations.values().iterator();
    while (it.hasNext()) {
      NatTranslation translation = it.next();
      if (!translation.insideGlobal().equals(destination) || translation.type() == NatType.STATIC) {
        continue;
      }
      if (translation.isExpired(now)) {
        it.remove();
        release(translation);
        continue;
      }
      if (translation.type() == NatType.PAT) {
        if (translation.protocol() == packet.protocol() && translation.translatedPort() == Math.max(port, 0)) {
          return hit(translation, now, rewriteDestination(packet, translation.insideLocal(), translation.insidePort()));
        }
      } else if (dynamicMatch == null) {
        dynamicMatch = translation;
      }
    }
    if (dynamicMatch != null) {
      return hit(dynamicMatch, now, rewriteDestination(packet, dynamicMatch.insideLocal(), -1));
    }
    misses++;
    return NatResult.notMatched(packet);
  }

  /**
   * Removes non-static translations idle longer than their timeout.
   *
   * @param nowMillis current time
   * @return number removed
   */
  public int cleanupExpired(long nowMillis) {
    int removed = 0;
    Iterator<NatTranslation> it = translations.values().iterator();
    while (it.hasNext()) {
      NatTranslation translation = it.next();
      if (translation.isExpired(nowMillis)) {
        it.remove();
        release(translation);
        removed++;
      }
    }
    if (removed > 0) {
      log.debug("{}: expired {} NAT translations", owner, removed);
    }
    return removed;
  }

  /** Removes dynamic and PAT translations; static ones stay. */
  public void clearDynamic() {
    translations.values().removeIf(t -> t.type() != NatType.STATIC);
    portsInUse.clear();
  }

  /** Removes every translation, then re-creates the static ones with fresh counters. */
  public void clearAll() {
    translations.clear();
    portsInUse.clear();
    staticEntries.forEach(this::putStaticTranslation);
  }

  /** @return translations in creation order */
  public List<NatTranslation> getTranslations() {
    return List.copyOf(translations.values());
  }

  /**
   * Looks up a translation by key.
   *
   * @param key translation key
   * @return translation, or empty
   */
  public Optional<NatTranslation> getTranslation(String key) {
    return Optional.ofNullable(translations.get(key));
  }

  /** @return counters snapshot */
  public NatStatistics getStatistics() {
    int statics = 0;
    int dynamics = 0;
    int pats = 0;
    for (NatTranslation translation : translations.values()) {
      switch (translation.type()) {
        case STATIC -> statics++;
        case DYNAMIC -> dynamics++;
        case PAT -> pats++;
      }
    }
    return new NatStatistics(translations.size(), statics, dynamics, pats, hits, misses, exhausted, expired,
        List.copyOf(insideInterfaces), List.copyOf(outsideInterfaces));
  }

  private NatResult translatePat(Ipv4Packet packet, Ipv4Address global, long now) {
    int protocol = packet.protocol();
    int insidePort = flowPort(packet.payload(), true);
    String key = NatTranslation.key(NatType.PAT, packet.source(), Math.max(insidePort, 0), protocol);
    NatTranslation translation = translations.get(key);
    if (translation != null && translation.isExpired(now)) {
      translations.remove(key);
      release(translation);
      translation = null;
    }
    if (translation == null || !translation.insideGlobal().equals(global)) {
      if (translation != null) {
        translations.remove(key);
        release(translation);
      }
      int translatedPort = 0;
      if (insidePort >= 0) {
        OptionalInt allocated = allocatePort(global);
        if (allocated.isEmpty() && cleanupExpired(now) > 0) {
          allocated = allocatePort(global);
        }
        if (allocated.isEmpty()) {
          exhausted++;
          log.warn("{}: PAT port space exhausted on {}", owner, global);
          return NatResult.exhausted(packet);
        }
        translatedPort = allocated.getAsInt();
      } else {
        Optional<NatTranslation> holder = portlessHolder(global, protocol, now);
        if (holder.isPresent() && !holder.get().insideLocal().equals(packet.source())) {
          exhausted++;
          log.warn("{}: protocol {} on {} already overloaded for {}; dropping flow from {}", owner, protocol,
              global, holder.get().insideLocal(), packet.source());
          return NatResult.exhausted(packet);
        }
      }
      translation = new NatTranslation(NatType.PAT, packet.source(), global, protocol, Math.max(insidePort, 0),
          translatedPort, translationTimeoutSeconds, now);
      translations.put(key, translation);
      log.debug("{}: created {}", owner, translation);
    }
    int rewrittenPort = insidePort >= 0 ? translation.translatedPort() : -1;
    return hit(translation, now, rewriteSource(packet, global, rewrittenPort));
  }

  private NatResult translateDynamic(Ipv4Packet packet, NatPool pool, long now) {
    String key = NatTranslation.key(NatType.DYNAMIC, packet.source(), 0, 0);
    NatTranslation translation = translations.get(key);
    if (translation != null && translation.isExpired(now)) {
      translations.remove(key);
      release(translation);
      translation = null;
    }
    if (translation == null) {
      Optional<Ipv4Address> global = freePoolAddress(pool, now);
      if (global.isEmpty()) {
        exhausted++;
        log.warn("{}: NAT pool {} exhausted", owner, pool.name());
        return NatResult.exhausted(packet);
      }
      translation = new NatTranslation(NatType.DYNAMIC, packet.source(), global.get(), 0, 0, 0,
          translationTimeoutSeconds, now);
      translations.put(key, translation);
      log.debug("{}: created {}", owner, translation);
    }
    return hit(translation, now, rewriteSource(packet, translation.insideGlobal(), -1));
  }

  /**
   * Finds the live PAT translation of a protocol without ports on {@code global}. Replies to such flows carry
   * nothing but the protocol, so only one inside host may hold each (global, protocol) pair.
   */
  private Optional<NatTranslation> portlessHolder(Ipv4Address global, int protocol, long now) {
    for (NatTranslation translation : translations.values()) {
      if (translation.type() == NatType.PAT && translation.protocol() == protocol && translation.translatedPort() == 0
          && translation.insideGlobal().equals(global) && !translation.isExpired(now)) {
        return Optional.of(translation);
      }
    }
    return Optional.empty();
  }

  private Optional<Ipv4Address> overloadAddress(NatBinding binding, Ipv4Address outsideAddress) {
    if (binding.interfaceName() != null) {
      return interfaceAddresses.apply(binding.interfaceName());
    }
    NatPool pool = binding.poolName() == null ? null : pools.get(binding.poolName());
    if (pool != null) {
      return Optional.of(pool.start());
    }
    return Optional.ofNullable(outsideAddress);
  }

  private Optional<Ipv4Address> freePoolAddress(NatPool pool, long now) {
    Set<Ipv4Address> used = new HashSet<>(staticEntries.values());
    for (NatTranslation translation : translations.values()) {
      if (translation.type() == NatType.DYNAMIC && !translation.isExpired(now)) {
        used.add(translation.insideGlobal());
      }
    }
    for (long i = 0; i < pool.size(); i++) {
      Ipv4Address candidate = pool.start().plus(i);
      if (!used.contains(candidate)) {
        return Optional.of(candidate);
      }
    }
    return Optional.empty();
  }

  private OptionalInt allocatePort(Ipv4Address global) {
    Set<Integer> used = portsInUse.computeIfAbsent(global, k -> new HashSet<>());
    int span = PAT_LAST_PORT - PAT_FIRST_PORT + 1;
    for (int attempt = 0; attempt < span; attempt++) {
      int candidate = nextPatPort;
      nextPatPort = candidate == PAT_LAST_PORT ? PAT_FIRST_PORT : candidate + 1;
      if (used.add(candidate)) {
        return OptionalInt.of(candidate);
      }
    }
    return OptionalInt.empty();
  }

  private void release(NatTranslation translation) {
    expired += translation.isExpired(clock.nowMillis()) ? 1 : 0;
    if (translation.type() == NatType.PAT) {
      Set<Integer> used = portsInUse.get(translation.insideGlobal());
      if (used != null) {
        used.remove(translation.translatedPort());
      }
    }
  }

  private NatTranslation putStaticTranslation(Ipv4Address insideLocal, Ipv4Address insideGlobal) {
    NatTranslation translation =
        new NatTranslation(NatType.STATIC, insideLocal, insideGlobal, 0, 0, 0, 0, clock.nowMillis());
    translations.put(translation.key(), translation);
    return translation;
  }

  private NatResult hit(NatTranslation translation, long now, Ipv4Packet rewritten) {
    translation.touch(now);
    hits++;
    return NatResult.of(rewritten, translation);
  }

  /**
   * Returns the flow identifier: TCP/UDP source (outbound) or destination (inbound) port, or the ICMP echo
   * identifier; -1 when the payload has neither.
   */
  private static int flowPort(Ipv4Payload payload, boolean outbound) {
    if (payload instanceof TcpSegment tcp) {
      return outbound ? tcp.sourcePort() : tcp.destinationPort();
    }
    if (payload instanceof UdpDatagram udp) {
      return outbound ? udp.sourcePort() : udp.destinationPort();
    }
    if (payload instanceof IcmpMessage icmp && isEcho(icmp)) {
      return icmp.identifier();
    }
    return -1;
  }

  private static boolean isEcho(IcmpMessage icmp) {
    return icmp.type() == IcmpType.ECHO_REQUEST || icmp.type() == IcmpType.ECHO_REPLY;
  }

  private static Ipv4Packet rewriteSource(Ipv4Packet packet, Ipv4Address source, int port) {
    Ipv4Packet rewritten = packet.withSource(source);
    if (port >= 0) {
      rewritten = rewritten.withTransportPayload(withPort(packet.payload(), port, true));
    }
    return rewritten.withComputedChecksum();
  }

  private static Ipv4Packet rewriteDestination(Ipv4Packet packet, Ipv4Address destination, int port) {
    Ipv4Packet rewritten = packet.withDestination(destination);
    if (port >= 0 && flowPort(packet.payload(), false) >= 0) {
      rewritten = rewritten.withTransportPayload(withPort(packet.payload(), port, false));
    }
    return rewritten.withComputedChecksum();
  }

  private static Ipv4Payload withPort(Ipv4Payload payload, int port, boolean source) {
    if (payload instanceof TcpSegment tcp) {
      return source ? tcp.withSourcePort(port) : tcp.withDestinationPort(port);
    }
    if (payload instanceof UdpDatagram udp) {
      return source ? udp.withSourcePort(port) : udp.withDestinationPort(port);
    }
    if (payload instanceof IcmpMessage icmp && isEcho(icmp)) {
      return icmp.withIdentifier(port);
    }
    return payload;
  }

}
