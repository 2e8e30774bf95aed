package ca.gc.cra.netsim.config;

import ca.gc.cra.netsim.validation.Numbers;
import ca.gc.cra.netsim.validation.Strings;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Tunables shared by every device of one simulation.
 * <p><strong>Why:</strong> Protocol timers, TTL defaults and table limits must be adjustable per lab without
 * code changes, and validated once at startup.</p>
 * <p><strong>Role:</strong> Immutable configuration record built from flattened {@code key=value} maps
 * (defaults, YAML, CLI) by {@link #fromMap(Map)}.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param helloIntervalSeconds OSPF HelloInterval
 * @param deadIntervalSeconds OSPF RouterDeadInterval; must exceed the hello interval
 * @param retransmitIntervalSeconds OSPF RxmtInterval for DD, LSR and LSU retransmission
 * @param referenceBandwidthMbps OSPF reference bandwidth used to derive interface cost
 * @param natTranslationTimeoutSeconds idle timeout of dynamic and PAT translations
 * @param routerDefaultTtl TTL of packets originated by routers (ICMP errors, echo replies)
 * @param hostDefaultTtl TTL of packets originated by hosts
 * @param macAgingSeconds idle age after which dynamic MAC table entries expire
 * @param macTableCapacity maximum MAC table entries per switch
 * @param arpQueueTimeoutMillis how long packets wait for ARP resolution before being discarded
 * @param metricsPrefix prefix applied to every metric key
 * @since 0.1.0
 */
public record SimulationConfig(
    int helloIntervalSeconds,
    int deadIntervalSeconds,
    int retransmitIntervalSeconds,
    int referenceBandwidthMbps,
    long natTranslationTimeoutSeconds,
    int routerDefaultTtl,
    int hostDefaultTtl,
    int macAgingSeconds,
    int macTableCapacity,
    long arpQueueTimeoutMillis,
    String metricsPrefix) {

  public static final String HELLO_INTERVAL = "ospf.helloIntervalSeconds";
  public static final String DEAD_INTERVAL = "ospf.deadIntervalSeconds";
  public static final String RETRANSMIT_INTERVAL = "ospf.retransmitIntervalSeconds";
  public static final String REFERENCE_BANDWIDTH = "ospf.referenceBandwidthMbps";
  public static final String NAT_TIMEOUT = "nat.translationTimeoutSeconds";
  public static final String ROUTER_TTL = "router.defaultTtl";
  public static final String HOST_TTL = "host.defaultTtl";
  public static final String MAC_AGING = "switch.macAgingSeconds";
  public static final String MAC_CAPACITY = "switch.macTableCapacity";
  public static final String ARP_QUEUE_TIMEOUT = "arp.queueTimeoutMillis";
  public static final String METRICS_PREFIX = "metrics.prefix";

  /**
   * Validates ranges and the hello/dead relationship.
   */
  public SimulationConfig {
    Numbers.requireRange("helloIntervalSeconds", helloIntervalSeconds, 1, 65_535);
    Numbers.requireRange("deadIntervalSeconds", deadIntervalSeconds, 1, Integer.MAX_VALUE);
    if (deadIntervalSeconds <= helloIntervalSeconds) {
      throw new IllegalArgumentException("deadIntervalSeconds must exceed helloIntervalSeconds (was "
          + deadIntervalSeconds + " <= " + helloIntervalSeconds + ")");
    }
    Numbers.requireRange("retransmitIntervalSeconds", retransmitIntervalSeconds, 1, 3_600);
    Numbers.requireRange("referenceBandwidthMbps", referenceBandwidthMbps, 1, 4_294_967);
    Numbers.requireRange("natTranslationTimeoutSeconds", natTranslationTimeoutSeconds, 1, 2_147_483L);
    Numbers.requireRange("routerDefaultTtl", routerDefaultTtl, 1, 255);
    Numbers.requireRange("hostDefaultTtl", hostDefaultTtl, 1, 255);
    Numbers.requireRange("macAgingSeconds", macAgingSeconds, 10, 1_000_000);
    Numbers.requireRange("macTableCapacity", macTableCapacity, 1, 1_048_576);
    Numbers.requireRange("arpQueueTimeoutMillis", arpQueueTimeoutMillis, 1, 600_000L);
    metricsPrefix = Strings.requireIdentifier("metricsPrefix", metricsPrefix);
  }

  /**
   * Returns the built-in defaults.
   *
   * @return default configuration
   */
  public static SimulationConfig defaults() {
    return new SimulationConfig(10, 40, 5, 100, 86_400L, 255, 64, 300, 8_192, 2_000L, "netsim");
  }

  /**
   * Renders the defaults as a flattened map, the lowest layer for {@link ConfigMerger}.
   *
   * @return unmodifiable ordered map of default values
   */
  public static Map<String, String> defaultsAsFlatMap() {
    return defaults().toFlatMap();
  }

  /**
   * Parses flattened configuration keys; absent or blank keys fall back to {@link #defaults()}, unknown keys are
   * ignored.
   *
   * @param values flattened keys; may be {@code null}
   * @return validated configuration
   * @throws IllegalArgumentException when a value is not an integer or out of range
   */
  public static SimulationConfig fromMap(Map<String, String> values) {
    Map<String, String> kv = values == null ? Map.of() : new HashMap<>(values);
    SimulationConfig d = defaults();
    String prefix = kv.get(METRICS_PREFIX);
    return new SimulationConfig(
        intValue(kv, HELLO_INTERVAL, d.helloIntervalSeconds()),
        intValue(kv, DEAD_INTERVAL, d.deadIntervalSeconds()),
        intValue(kv, RETRANSMIT_INTERVAL, d.retransmitIntervalSeconds()),
        intValue(kv, REFERENCE_BANDWIDTH, d.referenceBandwidthMbps()),
        longValue(kv, NAT_TIMEOUT, d.natTranslationTimeoutSeconds()),
        intValue(kv, ROUTER_TTL, d.routerDefaultTtl()),
        intValue(kv, HOST_TTL, d.hostDefaultTtl()),
        intValue(kv, MAC_AGING, d.macAgingSeconds()),
        intValue(kv, MAC_CAPACITY, d.macTableCapacity()),
        longValue(kv, ARP_QUEUE_TIMEOUT, d.arpQueueTimeoutMillis()),
        prefix == null || prefix.isBlank() ? d.metricsPrefix() : prefix.trim());
  }

  /**
   * Flattens this configuration back to dotted keys.
   *
   * @return unmodifiable ordered map
   */
  public Map<String, String> toFlatMap() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put(HELLO_INTERVAL, Integer.toString(helloIntervalSeconds));
    map.put(DEAD_INTERVAL, Integer.toString(deadIntervalSeconds));
    map.put(RETRANSMIT_INTERVAL, Integer.toString(retransmitIntervalSeconds));
    map.put(REFERENCE_BANDWIDTH, Integer.toString(referenceBandwidthMbps));
    map.put(NAT_TIMEOUT, Long.toString(natTranslationTimeoutSeconds));
    map.put(ROUTER_TTL, Integer.toString(routerDefaultTtl));
    map.put(HOST_TTL, Integer.toString(hostDefaultTtl));
    map.put(MAC_AGING, Integer.toString(macAgingSeconds));
    map.put(MAC_CAPACITY, Integer.toString(macTableCapacity));
    map.put(ARP_QUEUE_TIMEOUT, Long.toString(arpQueueTimeoutMillis));
    map.put(METRICS_PREFIX, metricsPrefix);
    return Collections.unmodifiableMap(map);
  }

  /**
   * Returns a copy with different OSPF timers, for labs that shorten convergence.
   *
   * @param hello hello interval in seconds
   * @param dead dead interval in seconds
   * @return adjusted configuration
   */
  public SimulationConfig withOspfTimers(int hello, int dead) {
    return new SimulationConfig(hello, dead, retransmitIntervalSeconds, referenceBandwidthMbps,
        natTranslationTimeoutSeconds, routerDefaultTtl, hostDefaultTtl, macAgingSeconds, macTableCapacity,
        arpQueueTimeoutMillis, metricsPrefix);
  }

  /**
   * Returns a copy with a different NAT idle timeout.
   *
   * @param seconds timeout in seconds
   * @return adjusted configuration
   */
  public SimulationConfig withNatTranslationTimeout(long seconds) {
    return new SimulationConfig(helloIntervalSeconds, deadIntervalSeconds, retransmitIntervalSeconds,
        referenceBandwidthMbps, seconds, routerDefaultTtl, hostDefaultTtl, macAgingSeconds, macTableCapacity,
        arpQueueTimeoutMillis, metricsPrefix);
  }

  /**
   * Builds a metric key under {@link #metricsPrefix()}.
   *
   * @param suffix dotted suffix such as {@code router.forwarded}
   * @return full key
   */
  public String metricKey(String suffix) {
    return metricsPrefix + "." + suffix;
  }

  private static int intValue(Map<String, String> kv, String key, int fallback) {
    return Math.toIntExact(longValue(kv, key, fallback));
  }

  private static long longValue(Map<String, String> kv, String key, long fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    long parsed = Numbers.parseLong(key, raw);
    return Numbers.requireRange(key, parsed, Integer.MIN_VALUE, Integer.MAX_VALUE);
  }
}
