package ca.gc.cra.netsim.application.ospf;

import ca.gc.cra.netsim.config.SimulationConfig;
import ca.gc.cra.netsim.domain.ospf.OspfConstants;
import ca.gc.cra.netsim.validation.Numbers;
import ca.gc.cra.netsim.validation.Strings;

/**
 * Process-wide OSPF defaults for one engine.
 *
 * @param helloIntervalSeconds default hello interval for new interfaces
 * @param deadIntervalSeconds default dead interval for new interfaces
 * @param retransmitIntervalSeconds interval for DD, LSR and LSU retransmission
 * @param referenceBandwidthMbps bandwidth that costs 1
 * @param metricsPrefix prefix for metric keys
 * @since 0.1.0
 */
public record OspfSettings(
    int helloIntervalSeconds,
    int deadIntervalSeconds,
    int retransmitIntervalSeconds,
    int referenceBandwidthMbps,
    String metricsPrefix) {

  /** RFC defaults with the {@code netsim} metrics prefix. */
  public static final OspfSettings DEFAULTS = new OspfSettings(
      OspfConstants.DEFAULT_HELLO_INTERVAL_SECONDS,
      OspfConstants.DEFAULT_DEAD_INTERVAL_SECONDS,
      OspfConstants.DEFAULT_RETRANSMIT_INTERVAL_SECONDS,
      OspfConstants.DEFAULT_REFERENCE_BANDWIDTH_MBPS,
      "netsim");

  public OspfSettings {
    Numbers.requireRange("helloIntervalSeconds", helloIntervalSeconds, 1, 65_535);
    Numbers.requireRange("deadIntervalSeconds", deadIntervalSeconds, helloIntervalSeconds + 1, Integer.MAX_VALUE);
    Numbers.requireRange("retransmitIntervalSeconds", retransmitIntervalSeconds, 1, 3_600);
    Numbers.requirePositive("referenceBandwidthMbps", referenceBandwidthMbps);
    metricsPrefix = Strings.requireIdentifier("metricsPrefix", metricsPrefix);
  }

  /**
   * Extracts the OSPF section of a simulation configuration.
   *
   * @param config configuration
   * @return settings
   */
  public static OspfSettings from(SimulationConfig config) {
    return new OspfSettings(
        config.helloIntervalSeconds(),
        config.deadIntervalSeconds(),
        config.retransmitIntervalSeconds(),
        config.referenceBandwidthMbps(),
        config.metricsPrefix());
  }

  String metricKey(String suffix) {
    return metricsPrefix + ".ospf." + suffix;
  }
}
