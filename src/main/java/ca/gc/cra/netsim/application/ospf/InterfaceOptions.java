package ca.gc.cra.netsim.application.ospf;

import ca.gc.cra.netsim.domain.ospf.NetworkType;
import ca.gc.cra.netsim.domain.ospf.OspfConstants;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.Objects;

/**
 * Per-interface OSPF parameters supplied when an interface is activated.
 *
 * <p>Zero for {@code cost}, {@code helloInterval} or {@code deadInterval} means "derive": the cost from the reference
 * bandwidth, the timers from {@link OspfSettings}.</p>
 *
 * @param networkType network type
 * @param priority router priority, 0-255; 0 makes the router ineligible for DR/BDR
 * @param cost explicit cost, or 0
 * @param bandwidthMbps interface bandwidth used to derive the cost
 * @param helloInterval hello interval in seconds, or 0
 * @param deadInterval dead interval in seconds, or 0
 * @param passive advertise the subnet without sending or accepting Hellos
 * @since 0.1.0
 */
public record InterfaceOptions(
    NetworkType networkType,
    int priority,
    int cost,
    int bandwidthMbps,
    int helloInterval,
    int deadInterval,
    boolean passive) {

  public InterfaceOptions {
    Objects.requireNonNull(networkType, "networkType");
    Numbers.requireRange("priority", priority, 0, 255);
    Numbers.requireRange("cost", cost, 0, 0xFFFF);
    Numbers.requirePositive("bandwidthMbps", bandwidthMbps);
    Numbers.requireRange("helloInterval", helloInterval, 0, 65_535);
    Numbers.requireRange("deadInterval", deadInterval, 0, Integer.MAX_VALUE);
  }

  /** @return broadcast network, priority 1, gigabit bandwidth, derived cost and timers */
  public static InterfaceOptions defaults() {
    return new InterfaceOptions(NetworkType.BROADCAST, OspfConstants.DEFAULT_PRIORITY, 0,
        OspfConstants.DEFAULT_INTERFACE_BANDWIDTH_MBPS, 0, 0, false);
  }

  /** @return default options on a point-to-point network */
  public static InterfaceOptions pointToPoint() {
    return defaults().withNetworkType(NetworkType.POINT_TO_POINT);
  }

  public InterfaceOptions withNetworkType(NetworkType type) {
    return new InterfaceOptions(type, priority, cost, bandwidthMbps, helloInterval, deadInterval, passive);
  }

  public InterfaceOptions withPriority(int newPriority) {
    return new InterfaceOptions(networkType, newPriority, cost, bandwidthMbps, helloInterval, deadInterval, passive);
  }

  public InterfaceOptions withCost(int newCost) {
    return new InterfaceOptions(networkType, priority, newCost, bandwidthMbps, helloInterval, deadInterval, passive);
  }

  public InterfaceOptions withTimers(int hello, int dead) {
    return new InterfaceOptions(networkType, priority, cost, bandwidthMbps, hello, dead, passive);
  }

  public InterfaceOptions withPassive(boolean isPassive) {
    return new InterfaceOptions(networkType, priority, cost, bandwidthMbps, helloInterval, deadInterval, isPassive);
  }
}
