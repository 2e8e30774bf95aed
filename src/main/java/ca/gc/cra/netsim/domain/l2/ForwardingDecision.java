package ca.gc.cra.netsim.domain.l2;

import ca.gc.cra.netsim.domain.net.EthernetFrame;
import java.util.List;
import java.util.Objects;

/**
 * One switching decision, reported to forwarding listeners.
 *
 * @param device switch name
 * @param ingressPort receiving port
 * @param vlan VLAN the frame was classified into, or 0 when it was dropped before classification
 * @param frame frame as received
 * @param action outcome
 * @param egressPorts ports the frame was sent to
 * @param reason short explanation for drops and filters; empty otherwise
 * @since 0.1.0
 */
public record ForwardingDecision(
    String device, String ingressPort, int vlan, EthernetFrame frame, ForwardAction action, List<String> egressPorts,
    String reason) {
  /**
   * Validates and copies fields.
   */
  public ForwardingDecision {
    Objects.requireNonNull(device, "device");
    Objects.requireNonNull(ingressPort, "ingressPort");
    Objects.requireNonNull(frame, "frame");
    Objects.requireNonNull(action, "action");
    egressPorts = List.copyOf(egressPorts);
    reason = reason == null ? "" : reason;
  }
}
