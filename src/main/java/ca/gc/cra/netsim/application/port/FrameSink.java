package ca.gc.cra.netsim.application.port;

import ca.gc.cra.netsim.domain.net.EthernetFrame;

/**
 * <strong>What:</strong> Capability every simulated device exposes to the cables attached to it.
 * <p><strong>Why:</strong> A cable delivers a frame to whatever sits at its far end without knowing whether that is a
 * switch, router or host; the receiver is resolved once, when the cable is connected.</p>
 * <p><strong>Thread-safety:</strong> Called on the simulation thread; delivery is synchronous.</p>
 *
 * @since 0.1.0
 */
public interface FrameSink {
  /**
   * Accepts a frame arriving on {@code portName}.
   *
   * @param portName name of the receiving port on this device
   * @param frame received frame
   */
  void receiveFrame(String portName, EthernetFrame frame);
}
