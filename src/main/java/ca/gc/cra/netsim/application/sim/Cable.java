package ca.gc.cra.netsim.application.sim;

import ca.gc.cra.netsim.application.port.FrameSink;
import ca.gc.cra.netsim.domain.net.EthernetFrame;
import java.util.Objects;

/**
 * Point-to-point link joining two device ports. Delivery is synchronous: {@link #transmit} returns once the far end
 * has handled the frame.
 *
 * @since 0.1.0
 */
public final class Cable {

  /**
   * One end of a cable.
   *
   * @param device device name
   * @param port port name on that device
   * @param sink receiver resolved at connection time
   */
  public record Endpoint(String device, String port, FrameSink sink) {
    /**
     * Validates fields.
     */
    public Endpoint {
      Objects.requireNonNull(device, "device");
      Objects.requireNonNull(port, "port");
      Objects.requireNonNull(sink, "sink");
    }

    @Override
    public String toString() {
      return device + ":" + port;
    }
  }

  private final Endpoint a;
  private final Endpoint b;
  private boolean connected = true;

  Cable(Endpoint a, Endpoint b) {
    this.a = Objects.requireNonNull(a, "a");
    this.b = Objects.requireNonNull(b, "b");
  }

  public Endpoint a() {
    return a;
  }

  public Endpoint b() {
    return b;
  }

  public boolean isConnected() {
    return connected;
  }

  void unplug() {
    connected = false;
  }

  /**
   * Returns the end opposite to {@code device:port}.
   *
   * @param device sending device
   * @param port sending port
   * @return far end
   * @throws IllegalArgumentException when {@code device:port} is not an end of this cable
   */
  public Endpoint peerOf(String device, String port) {
    if (a.device().equals(device) && a.port().equals(port)) {
      return b;
    }
    if (b.device().equals(device) && b.port().equals(port)) {
      return a;
    }
    throw new IllegalArgumentException(device + ":" + port + " is not attached to " + this);
  }

  /**
   * Carries {@code frame} from {@code device:port} to the far end. A disconnected cable drops it.
   *
   * @param device sending device
   * @param port sending port
   * @param frame frame
   * @return {@code true} when delivered
   */
  public boolean transmit(String device, String port, EthernetFrame frame) {
    if (!connected) {
      return false;
    }
    Endpoint peer = peerOf(device, port);
    peer.sink().receiveFrame(peer.port(), frame);
    return true;
  }

  @Override
  public String toString() {
    return a + " <-> " + b;
  }
}
