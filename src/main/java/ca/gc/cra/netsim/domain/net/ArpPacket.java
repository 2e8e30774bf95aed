package ca.gc.cra.netsim.domain.net;

import java.util.Objects;

/**
 * Ethernet/IPv4 ARP message (RFC 826).
 *
 * @param operation request or reply
 * @param senderMac sender hardware address
 * @param senderIp sender protocol address
 * @param targetMac target hardware address; {@link MacAddress#ZERO} in requests
 * @param targetIp target protocol address
 * @since 0.1.0
 */
public record ArpPacket(
    Operation operation,
    MacAddress senderMac,
    Ipv4Address senderIp,
    MacAddress targetMac,
    Ipv4Address targetIp) implements FramePayload {

  /** ARP opcode. */
  public enum Operation {
    REQUEST(1),
    REPLY(2);

    private final int opcode;

    Operation(int opcode) {
      this.opcode = opcode;
    }

    /** @return on-wire opcode */
    public int opcode() {
      return opcode;
    }
  }

  /**
   * Validates required fields.
   */
  public ArpPacket {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(senderMac, "senderMac");
    Objects.requireNonNull(senderIp, "senderIp");
    Objects.requireNonNull(targetMac, "targetMac");
    Objects.requireNonNull(targetIp, "targetIp");
  }

  /**
   * Creates a who-has request.
   *
   * @param senderMac requester MAC
   * @param senderIp requester address
   * @param targetIp address being resolved
   * @return request
   */
  public static ArpPacket request(MacAddress senderMac, Ipv4Address senderIp, Ipv4Address targetIp) {
    return new ArpPacket(Operation.REQUEST, senderMac, senderIp, MacAddress.ZERO, targetIp);
  }

  /**
   * Creates the reply to {@code request} from the owner of the target address.
   *
   * @param request request being answered
   * @param ownerMac MAC of the answering interface
   * @return reply
   */
  public static ArpPacket replyTo(ArpPacket request, MacAddress ownerMac) {
    return new ArpPacket(Operation.REPLY, ownerMac, request.targetIp(), request.senderMac(), request.senderIp());
  }

  @Override
  public int length() {
    return 28;
  }
}
