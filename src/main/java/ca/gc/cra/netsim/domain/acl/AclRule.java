package ca.gc.cra.netsim.domain.acl;

import ca.gc.cra.netsim.domain.net.FiveTuple;
import ca.gc.cra.netsim.domain.net.IpProtocol;
import ca.gc.cra.netsim.validation.Numbers;
import java.util.Objects;

/**
 * Match conditions and verdict of one access-list entry, without its sequence number or counters.
 *
 * <p>Standard rules carry only {@code action} and {@code source}; the other fields take their neutral values
 * (protocol 0, destination {@link AddressMatch#ANY}, no port conditions).</p>
 *
 * @param action verdict on match
 * @param protocol IP protocol number; 0 matches every protocol
 * @param source source condition
 * @param destination destination condition
 * @param sourcePort source port condition, or {@code null}
 * @param destinationPort destination port condition, or {@code null}
 * @param established require TCP with ACK or RST set
 * @param log log every match at INFO
 * @since 0.1.0
 */
public record AclRule(
    AclAction action,
    int protocol,
    AddressMatch source,
    AddressMatch destination,
    PortMatch sourcePort,
    PortMatch destinationPort,
    boolean established,
    boolean log) {

  /**
   * Validates fields.
   */
  public AclRule {
    Objects.requireNonNull(action, "action");
    Numbers.requireRange("protocol", protocol, 0, 255);
    Objects.requireNonNull(source, "source");
    destination = destination == null ? AddressMatch.ANY : destination;
  }

  /**
   * Builds a standard rule.
   *
   * @param action verdict
   * @param source source condition
   * @return rule
   */
  public static AclRule standard(AclAction action, AddressMatch source) {
    return new AclRule(action, 0, source, AddressMatch.ANY, null, null, false, false);
  }

  /**
   * Builds an extended rule without port conditions.
   *
   * @param action verdict
   * @param protocol protocol number, 0 for any
   * @param source source condition
   * @param destination destination condition
   * @return rule
   */
  public static AclRule extended(AclAction action, int protocol, AddressMatch source, AddressMatch destination) {
    return new AclRule(action, protocol, source, destination, null, null, false, false);
  }

  /**
   * Tests a packet key against this rule.
   *
   * @param tuple packet key
   * @param type type of the owning list; standard lists ignore everything but the source
   * @return {@code true} when every condition holds
   */
  public boolean matches(FiveTuple tuple, AclType type) {
    if (!source.matches(tuple.source())) {
      return false;
    }
    if (type == AclType.STANDARD) {
      return true;
    }
    if (protocol != 0 && tuple.protocol() != protocol) {
      return false;
    }
    if (!destination.isAny() && (tuple.destination() == null || !destination.matches(tuple.destination()))) {
      return false;
    }
    if (sourcePort != null && tuple.sourcePort().isPresent() && !sourcePort.matches(tuple.sourcePort().getAsInt())) {
      return false;
    }
    if (destinationPort != null && tuple.destinationPort().isPresent()
        && !destinationPort.matches(tuple.destinationPort().getAsInt())) {
      return false;
    }
    return !established || (tuple.protocol() == IpProtocol.TCP && tuple.established());
  }
}
