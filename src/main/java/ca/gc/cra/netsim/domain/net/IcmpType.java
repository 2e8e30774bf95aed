package ca.gc.cra.netsim.domain.net;

import java.util.Optional;

/**
 * ICMP message types produced and consumed by the simulator.
 *
 * @since 0.1.0
 */
public enum IcmpType {
  ECHO_REPLY(0),
  DESTINATION_UNREACHABLE(3),
  REDIRECT(5),
  ECHO_REQUEST(8),
  TIME_EXCEEDED(11);

  private final int code;

  IcmpType(int code) {
    this.code = code;
  }

  /** @return the on-wire type number */
  public int code() {
    return code;
  }

  /** @return {@code true} for error messages (unreachable, redirect, time exceeded) */
  public boolean isError() {
    return this == DESTINATION_UNREACHABLE || this == REDIRECT || this == TIME_EXCEEDED;
  }

  /**
   * Looks up a type by its on-wire number.
   *
   * @param code type number
   * @return matching type, or empty for types the simulator does not model
   */
  public static Optional<IcmpType> fromCode(int code) {
    for (IcmpType type : values()) {
      if (type.code == code) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
