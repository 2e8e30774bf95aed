package ca.gc.cra.netsim.domain.acl;

import ca.gc.cra.netsim.validation.Numbers;
import java.util.Objects;

/**
 * Port condition of an extended entry.
 *
 * @param operator comparison
 * @param port port operand (range start for {@link PortOperator#RANGE})
 * @param portEnd inclusive range end; equals {@code port} for other operators
 * @since 0.1.0
 */
public record PortMatch(PortOperator operator, int port, int portEnd) {
  /**
   * Validates port bounds.
   */
  public PortMatch {
    Objects.requireNonNull(operator, "operator");
    Numbers.requireRange("port", port, 0, 65_535);
    Numbers.requireRange("portEnd", portEnd, 0, 65_535);
    if (operator == PortOperator.RANGE && portEnd < port) {
      throw new IllegalArgumentException("port range end must not precede start (was " + port + "-" + portEnd + ")");
    }
  }

  /**
   * Single-operand condition.
   *
   * @param operator comparison other than range
   * @param port operand
   * @return condition
   */
  public static PortMatch of(PortOperator operator, int port) {
    return new PortMatch(operator, port, port);
  }

  /**
   * Inclusive range condition.
   *
   * @param start first port
   * @param end last port
   * @return condition
   */
  public static PortMatch range(int start, int end) {
    return new PortMatch(PortOperator.RANGE, start, end);
  }

  /**
   * Tests a packet port.
   *
   * @param value packet port
   * @return {@code true} when the condition holds
   */
  public boolean matches(int value) {
    return switch (operator) {
      case EQ -> value == port;
      case NEQ -> value != port;
      case LT -> value < port;
      case GT -> value > port;
      case RANGE -> value >= port && value <= portEnd;
    };
  }
}
