package ca.gc.cra.netsim.domain.acl;

import java.util.Locale;
import java.util.Optional;

/**
 * Port comparison keywords of extended access lists.
 *
 * @since 0.1.0
 */
public enum PortOperator {
  EQ,
  NEQ,
  LT,
  GT,
  RANGE;

  /**
   * Looks up the operator for a CLI keyword.
   *
   * @param token keyword such as {@code eq}
   * @return operator, or empty when the token is not an operator keyword
   */
  public static Optional<PortOperator> fromKeyword(String token) {
    if (token == null) {
      return Optional.empty();
    }
    for (PortOperator op : values()) {
      if (op.keyword().equals(token.toLowerCase(Locale.ROOT))) {
        return Optional.of(op);
      }
    }
    return Optional.empty();
  }

  /** @return CLI keyword */
  public String keyword() {
    return name().toLowerCase(Locale.ROOT);
  }
}
