package ca.gc.cra.netsim.domain.acl;

import java.util.Locale;
import java.util.Optional;

/**
 * Standard lists match on source only; extended lists also match protocol, destination and ports.
 *
 * @since 0.1.0
 */
public enum AclType {
  STANDARD,
  EXTENDED;

  /**
   * Returns the type implied by a numbered list's number (1-99 and 1300-1999 standard, 100-199 and 2000-2699
   * extended).
   *
   * @param number list number
   * @return type, or empty when the number is outside every range
   */
  public static Optional<AclType> forNumber(int number) {
    if ((number >= 1 && number <= 99) || (number >= 1300 && number <= 1999)) {
      return Optional.of(STANDARD);
    }
    if ((number >= 100 && number <= 199) || (number >= 2000 && number <= 2699)) {
      return Optional.of(EXTENDED);
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
