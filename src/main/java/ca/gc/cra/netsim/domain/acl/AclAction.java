package ca.gc.cra.netsim.domain.acl;

import java.util.Locale;

/**
 * Verdict of an access-list entry.
 *
 * @since 0.1.0
 */
public enum AclAction {
  PERMIT,
  DENY;

  /**
   * Parses {@code permit} or {@code deny}, ignoring case.
   *
   * @param token CLI token
   * @return action
   * @throws IllegalArgumentException for any other token
   */
  public static AclAction parse(String token) {
    String normalized = token == null ? "" : token.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "permit" -> PERMIT;
      case "deny" -> DENY;
      default -> throw new IllegalArgumentException("action must be permit or deny (was '" + token + "')");
    };
  }

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
