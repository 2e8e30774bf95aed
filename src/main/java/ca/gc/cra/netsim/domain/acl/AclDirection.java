package ca.gc.cra.netsim.domain.acl;

import java.util.Locale;

/**
 * Direction an access list filters on an interface.
 *
 * @since 0.1.0
 */
public enum AclDirection {
  /** Packets arriving on the interface. */
  IN,
  /** Packets leaving through the interface. */
  OUT;

  @Override
  public String toString() {
    return name().toLowerCase(Locale.ROOT);
  }
}
