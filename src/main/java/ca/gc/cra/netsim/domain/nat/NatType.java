package ca.gc.cra.netsim.domain.nat;

import java.util.Locale;

/**
 * Kind of address translation.
 *
 * @since 0.1.0
 */
public enum NatType {
  /** Operator-configured one-to-one mapping; never expires. */
  STATIC,
  /** One-to-one mapping allocated from a pool. */
  DYNAMIC,
  /** Many-to-one mapping distinguished by translated port (overload). */
  PAT;

  /** @return key prefix used in translation keys */
  public String keyPrefix() {
    return name().toLowerCase(Locale.ROOT);
  }
}
