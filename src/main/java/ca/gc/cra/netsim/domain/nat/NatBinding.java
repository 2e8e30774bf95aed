package ca.gc.cra.netsim.domain.nat;

import ca.gc.cra.netsim.domain.acl.AclId;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code ip nat inside source list <acl> {pool <name> | interface <if>} [overload]}.
 *
 * @param aclId list selecting inside traffic
 * @param poolName pool to translate into, or {@code null}
 * @param interfaceName interface whose address is used, or {@code null}
 * @param overload translate with ports (PAT)
 * @since 0.1.0
 */
public record NatBinding(AclId aclId, String poolName, String interfaceName, boolean overload) {
  /**
   * Validates that a target is named.
   */
  public NatBinding {
    Objects.requireNonNull(aclId, "aclId");
    if (poolName == null && interfaceName == null) {
      throw new IllegalArgumentException("NAT binding needs a pool or an interface");
    }
    if (poolName != null && interfaceName != null) {
      throw new IllegalArgumentException("NAT binding takes a pool or an interface, not both");
    }
    if (interfaceName != null && !overload) {
      throw new IllegalArgumentException("interface NAT bindings require overload");
    }
  }

  /**
   * Binding to a pool.
   *
   * @param aclId list
   * @param poolName pool
   * @param overload PAT onto the pool's first address
   * @return binding
   */
  public static NatBinding pool(AclId aclId, String poolName, boolean overload) {
    return new NatBinding(aclId, Objects.requireNonNull(poolName, "poolName"), null, overload);
  }

  /**
   * Overload binding to an interface address.
   *
   * @param aclId list
   * @param interfaceName interface
   * @return binding
   */
  public static NatBinding interfaceOverload(AclId aclId, String interfaceName) {
    return new NatBinding(aclId, null, Objects.requireNonNull(interfaceName, "interfaceName"), true);
  }

  public Optional<String> pool() {
    return Optional.ofNullable(poolName);
  }

  public Optional<String> iface() {
    return Optional.ofNullable(interfaceName);
  }
}
