package ca.gc.cra.netsim.domain.acl;

import java.util.Objects;

/**
 * Attachment of an access list to one interface direction.
 *
 * @param interfaceName interface name
 * @param aclId list applied
 * @param direction filtered direction
 * @since 0.1.0
 */
public record AclBinding(String interfaceName, AclId aclId, AclDirection direction) {
  /**
   * Validates fields.
   */
  public AclBinding {
    Objects.requireNonNull(interfaceName, "interfaceName");
    Objects.requireNonNull(aclId, "aclId");
    Objects.requireNonNull(direction, "direction");
  }
}
