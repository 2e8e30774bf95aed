package ca.gc.cra.netsim.domain.acl;

/**
 * Summary counters of an ACL engine.
 *
 * @param totalAcls lists defined
 * @param numberedAcls numbered lists
 * @param namedAcls named lists
 * @param totalEntries entries across all lists
 * @param interfaceBindings active interface bindings
 * @since 0.1.0
 */
public record AclStatistics(int totalAcls, int numberedAcls, int namedAcls, int totalEntries, int interfaceBindings) {}
