package ca.gc.cra.netsim.application.acl;

import ca.gc.cra.netsim.domain.acl.AclEntry;
import ca.gc.cra.netsim.domain.acl.AclRule;
import ca.gc.cra.netsim.domain.acl.AclType;
import ca.gc.cra.netsim.domain.acl.AddressMatch;
import ca.gc.cra.netsim.domain.acl.PortMatch;
import ca.gc.cra.netsim.domain.acl.PortOperator;

/**
 * Renders access-list entries in IOS configuration syntax, preferring well-known names for protocols and ports.
 */
final class AclEntryFormatter {
  private AclEntryFormatter() {
    // Utility
  }

  static String format(AclEntry entry, AclType type) {
    AclRule rule = entry.rule();
    StringBuilder sb = new StringBuilder();
    sb.append(entry.sequence()).append(' ').append(rule.action());
    if (type == AclType.EXTENDED) {
      sb.append(' ').append(AclEntryParser.protocolName(rule.protocol()));
    }
    appendAddress(sb, rule.source());
    if (type == AclType.EXTENDED) {
      appendPort(sb, rule.sourcePort());
      appendAddress(sb, rule.destination());
      appendPort(sb, rule.destinationPort());
      if (rule.established()) {
        sb.append(" established");
      }
    }
    if (rule.log()) {
      sb.append(" log");
    }
    return sb.toString();
  }

  private static void appendAddress(StringBuilder sb, AddressMatch match) {
    if (match.isAny()) {
      sb.append(" any");
    } else if (match.isHost()) {
      sb.append(" host ").append(match.network());
    } else {
      sb.append(' ').append(match.network()).append(' ').append(match.wildcard());
    }
  }

  private static void appendPort(StringBuilder sb, PortMatch match) {
    if (match == null) {
      return;
    }
    sb.append(' ').append(match.operator().keyword()).append(' ').append(AclEntryParser.portName(match.port()));
    if (match.operator() == PortOperator.RANGE) {
      sb.append(' ').append(AclEntryParser.portName(match.portEnd()));
    }
  }
}
