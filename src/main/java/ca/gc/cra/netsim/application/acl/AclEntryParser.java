package ca.gc.cra.netsim.application.acl;

import ca.gc.cra.netsim.domain.acl.AclAction;
import ca.gc.cra.netsim.domain.acl.AclRule;
import ca.gc.cra.netsim.domain.acl.AddressMatch;
import ca.gc.cra.netsim.domain.acl.PortMatch;
import ca.gc.cra.netsim.domain.acl.PortOperator;
import ca.gc.cra.netsim.domain.net.IpProtocol;
import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Parses IOS-style access-list token lists into {@link AclRule}s.
 *
 * <p>Standard: {@code {permit|deny} {any | host A | A W}}. Extended:
 * {@code {permit|deny} PROTO SRC [PORTOP] DST [PORTOP] [established] [log]} where {@code PORTOP} is
 * {@code eq|neq|lt|gt P} or {@code range P1 P2} and is only accepted for tcp and udp.</p>
 *
 * <p>Malformed input raises {@link IllegalArgumentException} naming the offending token.</p>
 */
public final class AclEntryParser {
  private static final Map<String, Integer> PROTOCOLS = new LinkedHashMap<>();
  private static final Map<String, Integer> PORTS = new LinkedHashMap<>();

  static {
    PROTOCOLS.put("ip", 0);
    PROTOCOLS.put("icmp", 1);
    PROTOCOLS.put("tcp", 6);
    PROTOCOLS.put("udp", 17);
    PROTOCOLS.put("gre", 47);
    PROTOCOLS.put("esp", 50);
    PROTOCOLS.put("ah", 51);
    PROTOCOLS.put("eigrp", 88);
    PROTOCOLS.put("ospf", 89);

    // First name per number is the one used for rendering.
    PORTS.put("ftp-data", 20);
    PORTS.put("ftp", 21);
    PORTS.put("ssh", 22);
    PORTS.put("telnet", 23);
    PORTS.put("smtp", 25);
    PORTS.put("domain", 53);
    PORTS.put("dns", 53);
    PORTS.put("bootps", 67);
    PORTS.put("dhcp", 67);
    PORTS.put("tftp", 69);
    PORTS.put("www", 80);
    PORTS.put("http", 80);
    PORTS.put("pop3", 110);
    PORTS.put("ntp", 123);
    PORTS.put("snmp", 161);
    PORTS.put("https", 443);
  }

  private AclEntryParser() {
    // Utility
  }

  /**
   * Parses a standard entry.
   *
   * @param tokens tokens after the list identifier
   * @return rule
   */
  public static AclRule parseStandard(List<String> tokens) {
    Cursor cursor = new Cursor(tokens);
    AclAction action = AclAction.parse(cursor.next("action"));
    AddressMatch source = cursor.hasNext() ? parseAddress(cursor, "source") : AddressMatch.ANY;
    boolean log = cursor.consumeIf("log");
    cursor.requireEnd();
    return new AclRule(action, 0, source, AddressMatch.ANY, null, null, false, log);
  }

  /**
   * Parses an extended entry.
   *
   * @param tokens tokens after the list identifier
   * @return rule
   */
  public static AclRule parseExtended(List<String> tokens) {
    Cursor cursor = new Cursor(tokens);
    AclAction action = AclAction.parse(cursor.next("action"));
    int protocol = parseProtocol(cursor.next("protocol"));
    boolean ports = IpProtocol.hasPorts(protocol);
    AddressMatch source = parseAddress(cursor, "source");
    PortMatch sourcePort = ports ? parsePortMatch(cursor) : null;
    AddressMatch destination = parseAddress(cursor, "destination");
    PortMatch destinationPort = ports ? parsePortMatch(cursor) : null;
    boolean established = false;
    boolean log = false;
    while (cursor.hasNext()) {
      String option = cursor.next("option").toLowerCase(Locale.ROOT);
      switch (option) {
        case "established" -> {
          if (protocol != IpProtocol.TCP) {
            throw new IllegalArgumentException("established is only valid for tcp");
          }
          established = true;
        }
        case "log" -> log = true;
        default -> throw new IllegalArgumentException("unexpected ACL option: " + option);
      }
    }
    return new AclRule(action, protocol, source, destination, sourcePort, destinationPort, established, log);
  }

  /**
   * Parses a protocol keyword or number (0-255).
   *
   * @param token token
   * @return protocol number; 0 for {@code ip}
   */
  public static int parseProtocol(String token) {
    String lower = Objects.requireNonNull(token, "token").trim().toLowerCase(Locale.ROOT);
    Integer named = PROTOCOLS.get(lower);
    if (named != null) {
      return named;
    }
    return parseNumber("protocol", lower, 255);
  }

  /**
   * Parses a port name or number (0-65535).
   *
   * @param token token
   * @return port number
   */
  public static int parsePort(String token) {
    String lower = Objects.requireNonNull(token, "token").trim().toLowerCase(Locale.ROOT);
    Integer named = PORTS.get(lower);
    if (named != null) {
      return named;
    }
    return parseNumber("port", lower, 65_535);
  }

  static String protocolName(int protocol) {
    return nameOf(PROTOCOLS, protocol).orElse(Integer.toString(protocol));
  }

  static String portName(int port) {
    return nameOf(PORTS, port).orElse(Integer.toString(port));
  }

  private static Optional<String> nameOf(Map<String, Integer> table, int value) {
    for (Map.Entry<String, Integer> entry : table.entrySet()) {
      if (entry.getValue() == value) {
        return Optional.of(entry.getKey());
      }
    }
    return Optional.empty();
  }

  private static AddressMatch parseAddress(Cursor cursor, String field) {
    String token = cursor.next(field);
    if ("any".equalsIgnoreCase(token)) {
      return AddressMatch.ANY;
    }
    if ("host".equalsIgnoreCase(token)) {
      return AddressMatch.host(Ipv4Address.parse(cursor.next(field + " host")));
    }
    Ipv4Address network = Ipv4Address.parse(token);
    String wildcard = cursor.peek();
    if (wildcard != null && wildcard.indexOf('.') > 0) {
      cursor.next(field + " wildcard");
      return new AddressMatch(network, Ipv4Address.parse(wildcard));
    }
    return AddressMatch.host(network);
  }

  private static PortMatch parsePortMatch(Cursor cursor) {
    Optional<PortOperator> operator = PortOperator.fromKeyword(cursor.peek());
    if (operator.isEmpty()) {
      return null;
    }
    cursor.next("port operator");
    int port = parsePort(cursor.next("port"));
    if (operator.get() == PortOperator.RANGE) {
      return PortMatch.range(port, parsePort(cursor.next("range end")));
    }
    return PortMatch.of(operator.get(), port);
  }

  private static int parseNumber(String field, String token, int max) {
    try {
      int value = Integer.parseInt(token);
      if (value < 0 || value > max) {
        throw new IllegalArgumentException(field + " must be between 0 and " + max + " (was " + value + ")");
      }
      return value;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("invalid " + field + ": " + token, ex);
    }
  }

  private static final class Cursor {
    private final List<String> tokens;
    private int index;

    private Cursor(List<String> tokens) {
      this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    boolean hasNext() {
      return index < tokens.size();
    }

    String peek() {
      return hasNext() ? tokens.get(index) : null;
    }

    String next(String field) {
      if (!hasNext()) {
        throw new IllegalArgumentException("missing " + field);
      }
      return tokens.get(index++);
    }

    boolean consumeIf(String keyword) {
      if (keyword.equalsIgnoreCase(peek())) {
        index++;
        return true;
      }
      return false;
    }

    void requireEnd() {
      if (hasNext()) {
        throw new IllegalArgumentException("unexpected token: " + peek());
      }
    }
  }
}
