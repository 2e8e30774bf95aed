package ca.gc.cra.netsim.domain.nat;

import ca.gc.cra.netsim.domain.net.Ipv4Address;
import java.util.Objects;

/**
 * <strong>What:</strong> One row of the NAT translation table.
 * <p><strong>Keys:</strong> {@code static:<local>}, {@code dynamic:<local>} and
 * {@code pat:<local>:<port>:<proto>}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; usage fields are updated by the owning engine.</p>
 *
 * @since 0.1.0
 */
public final class NatTranslation {
  private final NatType type;
  private final Ipv4Address insideLocal;
  private final Ipv4Address insideGlobal;
  private final int protocol;
  private final int insidePort;
  private final int translatedPort;
  private final long timeoutSeconds;
  private final long createdMillis;
  private long lastUsedMillis;
  private long hits;

  /**
   * Creates a translation.
   *
   * @param type kind
   * @param insideLocal private address
   * @param insideGlobal public address
   * @param protocol IP protocol; 0 for address-only translations
   * @param insidePort original port or ICMP identifier; 0 when not port based
   * @param translatedPort port or identifier on the global side; 0 when not port based
   * @param timeoutSeconds idle timeout; 0 never expires
   * @param createdMillis creation time
   */
  public NatTranslation(NatType type, Ipv4Address insideLocal, Ipv4Address insideGlobal, int protocol,
      int insidePort, int translatedPort, long timeoutSeconds, long createdMillis) {
    this.type = Objects.requireNonNull(type, "type");
    this.insideLocal = Objects.requireNonNull(insideLocal, "insideLocal");
    this.insideGlobal = Objects.requireNonNull(insideGlobal, "insideGlobal");
    this.protocol = protocol;
    this.insidePort = insidePort;
    this.translatedPort = translatedPort;
    this.timeoutSeconds = timeoutSeconds;
    this.createdMillis = createdMillis;
    this.lastUsedMillis = createdMillis;
  }

  /**
   * Builds the table key for a translation of {@code type}.
   *
   * @param type kind
   * @param insideLocal private address
   * @param port inside port (PAT only)
   * @param protocol protocol (PAT only)
   * @return key
   */
  public static String key(NatType type, Ipv4Address insideLocal, int port, int protocol) {
    String base = type.keyPrefix() + ":" + insideLocal;
    return type == NatType.PAT ? base + ":" + port + ":" + protocol : base;
  }

  /** @return this translation's table key */
  public String key() {
    return key(type, insideLocal, insidePort, protocol);
  }

  public NatType type() {
    return type;
  }

  public Ipv4Address insideLocal() {
    return insideLocal;
  }

  public Ipv4Address insideGlobal() {
    return insideGlobal;
  }

  public int protocol() {
    return protocol;
  }

  public int insidePort() {
    return insidePort;
  }

  public int translatedPort() {
    return translatedPort;
  }

  public long timeoutSeconds() {
    return timeoutSeconds;
  }

  public long createdMillis() {
    return createdMillis;
  }

  public long lastUsedMillis() {
    return lastUsedMillis;
  }

  public long hits() {
    return hits;
  }

  /**
   * Records a use.
   *
   * @param nowMillis current time
   */
  public void touch(long nowMillis) {
    hits++;
    lastUsedMillis = nowMillis;
  }

  /**
   * Returns whether the translation has been idle longer than its timeout.
   *
   * @param nowMillis current time
   * @return {@code true} when expired; static translations never expire
   */
  public boolean isExpired(long nowMillis) {
    return type != NatType.STATIC && timeoutSeconds > 0 && nowMillis - lastUsedMillis > timeoutSeconds * 1_000L;
  }

  @Override
  public String toString() {
    String local = insideLocal + (type == NatType.PAT ? ":" + insidePort : "");
    String global = insideGlobal + (type == NatType.PAT ? ":" + translatedPort : "");
    return type.keyPrefix() + " " + local + " -> " + global + (protocol == 0 ? "" : " proto " + protocol)
        + " hits=" + hits;
  }
}
