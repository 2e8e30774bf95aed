package ca.gc.cra.netsim.domain.ospf;

import java.util.Optional;

/**
 * LSA types (RFC 2328 §12.1.3). Only router and network LSAs are originated here.
 *
 * @since 0.1.0
 */
public enum LsaType {
  ROUTER(1),
  NETWORK(2),
  SUMMARY_NETWORK(3),
  SUMMARY_ASBR(4),
  AS_EXTERNAL(5);

  private final int code;

  LsaType(int code) {
    this.code = code;
  }

  /**
   * Resolves a wire code.
   *
   * @param code LS type field
   * @return type, or empty for unknown codes
   */
  public static Optional<LsaType> fromCode(int code) {
    for (LsaType type : values()) {
      if (type.code == code) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  public int code() {
    return code;
  }
}
