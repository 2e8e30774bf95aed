package ca.gc.cra.netsim.domain.ospf;

import java.util.Locale;
import java.util.Optional;

/**
 * OSPF interface network types.
 *
 * @since 0.1.0
 */
public enum NetworkType {
  BROADCAST("broadcast"),
  NBMA("nbma"),
  POINT_TO_POINT("point-to-point"),
  POINT_TO_MULTIPOINT("point-to-multipoint");

  private final String keyword;

  NetworkType(String keyword) {
    this.keyword = keyword;
  }

  /**
   * Parses a keyword such as {@code point-to-point}.
   *
   * @param text keyword, case-insensitive
   * @return type, or empty when unknown
   */
  public static Optional<NetworkType> fromKeyword(String text) {
    if (text == null) {
      return Optional.empty();
    }
    String normalized = text.trim().toLowerCase(Locale.ROOT);
    for (NetworkType type : values()) {
      if (type.keyword.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  /** @return {@code true} for broadcast and NBMA networks, which elect a DR */
  public boolean isMultiAccess() {
    return this == BROADCAST || this == NBMA;
  }

  public String keyword() {
    return keyword;
  }

  @Override
  public String toString() {
    return keyword;
  }
}
