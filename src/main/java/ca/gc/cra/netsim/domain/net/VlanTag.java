package ca.gc.cra.netsim.domain.net;

import ca.gc.cra.netsim.validation.Numbers;

/**
 * IEEE 802.1Q tag carried by trunk frames.
 *
 * @param pcp priority code point, 0-7
 * @param dei drop eligible indicator
 * @param vid VLAN identifier, 1-4094
 * @since 0.1.0
 */
public record VlanTag(int pcp, boolean dei, int vid) {
  /**
   * Validates field ranges.
   *
   * @throws IllegalArgumentException when a field is out of range
   */
  public VlanTag {
    Numbers.requireRange("pcp", pcp, 0, 7);
    Numbers.requireRange("vid", vid, 1, 4094);
  }

  /**
   * Creates a default-priority tag.
   *
   * @param vid VLAN identifier
   * @return tag with {@code pcp=0} and {@code dei=false}
   */
  public static VlanTag of(int vid) {
    return new VlanTag(0, false, vid);
  }

  /** @return the tag protocol identifier, always {@code 0x8100} */
  public int tpid() {
    return EtherType.VLAN;
  }
}
