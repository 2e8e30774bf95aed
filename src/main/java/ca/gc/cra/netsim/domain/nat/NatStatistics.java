package ca.gc.cra.netsim.domain.nat;

import java.util.List;

/**
 * Snapshot of NAT engine counters.
 *
 * @param totalTranslations rows in the translation table
 * @param staticTranslations static rows
 * @param dynamicTranslations dynamic rows
 * @param patTranslations PAT rows
 * @param hits packets translated
 * @param misses packets no rule applied to
 * @param exhausted packets dropped for lack of addresses or ports
 * @param expired translations removed for idleness
 * @param insideInterfaces interfaces marked inside
 * @param outsideInterfaces interfaces marked outside
 * @since 0.1.0
 */
public record NatStatistics(
    int totalTranslations,
    int staticTranslations,
    int dynamicTranslations,
    int patTranslations,
    long hits,
    long misses,
    long exhausted,
    long expired,
    List<String> insideInterfaces,
    List<String> outsideInterfaces) {
  /**
   * Copies the interface lists.
   */
  public NatStatistics {
    insideInterfaces = List.copyOf(insideInterfaces);
    outsideInterfaces = List.copyOf(outsideInterfaces);
  }
}
