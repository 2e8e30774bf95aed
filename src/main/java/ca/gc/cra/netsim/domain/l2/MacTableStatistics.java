package ca.gc.cra.netsim.domain.l2;

/**
 * Point-in-time counters of a {@link MacTable}.
 *
 * @param size current number of entries
 * @param learned learn or refresh operations accepted
 * @param moves times a known address appeared on a different port
 * @param lookups unicast lookups performed
 * @param hits lookups that found a live entry
 * @param misses lookups that found nothing or an expired entry
 * @param evictions entries dropped to make room at capacity
 * @since 0.1.0
 */
public record MacTableStatistics(
    int size, long learned, long moves, long lookups, long hits, long misses, long evictions) {}
