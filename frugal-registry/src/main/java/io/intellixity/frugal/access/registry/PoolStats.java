package io.intellixity.frugal.access.registry;

/**
 * Point-in-time view of one pool.
 *
 * @param size     clients currently alive (idle + in use)
 * @param waiters  callers blocked in checkout
 * @param created  clients built since start
 * @param timeouts checkouts that failed with {@link ResourceExhaustedException}
 */
public record PoolStats(String kind,
                        int maxSize,
                        int size,
                        int idle,
                        int inUse,
                        int waiters,
                        long created,
                        long timeouts) {
}
