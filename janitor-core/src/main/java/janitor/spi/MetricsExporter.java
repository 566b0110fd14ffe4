package janitor.spi;

import janitor.model.EvictionStats;
import janitor.model.MembershipRefreshStats;
import janitor.model.OrphanCleanupStats;

/**
 * Observability hook for exporting job statistics to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards everything. Implement this interface to
 * bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Records a successful membership refresh.
     *
     * @param jobName name of the cache that refreshed
     * @param stats the snapshot just published
     */
    void recordMembershipRefresh(String jobName, MembershipRefreshStats stats);

    /**
     * Records a completed orphan reconciliation pass.
     *
     * @param jobName name of the reconciler
     * @param stats the snapshot just published
     */
    void recordOrphanCleanup(String jobName, OrphanCleanupStats stats);

    /**
     * Records a completed eviction pass.
     *
     * @param jobName name of the evictor
     * @param stats the snapshot just published
     */
    void recordEviction(String jobName, EvictionStats stats);

    /**
     * Increments the count of passes that were aborted or threw.
     *
     * @param jobName name of the job whose pass failed
     */
    void incrementPassFailure(String jobName);

    /**
     * Records the wall-clock time of one scheduled pass, successful or not.
     *
     * @param jobName    name of the job
     * @param durationMs duration in milliseconds (always non-negative)
     */
    default void recordPassDurationMs(String jobName, long durationMs) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void recordMembershipRefresh(String jobName, MembershipRefreshStats stats) {
        }

        @Override
        public void recordOrphanCleanup(String jobName, OrphanCleanupStats stats) {
        }

        @Override
        public void recordEviction(String jobName, EvictionStats stats) {
        }

        @Override
        public void incrementPassFailure(String jobName) {
        }
    }
}
