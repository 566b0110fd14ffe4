/**
 * Immutable per-pass statistics published by the background jobs.
 *
 * <p>Each job replaces its snapshot wholesale at the end of a pass; snapshots are
 * never merged and are not persisted.
 *
 * @see janitor.model.OrphanCleanupStats
 * @see janitor.model.EvictionStats
 * @see janitor.model.MembershipRefreshStats
 */
package janitor.model;
