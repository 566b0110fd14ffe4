/**
 * Background enforcement of a per-partition item cap.
 *
 * @see janitor.evict.BoundedCollectionEvictor
 */
package janitor.evict;
