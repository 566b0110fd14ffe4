package janitor.spi;

import java.util.List;
import java.util.OptionalLong;

/**
 * Read-only queries over a partitioned, capped collection (e.g. threads per board).
 *
 * <p>Counts are never cached by the caller; each pass asks again.
 */
public interface PartitionStore {

    /**
     * Lists all partitions that are subject to the cap.
     *
     * @return partition keys, never {@code null}
     */
    List<String> listPartitions();

    /**
     * Counts the items currently stored in a partition.
     *
     * @param partition the partition key
     * @return the current item count
     */
    int countItems(String partition);

    /**
     * Finds the oldest evictable item in a partition.
     *
     * @param partition the partition key
     * @return the item id, or empty if nothing in the partition can be evicted
     */
    OptionalLong findOldestItem(String partition);
}
