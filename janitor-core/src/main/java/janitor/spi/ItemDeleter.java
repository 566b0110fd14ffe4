package janitor.spi;

/**
 * Cascading delete owned by the host application.
 *
 * <p>Implementations remove the item and everything that depends on it, including
 * its blob-store files. The evictor never deletes rows directly.
 */
@FunctionalInterface
public interface ItemDeleter {

    /**
     * Deletes one item.
     *
     * @param partition the partition the item belongs to
     * @param itemId    the item id
     * @throws Exception if the item could not be deleted
     */
    void delete(String partition, long itemId) throws Exception;
}
