package janitor.spi;

import java.util.Collection;

/**
 * Authoritative record of the blob paths that are still referenced.
 */
@FunctionalInterface
public interface PathRecordStore {

    /**
     * Returns every relative storage path the authoritative store references.
     *
     * @return referenced paths, never {@code null}
     * @throws RuntimeException if the store cannot be queried
     */
    Collection<String> findAllPaths();
}
