package janitor.spi;

import java.io.IOException;
import java.util.List;

/**
 * Durable binary storage addressed by relative path.
 *
 * @see janitor.blob.FileSystemBlobStore
 */
public interface BlobStore {

    /**
     * Lists every stored blob as a path relative to the store root.
     *
     * @return relative paths; separators may be platform-specific
     * @throws IOException if the store cannot be listed
     */
    List<String> listPaths() throws IOException;

    /**
     * Reads the metadata of one blob.
     *
     * @param path a path as returned by {@link #listPaths()}
     * @return the blob attributes
     * @throws IOException if the blob cannot be read
     */
    BlobAttributes stat(String path) throws IOException;

    /**
     * Deletes one blob. Deleting a blob that is already gone is not an error.
     *
     * @param path a path as returned by {@link #listPaths()}
     * @throws IOException if the blob exists but cannot be deleted
     */
    void delete(String path) throws IOException;
}
