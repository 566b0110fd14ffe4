package janitor.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata of a single blob as reported by {@link BlobStore#stat(String)}.
 *
 * @param lastModified last modification time
 * @param sizeBytes    size in bytes, or {@code -1} if unknown
 */
public record BlobAttributes(Instant lastModified, long sizeBytes) {

    public BlobAttributes {
        Objects.requireNonNull(lastModified, "lastModified");
    }
}
