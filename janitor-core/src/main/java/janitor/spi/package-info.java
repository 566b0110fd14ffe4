/**
 * Service Provider Interfaces (SPI) the background jobs consume.
 *
 * <p>The host application owns the authoritative store, the blob store and the
 * cascading delete; these interfaces are the narrow views the jobs need of them.
 * Reference adapters live in {@code janitor-jdbc} and {@link janitor.blob}.
 *
 * @see janitor.spi.MembershipStore
 * @see janitor.spi.PathRecordStore
 * @see janitor.spi.BlobStore
 * @see janitor.spi.PartitionStore
 * @see janitor.spi.ItemDeleter
 * @see janitor.spi.MetricsExporter
 */
package janitor.spi;
