/**
 * Local-filesystem {@link janitor.spi.BlobStore} implementation.
 */
package janitor.blob;
