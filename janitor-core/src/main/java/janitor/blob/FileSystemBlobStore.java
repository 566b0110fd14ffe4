package janitor.blob;

import janitor.spi.BlobAttributes;
import janitor.spi.BlobStore;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BlobStore} over a local directory tree, e.g. an uploaded-media root.
 *
 * <p>Paths are relative to the root directory. Entries that cannot be visited
 * while listing are skipped. Paths that would resolve outside the root are
 * rejected.
 */
public final class FileSystemBlobStore implements BlobStore {
  private static final Logger logger = Logger.getLogger(FileSystemBlobStore.class.getName());

  private final Path root;

  public FileSystemBlobStore(Path root) {
    this.root = Objects.requireNonNull(root, "root").toAbsolutePath().normalize();
  }

  public Path root() {
    return root;
  }

  @Override
  public List<String> listPaths() throws IOException {
    if (!Files.isDirectory(root)) {
      logger.log(Level.WARNING, "Blob root {0} does not exist or is not a directory", root);
      return List.of();
    }
    List<String> paths = new ArrayList<>();
    Files.walkFileTree(root, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
        if (attrs.isRegularFile()) {
          paths.add(root.relativize(file).toString());
        }
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFileFailed(Path file, IOException exc) {
        logger.log(Level.FINE, "Skipping unreadable entry " + file, exc);
        return FileVisitResult.CONTINUE;
      }
    });
    return paths;
  }

  @Override
  public BlobAttributes stat(String path) throws IOException {
    BasicFileAttributes attrs = Files.readAttributes(resolve(path), BasicFileAttributes.class);
    return new BlobAttributes(attrs.lastModifiedTime().toInstant(), attrs.size());
  }

  @Override
  public void delete(String path) throws IOException {
    Files.deleteIfExists(resolve(path));
  }

  private Path resolve(String path) throws IOException {
    Objects.requireNonNull(path, "path");
    Path resolved = root.resolve(path).normalize();
    if (!resolved.startsWith(root) || resolved.equals(root)) {
      throw new IOException("Path escapes blob root: " + path);
    }
    return resolved;
  }
}
