package janitor.blob;

import janitor.MutableClock;
import janitor.model.OrphanCleanupStats;
import janitor.orphan.OrphanReconciler;
import janitor.spi.BlobAttributes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemBlobStoreTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @TempDir
  Path root;

  @Test
  void listsRegularFilesRelativeToRoot() throws Exception {
    write("a.png", NOW);
    write("thumbs/a.png", NOW);
    Files.createDirectories(root.resolve("empty"));

    FileSystemBlobStore store = new FileSystemBlobStore(root);
    List<String> paths = store.listPaths();

    assertEquals(2, paths.size());
    assertTrue(paths.contains("a.png"));
    assertTrue(paths.contains(Path.of("thumbs", "a.png").toString()));
  }

  @Test
  void missingRootListsNothing() throws Exception {
    FileSystemBlobStore store = new FileSystemBlobStore(root.resolve("nope"));

    assertTrue(store.listPaths().isEmpty());
  }

  @Test
  void statReportsModificationTimeAndSize() throws Exception {
    Instant modified = NOW.minus(Duration.ofHours(3));
    write("x.bin", modified);

    BlobAttributes attributes = new FileSystemBlobStore(root).stat("x.bin");

    assertEquals(modified, attributes.lastModified());
    assertEquals(5, attributes.sizeBytes());
  }

  @Test
  void statOfMissingFileFails() {
    FileSystemBlobStore store = new FileSystemBlobStore(root);

    assertThrows(IOException.class, () -> store.stat("gone.png"));
  }

  @Test
  void deleteIgnoresMissingFile() throws Exception {
    write("x.bin", NOW);
    FileSystemBlobStore store = new FileSystemBlobStore(root);

    store.delete("x.bin");
    store.delete("x.bin");

    assertFalse(Files.exists(root.resolve("x.bin")));
  }

  @Test
  void rejectsPathsOutsideRoot() {
    FileSystemBlobStore store = new FileSystemBlobStore(root.resolve("media"));

    assertThrows(IOException.class, () -> store.delete("../secret.txt"));
    assertThrows(IOException.class, () -> store.stat("a/../../secret.txt"));
    assertThrows(IOException.class, () -> store.delete(""));
  }

  @Test
  void reconcilerDeletesOnlyOldUnreferencedFiles() throws Exception {
    write("kept.png", NOW.minus(Duration.ofDays(2)));
    write("old-orphan.png", NOW.minus(Duration.ofDays(2)));
    write("thumbs/young-orphan.png", NOW.minus(Duration.ofMinutes(1)));

    OrphanReconciler reconciler = OrphanReconciler.builder()
        .pathRecordStore(() -> Set.of("kept.png"))
        .blobStore(new FileSystemBlobStore(root))
        .safetyThreshold(Duration.ofHours(1))
        .clock(new MutableClock(NOW))
        .build();

    OrphanCleanupStats stats = reconciler.runCleanup();

    assertEquals(3, stats.filesScanned());
    assertEquals(2, stats.orphanedFiles());
    assertEquals(1, stats.skippedTooYoung());
    assertEquals(1, stats.filesDeleted());
    assertEquals(5, stats.bytesReclaimed());
    assertTrue(Files.exists(root.resolve("kept.png")));
    assertFalse(Files.exists(root.resolve("old-orphan.png")));
    assertTrue(Files.exists(root.resolve("thumbs/young-orphan.png")));
  }

  private void write(String relative, Instant modified) throws IOException {
    Path file = root.resolve(relative);
    Files.createDirectories(file.getParent());
    Files.writeString(file, "bytes");
    Files.setLastModifiedTime(file, FileTime.from(modified));
  }
}
