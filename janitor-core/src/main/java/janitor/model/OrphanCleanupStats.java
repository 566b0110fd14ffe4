package janitor.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one orphan reconciliation pass.
 *
 * @param runAt           when the pass started
 * @param filesScanned    number of paths listed from the blob store
 * @param orphanedFiles   listed paths absent from the authoritative record
 * @param skippedTooYoung orphans left alone because they are younger than the safety threshold
 * @param filesDeleted    orphans actually deleted
 * @param bytesReclaimed  total size of the deleted files, where the blob store reports sizes
 * @param durationMs      wall-clock duration of the pass
 * @param errors          per-file error messages, at most the configured limit
 * @param droppedErrors   errors counted but not recorded because the limit was reached
 */
public record OrphanCleanupStats(
    Instant runAt,
    int filesScanned,
    int orphanedFiles,
    int skippedTooYoung,
    int filesDeleted,
    long bytesReclaimed,
    long durationMs,
    List<String> errors,
    int droppedErrors) {

  public OrphanCleanupStats {
    Objects.requireNonNull(runAt, "runAt");
    errors = List.copyOf(errors);
  }

  /** Snapshot reported before the first pass has completed. */
  public static OrphanCleanupStats empty() {
    return new OrphanCleanupStats(Instant.EPOCH, 0, 0, 0, 0, 0L, 0L, List.of(), 0);
  }

  /** Total number of per-file errors, recorded or dropped. */
  public int errorCount() {
    return errors.size() + droppedErrors;
  }
}
