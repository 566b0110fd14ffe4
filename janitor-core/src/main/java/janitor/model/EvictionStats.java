package janitor.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one bounded-collection eviction pass.
 *
 * @param runAt             when the pass started
 * @param partitionsScanned number of partitions listed
 * @param partitionsOverCap partitions whose count exceeded the cap
 * @param itemsDeleted      items removed through the cascading delete
 * @param durationMs        wall-clock duration of the pass
 * @param errors            per-partition error messages, at most the configured limit
 * @param droppedErrors     errors counted but not recorded because the limit was reached
 */
public record EvictionStats(
    Instant runAt,
    int partitionsScanned,
    int partitionsOverCap,
    int itemsDeleted,
    long durationMs,
    List<String> errors,
    int droppedErrors) {

  public EvictionStats {
    Objects.requireNonNull(runAt, "runAt");
    errors = List.copyOf(errors);
  }

  public static EvictionStats empty() {
    return new EvictionStats(Instant.EPOCH, 0, 0, 0, 0L, List.of(), 0);
  }

  public int errorCount() {
    return errors.size() + droppedErrors;
  }
}
