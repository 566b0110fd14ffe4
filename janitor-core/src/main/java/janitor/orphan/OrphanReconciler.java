package janitor.orphan;

import janitor.Job;
import janitor.PassAbortedException;
import janitor.model.OrphanCleanupStats;
import janitor.spi.BlobAttributes;
import janitor.spi.BlobStore;
import janitor.spi.MetricsExporter;
import janitor.spi.PathRecordStore;
import janitor.util.BoundedErrorList;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes blob-store files that the authoritative store no longer references.
 *
 * <p>A pass loads the full authoritative path set, lists the blob store, and for
 * every listed path missing from the set checks its age. Files at least
 * {@code safetyThreshold} old are deleted; younger ones are skipped because the
 * record that will reference them may not be committed yet.
 *
 * <p>Only a failure to load the path set or to list the blob store aborts the
 * pass. Stat and delete failures are recorded in the published
 * {@link OrphanCleanupStats} and the pass moves on to the next file.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class OrphanReconciler implements Job {
  private static final Logger logger = Logger.getLogger(OrphanReconciler.class.getName());

  private final String name;
  private final PathRecordStore pathRecordStore;
  private final BlobStore blobStore;
  private final Duration safetyThreshold;
  private final int maxRecordedErrors;
  private final Clock clock;
  private final MetricsExporter metrics;

  private final ReentrantLock passLock = new ReentrantLock();
  private volatile OrphanCleanupStats lastStats = OrphanCleanupStats.empty();

  private OrphanReconciler(Builder builder) {
    this.pathRecordStore = Objects.requireNonNull(builder.pathRecordStore, "pathRecordStore");
    this.blobStore = Objects.requireNonNull(builder.blobStore, "blobStore");
    this.safetyThreshold = Objects.requireNonNull(builder.safetyThreshold, "safetyThreshold");
    if (safetyThreshold.isNegative()) {
      throw new IllegalArgumentException("safetyThreshold must be >= 0");
    }
    if (builder.maxRecordedErrors < 0) {
      throw new IllegalArgumentException("maxRecordedErrors must be >= 0");
    }
    this.name = builder.name;
    this.maxRecordedErrors = builder.maxRecordedErrors;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void runPass() {
    runCleanup();
  }

  /**
   * Runs one reconciliation pass and publishes its statistics.
   *
   * @return the statistics of this pass
   * @throws PassAbortedException if the path set cannot be loaded or the blob store cannot be listed
   */
  public OrphanCleanupStats runCleanup() {
    passLock.lock();
    try {
      return doRunCleanup();
    } finally {
      passLock.unlock();
    }
  }

  private OrphanCleanupStats doRunCleanup() {
    Instant runAt = clock.instant();
    long startNanos = System.nanoTime();

    Set<String> recorded = loadRecordedPaths();

    List<String> listed;
    try {
      listed = blobStore.listPaths();
    } catch (IOException | RuntimeException e) {
      throw new PassAbortedException(name, "failed to list blob store", e);
    }

    BoundedErrorList errors = new BoundedErrorList(maxRecordedErrors);
    int orphaned = 0;
    int tooYoung = 0;
    int deleted = 0;
    long bytesReclaimed = 0L;

    for (String path : listed) {
      if (recorded.contains(PathNormalizer.normalize(path))) {
        continue;
      }
      orphaned++;

      BlobAttributes attributes;
      try {
        attributes = blobStore.stat(path);
      } catch (IOException | RuntimeException e) {
        errors.add("stat error: " + path + ": " + e.getMessage());
        continue;
      }

      Duration age = Duration.between(attributes.lastModified(), clock.instant());
      if (age.compareTo(safetyThreshold) < 0) {
        tooYoung++;
        continue;
      }

      try {
        blobStore.delete(path);
        deleted++;
        if (attributes.sizeBytes() > 0) {
          bytesReclaimed += attributes.sizeBytes();
        }
      } catch (IOException | RuntimeException e) {
        errors.add("delete error: " + path + ": " + e.getMessage());
      }
    }

    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    OrphanCleanupStats stats = new OrphanCleanupStats(runAt, listed.size(), orphaned, tooYoung,
        deleted, bytesReclaimed, durationMs, errors.messages(), errors.dropped());
    lastStats = stats;
    metrics.recordOrphanCleanup(name, stats);

    logger.log(errors.isEmpty() ? Level.INFO : Level.WARNING,
        "{0}: scanned: {1}, orphans: {2}, too young: {3}, deleted: {4}, bytes reclaimed: {5}, duration: {6}ms, errors: {7}",
        new Object[]{name, stats.filesScanned(), orphaned, tooYoung, deleted, bytesReclaimed,
            durationMs, stats.errorCount()});
    return stats;
  }

  private Set<String> loadRecordedPaths() {
    Collection<String> paths;
    try {
      paths = pathRecordStore.findAllPaths();
    } catch (RuntimeException e) {
      throw new PassAbortedException(name, "failed to load recorded paths", e);
    }
    Set<String> normalized = new HashSet<>(Math.max(16, paths.size() * 2));
    for (String path : paths) {
      if (path != null && !path.isEmpty()) {
        normalized.add(PathNormalizer.normalize(path));
      }
    }
    return normalized;
  }

  /**
   * Returns the statistics of the most recent completed pass. While a pass is
   * running this is still the previous snapshot.
   */
  public OrphanCleanupStats getLastStats() {
    return lastStats;
  }

  public Duration safetyThreshold() {
    return safetyThreshold;
  }

  /** Builder for {@link OrphanReconciler}. */
  public static final class Builder {
    private String name = "orphan-gc";
    private PathRecordStore pathRecordStore;
    private BlobStore blobStore;
    private Duration safetyThreshold;
    private int maxRecordedErrors = 100;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the authoritative record of referenced paths.
     *
     * <p><b>Required.</b>
     *
     * @param pathRecordStore the path record store
     * @return this builder
     */
    public Builder pathRecordStore(PathRecordStore pathRecordStore) {
      this.pathRecordStore = pathRecordStore;
      return this;
    }

    /**
     * Sets the blob store to reconcile.
     *
     * <p><b>Required.</b>
     *
     * @param blobStore the blob store
     * @return this builder
     */
    public Builder blobStore(BlobStore blobStore) {
      this.blobStore = blobStore;
      return this;
    }

    /**
     * Sets the minimum age an unreferenced file must reach before it is deleted.
     *
     * <p><b>Required.</b> Must be &ge; 0.
     *
     * @param safetyThreshold minimum orphan age
     * @return this builder
     */
    public Builder safetyThreshold(Duration safetyThreshold) {
      this.safetyThreshold = safetyThreshold;
      return this;
    }

    /**
     * Caps the number of error messages kept per pass; further errors are only counted.
     *
     * <p>Optional. Defaults to {@code 100}. Must be &ge; 0.
     *
     * @param maxRecordedErrors maximum recorded messages
     * @return this builder
     */
    public Builder maxRecordedErrors(int maxRecordedErrors) {
      this.maxRecordedErrors = maxRecordedErrors;
      return this;
    }

    /**
     * Sets the job name.
     *
     * <p>Optional. Defaults to {@code "orphan-gc"}.
     *
     * @param name the job name
     * @return this builder
     */
    public Builder name(String name) {
      this.name = Objects.requireNonNull(name, "name");
      return this;
    }

    /**
     * Sets the clock used to compute file ages.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock the clock
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the reconciler.
     *
     * @return a new {@link OrphanReconciler}
     * @throws NullPointerException if a required collaborator is missing
     * @throws IllegalArgumentException if {@code safetyThreshold} or {@code maxRecordedErrors} is negative
     */
    public OrphanReconciler build() {
      return new OrphanReconciler(this);
    }
  }
}
