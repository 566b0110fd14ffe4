package janitor.evict;

import janitor.Job;
import janitor.PassAbortedException;
import janitor.model.EvictionStats;
import janitor.spi.ItemDeleter;
import janitor.spi.MetricsExporter;
import janitor.spi.PartitionStore;
import janitor.util.BoundedErrorList;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps every partition at or below a global item cap by deleting the oldest
 * excess items.
 *
 * <p>For each partition over the cap the evictor repeatedly asks the store for
 * the oldest remaining item and hands it to the host's cascading
 * {@link ItemDeleter}, {@code count - cap} times. A failed lookup or delete ends
 * work on that partition only; the error is recorded and the next partition is
 * processed.
 *
 * <p>Without a configured cap every pass is a no-op.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class BoundedCollectionEvictor implements Job {
  private static final Logger logger = Logger.getLogger(BoundedCollectionEvictor.class.getName());

  private final String name;
  private final PartitionStore partitionStore;
  private final ItemDeleter itemDeleter;
  private final Integer maxItemsPerPartition;
  private final int maxRecordedErrors;
  private final Clock clock;
  private final MetricsExporter metrics;

  private final ReentrantLock passLock = new ReentrantLock();
  private volatile EvictionStats lastStats = EvictionStats.empty();

  private BoundedCollectionEvictor(Builder builder) {
    this.partitionStore = Objects.requireNonNull(builder.partitionStore, "partitionStore");
    this.itemDeleter = Objects.requireNonNull(builder.itemDeleter, "itemDeleter");
    if (builder.maxItemsPerPartition != null && builder.maxItemsPerPartition < 0) {
      throw new IllegalArgumentException("maxItemsPerPartition must be >= 0");
    }
    if (builder.maxRecordedErrors < 0) {
      throw new IllegalArgumentException("maxRecordedErrors must be >= 0");
    }
    this.name = builder.name;
    this.maxItemsPerPartition = builder.maxItemsPerPartition;
    this.maxRecordedErrors = builder.maxRecordedErrors;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    if (maxItemsPerPartition == null) {
      logger.log(Level.WARNING, "{0}: no item cap configured, eviction disabled", name);
    }
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

  /** Returns {@code true} when a cap is configured. */
  public boolean isEnabled() {
    return maxItemsPerPartition != null;
  }

  /**
   * Runs one eviction pass and publishes its statistics.
   *
   * <p>When no cap is configured nothing is queried, the last snapshot is kept
   * and {@link EvictionStats#empty()} is returned.
   *
   * @return the statistics of this pass
   * @throws PassAbortedException if the partition list cannot be loaded
   */
  public EvictionStats runCleanup() {
    if (maxItemsPerPartition == null) {
      return EvictionStats.empty();
    }
    passLock.lock();
    try {
      return doRunCleanup(maxItemsPerPartition);
    } finally {
      passLock.unlock();
    }
  }

  private EvictionStats doRunCleanup(int cap) {
    Instant runAt = clock.instant();
    long startNanos = System.nanoTime();

    List<String> partitions;
    try {
      partitions = partitionStore.listPartitions();
    } catch (RuntimeException e) {
      throw new PassAbortedException(name, "failed to list partitions", e);
    }

    BoundedErrorList errors = new BoundedErrorList(maxRecordedErrors);
    int overCap = 0;
    int deleted = 0;

    for (String partition : partitions) {
      if (Thread.currentThread().isInterrupted()) {
        errors.add("partition '" + partition + "': pass interrupted, remaining partitions skipped");
        break;
      }
      int count;
      try {
        count = partitionStore.countItems(partition);
      } catch (RuntimeException e) {
        errors.add("partition '" + partition + "': failed to count items: " + e.getMessage());
        continue;
      }
      if (count <= cap) {
        continue;
      }
      overCap++;
      deleted += evictExcess(partition, count - cap, errors);
    }

    long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    EvictionStats stats = new EvictionStats(runAt, partitions.size(), overCap, deleted,
        durationMs, errors.messages(), errors.dropped());
    lastStats = stats;
    metrics.recordEviction(name, stats);

    logger.log(errors.isEmpty() ? Level.INFO : Level.WARNING,
        "{0}: partitions scanned: {1}, over cap: {2}, items deleted: {3}, duration: {4}ms, errors: {5}",
        new Object[]{name, stats.partitionsScanned(), overCap, deleted, durationMs, stats.errorCount()});
    return stats;
  }

  private int evictExcess(String partition, int excess, BoundedErrorList errors) {
    int deleted = 0;
    for (int i = 0; i < excess; i++) {
      OptionalLong oldest;
      try {
        oldest = partitionStore.findOldestItem(partition);
      } catch (RuntimeException e) {
        errors.add("partition '" + partition + "': failed to get oldest item: " + e.getMessage());
        break;
      }
      if (oldest.isEmpty()) {
        errors.add("partition '" + partition + "': no evictable item found, "
            + (excess - i) + " still over cap");
        break;
      }

      long itemId = oldest.getAsLong();
      try {
        itemDeleter.delete(partition, itemId);
      } catch (Exception e) {
        if (e instanceof InterruptedException) {
          Thread.currentThread().interrupt();
        }
        errors.add("partition '" + partition + "': failed to delete item " + itemId + ": " + e.getMessage());
        break;
      }
      deleted++;
    }
    return deleted;
  }

  /**
   * Returns the statistics of the most recent completed pass.
   */
  public EvictionStats getLastStats() {
    return lastStats;
  }

  /** Builder for {@link BoundedCollectionEvictor}. */
  public static final class Builder {
    private String name = "eviction";
    private PartitionStore partitionStore;
    private ItemDeleter itemDeleter;
    private Integer maxItemsPerPartition;
    private int maxRecordedErrors = 100;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the store answering count and oldest-item queries.
     *
     * <p><b>Required.</b>
     *
     * @param partitionStore the partition store
     * @return this builder
     */
    public Builder partitionStore(PartitionStore partitionStore) {
      this.partitionStore = partitionStore;
      return this;
    }

    /**
     * Sets the cascading delete owned by the host application.
     *
     * <p><b>Required.</b>
     *
     * @param itemDeleter the item deleter
     * @return this builder
     */
    public Builder itemDeleter(ItemDeleter itemDeleter) {
      this.itemDeleter = itemDeleter;
      return this;
    }

    /**
     * Sets the maximum number of items allowed per partition.
     *
     * <p>Optional. When {@code null} (the default) eviction is disabled. Must be &ge; 0.
     *
     * @param maxItemsPerPartition the cap, or {@code null}
     * @return this builder
     */
    public Builder maxItemsPerPartition(Integer maxItemsPerPartition) {
      this.maxItemsPerPartition = maxItemsPerPartition;
      return this;
    }

    /**
     * Caps the number of error messages kept per pass.
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
     * <p>Optional. Defaults to {@code "eviction"}.
     *
     * @param name the job name
     * @return this builder
     */
    public Builder name(String name) {
      this.name = Objects.requireNonNull(name, "name");
      return this;
    }

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

    public BoundedCollectionEvictor build() {
      return new BoundedCollectionEvictor(this);
    }
  }
}
