package janitor;

import janitor.evict.BoundedCollectionEvictor;
import janitor.membership.MembershipCache;
import janitor.orphan.OrphanReconciler;
import janitor.schedule.PeriodicTask;
import janitor.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-level supervisor that owns one {@link PeriodicTask} per configured job.
 *
 * <p>Jobs are independent: each runs on its own thread with its own interval and
 * no lock is shared between them. {@link #start()} schedules all of them;
 * {@link #close()} stops them, letting in-flight passes finish.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * MembershipCache blacklist = MembershipCache.builder()
 *     .store(membershipStore)
 *     .validityWindow(Duration.ofHours(1))
 *     .build();
 *
 * try (Janitor janitor = Janitor.builder()
 *     .membership(blacklist, Duration.ofSeconds(30))
 *     .orphans(reconciler, Duration.ofHours(1))
 *     .eviction(evictor, Duration.ofMinutes(5))
 *     .build()) {
 *   janitor.start();
 *   // serve requests, consulting blacklist.isMember(userId)
 * }
 * }</pre>
 *
 * <p>The membership task runs its first refresh immediately unless
 * {@link Builder#warmMembershipOnStart(boolean)} is disabled; the other jobs
 * first run one interval after start. An evictor without a cap is kept for
 * manual use but never scheduled.
 */
public final class Janitor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Janitor.class.getName());

  private final MembershipCache membershipCache;
  private final OrphanReconciler orphanReconciler;
  private final BoundedCollectionEvictor evictor;
  private final List<PeriodicTask> tasks;
  private final MetricsExporter metrics;
  private final AtomicBoolean started = new AtomicBoolean();

  private Janitor(Builder builder) {
    this.membershipCache = builder.membershipCache;
    this.orphanReconciler = builder.orphanReconciler;
    this.evictor = builder.evictor;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    List<PeriodicTask> built = new ArrayList<>();
    if (membershipCache != null) {
      built.add(task(membershipCache, builder.membershipInterval,
          builder.warmMembershipOnStart ? Duration.ZERO : null, builder));
    }
    if (orphanReconciler != null) {
      built.add(task(orphanReconciler, builder.orphanInterval, null, builder));
    }
    if (evictor != null) {
      if (evictor.isEnabled()) {
        built.add(task(evictor, builder.evictionInterval, null, builder));
      } else {
        logger.log(Level.WARNING, "{0} has no item cap; not scheduling it", evictor.name());
      }
    }
    this.tasks = Collections.unmodifiableList(built);
  }

  private PeriodicTask task(Job job, Duration interval, Duration initialDelay, Builder builder) {
    return PeriodicTask.builder()
        .job(job)
        .interval(interval)
        .initialDelay(initialDelay)
        .shutdownTimeout(builder.shutdownTimeout)
        .metrics(metrics)
        .build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts every scheduled job. Subsequent calls are no-ops.
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    for (PeriodicTask task : tasks) {
      task.start();
    }
    logger.log(Level.INFO, "Janitor started {0} job(s)", tasks.size());
  }

  public MembershipCache membershipCache() {
    return membershipCache;
  }

  public OrphanReconciler orphanReconciler() {
    return orphanReconciler;
  }

  public BoundedCollectionEvictor evictor() {
    return evictor;
  }

  /** Returns the scheduled tasks in start order. */
  public List<PeriodicTask> tasks() {
    return tasks;
  }

  /**
   * Stops the jobs in reverse start order. Each task waits for its in-flight
   * pass. Failures are collected; the first is rethrown with the rest suppressed.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    for (int i = tasks.size() - 1; i >= 0; i--) {
      try {
        tasks.get(i).close();
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link Janitor}. At least one job is required. */
  public static final class Builder {
    private MembershipCache membershipCache;
    private Duration membershipInterval;
    private boolean warmMembershipOnStart = true;
    private OrphanReconciler orphanReconciler;
    private Duration orphanInterval;
    private BoundedCollectionEvictor evictor;
    private Duration evictionInterval;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Schedules a membership cache refresh every {@code interval}.
     *
     * @param cache    the cache
     * @param interval refresh interval
     * @return this builder
     */
    public Builder membership(MembershipCache cache, Duration interval) {
      this.membershipCache = Objects.requireNonNull(cache, "cache");
      this.membershipInterval = Objects.requireNonNull(interval, "interval");
      return this;
    }

    /**
     * Whether the membership cache refreshes as soon as the janitor starts.
     *
     * <p>Optional. Defaults to {@code true}.
     *
     * @param warm {@code false} to wait one interval like the other jobs
     * @return this builder
     */
    public Builder warmMembershipOnStart(boolean warm) {
      this.warmMembershipOnStart = warm;
      return this;
    }

    /**
     * Schedules an orphan reconciliation pass every {@code interval}.
     *
     * @param reconciler the reconciler
     * @param interval   pass interval
     * @return this builder
     */
    public Builder orphans(OrphanReconciler reconciler, Duration interval) {
      this.orphanReconciler = Objects.requireNonNull(reconciler, "reconciler");
      this.orphanInterval = Objects.requireNonNull(interval, "interval");
      return this;
    }

    /**
     * Schedules an eviction pass every {@code interval}.
     *
     * @param evictor  the evictor
     * @param interval pass interval
     * @return this builder
     */
    public Builder eviction(BoundedCollectionEvictor evictor, Duration interval) {
      this.evictor = Objects.requireNonNull(evictor, "evictor");
      this.evictionInterval = Objects.requireNonNull(interval, "interval");
      return this;
    }

    /**
     * Sets how long closing waits for each in-flight pass.
     *
     * <p>Optional. Defaults to {@code 30 seconds}.
     *
     * @param shutdownTimeout maximum wait per task
     * @return this builder
     */
    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
      return this;
    }

    /**
     * Sets the metrics exporter used by the periodic tasks. Closed together with
     * the janitor if it is {@link AutoCloseable}.
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
     * Builds the janitor. Call {@link Janitor#start()} to begin.
     *
     * @return a new {@link Janitor}
     * @throws IllegalStateException if no job was configured
     */
    public Janitor build() {
      if (membershipCache == null && orphanReconciler == null && evictor == null) {
        throw new IllegalStateException("At least one job must be configured");
      }
      return new Janitor(this);
    }
  }
}
