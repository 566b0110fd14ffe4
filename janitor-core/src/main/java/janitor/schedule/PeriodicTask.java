package janitor.schedule;

import janitor.Job;
import janitor.spi.MetricsExporter;
import janitor.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a {@link Job} pass on a fixed delay until closed.
 *
 * <p>Each task owns a single daemon thread. Passes run with
 * {@code scheduleWithFixedDelay}, so passes of the same task never overlap and
 * a slow pass pushes the next tick back.
 *
 * <p>A pass that throws is logged and counted; the next tick still runs.
 * {@link #close()} is the cancellation signal: it stops further ticks and waits
 * for an in-flight pass to finish without interrupting it.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see PeriodicTask.Builder
 */
public final class PeriodicTask implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PeriodicTask.class.getName());

  private final Job job;
  private final Duration interval;
  private final Duration initialDelay;
  private final Duration shutdownTimeout;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> tickTask;
  private volatile Thread worker;
  private volatile boolean closed;

  private PeriodicTask(Builder builder) {
    this.job = Objects.requireNonNull(builder.job, "job");
    this.interval = Objects.requireNonNull(builder.interval, "interval");

    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    if (builder.initialDelay != null && builder.initialDelay.isNegative()) {
      throw new IllegalArgumentException("initialDelay must be >= 0");
    }
    if (builder.shutdownTimeout.isNegative()) {
      throw new IllegalArgumentException("shutdownTimeout must be >= 0");
    }

    this.initialDelay = builder.initialDelay != null ? builder.initialDelay : interval;
    this.shutdownTimeout = builder.shutdownTimeout;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the schedule. Subsequent calls are no-ops if already started.
   *
   * @throws IllegalStateException if the task has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PeriodicTask " + job.name() + " has been closed");
    }
    if (tickTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(DaemonThreadFactory.forJob(job.name()));
    tickTask = scheduler.scheduleWithFixedDelay(
        this::tick, initialDelay.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
    logger.log(Level.INFO, "Started {0} (interval: {1}, initial delay: {2})",
        new Object[]{job.name(), interval, initialDelay});
  }

  /**
   * Executes a single pass of the job, logging instead of propagating failures.
   *
   * <p>Called by the scheduler; may also be invoked directly.
   */
  public void runOnce() {
    if (closed) {
      return;
    }
    long startNanos = System.nanoTime();
    try {
      job.runPass();
    } catch (Throwable t) {
      metrics.incrementPassFailure(job.name());
      logger.log(Level.SEVERE, job.name() + " pass failed", t);
    } finally {
      long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      metrics.recordPassDurationMs(job.name(), Math.max(0L, durationMs));
    }
  }

  private void tick() {
    worker = Thread.currentThread();
    runOnce();
  }

  /**
   * Returns {@code true} while the schedule is active.
   */
  public boolean isRunning() {
    return tickTask != null && !closed;
  }

  public String jobName() {
    return job.name();
  }

  public Duration interval() {
    return interval;
  }

  /**
   * Cancels the schedule and waits up to the shutdown timeout for an in-flight
   * pass to complete. The running pass is never interrupted.
   *
   * <p>When called from the task's own pass there is nothing to wait for: the
   * pass finishes after this method returns and no further pass is scheduled.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (tickTask != null) {
      tickTask.cancel(false);
      tickTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdown();
      if (Thread.currentThread() == worker) {
        logger.log(Level.INFO, "Stopped {0} from its own pass", job.name());
        return;
      }
      try {
        if (!scheduler.awaitTermination(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
          logger.log(Level.WARNING, "{0} pass still running after {1}; leaving it to finish",
              new Object[]{job.name(), shutdownTimeout});
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      logger.log(Level.INFO, "Stopped {0}", job.name());
    }
  }

  /** Builder for {@link PeriodicTask}. */
  public static final class Builder {
    private Job job;
    private Duration interval;
    private Duration initialDelay;
    private Duration shutdownTimeout = Duration.ofSeconds(30);
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the job whose pass runs on each tick.
     *
     * <p><b>Required.</b>
     *
     * @param job the job
     * @return this builder
     */
    public Builder job(Job job) {
      this.job = job;
      return this;
    }

    /**
     * Sets the fixed delay between the end of one pass and the start of the next.
     * The interval cannot change once the task is built.
     *
     * <p><b>Required.</b> Must be &gt; 0.
     *
     * @param interval the tick interval
     * @return this builder
     */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /**
     * Sets the delay before the first pass.
     *
     * <p>Optional. Defaults to the interval. Must be &ge; 0.
     *
     * @param initialDelay delay before the first tick
     * @return this builder
     */
    public Builder initialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    /**
     * Sets how long {@link PeriodicTask#close()} waits for an in-flight pass.
     *
     * <p>Optional. Defaults to {@code 30 seconds}. Must be &ge; 0.
     *
     * @param shutdownTimeout maximum wait on close
     * @return this builder
     */
    public Builder shutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
      return this;
    }

    /**
     * Sets the metrics exporter for pass failures and durations.
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
     * Builds the task. Call {@link PeriodicTask#start()} to begin.
     *
     * @return a new {@link PeriodicTask}
     * @throws NullPointerException if {@code job} or {@code interval} is null
     * @throws IllegalArgumentException if {@code interval <= 0} or a delay is negative
     */
    public PeriodicTask build() {
      return new PeriodicTask(this);
    }
  }
}
