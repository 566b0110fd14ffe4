package janitor;

import janitor.schedule.PeriodicTask;
import janitor.spi.MetricsExporter;

import java.time.Duration;

/**
 * A background job whose pass can be run on demand or on a fixed schedule.
 *
 * @see janitor.membership.MembershipCache
 * @see janitor.orphan.OrphanReconciler
 * @see janitor.evict.BoundedCollectionEvictor
 */
public interface Job {

  /**
   * Short name used for thread names, log records and metric tags.
   */
  String name();

  /**
   * Runs one complete pass synchronously.
   *
   * @throws PassAbortedException if the pass could not start its work
   */
  void runPass();

  /**
   * Starts a {@link PeriodicTask} that runs this job every {@code interval}.
   * Close the returned task to stop it.
   *
   * @param interval fixed delay between the end of one pass and the start of the next
   * @return the started task
   */
  default PeriodicTask runPeriodically(Duration interval) {
    return runPeriodically(interval, MetricsExporter.NOOP);
  }

  /**
   * Starts a {@link PeriodicTask} that runs this job every {@code interval},
   * reporting failures and durations to {@code metrics}.
   *
   * @param interval fixed delay between passes
   * @param metrics  the metrics exporter
   * @return the started task
   */
  default PeriodicTask runPeriodically(Duration interval, MetricsExporter metrics) {
    PeriodicTask task = PeriodicTask.builder()
        .job(this)
        .interval(interval)
        .metrics(metrics)
        .build();
    task.start();
    return task;
  }
}
