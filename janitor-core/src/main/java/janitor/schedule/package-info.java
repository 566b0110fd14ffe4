/**
 * Fixed-interval scheduling shared by all background jobs.
 *
 * <p>{@link janitor.schedule.PeriodicTask} serializes the passes of one job and
 * stops cooperatively on close.
 */
package janitor.schedule;
