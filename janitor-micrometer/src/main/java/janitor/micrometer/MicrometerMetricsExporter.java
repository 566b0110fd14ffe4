package janitor.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import janitor.model.EvictionStats;
import janitor.model.MembershipRefreshStats;
import janitor.model.OrphanCleanupStats;
import janitor.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Every meter carries a {@code job} tag holding the reporting job's name, so
 * several reconcilers or evictors can share one exporter. A job's meters are
 * registered the first time it reports.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code janitor.orphan.files.deleted}: orphaned files deleted</li>
 *   <li>{@code janitor.orphan.bytes.reclaimed}: bytes freed by deleted orphans</li>
 *   <li>{@code janitor.eviction.items.deleted}: items evicted to enforce the cap</li>
 *   <li>{@code janitor.pass.failures}: passes that threw</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code janitor.membership.size}: entries after the last refresh</li>
 *   <li>{@code janitor.orphan.last.orphaned}, {@code janitor.orphan.last.skipped},
 *       {@code janitor.orphan.last.errors}: from the last orphan pass</li>
 *   <li>{@code janitor.eviction.last.over.cap}, {@code janitor.eviction.last.errors}:
 *       from the last eviction pass</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code janitor.pass.duration}: wall time of each scheduled pass</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Map<String, MembershipMeters> membershipMeters = new ConcurrentHashMap<>();
  private final Map<String, OrphanMeters> orphanMeters = new ConcurrentHashMap<>();
  private final Map<String, EvictionMeters> evictionMeters = new ConcurrentHashMap<>();
  private final Map<String, Counter> passFailures = new ConcurrentHashMap<>();
  private final Map<String, Timer> passDurations = new ConcurrentHashMap<>();
  private final List<Meter> registered = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "janitor"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "janitor");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "media.janitor"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }
    this.registry = registry;
    this.namePrefix = namePrefix;
  }

  @Override
  public void recordMembershipRefresh(String jobName, MembershipRefreshStats stats) {
    if (closed) return;
    membershipMeters.computeIfAbsent(jobName, MembershipMeters::new).size.set(stats.members());
  }

  @Override
  public void recordOrphanCleanup(String jobName, OrphanCleanupStats stats) {
    if (closed) return;
    OrphanMeters meters = orphanMeters.computeIfAbsent(jobName, OrphanMeters::new);
    meters.filesDeleted.increment(stats.filesDeleted());
    meters.bytesReclaimed.increment(stats.bytesReclaimed());
    meters.orphaned.set(stats.orphanedFiles());
    meters.skipped.set(stats.skippedTooYoung());
    meters.errors.set(stats.errorCount());
  }

  @Override
  public void recordEviction(String jobName, EvictionStats stats) {
    if (closed) return;
    EvictionMeters meters = evictionMeters.computeIfAbsent(jobName, EvictionMeters::new);
    meters.itemsDeleted.increment(stats.itemsDeleted());
    meters.overCap.set(stats.partitionsOverCap());
    meters.errors.set(stats.errorCount());
  }

  @Override
  public void incrementPassFailure(String jobName) {
    if (closed) return;
    passFailures.computeIfAbsent(jobName, job -> track(
        Counter.builder(namePrefix + ".pass.failures")
            .description("Passes that ended with an exception")
            .tag("job", job)
            .register(registry)))
        .increment();
  }

  @Override
  public void recordPassDurationMs(String jobName, long durationMs) {
    if (closed) return;
    passDurations.computeIfAbsent(jobName, job -> track(
        Timer.builder(namePrefix + ".pass.duration")
            .description("Wall time of each pass")
            .tag("job", job)
            .register(registry)))
        .record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link janitor.Janitor#close()} to prevent stale gauges.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : registered) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }

  private <M extends Meter> M track(M meter) {
    registered.add(meter);
    return meter;
  }

  private Counter counter(String suffix, String job, String description, String baseUnit) {
    return track(Counter.builder(namePrefix + suffix)
        .description(description)
        .baseUnit(baseUnit)
        .tag("job", job)
        .register(registry));
  }

  private AtomicLong gauge(String suffix, String job, String description) {
    AtomicLong value = new AtomicLong();
    track(Gauge.builder(namePrefix + suffix, value, AtomicLong::get)
        .description(description)
        .tag("job", job)
        .register(registry));
    return value;
  }

  private final class MembershipMeters {
    final AtomicLong size;

    MembershipMeters(String job) {
      size = gauge(".membership.size", job, "Entries in the membership cache");
    }
  }

  private final class OrphanMeters {
    final Counter filesDeleted;
    final Counter bytesReclaimed;
    final AtomicLong orphaned;
    final AtomicLong skipped;
    final AtomicLong errors;

    OrphanMeters(String job) {
      filesDeleted = counter(".orphan.files.deleted", job, "Orphaned files deleted", null);
      bytesReclaimed = counter(".orphan.bytes.reclaimed", job,
          "Bytes freed by deleting orphaned files", "bytes");
      orphaned = gauge(".orphan.last.orphaned", job, "Unreferenced files seen in the last pass");
      skipped = gauge(".orphan.last.skipped", job, "Orphans skipped as too young in the last pass");
      errors = gauge(".orphan.last.errors", job, "Errors in the last orphan pass");
    }
  }

  private final class EvictionMeters {
    final Counter itemsDeleted;
    final AtomicLong overCap;
    final AtomicLong errors;

    EvictionMeters(String job) {
      itemsDeleted = counter(".eviction.items.deleted", job,
          "Items evicted to keep partitions under the cap", null);
      overCap = gauge(".eviction.last.over.cap", job, "Partitions over the cap in the last pass");
      errors = gauge(".eviction.last.errors", job, "Errors in the last eviction pass");
    }
  }
}
