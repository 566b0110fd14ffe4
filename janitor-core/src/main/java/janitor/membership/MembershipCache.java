package janitor.membership;

import janitor.Job;
import janitor.PassAbortedException;
import janitor.model.MembershipRefreshStats;
import janitor.spi.MembershipStore;
import janitor.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory set of entity ids (e.g. blacklisted users) consulted on the
 * authentication path instead of querying the store per request.
 *
 * <p>Each {@link #refresh()} asks the store for every entity whose membership
 * event happened within the last {@code validityWindow × 1.1}, builds a new set
 * outside any lock and swaps it in under the write lock. Readers therefore see
 * either the previous complete set or the new complete set. A failed refresh
 * leaves the previous set in place.
 *
 * <p>An entity added to the store becomes visible after at most
 * {@link #stalenessBound(Duration) validityWindow × 1.1 + refreshInterval}.
 *
 * <p>This class is thread-safe. Create instances via {@link #builder()}.
 */
public final class MembershipCache implements Job {
  private static final Logger logger = Logger.getLogger(MembershipCache.class.getName());

  static final double WINDOW_BUFFER = 1.1;

  private final String name;
  private final MembershipStore store;
  private final Duration validityWindow;
  private final Duration lookback;
  private final Clock clock;
  private final MetricsExporter metrics;

  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
  private final ReentrantLock passLock = new ReentrantLock();
  private Set<Long> members = Set.of();
  private volatile MembershipRefreshStats lastStats = MembershipRefreshStats.empty();

  private MembershipCache(Builder builder) {
    this.store = Objects.requireNonNull(builder.store, "store");
    this.validityWindow = Objects.requireNonNull(builder.validityWindow, "validityWindow");
    if (validityWindow.isNegative() || validityWindow.isZero()) {
      throw new IllegalArgumentException("validityWindow must be > 0");
    }
    this.lookback = Duration.ofMillis(Math.round(validityWindow.toMillis() * WINDOW_BUFFER));
    this.name = builder.name;
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
    refresh();
  }

  /**
   * Replaces the whole set with the members found in the recency window.
   *
   * @return the size of the new set
   * @throws PassAbortedException if the store query fails; the previous set is kept
   */
  public int refresh() {
    passLock.lock();
    try {
      long startNanos = System.nanoTime();
      Instant since = clock.instant().minus(lookback);

      List<Long> ids;
      try {
        ids = store.findMembersSince(since);
      } catch (RuntimeException e) {
        throw new PassAbortedException(name, "failed to query members since " + since, e);
      }

      Set<Long> replacement = new HashSet<>(Math.max(16, ids.size() * 2));
      replacement.addAll(ids);
      replacement = Collections.unmodifiableSet(replacement);

      lock.writeLock().lock();
      try {
        members = replacement;
      } finally {
        lock.writeLock().unlock();
      }

      long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      MembershipRefreshStats stats =
          new MembershipRefreshStats(clock.instant(), since, replacement.size(), durationMs);
      lastStats = stats;
      metrics.recordMembershipRefresh(name, stats);
      logger.log(Level.INFO, "{0}: refreshed with {1} entries (since: {2})",
          new Object[]{name, replacement.size(), since});
      return replacement.size();
    } finally {
      passLock.unlock();
    }
  }

  /**
   * Returns whether {@code id} is in the current set. Never touches the store.
   *
   * @param id entity id
   * @return {@code true} if the entity is a member
   */
  public boolean isMember(long id) {
    lock.readLock().lock();
    try {
      return members.contains(id);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Returns the size of the current set. */
  public int size() {
    lock.readLock().lock();
    try {
      return members.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Returns the time of the last successful refresh, or {@link Instant#EPOCH}
   * if none has completed yet.
   */
  public Instant lastRefreshedAt() {
    return lastStats.refreshedAt();
  }

  public MembershipRefreshStats getLastStats() {
    return lastStats;
  }

  /** Returns how far back each refresh looks: the validity window plus 10%. */
  public Duration lookback() {
    return lookback;
  }

  /**
   * Upper bound on how long a membership change can stay invisible when the
   * cache is refreshed every {@code refreshInterval}.
   *
   * @param refreshInterval the refresh interval
   * @return {@code validityWindow × 1.1 + refreshInterval}
   */
  public Duration stalenessBound(Duration refreshInterval) {
    return lookback.plus(Objects.requireNonNull(refreshInterval, "refreshInterval"));
  }

  /** Builder for {@link MembershipCache}. */
  public static final class Builder {
    private String name = "membership";
    private MembershipStore store;
    private Duration validityWindow;
    private Clock clock;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the store queried on each refresh.
     *
     * <p><b>Required.</b>
     *
     * @param store the membership store
     * @return this builder
     */
    public Builder store(MembershipStore store) {
      this.store = store;
      return this;
    }

    /**
     * Sets the validity window of the credentials this cache gates (e.g. the
     * token TTL). Each refresh looks back 10% further than this.
     *
     * <p><b>Required.</b> Must be &gt; 0.
     *
     * @param validityWindow the credential validity window
     * @return this builder
     */
    public Builder validityWindow(Duration validityWindow) {
      this.validityWindow = validityWindow;
      return this;
    }

    /**
     * Sets the job name used in logs, thread names and metric tags.
     *
     * <p>Optional. Defaults to {@code "membership"}.
     *
     * @param name the job name
     * @return this builder
     */
    public Builder name(String name) {
      this.name = Objects.requireNonNull(name, "name");
      return this;
    }

    /**
     * Sets the clock used to compute the recency window.
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
     * Builds an empty cache. Call {@link MembershipCache#refresh()} or schedule
     * it to populate.
     *
     * @return a new {@link MembershipCache}
     */
    public MembershipCache build() {
      return new MembershipCache(this);
    }
  }
}
