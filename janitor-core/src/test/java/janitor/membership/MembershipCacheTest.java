package janitor.membership;

import janitor.MutableClock;
import janitor.PassAbortedException;
import janitor.RecordingMetrics;
import janitor.spi.MembershipStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MembershipCacheTest {

  private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

  private final MutableClock clock = new MutableClock(NOW);

  @Test
  void startsEmpty() {
    MembershipCache cache = cache(since -> List.of(1L));

    assertFalse(cache.isMember(1L));
    assertEquals(0, cache.size());
    assertEquals(Instant.EPOCH, cache.lastRefreshedAt());
  }

  @Test
  void refreshedIdsAreMembersAndOthersAreNot() {
    MembershipCache cache = cache(since -> List.of(1L, 2L, 3L));

    assertEquals(3, cache.refresh());

    assertTrue(cache.isMember(1L));
    assertTrue(cache.isMember(2L));
    assertTrue(cache.isMember(3L));
    assertFalse(cache.isMember(4L));
    assertFalse(cache.isMember(-1L));
  }

  @Test
  void memberStaysUntilALaterRefreshExcludesIt() {
    AtomicReference<List<Long>> current = new AtomicReference<>(List.of(7L, 8L));
    MembershipCache cache = cache(since -> current.get());

    cache.refresh();
    assertTrue(cache.isMember(7L));

    current.set(List.of(8L));
    assertTrue(cache.isMember(7L), "no refresh yet");

    cache.refresh();
    assertFalse(cache.isMember(7L));
    assertTrue(cache.isMember(8L));
  }

  @Test
  void queriesValidityWindowPlusTenPercent() {
    AtomicReference<Instant> seen = new AtomicReference<>();
    MembershipCache cache = cache(since -> {
      seen.set(since);
      return List.of();
    });

    cache.refresh();

    assertEquals(NOW.minus(Duration.ofMinutes(66)), seen.get());
    assertEquals(Duration.ofMinutes(66), cache.lookback());
    assertEquals(NOW.minus(Duration.ofMinutes(66)), cache.getLastStats().windowStart());
  }

  @Test
  void stalenessBoundAddsRefreshInterval() {
    MembershipCache cache = cache(since -> List.of());

    assertEquals(Duration.ofMinutes(66).plusSeconds(30), cache.stalenessBound(Duration.ofSeconds(30)));
  }

  @Test
  void failedRefreshKeepsPreviousSet() {
    AtomicBoolean fail = new AtomicBoolean();
    MembershipCache cache = cache(since -> {
      if (fail.get()) {
        throw new IllegalStateException("db down");
      }
      return List.of(42L);
    });
    cache.refresh();
    var statsBefore = cache.getLastStats();

    fail.set(true);
    clock.advance(Duration.ofMinutes(1));
    PassAbortedException ex = assertThrows(PassAbortedException.class, cache::refresh);

    assertEquals("membership", ex.jobName());
    assertTrue(ex.getCause() instanceof IllegalStateException);
    assertTrue(cache.isMember(42L));
    assertSame(statsBefore, cache.getLastStats());
  }

  @Test
  void publishesStatsOnEachRefresh() {
    RecordingMetrics metrics = new RecordingMetrics();
    MembershipCache cache = MembershipCache.builder()
        .store(since -> List.of(1L, 1L, 2L))
        .validityWindow(Duration.ofHours(1))
        .clock(clock)
        .metrics(metrics)
        .build();

    cache.refresh();

    assertEquals(2, cache.size());
    assertEquals(1, metrics.refreshes.size());
    assertEquals(2, metrics.refreshes.get(0).members());
    assertEquals(NOW, cache.lastRefreshedAt());
  }

  @Test
  void readersNeverSeeAPartialSetDuringRefresh() throws Exception {
    List<Long> oldIds = ids(0, 1000);
    List<Long> newIds = ids(1000, 2000);
    CountDownLatch queryStarted = new CountDownLatch(1);
    CountDownLatch releaseQuery = new CountDownLatch(1);
    AtomicBoolean blockNext = new AtomicBoolean(false);

    MembershipCache cache = cache(since -> {
      if (blockNext.get()) {
        queryStarted.countDown();
        await(releaseQuery);
        return newIds;
      }
      return oldIds;
    });
    cache.refresh();
    blockNext.set(true);

    ExecutorService pool = Executors.newFixedThreadPool(9);
    try {
      Future<?> refresh = pool.submit(cache::refresh);
      assertTrue(queryStarted.await(5, TimeUnit.SECONDS));

      List<Future<Boolean>> readers = new ArrayList<>();
      AtomicBoolean stop = new AtomicBoolean();
      for (int r = 0; r < 8; r++) {
        readers.add(pool.submit(() -> {
          while (!stop.get()) {
            if (cache.size() != 1000) {
              return false;
            }
            // Exactly one complete set is installed at any instant.
            if (!cache.isMember(0L) && !cache.isMember(1000L)) {
              return false;
            }
          }
          return true;
        }));
      }

      // Readers keep going while the store query is blocked.
      Thread.sleep(50);
      assertTrue(cache.isMember(0L));
      releaseQuery.countDown();
      refresh.get(5, TimeUnit.SECONDS);
      Thread.sleep(20);
      stop.set(true);

      for (Future<Boolean> reader : readers) {
        assertTrue(reader.get(5, TimeUnit.SECONDS));
      }
      assertTrue(cache.isMember(1500L));
      assertFalse(cache.isMember(500L));
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void builderValidation() {
    assertThrows(NullPointerException.class, () ->
        MembershipCache.builder().validityWindow(Duration.ofHours(1)).build());
    assertThrows(NullPointerException.class, () ->
        MembershipCache.builder().store(since -> List.of()).build());
    assertThrows(IllegalArgumentException.class, () ->
        MembershipCache.builder().store(since -> List.of()).validityWindow(Duration.ZERO).build());
  }

  private MembershipCache cache(MembershipStore store) {
    return MembershipCache.builder()
        .store(store)
        .validityWindow(Duration.ofHours(1))
        .clock(clock)
        .build();
  }

  private static List<Long> ids(long fromInclusive, long toExclusive) {
    List<Long> ids = new ArrayList<>();
    for (long i = fromInclusive; i < toExclusive; i++) {
      ids.add(i);
    }
    return ids;
  }

  private static void await(CountDownLatch latch) {
    try {
      latch.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
