package janitor.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of the last successful membership refresh.
 *
 * @param refreshedAt when the new set was swapped in
 * @param windowStart lower bound passed to the store query
 * @param members     size of the new set
 * @param durationMs  time spent querying and building the set
 */
public record MembershipRefreshStats(
    Instant refreshedAt,
    Instant windowStart,
    int members,
    long durationMs) {

  public MembershipRefreshStats {
    Objects.requireNonNull(refreshedAt, "refreshedAt");
    Objects.requireNonNull(windowStart, "windowStart");
  }

  public static MembershipRefreshStats empty() {
    return new MembershipRefreshStats(Instant.EPOCH, Instant.EPOCH, 0, 0L);
  }
}
