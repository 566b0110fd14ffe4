package janitor.spi;

import java.time.Instant;
import java.util.List;

/**
 * Authoritative query behind the {@link janitor.membership.MembershipCache}.
 */
@FunctionalInterface
public interface MembershipStore {

    /**
     * Returns the ids of all entities whose membership event (e.g. blacklisting)
     * happened at or after {@code since}.
     *
     * @param since inclusive lower bound of the recency window
     * @return matching entity ids, never {@code null}
     * @throws RuntimeException if the store cannot be queried
     */
    List<Long> findMembersSince(Instant since);
}
