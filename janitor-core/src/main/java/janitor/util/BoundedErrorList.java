package janitor.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-pass error accumulator that keeps at most {@code limit} messages.
 *
 * <p>Messages past the limit are only counted. Not thread-safe; a pass owns its
 * list for the duration of that pass.
 */
public final class BoundedErrorList {
    private final int limit;
    private final List<String> messages = new ArrayList<>();
    private int dropped;

    public BoundedErrorList(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0");
        }
        this.limit = limit;
    }

    public void add(String message) {
        if (messages.size() < limit) {
            messages.add(message);
        } else {
            dropped++;
        }
    }

    /** Returns an immutable copy of the recorded messages. */
    public List<String> messages() {
        return List.copyOf(messages);
    }

    public int dropped() {
        return dropped;
    }

    public int total() {
        return messages.size() + dropped;
    }

    public boolean isEmpty() {
        return total() == 0;
    }
}
