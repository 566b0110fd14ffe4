package janitor.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedErrorListTest {

    @Test
    void keepsMessagesUpToLimitAndCountsTheRest() {
        BoundedErrorList errors = new BoundedErrorList(2);
        errors.add("a");
        errors.add("b");
        errors.add("c");
        errors.add("d");

        assertEquals(List.of("a", "b"), errors.messages());
        assertEquals(2, errors.dropped());
        assertEquals(4, errors.total());
        assertFalse(errors.isEmpty());
    }

    @Test
    void zeroLimitOnlyCounts() {
        BoundedErrorList errors = new BoundedErrorList(0);
        errors.add("a");

        assertTrue(errors.messages().isEmpty());
        assertEquals(1, errors.total());
    }

    @Test
    void messagesAreASnapshot() {
        BoundedErrorList errors = new BoundedErrorList(10);
        errors.add("a");
        List<String> snapshot = errors.messages();
        errors.add("b");

        assertEquals(List.of("a"), snapshot);
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add("x"));
    }

    @Test
    void negativeLimitThrows() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedErrorList(-1));
    }
}
