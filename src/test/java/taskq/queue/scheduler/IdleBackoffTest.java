package taskq.queue.scheduler;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class IdleBackoffTest {

    @Test
    void doublesUpToCeiling() {
        IdleBackoff backoff = new IdleBackoff(Duration.ofSeconds(1), Duration.ofSeconds(60));

        assertEquals(Duration.ofSeconds(1), backoff.next());
        assertEquals(Duration.ofSeconds(2), backoff.next());
        assertEquals(Duration.ofSeconds(4), backoff.next());
        assertEquals(Duration.ofSeconds(8), backoff.next());
        assertEquals(Duration.ofSeconds(16), backoff.next());
        assertEquals(Duration.ofSeconds(32), backoff.next());
        assertEquals(Duration.ofSeconds(60), backoff.next());
        assertEquals(Duration.ofSeconds(60), backoff.next());
    }

    @Test
    void resetReturnsToBase() {
        IdleBackoff backoff = new IdleBackoff(Duration.ofMillis(100), Duration.ofSeconds(1));
        backoff.next();
        backoff.next();
        backoff.next();

        backoff.reset();

        assertEquals(Duration.ofMillis(100), backoff.next());
    }

    @Test
    void rejectsBadBounds() {
        assertThrows(IllegalArgumentException.class, () -> new IdleBackoff(Duration.ZERO, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new IdleBackoff(Duration.ofSeconds(2), Duration.ofSeconds(1)));
    }
}
