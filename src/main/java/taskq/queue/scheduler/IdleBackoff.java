package taskq.queue.scheduler;

import java.time.Duration;

/**
 * Exponential idle delay: doubles from a base up to a ceiling, back to the
 * base once work shows up again. Used from the dispatcher thread only.
 */
public class IdleBackoff {

    private final Duration base;
    private final Duration ceiling;
    private Duration current;

    public IdleBackoff(Duration base, Duration ceiling) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive: " + base);
        }
        if (ceiling.compareTo(base) < 0) {
            throw new IllegalArgumentException("ceiling " + ceiling + " is below base " + base);
        }
        this.base = base;
        this.ceiling = ceiling;
        this.current = base;
    }

    /**
     * @return the delay to sleep now; the following call returns twice as much, capped
     */
    public Duration next() {
        Duration delay = current;
        Duration doubled = current.multipliedBy(2);
        current = doubled.compareTo(ceiling) > 0 ? ceiling : doubled;
        return delay;
    }

    public void reset() {
        current = base;
    }
}
