package taskq.queue.model;

import java.util.Locale;

/**
 * Value of the persisted run-state marker.
 */
public enum RunState {
    RUNNING,
    STOPPED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
