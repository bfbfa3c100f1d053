package taskq.queue.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Task lifecycle status.
 *
 * Legal edges:
 * PENDING -> RUNNING -> {COMPLETED, FAILED}
 * PENDING | RUNNING -> CANCELLED
 */
public enum TaskStatus {
    /** Submitted, waiting for the dispatcher */
    PENDING,
    /** Child process being launched or running */
    RUNNING,
    /** Child process exited with status 0 */
    COMPLETED,
    /** Cancelled by request while pending or running */
    CANCELLED,
    /** Non-zero exit, timeout or any execution-path error */
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        return allowedNext().contains(next);
    }

    public Set<TaskStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(RUNNING, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            default -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    /** Lower-case name as shown by the CLI. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parse a status name, case-insensitive. */
    public static TaskStatus parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown status: " + value);
        }
    }
}
