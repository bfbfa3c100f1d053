package taskq.queue.model;

/**
 * Result of a cancel request.
 */
public enum CancelResult {
    /** Pending task cancelled before it was started */
    CANCELLED,

    /** Running task cancelled; its process was signalled if one was recorded */
    CANCELLED_RUNNING,

    /** Task already in a terminal state - status left unchanged */
    REJECTED,

    /** Task not found */
    NOT_FOUND
}
