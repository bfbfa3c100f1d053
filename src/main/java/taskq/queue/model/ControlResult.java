package taskq.queue.model;

/**
 * Result of a scheduler start or stop request.
 */
public enum ControlResult {
    /** Dispatcher loop ran and has since exited */
    STARTED,

    /** Marker already reads running - nothing was started */
    ALREADY_RUNNING,

    /** Marker flipped to stopped; the dispatcher exits on its next check */
    STOPPING,

    /** Marker did not read running - nothing to stop */
    NOT_RUNNING
}
