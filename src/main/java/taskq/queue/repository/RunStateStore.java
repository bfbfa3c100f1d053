package taskq.queue.repository;

import taskq.queue.model.RunState;

/**
 * Persisted marker telling whether a dispatcher loop is active.
 * Lives outside the scheduler's memory so a separate invocation can read
 * or flip it.
 */
public interface RunStateStore {

    /**
     * Current marker value; an absent marker reads as {@link RunState#STOPPED}.
     */
    RunState get();

    void set(RunState state);
}
