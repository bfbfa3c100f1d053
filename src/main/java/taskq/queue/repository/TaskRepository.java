package taskq.queue.repository;

import taskq.queue.model.Task;
import taskq.queue.model.TaskStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Repository interface for Task persistence.
 * Every write touches a single row in its own transaction, so concurrent
 * writers to different tasks never block each other.
 */
public interface TaskRepository {

    /**
     * Insert a new task. The id on the given task is ignored.
     *
     * @param task the task to insert
     * @return the assigned id
     */
    long insert(Task task);

    /**
     * Find a task by ID.
     *
     * @param taskId the task ID
     * @return the task if found
     */
    Optional<Task> findById(long taskId);

    /**
     * List tasks ordered by priority ascending, then creation time, then id.
     *
     * @param statuses statuses to include; null or empty means all
     * @return ordered tasks
     */
    List<Task> list(Set<TaskStatus> statuses);

    /**
     * Pending tasks in dispatch order.
     *
     * @param limit maximum number of results
     * @return at most {@code limit} pending tasks
     */
    List<Task> findPending(int limit);

    /**
     * Count tasks in a status.
     */
    int countByStatus(TaskStatus status);

    /**
     * Unconditional status write.
     */
    boolean updateStatus(long taskId, TaskStatus status);

    boolean updatePid(long taskId, long pid);

    boolean updateStartTime(long taskId, Instant startTime);

    /**
     * Stamp end_time unless it is already set.
     *
     * @return true if this call stamped it
     */
    boolean updateEndTime(long taskId, Instant endTime);

    /**
     * Atomically move a PENDING task to RUNNING and stamp start_time.
     *
     * @return false if the task was no longer PENDING
     */
    boolean markRunning(long taskId, Instant startTime);

    /**
     * Atomically move a RUNNING task to a terminal status and stamp end_time.
     *
     * @param status       COMPLETED or FAILED
     * @param exitCode     child exit code, null if the child never exited on its own
     * @param errorMessage failure detail, null on success
     * @return false if the task was no longer RUNNING (e.g. cancelled meanwhile)
     */
    boolean finish(long taskId, TaskStatus status, Instant endTime, Integer exitCode, String errorMessage);

    /**
     * Atomically move a task from {@code from} to CANCELLED.
     *
     * @param endTime stamped when non-null (cancel after running)
     * @return false if the task was no longer in {@code from}
     */
    boolean cancel(long taskId, TaskStatus from, Instant endTime);
}
