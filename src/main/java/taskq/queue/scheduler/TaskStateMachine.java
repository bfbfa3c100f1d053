package taskq.queue.scheduler;

import taskq.queue.model.CancelResult;
import taskq.queue.model.ExecutionResult;
import taskq.queue.model.Task;
import taskq.queue.model.TaskStatus;
import taskq.queue.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;

/**
 * Applies task transitions to the store. Only the edges allowed by
 * {@link TaskStatus#canTransitionTo} are ever written, each as a guarded
 * compare-and-set so concurrent writers cannot resurrect a terminal task.
 */
public class TaskStateMachine {

    private static final Logger log = LoggerFactory.getLogger(TaskStateMachine.class);

    // PENDING -> RUNNING -> terminal: a cancel can lose at most two races
    private static final int MAX_CANCEL_ATTEMPTS = 3;

    private final TaskRepository taskRepository;

    public TaskStateMachine(TaskRepository taskRepository) {
        this.taskRepository = taskRepository;
    }

    /**
     * PENDING -> RUNNING, stamping start_time.
     *
     * @return false if the task is no longer pending
     */
    public boolean start(long taskId) {
        requireEdge(TaskStatus.PENDING, TaskStatus.RUNNING);
        return taskRepository.markRunning(taskId, Instant.now());
    }

    /**
     * RUNNING -> COMPLETED | FAILED according to the execution result,
     * stamping end_time exactly once.
     *
     * @return the status the task ended in, or null if no transition applied
     */
    public TaskStatus finish(long taskId, ExecutionResult result) {
        TaskStatus target = result.targetStatus();
        if (target == null) {
            return null;
        }
        requireEdge(TaskStatus.RUNNING, target);

        Integer exitCode = null;
        String error = null;
        if (result instanceof ExecutionResult.Completed completed) {
            exitCode = completed.exitCode();
            if (target == TaskStatus.FAILED) {
                error = "exited with status " + completed.exitCode();
            }
        } else if (result instanceof ExecutionResult.Failed failed) {
            error = failed.reason();
        } else if (result instanceof ExecutionResult.TimedOut timedOut) {
            error = "timed out after " + timedOut.timeoutSeconds() + "s";
        }

        Instant now = Instant.now();
        if (taskRepository.finish(taskId, target, now, exitCode, error)) {
            return target;
        }

        // Lost the race: a cancel request already moved the row
        Optional<Task> current = taskRepository.findById(taskId);
        if (current.isEmpty()) {
            log.warn("Task {} disappeared before its result could be recorded", taskId);
            return null;
        }
        TaskStatus status = current.get().status();
        if (status == TaskStatus.CANCELLED) {
            taskRepository.updateEndTime(taskId, now);
            log.info("Task {} was cancelled while running; result {} discarded", taskId, result);
        } else {
            log.warn("Task {} is {} - cannot record result {}", taskId, status, result);
        }
        return status;
    }

    /**
     * PENDING | RUNNING -> CANCELLED. A running task's recorded process is
     * signalled; failure to signal does not block the transition.
     */
    public CancelResult cancel(long taskId) {
        for (int attempt = 0; attempt < MAX_CANCEL_ATTEMPTS; attempt++) {
            Optional<Task> found = taskRepository.findById(taskId);
            if (found.isEmpty()) {
                return CancelResult.NOT_FOUND;
            }
            Task task = found.get();

            switch (task.status()) {
                case PENDING -> {
                    if (taskRepository.cancel(taskId, TaskStatus.PENDING, null)) {
                        log.info("Task {} cancelled before start", taskId);
                        return CancelResult.CANCELLED;
                    }
                }
                case RUNNING -> {
                    if (taskRepository.cancel(taskId, TaskStatus.RUNNING, Instant.now())) {
                        signal(task);
                        log.info("Task {} cancelled while running", taskId);
                        return CancelResult.CANCELLED_RUNNING;
                    }
                }
                default -> {
                    log.info("Task {} cannot be cancelled (status: {})", taskId, task.status());
                    return CancelResult.REJECTED;
                }
            }
            log.debug("Task {} changed state during cancel, retrying", taskId);
        }
        return CancelResult.REJECTED;
    }

    private void signal(Task snapshot) {
        Task task = snapshot;
        if (task.pid() == null) {
            // the pid may have been recorded between our read and the cancel write
            task = taskRepository.findById(snapshot.id()).orElse(snapshot);
        }
        if (task.pid() == null) {
            // executor re-checks the row right after recording the pid
            log.info("Task {} has no recorded pid yet; executor will stop it after spawn", task.id());
            return;
        }
        try {
            if (!ProcessTrees.terminate(task.pid(), task.startTime())) {
                log.info("Task {} process {} already exited", task.id(), task.pid());
            }
        } catch (RuntimeException e) {
            log.warn("Failed to signal process {} of task {}: {}", task.pid(), task.id(), e.getMessage());
        }
    }

    private static void requireEdge(TaskStatus from, TaskStatus to) {
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal task transition " + from + " -> " + to);
        }
    }
}
