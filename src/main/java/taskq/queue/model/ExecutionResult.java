package taskq.queue.model;

/**
 * Outcome of running one task, produced by the executor and applied to the
 * store by the state machine.
 */
public sealed interface ExecutionResult
        permits ExecutionResult.Completed, ExecutionResult.Failed, ExecutionResult.TimedOut,
        ExecutionResult.NotStarted {

    /** Status the task moves to, or null when no transition applies */
    TaskStatus targetStatus();

    /** Child exited on its own. Only exit code 0 counts as success. */
    record Completed(int exitCode) implements ExecutionResult {
        @Override
        public TaskStatus targetStatus() {
            return exitCode == 0 ? TaskStatus.COMPLETED : TaskStatus.FAILED;
        }
    }

    /** Validation, spawn or wait error. */
    record Failed(String reason) implements ExecutionResult {
        @Override
        public TaskStatus targetStatus() {
            return TaskStatus.FAILED;
        }
    }

    /** Deadline passed; the process tree was destroyed. */
    record TimedOut(int timeoutSeconds) implements ExecutionResult {
        @Override
        public TaskStatus targetStatus() {
            return TaskStatus.FAILED;
        }
    }

    /** Task left PENDING before the executor could claim it (e.g. cancelled). */
    record NotStarted(String reason) implements ExecutionResult {
        @Override
        public TaskStatus targetStatus() {
            return null;
        }
    }
}
