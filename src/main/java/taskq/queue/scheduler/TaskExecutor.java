package taskq.queue.scheduler;

import taskq.queue.model.ExecutionResult;
import taskq.queue.model.Task;
import taskq.queue.model.TaskStatus;
import taskq.queue.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Runs one task's command as a child process.
 *
 * The executor claims the task (PENDING -> RUNNING), validates the snapshot,
 * launches {@code /bin/sh -c <command>} with the task's environment and working
 * directory, records the pid and waits, bounded by the task timeout. It returns
 * an {@link ExecutionResult}; recording the terminal status is left to the
 * caller via {@link TaskStateMachine#finish}.
 *
 * A timed-out child is killed together with its descendants and reaped, so no
 * orphan outlives its task.
 */
public class TaskExecutor {

    private static final Duration KILL_GRACE = Duration.ofSeconds(5);
    private static final File NULL_INPUT = new File("/dev/null");

    private final TaskRepository taskRepository;
    private final TaskStateMachine stateMachine;
    private final Logger log;
    private final List<String> shell;

    // live children by task id; lets the dispatcher kill them on JVM termination
    private final Map<Long, Process> live = new ConcurrentHashMap<>();
    private volatile boolean terminating = false;

    public TaskExecutor(TaskRepository taskRepository, TaskStateMachine stateMachine) {
        this(taskRepository, stateMachine, LoggerFactory.getLogger(TaskExecutor.class));
    }

    public TaskExecutor(TaskRepository taskRepository, TaskStateMachine stateMachine, Logger log) {
        this(taskRepository, stateMachine, log, List.of("/bin/sh", "-c"));
    }

    TaskExecutor(TaskRepository taskRepository, TaskStateMachine stateMachine, Logger log, List<String> shell) {
        this.taskRepository = taskRepository;
        this.stateMachine = stateMachine;
        this.log = log;
        this.shell = List.copyOf(shell);
    }

    /**
     * Execute a task to completion. Never throws for execution-path errors;
     * store failures propagate as RuntimeException.
     */
    public ExecutionResult execute(Task task) {
        long taskId = task.id();

        if (!stateMachine.start(taskId)) {
            log.info("Task {} is no longer pending, skipping", taskId);
            return new ExecutionResult.NotStarted("task is no longer pending");
        }

        String invalid = validate(task);
        if (invalid != null) {
            log.warn("Task {} failed validation: {}", taskId, invalid);
            return new ExecutionResult.Failed(invalid);
        }

        Process process;
        try {
            process = launch(task);
        } catch (IOException | RuntimeException e) {
            log.error("Task {} failed to spawn: {}", taskId, e.getMessage());
            return new ExecutionResult.Failed("spawn failed: " + e.getMessage());
        }

        live.put(taskId, process);
        try {
            log.info("Task {} '{}' started as pid {}", taskId, task.name(), process.pid());
            recordPid(taskId, process);
            return await(task, process);
        } finally {
            live.remove(taskId);
        }
    }

    /**
     * Kill every live child. Used when the scheduler JVM is terminating; the
     * affected tasks end FAILED.
     */
    public void destroyAll() {
        terminating = true;
        for (Map.Entry<Long, Process> entry : live.entrySet()) {
            log.warn("Killing task {} (pid {}) on scheduler termination", entry.getKey(), entry.getValue().pid());
            entry.getValue().descendants().forEach(ProcessHandle::destroyForcibly);
            entry.getValue().destroyForcibly();
        }
    }

    public int liveCount() {
        return live.size();
    }

    private void recordPid(long taskId, Process process) {
        try {
            taskRepository.updatePid(taskId, process.pid());
            // a cancel that arrived before the pid was visible could not signal us
            TaskStatus status = taskRepository.findById(taskId).map(Task::status).orElse(null);
            if (status == TaskStatus.CANCELLED) {
                log.info("Task {} was cancelled during spawn; stopping pid {}", taskId, process.pid());
                ProcessTrees.terminate(process.pid(), null);
            }
        } catch (RuntimeException e) {
            // child keeps running under supervision, it just cannot be signalled externally
            log.error("Failed to record pid {} for task {}", process.pid(), taskId, e);
        }
    }

    private ExecutionResult await(Task task, Process process) {
        long taskId = task.id();
        try {
            if (task.hasTimeout()) {
                if (!process.waitFor(task.timeoutSeconds(), TimeUnit.SECONDS)) {
                    log.warn("Task {} exceeded timeout of {}s, killing pid {}", taskId, task.timeoutSeconds(),
                            process.pid());
                    if (!ProcessTrees.destroyForcibly(process, KILL_GRACE)) {
                        log.error("Task {} pid {} did not exit after SIGKILL", taskId, process.pid());
                    }
                    return new ExecutionResult.TimedOut(task.timeoutSeconds());
                }
            } else {
                process.waitFor();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Task {} interrupted while waiting, killing pid {}", taskId, process.pid());
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            return new ExecutionResult.Failed("interrupted while waiting for process");
        }

        if (terminating) {
            return new ExecutionResult.Failed("killed by scheduler termination");
        }
        int exitCode = process.exitValue();
        log.info("Task {} exited with status {}", taskId, exitCode);
        return new ExecutionResult.Completed(exitCode);
    }

    private Process launch(Task task) throws IOException {
        Path stdout = Path.of(task.stdoutFile());
        Path stderr = Path.of(task.stderrFile());
        createParent(stdout);
        createParent(stderr);

        ProcessBuilder pb = new ProcessBuilder(command(task));
        pb.directory(new File(task.cwd()));
        Map<String, String> env = pb.environment();
        env.clear();
        env.putAll(task.environment());
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(stdout.toFile()));
        pb.redirectError(ProcessBuilder.Redirect.appendTo(stderr.toFile()));
        // no interactive input
        pb.redirectInput(ProcessBuilder.Redirect.from(NULL_INPUT));

        return pb.start();
    }

    private List<String> command(Task task) {
        List<String> cmd = new ArrayList<>(shell);
        cmd.add(task.command());
        return cmd;
    }

    /**
     * @return a one-line reason, or null if the task can be launched
     */
    static String validate(Task task) {
        if (task.cwd() == null || task.cwd().isBlank()) {
            return "working directory is not set";
        }
        if (!Files.isDirectory(Path.of(task.cwd()))) {
            return "working directory does not exist: " + task.cwd();
        }
        String envProblem = Task.environmentProblem(task.environment());
        if (envProblem != null) {
            return envProblem;
        }
        if (task.stdoutFile() == null || task.stderrFile() == null) {
            return "output files are not set";
        }
        return null;
    }

    private static void createParent(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
