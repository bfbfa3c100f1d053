package taskq.queue.service;

import taskq.queue.config.QueueConfig;
import taskq.queue.model.CancelResult;
import taskq.queue.model.SubmitRequest;
import taskq.queue.model.Task;
import taskq.queue.model.TaskStatus;
import taskq.queue.repository.TaskRepository;
import taskq.queue.scheduler.TaskStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Service layer for task submission, listing and cancellation.
 * Validation happens before anything is written; a rejected submission
 * leaves no row behind.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    public static final int MIN_PRIORITY = 0;
    public static final int MAX_PRIORITY = 9;
    private static final int MAX_NAME_LENGTH = 256;

    private final TaskRepository taskRepository;
    private final TaskStateMachine stateMachine;
    private final QueueConfig config;

    public TaskService(TaskRepository taskRepository, TaskStateMachine stateMachine, QueueConfig config) {
        this.taskRepository = taskRepository;
        this.stateMachine = stateMachine;
        this.config = config;
    }

    /**
     * Validate and enqueue a task as PENDING.
     *
     * @return the stored task, id assigned
     * @throws IllegalArgumentException if the request is invalid
     */
    public Task submit(SubmitRequest request) {
        if (request.command() == null || request.command().isBlank()) {
            throw new IllegalArgumentException("command is required");
        }
        if (request.priority() < MIN_PRIORITY || request.priority() > MAX_PRIORITY) {
            throw new IllegalArgumentException(
                    "priority must be between " + MIN_PRIORITY + " and " + MAX_PRIORITY + ": " + request.priority());
        }
        if (request.timeoutSeconds() != null && request.timeoutSeconds() < 0) {
            throw new IllegalArgumentException("timeout must not be negative: " + request.timeoutSeconds());
        }
        if (request.cwd() == null || request.cwd().isBlank()) {
            throw new IllegalArgumentException("working directory is required");
        }
        Path cwd = Path.of(request.cwd()).toAbsolutePath().normalize();
        if (!Files.isDirectory(cwd)) {
            throw new IllegalArgumentException("working directory does not exist: " + request.cwd());
        }
        Map<String, String> env = request.environment() == null ? Map.of() : request.environment();
        String envProblem = Task.environmentProblem(env);
        if (envProblem != null) {
            throw new IllegalArgumentException(envProblem);
        }

        String tag = UUID.randomUUID().toString().substring(0, 8);
        String stdout = resolveOutput(request.stdoutFile(), cwd, "task-" + tag + ".out");
        String stderr = resolveOutput(request.stderrFile(), cwd, "task-" + tag + ".err");

        Task task = Task.builder()
                .name(displayName(request))
                .command(request.command())
                .priority(request.priority())
                .createdAt(Instant.now())
                .status(TaskStatus.PENDING)
                .environment(new LinkedHashMap<>(env))
                .cwd(cwd.toString())
                .stdoutFile(stdout)
                .stderrFile(stderr)
                .timeoutSeconds(request.timeoutSeconds())
                .build();

        long id = taskRepository.insert(task);
        log.info("Submitted task {} '{}' with priority {}", id, task.name(), task.priority());

        return taskRepository.findById(id)
                .orElseThrow(() -> new IllegalStateException("Task " + id + " vanished after insert"));
    }

    /**
     * Tasks in dispatch order.
     *
     * @param statuses statuses to include; null or empty means all
     */
    public List<Task> list(Set<TaskStatus> statuses) {
        return taskRepository.list(statuses);
    }

    public Optional<Task> find(long taskId) {
        return taskRepository.findById(taskId);
    }

    /**
     * Cancel a pending or running task. Cancelling a terminal task is
     * rejected and leaves it untouched.
     */
    public CancelResult cancel(long taskId) {
        CancelResult result = stateMachine.cancel(taskId);
        switch (result) {
            case NOT_FOUND -> log.warn("Cancel: task {} not found", taskId);
            case REJECTED -> log.warn("Cancel: task {} is already finished", taskId);
            default -> log.info("Cancel: task {} -> {}", taskId, result);
        }
        return result;
    }

    private String resolveOutput(String requested, Path cwd, String defaultName) {
        if (requested == null || requested.isBlank()) {
            return config.logDir().resolve(defaultName).toAbsolutePath().normalize().toString();
        }
        Path path = Path.of(requested);
        if (!path.isAbsolute()) {
            path = cwd.resolve(path);
        }
        path = path.normalize();
        if (Files.isDirectory(path)) {
            throw new IllegalArgumentException("output path is a directory: " + requested);
        }
        return path.toString();
    }

    private static String displayName(SubmitRequest request) {
        String name = request.name() != null && !request.name().isBlank()
                ? request.name().strip()
                : request.command().strip();
        return name.length() > MAX_NAME_LENGTH ? name.substring(0, MAX_NAME_LENGTH) : name;
    }
}
