package taskq.queue.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one queued shell command and its execution metadata.
 * The store owns the live row; instances are re-read rather than mutated.
 */
public final class Task {
    private final Long id;
    private final String name;
    private final String command;
    private final int priority;
    private final Instant createdAt;
    private final TaskStatus status;
    private final Map<String, String> environment;
    private final String cwd;
    private final String stdoutFile;
    private final String stderrFile;
    private final Long pid;
    private final Integer timeoutSeconds;
    private final Instant startTime;
    private final Instant endTime;
    private final Integer exitCode;
    private final String errorMessage;

    private Task(Builder builder) {
        this.id = builder.id;
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.command = Objects.requireNonNull(builder.command, "command is required");
        this.priority = builder.priority;
        this.createdAt = builder.createdAt;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.environment = builder.environment == null
                ? null
                : Collections.unmodifiableMap(new LinkedHashMap<>(builder.environment));
        this.cwd = builder.cwd;
        this.stdoutFile = builder.stdoutFile;
        this.stderrFile = builder.stderrFile;
        this.pid = builder.pid;
        this.timeoutSeconds = builder.timeoutSeconds;
        this.startTime = builder.startTime;
        this.endTime = builder.endTime;
        this.exitCode = builder.exitCode;
        this.errorMessage = builder.errorMessage;
    }

    // Getters
    public Long id() {
        return id;
    }

    public String name() {
        return name;
    }

    public String command() {
        return command;
    }

    public int priority() {
        return priority;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public TaskStatus status() {
        return status;
    }

    /** Snapshotted environment; null when the stored snapshot could not be read */
    public Map<String, String> environment() {
        return environment;
    }

    public String cwd() {
        return cwd;
    }

    public String stdoutFile() {
        return stdoutFile;
    }

    public String stderrFile() {
        return stderrFile;
    }

    public Long pid() {
        return pid;
    }

    public Integer timeoutSeconds() {
        return timeoutSeconds;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public Integer exitCode() {
        return exitCode;
    }

    public String errorMessage() {
        return errorMessage;
    }

    /** True when a non-zero timeout applies */
    public boolean hasTimeout() {
        return timeoutSeconds != null && timeoutSeconds > 0;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Wall time between start and end, if both are stamped */
    public Duration elapsed() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return Duration.between(startTime, endTime);
    }

    /**
     * Check an environment mapping for names and values a child process
     * cannot receive.
     *
     * @return a one-line reason, or null if the mapping is usable
     */
    public static String environmentProblem(Map<String, String> env) {
        if (env == null) {
            return "environment snapshot is malformed";
        }
        for (Map.Entry<String, String> e : env.entrySet()) {
            String key = e.getKey();
            if (key == null || key.isEmpty() || key.indexOf('=') >= 0 || key.indexOf('\0') >= 0) {
                return "invalid environment variable name: " + key;
            }
            if (e.getValue() == null || e.getValue().indexOf('\0') >= 0) {
                return "invalid value for environment variable " + key;
            }
        }
        return null;
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .command(command)
                .priority(priority)
                .createdAt(createdAt)
                .status(status)
                .environment(environment)
                .cwd(cwd)
                .stdoutFile(stdoutFile)
                .stderrFile(stderrFile)
                .pid(pid)
                .timeoutSeconds(timeoutSeconds)
                .startTime(startTime)
                .endTime(endTime)
                .exitCode(exitCode)
                .errorMessage(errorMessage);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Long id;
        private String name;
        private String command;
        private int priority = 0;
        private Instant createdAt;
        private TaskStatus status = TaskStatus.PENDING;
        private Map<String, String> environment = Map.of();
        private String cwd;
        private String stdoutFile;
        private String stderrFile;
        private Long pid;
        private Integer timeoutSeconds;
        private Instant startTime;
        private Instant endTime;
        private Integer exitCode;
        private String errorMessage;

        public Builder id(Long id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public Builder cwd(String cwd) {
            this.cwd = cwd;
            return this;
        }

        public Builder stdoutFile(String stdoutFile) {
            this.stdoutFile = stdoutFile;
            return this;
        }

        public Builder stderrFile(String stderrFile) {
            this.stderrFile = stderrFile;
            return this;
        }

        public Builder pid(Long pid) {
            this.pid = pid;
            return this;
        }

        public Builder timeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder startTime(Instant startTime) {
            this.startTime = startTime;
            return this;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder exitCode(Integer exitCode) {
            this.exitCode = exitCode;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", name='" + name + "', priority=" + priority + ", status=" + status + "}";
    }
}
