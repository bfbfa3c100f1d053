package taskq.queue.config;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Configuration holder for the queue and its scheduler.
 * All settings have sensible defaults; paths derive from the home directory
 * unless set explicitly.
 */
public final class QueueConfig {

    // Locations
    private Path homeDir = Path.of(System.getProperty("user.home"), ".taskq");
    private String databaseUrl = null;
    private int databasePoolSize = 10;
    private Path runStateFile = null;
    private Path logDir = null;

    // Dispatch settings
    private int batchSize = 5;
    private Duration releaseStagger = Duration.ofMillis(500);
    private Duration pollInterval = Duration.ofSeconds(1);
    private Duration maxIdleBackoff = Duration.ofSeconds(60);
    private Duration overloadCooldown = Duration.ofSeconds(30);
    private Duration stopCheckInterval = Duration.ofSeconds(1);

    // Admission settings
    private double cpuThreshold = 80.0;
    private double memoryThreshold = 75.0;
    private double loadMargin = 10.0;
    private int maxWorkers = Math.max(2, Runtime.getRuntime().availableProcessors());
    private Integer reducedWorkers = null;

    private QueueConfig() {
    }

    public static QueueConfig defaults() {
        return new QueueConfig();
    }

    /**
     * Defaults, then {@code <home>/taskq.ini} if present, then environment variables.
     */
    public static QueueConfig load() {
        QueueConfig config = new QueueConfig();
        String home = System.getenv("TASKQ_HOME");
        if (home != null && !home.isBlank()) {
            config.homeDir = Path.of(home);
        }
        IniConfigLoader.applyIfPresent(config.homeDir.resolve("taskq.ini"), config);
        return config.applyEnv();
    }

    public static QueueConfig fromEnv() {
        return new QueueConfig().applyEnv();
    }

    private QueueConfig applyEnv() {
        String home = System.getenv("TASKQ_HOME");
        if (home != null && !home.isBlank()) {
            homeDir = Path.of(home);
        }

        String dbUrl = System.getenv("TASKQ_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            databaseUrl = dbUrl;
        }

        String batch = System.getenv("TASKQ_BATCH_SIZE");
        if (batch != null && !batch.isBlank()) {
            batchSize = Integer.parseInt(batch.trim());
        }

        String workers = System.getenv("TASKQ_MAX_WORKERS");
        if (workers != null && !workers.isBlank()) {
            maxWorkers = Integer.parseInt(workers.trim());
        }

        String cpu = System.getenv("TASKQ_CPU_THRESHOLD");
        if (cpu != null && !cpu.isBlank()) {
            cpuThreshold = Double.parseDouble(cpu.trim());
        }

        String mem = System.getenv("TASKQ_MEM_THRESHOLD");
        if (mem != null && !mem.isBlank()) {
            memoryThreshold = Double.parseDouble(mem.trim());
        }

        return this;
    }

    // Getters
    public Path homeDir() {
        return homeDir;
    }

    public String databaseUrl() {
        if (databaseUrl != null) {
            return databaseUrl;
        }
        return "jdbc:h2:file:" + homeDir.resolve("taskq").toAbsolutePath()
                + ";AUTO_SERVER=TRUE;DB_CLOSE_ON_EXIT=FALSE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public Path runStateFile() {
        return runStateFile != null ? runStateFile : homeDir.resolve("scheduler.status");
    }

    public Path logDir() {
        return logDir != null ? logDir : homeDir.resolve("logs");
    }

    public int batchSize() {
        return batchSize;
    }

    public Duration releaseStagger() {
        return releaseStagger;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration maxIdleBackoff() {
        return maxIdleBackoff;
    }

    public Duration overloadCooldown() {
        return overloadCooldown;
    }

    public Duration stopCheckInterval() {
        return stopCheckInterval;
    }

    public double cpuThreshold() {
        return cpuThreshold;
    }

    public double memoryThreshold() {
        return memoryThreshold;
    }

    public double loadMargin() {
        return loadMargin;
    }

    public int maxWorkers() {
        return maxWorkers;
    }

    public int reducedWorkers() {
        return reducedWorkers != null ? reducedWorkers : Math.max(1, maxWorkers / 2);
    }

    // Fluent setters for testing/customization
    public QueueConfig withHomeDir(Path homeDir) {
        this.homeDir = homeDir;
        return this;
    }

    public QueueConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public QueueConfig withDatabasePoolSize(int poolSize) {
        this.databasePoolSize = poolSize;
        return this;
    }

    public QueueConfig withRunStateFile(Path runStateFile) {
        this.runStateFile = runStateFile;
        return this;
    }

    public QueueConfig withLogDir(Path logDir) {
        this.logDir = logDir;
        return this;
    }

    public QueueConfig withBatchSize(int batchSize) {
        this.batchSize = batchSize;
        return this;
    }

    public QueueConfig withReleaseStagger(Duration releaseStagger) {
        this.releaseStagger = releaseStagger;
        return this;
    }

    public QueueConfig withPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
        return this;
    }

    public QueueConfig withMaxIdleBackoff(Duration maxIdleBackoff) {
        this.maxIdleBackoff = maxIdleBackoff;
        return this;
    }

    public QueueConfig withOverloadCooldown(Duration overloadCooldown) {
        this.overloadCooldown = overloadCooldown;
        return this;
    }

    public QueueConfig withStopCheckInterval(Duration stopCheckInterval) {
        this.stopCheckInterval = stopCheckInterval;
        return this;
    }

    public QueueConfig withThresholds(double cpuThreshold, double memoryThreshold) {
        this.cpuThreshold = cpuThreshold;
        this.memoryThreshold = memoryThreshold;
        return this;
    }

    public QueueConfig withLoadMargin(double loadMargin) {
        this.loadMargin = loadMargin;
        return this;
    }

    public QueueConfig withMaxWorkers(int maxWorkers) {
        this.maxWorkers = maxWorkers;
        return this;
    }

    public QueueConfig withReducedWorkers(int reducedWorkers) {
        this.reducedWorkers = reducedWorkers;
        return this;
    }

    @Override
    public String toString() {
        return "QueueConfig{" +
                "homeDir=" + homeDir +
                ", databaseUrl='" + databaseUrl() + '\'' +
                ", batchSize=" + batchSize +
                ", maxWorkers=" + maxWorkers +
                ", reducedWorkers=" + reducedWorkers() +
                ", cpuThreshold=" + cpuThreshold +
                ", memoryThreshold=" + memoryThreshold +
                '}';
    }
}
